package ai.convoy.scheduler.lifecycle;

public enum LeaseState {
    UNISSUED,
    ISSUED,
    RENEWED,
    DONE,
    RETURNED,
    EXPIRED;

    public boolean isLive() {
        return this == ISSUED || this == RENEWED;
    }

    public boolean isTerminal() {
        return this == DONE || this == RETURNED || this == EXPIRED;
    }
}
