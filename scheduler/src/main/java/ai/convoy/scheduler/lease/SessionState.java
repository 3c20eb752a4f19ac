package ai.convoy.scheduler.lease;

public enum SessionState {
    HANDSHAKE,
    STREAMING,
    AWAITING_ACKS,
    DRAINING,
    CLOSED
}
