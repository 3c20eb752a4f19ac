package ai.convoy.scheduler.nodes;

import ai.convoy.v1.QueueApi;

import java.util.Comparator;

public record Taint(String key, String value, String effect) implements Comparable<Taint> {
    public static final String NO_SCHEDULE = "NoSchedule";
    public static final String NO_EXECUTE = "NoExecute";

    private static final Comparator<Taint> ORDER = Comparator.comparing(Taint::key)
        .thenComparing(Taint::value)
        .thenComparing(Taint::effect);

    public static Taint fromProto(QueueApi.Taint taint) {
        return new Taint(taint.getKey(), taint.getValue(), taint.getEffect());
    }

    public QueueApi.Taint toProto() {
        return QueueApi.Taint.newBuilder().setKey(key).setValue(value).setEffect(effect).build();
    }

    /**
     * Only hard taints keep a pod off a node; {@code PreferNoSchedule} is advisory.
     */
    public boolean isHard() {
        return NO_SCHEDULE.equals(effect) || NO_EXECUTE.equals(effect);
    }

    @Override
    public int compareTo(Taint other) {
        return ORDER.compare(this, other);
    }
}
