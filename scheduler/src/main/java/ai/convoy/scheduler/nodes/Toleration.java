package ai.convoy.scheduler.nodes;

import ai.convoy.v1.QueueApi;

public record Toleration(String key, String operator, String value, String effect) {
    public static final String EXISTS = "Exists";

    public static Toleration fromProto(QueueApi.Toleration toleration) {
        return new Toleration(toleration.getKey(), toleration.getOperator(), toleration.getValue(),
            toleration.getEffect());
    }

    public QueueApi.Toleration toProto() {
        return QueueApi.Toleration.newBuilder()
            .setKey(key)
            .setOperator(operator)
            .setValue(value)
            .setEffect(effect)
            .build();
    }

    /**
     * Kubernetes matching: an empty key with {@code Exists} tolerates everything, an empty effect matches
     * every effect, {@code Exists} ignores the value and the default operator {@code Equal} compares it.
     */
    public boolean tolerates(Taint taint) {
        if (!effect.isEmpty() && !effect.equals(taint.effect())) {
            return false;
        }
        if (key.isEmpty()) {
            return EXISTS.equals(operator);
        }
        if (!key.equals(taint.key())) {
            return false;
        }
        return EXISTS.equals(operator) || value.equals(taint.value());
    }
}
