package ai.convoy.scheduler.resources;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.LongBinaryOperator;

/**
 * Immutable vector of named resource amounts in milli-units. Zero entries are dropped, so two vectors
 * are equal iff every resource amount is equal.
 */
public final class ComputeResources {
    public static final ComputeResources EMPTY = new ComputeResources(new TreeMap<>());

    private final SortedMap<String, Long> millis;

    private ComputeResources(SortedMap<String, Long> millis) {
        this.millis = Collections.unmodifiableSortedMap(millis);
    }

    public static ComputeResources ofMillis(Map<String, Long> amounts) {
        var normalized = new TreeMap<String, Long>();
        amounts.forEach((name, amount) -> {
            if (amount != 0) {
                normalized.put(name, amount);
            }
        });
        return normalized.isEmpty() ? EMPTY : new ComputeResources(normalized);
    }

    public static ComputeResources of(String name, String quantity) {
        return parse(Map.of(name, quantity));
    }

    /**
     * @throws IllegalArgumentException if any quantity is malformed
     */
    public static ComputeResources parse(Map<String, String> quantities) {
        var amounts = new HashMap<String, Long>();
        quantities.forEach((name, quantity) -> amounts.put(name, Quantities.parseMillis(quantity)));
        return ofMillis(amounts);
    }

    public long get(String name) {
        return millis.getOrDefault(name, 0L);
    }

    public SortedMap<String, Long> asMap() {
        return millis;
    }

    public boolean isEmpty() {
        return millis.isEmpty();
    }

    public ComputeResources add(ComputeResources other) {
        return combine(other, Math::addExact);
    }

    public ComputeResources subtract(ComputeResources other) {
        return combine(other, Math::subtractExact);
    }

    /**
     * Component-wise subtraction floored at zero.
     */
    public ComputeResources subtractClamped(ComputeResources other) {
        return combine(other, (a, b) -> Math.max(0, a - b));
    }

    public ComputeResources multiply(long factor) {
        var result = new HashMap<String, Long>();
        millis.forEach((name, amount) -> result.put(name, Math.multiplyExact(amount, factor)));
        return ofMillis(result);
    }

    /**
     * True iff every amount of this vector is at most the amount of the same resource in {@code limit};
     * resources missing from {@code limit} count as zero.
     */
    public boolean fitsWithin(ComputeResources limit) {
        for (var entry : millis.entrySet()) {
            if (entry.getValue() > limit.get(entry.getKey())) {
                return false;
            }
        }
        return true;
    }

    /**
     * True iff every resource named in {@code minimum} is requested in at least that amount.
     */
    public boolean meetsMinimum(ComputeResources minimum) {
        return minimum.fitsWithin(this);
    }

    public boolean hasNegative() {
        return millis.values().stream().anyMatch(amount -> amount < 0);
    }

    public Map<String, String> toQuantities() {
        var result = new LinkedHashMap<String, String>();
        millis.forEach((name, amount) -> result.put(name, Quantities.format(amount)));
        return result;
    }

    private ComputeResources combine(ComputeResources other, LongBinaryOperator op) {
        var result = new HashMap<String, Long>(millis);
        other.millis.forEach((name, amount) -> result.put(name, op.applyAsLong(get(name), amount)));
        return ofMillis(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ComputeResources that && millis.equals(that.millis);
    }

    @Override
    public int hashCode() {
        return millis.hashCode();
    }

    @Override
    public String toString() {
        return toQuantities().toString();
    }
}
