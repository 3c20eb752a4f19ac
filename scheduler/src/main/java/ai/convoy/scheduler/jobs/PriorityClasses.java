package ai.convoy.scheduler.jobs;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Named priority classes. A larger value is more urgent, as with Kubernetes PriorityClass.
 */
public class PriorityClasses {
    private final Map<String, Integer> classes;
    private final String defaultClass;

    /**
     * @throws IllegalStateException if the default class is not one of the given classes
     */
    public PriorityClasses(Map<String, Integer> classes, String defaultClass) {
        if (classes.isEmpty()) {
            throw new IllegalStateException("At least one priority class must be configured");
        }
        if (!classes.containsKey(defaultClass)) {
            throw new IllegalStateException("Default priority class '" + defaultClass + "' is not configured");
        }
        this.classes = Map.copyOf(classes);
        this.defaultClass = defaultClass;
    }

    public boolean isKnown(String name) {
        return name.isEmpty() || classes.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException for an unknown class name
     */
    public int resolve(String name) {
        var value = classes.get(name.isEmpty() ? defaultClass : name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown priority class '" + name + "'");
        }
        return value;
    }

    public SortedSet<Integer> values() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(classes.values()));
    }
}
