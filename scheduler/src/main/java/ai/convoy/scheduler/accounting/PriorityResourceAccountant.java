package ai.convoy.scheduler.accounting;

import ai.convoy.scheduler.resources.ComputeResources;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per cluster/pool ledger of resources committed to leases, bucketed by priority class.
 *
 * <p>Invariant: for every priority class p, the sum of commitments of all classes q &ge; p fits within the
 * capacity. Admitting at p raises that sum for p and for every class below it, so all of those bands are
 * checked. Preemption of running pods is visible through node-level availability, not through this ledger.
 *
 * <p>The instance monitor is the lock of its pool: callers that combine several calls into one admission
 * decision hold {@code synchronized (accountant)} for the whole sequence.
 */
public class PriorityResourceAccountant {
    private final PoolKey pool;
    private final TreeMap<Integer, ComputeResources> committed = new TreeMap<>();
    private ComputeResources capacity = ComputeResources.EMPTY;

    public PriorityResourceAccountant(PoolKey pool) {
        this.pool = pool;
    }

    public PoolKey pool() {
        return pool;
    }

    public synchronized void updateCapacity(ComputeResources capacity) {
        this.capacity = capacity;
    }

    public synchronized ComputeResources capacity() {
        return capacity;
    }

    public synchronized boolean canAdmit(int priority, ComputeResources request) {
        if (!committedAtOrAbove(priority).add(request).fitsWithin(capacity)) {
            return false;
        }
        for (int band : committed.headMap(priority).keySet()) {
            if (!committedAtOrAbove(band).add(request).fitsWithin(capacity)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws IllegalStateException if the request is not admissible at this priority
     */
    public synchronized void commit(int priority, ComputeResources request) {
        if (!canAdmit(priority, request)) {
            throw new IllegalStateException("Cannot commit " + request + " at priority " + priority
                + " in pool " + pool + ": headroom is " + headroom(priority));
        }
        committed.merge(priority, request, ComputeResources::add);
    }

    /**
     * Commits without the capacity check. Used when leases are restored before the executor has reported
     * its capacity.
     */
    public synchronized void restore(int priority, ComputeResources request) {
        committed.merge(priority, request, ComputeResources::add);
    }

    /**
     * @throws IllegalStateException if more is released than was committed at this priority
     */
    public synchronized void release(int priority, ComputeResources request) {
        var current = committed.getOrDefault(priority, ComputeResources.EMPTY);
        var remaining = current.subtract(request);
        if (remaining.hasNegative()) {
            throw new IllegalStateException("Cannot release " + request + " at priority " + priority
                + " in pool " + pool + ": only " + current + " is committed");
        }
        if (remaining.isEmpty()) {
            committed.remove(priority);
        } else {
            committed.put(priority, remaining);
        }
    }

    /**
     * Largest request that {@link #canAdmit} would accept at this priority, per resource.
     */
    public synchronized ComputeResources headroom(int priority) {
        var headroom = capacity.subtractClamped(committedAtOrAbove(priority));
        for (int band : committed.headMap(priority).keySet()) {
            headroom = min(headroom, capacity.subtractClamped(committedAtOrAbove(band)));
        }
        return headroom;
    }

    /**
     * True iff every band respects the capacity.
     */
    public synchronized boolean isConsistent() {
        for (int band : committed.keySet()) {
            if (!committedAtOrAbove(band).fitsWithin(capacity)) {
                return false;
            }
        }
        return true;
    }

    public synchronized ComputeResources committed(int priority) {
        return committed.getOrDefault(priority, ComputeResources.EMPTY);
    }

    public synchronized SortedMap<Integer, ComputeResources> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(committed));
    }

    private static ComputeResources min(ComputeResources a, ComputeResources b) {
        return a.subtract(a.subtractClamped(b));
    }

    private ComputeResources committedAtOrAbove(int priority) {
        var sum = ComputeResources.EMPTY;
        for (var resources : committed.tailMap(priority).values()) {
            sum = sum.add(resources);
        }
        return sum;
    }
}
