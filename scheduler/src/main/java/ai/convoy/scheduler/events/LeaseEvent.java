package ai.convoy.scheduler.events;

import ai.convoy.scheduler.lifecycle.LeaseState;

import java.time.Instant;

public record LeaseEvent(long jobSetHandle, String jobId, String clusterId, LeaseState state, Instant time) {
}
