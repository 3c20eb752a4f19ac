package ai.convoy.scheduler.events;

public record JobSetKey(String queue, String jobSetId) {
}
