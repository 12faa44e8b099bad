package io.backup4j.core;

/**
 * Input for creating a schedule. Validated by the schedule manager before it reaches a store.
 */
public record ScheduleDraft(
        String name,
        String sourceId,
        String destinationId,
        int keepN,
        String cron,
        boolean active
) {

    public static ScheduleDraft active(String name, String sourceId, String destinationId, int keepN, String cron) {
        return new ScheduleDraft(name, sourceId, destinationId, keepN, cron, true);
    }
}
