package io.backup4j.core;

import java.time.Instant;

/**
 * Persisted backup schedule.
 * Pure data; mutated only through the schedule manager.
 */
public record Schedule(

        // identity
        String id,
        String tenantId,
        String name,

        // pipeline
        String sourceId,
        String destinationId,
        int keepN,

        // scheduling
        String cron,
        boolean active,
        Instant lastRun,
        Instant nextRun,

        // audit
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Whether a run must prune old artifacts. Zero means retention is unbounded.
     */
    public boolean hasRetention() {
        return keepN > 0;
    }
}
