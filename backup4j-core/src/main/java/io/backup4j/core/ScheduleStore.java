package io.backup4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable schedule persistence.
 *
 * <p>Every tenant-facing method takes the tenant id and includes it in the match predicate;
 * only {@link #findAll()} crosses tenants, for the dispatcher's table build.
 */
public interface ScheduleStore {

    /**
     * @param nextRun first fire time, precomputed by the caller from the draft's cron
     */
    Schedule insert(String tenantId, ScheduleDraft draft, Instant nextRun, Instant now);

    Optional<Schedule> findById(String tenantId, String id);

    /**
     * @param active optional filter; {@code null} returns both active and inactive schedules
     */
    List<Schedule> findByTenant(String tenantId, Boolean active);

    List<Schedule> findAll();

    Optional<Schedule> update(String tenantId, String id, ScheduleUpdate update, Instant now);

    Optional<Schedule> toggleActive(String tenantId, String id, Instant now);

    /**
     * Bookkeeping after a fire. Touches only {@code lastRun}, {@code nextRun} and {@code updatedAt}.
     */
    Optional<Schedule> updateLastRun(String tenantId, String id, Instant lastRun, Instant nextRun, Instant now);

    /**
     * @return true when a schedule was removed
     */
    boolean delete(String tenantId, String id);
}
