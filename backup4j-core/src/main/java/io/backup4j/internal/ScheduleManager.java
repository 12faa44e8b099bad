package io.backup4j.internal;

import io.backup4j.core.DestinationStore;
import io.backup4j.core.ReloadPublisher;
import io.backup4j.core.Schedule;
import io.backup4j.core.ScheduleDraft;
import io.backup4j.core.ScheduleStore;
import io.backup4j.core.ScheduleUpdate;
import io.backup4j.core.SourceStore;
import io.backup4j.core.exception.NotFoundException;
import io.backup4j.utils.CronParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tenant-scoped schedule CRUD.
 *
 * <p>Every mutation that changes what the dispatcher should fire (create, update, delete,
 * toggle) is persisted first and then followed by a reload notification. Fire bookkeeping
 * ({@link #updateLastRun}) never notifies, otherwise each fire would trigger a reload.
 */
public class ScheduleManager {
    private static final Logger log = LoggerFactory.getLogger(ScheduleManager.class);

    static final String SCHEDULE = "Schedule";
    static final String SOURCE = "Source";
    static final String DESTINATION = "Destination";

    private final ScheduleStore scheduleStore;
    private final SourceStore sourceStore;
    private final DestinationStore destinationStore;
    private final ReloadPublisher reloadPublisher;
    private final ZoneId timezone;
    private final Clock clock;

    public ScheduleManager(ScheduleStore scheduleStore,
                           SourceStore sourceStore,
                           DestinationStore destinationStore,
                           ReloadPublisher reloadPublisher,
                           ZoneId timezone,
                           Clock clock) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.sourceStore = Objects.requireNonNull(sourceStore, "sourceStore must not be null");
        this.destinationStore = Objects.requireNonNull(destinationStore, "destinationStore must not be null");
        this.reloadPublisher = Objects.requireNonNull(reloadPublisher, "reloadPublisher must not be null");
        this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Schedule createSchedule(String tenantId, ScheduleDraft draft) {
        requireTenant(tenantId);
        Objects.requireNonNull(draft, "draft must not be null");
        if (draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        requireKeepN(draft.keepN());
        CronParser.validate(draft.cron());
        requireSource(tenantId, draft.sourceId());
        requireDestination(tenantId, draft.destinationId());

        Instant now = clock.instant();
        Schedule created = scheduleStore.insert(tenantId, draft, nextRun(draft.cron(), now), now);
        log.info("Schedule created tenantId={} id={} cron='{}' keepN={}",
                tenantId, created.id(), created.cron(), created.keepN());

        publishReload("create", created.id());
        return created;
    }

    public Optional<Schedule> getSchedule(String tenantId, String id) {
        requireTenant(tenantId);
        return scheduleStore.findById(tenantId, id);
    }

    /**
     * @param active optional filter; {@code null} lists every schedule of the tenant
     */
    public List<Schedule> listSchedules(String tenantId, Boolean active) {
        requireTenant(tenantId);
        return scheduleStore.findByTenant(tenantId, active);
    }

    public Schedule updateSchedule(String tenantId, String id, ScheduleUpdate update) {
        requireTenant(tenantId);
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            throw new IllegalArgumentException("ScheduleUpdate must change at least one field");
        }
        if (update.keepN() != null) {
            requireKeepN(update.keepN());
        }
        if (update.sourceId() != null) {
            requireSource(tenantId, update.sourceId());
        }
        if (update.destinationId() != null) {
            requireDestination(tenantId, update.destinationId());
        }

        Instant now = clock.instant();
        ScheduleUpdate effective = update;
        if (update.cron() != null) {
            CronParser.validate(update.cron());
            effective = update.toBuilder().nextRun(nextRun(update.cron(), now)).build();
        }

        Schedule updated = scheduleStore.update(tenantId, id, effective, now)
                .orElseThrow(() -> new NotFoundException(SCHEDULE, id, tenantId));
        log.info("Schedule updated tenantId={} id={} update={}", tenantId, id, effective);

        publishReload("update", id);
        return updated;
    }

    public void deleteSchedule(String tenantId, String id) {
        requireTenant(tenantId);
        if (!scheduleStore.delete(tenantId, id)) {
            throw new NotFoundException(SCHEDULE, id, tenantId);
        }
        log.info("Schedule deleted tenantId={} id={}", tenantId, id);

        publishReload("delete", id);
    }

    public Schedule toggleSchedule(String tenantId, String id) {
        requireTenant(tenantId);
        Schedule toggled = scheduleStore.toggleActive(tenantId, id, clock.instant())
                .orElseThrow(() -> new NotFoundException(SCHEDULE, id, tenantId));
        log.info("Schedule toggled tenantId={} id={} active={}", tenantId, id, toggled.active());

        publishReload("toggle", id);
        return toggled;
    }

    /**
     * Record a fire. Does not notify the dispatchers.
     */
    public Schedule updateLastRun(String tenantId, String id, Instant lastRun) {
        requireTenant(tenantId);
        Objects.requireNonNull(lastRun, "lastRun must not be null");

        Schedule current = scheduleStore.findById(tenantId, id)
                .orElseThrow(() -> new NotFoundException(SCHEDULE, id, tenantId));
        Instant next = nextRun(current.cron(), lastRun);

        return scheduleStore.updateLastRun(tenantId, id, lastRun, next, clock.instant())
                .orElseThrow(() -> new NotFoundException(SCHEDULE, id, tenantId));
    }

    private Instant nextRun(String cron, Instant from) {
        return CronParser.nextRunAt(cron, timezone, from);
    }

    private void publishReload(String reason, String scheduleId) {
        reloadPublisher.publishReload();
        log.debug("Reload published reason={} scheduleId={}", reason, scheduleId);
    }

    private void requireSource(String tenantId, String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        if (sourceStore.findById(tenantId, sourceId).isEmpty()) {
            throw new NotFoundException(SOURCE, sourceId, tenantId);
        }
    }

    private void requireDestination(String tenantId, String destinationId) {
        Objects.requireNonNull(destinationId, "destinationId must not be null");
        if (destinationStore.findById(tenantId, destinationId).isEmpty()) {
            throw new NotFoundException(DESTINATION, destinationId, tenantId);
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }

    private static void requireKeepN(int keepN) {
        if (keepN < 0) {
            throw new IllegalArgumentException("keepN must be >= 0, got " + keepN);
        }
    }
}
