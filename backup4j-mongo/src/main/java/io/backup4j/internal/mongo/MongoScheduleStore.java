package io.backup4j.internal.mongo;

import io.backup4j.core.Schedule;
import io.backup4j.core.ScheduleDraft;
import io.backup4j.core.ScheduleStore;
import io.backup4j.core.ScheduleUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>Every tenant-facing lookup matches on {@code (_id, tenantId)}, so an id from another tenant
 * behaves exactly like an unknown id.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private static final int TOGGLE_ATTEMPTS = 3;

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Schedule insert(String tenantId, ScheduleDraft draft, Instant nextRun, Instant now) {
        requireTenant(tenantId);
        Objects.requireNonNull(draft, "draft must not be null");

        ScheduleDocument doc = new ScheduleDocument();
        doc.setTenantId(tenantId);
        doc.setName(draft.name());
        doc.setSourceId(draft.sourceId());
        doc.setDestinationId(draft.destinationId());
        doc.setKeepN(draft.keepN());
        doc.setCron(draft.cron());
        doc.setActive(draft.active());
        doc.setNextRun(nextRun);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        return toSchedule(mongoTemplate.insert(doc));
    }

    @Override
    public Optional<Schedule> findById(String tenantId, String id) {
        requireTenant(tenantId);
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findOne(byTenantAndId(tenantId, id), ScheduleDocument.class))
                .map(MongoScheduleStore::toSchedule);
    }

    @Override
    public List<Schedule> findByTenant(String tenantId, Boolean active) {
        requireTenant(tenantId);
        Criteria c = Criteria.where("tenantId").is(tenantId);
        if (active != null) {
            c = c.and("active").is(active);
        }
        Query q = new Query(c).with(Sort.by(Sort.Order.asc("createdAt")));
        return toSchedules(mongoTemplate.find(q, ScheduleDocument.class));
    }

    @Override
    public List<Schedule> findAll() {
        return toSchedules(mongoTemplate.findAll(ScheduleDocument.class));
    }

    @Override
    public Optional<Schedule> update(String tenantId, String id, ScheduleUpdate update, Instant now) {
        requireTenant(tenantId);
        Objects.requireNonNull(update, "update must not be null");
        if (id == null) {
            return Optional.empty();
        }

        Update u = new Update().set("updatedAt", now);
        if (update.name() != null) {
            u.set("name", update.name());
        }
        if (update.sourceId() != null) {
            u.set("sourceId", update.sourceId());
        }
        if (update.destinationId() != null) {
            u.set("destinationId", update.destinationId());
        }
        if (update.keepN() != null) {
            u.set("keepN", update.keepN());
        }
        if (update.cron() != null) {
            u.set("cron", update.cron());
        }
        if (update.active() != null) {
            u.set("active", update.active());
        }
        if (update.nextRun() != null) {
            u.set("nextRun", update.nextRun());
        }

        return findAndModify(byTenantAndId(tenantId, id), u);
    }

    /**
     * Flip {@code active} with a compare-and-set on the value just read, so two concurrent toggles
     * always end up applied one after the other.
     */
    @Override
    public Optional<Schedule> toggleActive(String tenantId, String id, Instant now) {
        requireTenant(tenantId);
        for (int attempt = 1; attempt <= TOGGLE_ATTEMPTS; attempt++) {
            Optional<Schedule> current = findById(tenantId, id);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            boolean active = current.get().active();
            Query q = new Query(Criteria.where("_id").is(id)
                    .and("tenantId").is(tenantId)
                    .and("active").is(active));
            Update u = new Update()
                    .set("active", !active)
                    .set("updatedAt", now);

            Optional<Schedule> toggled = findAndModify(q, u);
            if (toggled.isPresent()) {
                return toggled;
            }
            log.debug("Toggle lost a race tenantId={} scheduleId={} attempt={}", tenantId, id, attempt);
        }
        throw new IllegalStateException("Schedule " + id + " changed concurrently, toggle not applied");
    }

    @Override
    public Optional<Schedule> updateLastRun(String tenantId, String id, Instant lastRun, Instant nextRun, Instant now) {
        requireTenant(tenantId);
        if (id == null) {
            return Optional.empty();
        }
        Update u = new Update()
                .set("lastRun", lastRun)
                .set("nextRun", nextRun)
                .set("updatedAt", now);
        return findAndModify(byTenantAndId(tenantId, id), u);
    }

    @Override
    public boolean delete(String tenantId, String id) {
        requireTenant(tenantId);
        if (id == null) {
            return false;
        }
        return mongoTemplate.remove(byTenantAndId(tenantId, id), ScheduleDocument.class).getDeletedCount() > 0;
    }

    private Optional<Schedule> findAndModify(Query query, Update update) {
        ScheduleDocument doc = mongoTemplate.findAndModify(
                query,
                update,
                FindAndModifyOptions.options().returnNew(true),
                ScheduleDocument.class
        );
        return Optional.ofNullable(doc).map(MongoScheduleStore::toSchedule);
    }

    private static Query byTenantAndId(String tenantId, String id) {
        return new Query(Criteria.where("_id").is(id).and("tenantId").is(tenantId));
    }

    private static void requireTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
    }

    private static List<Schedule> toSchedules(List<ScheduleDocument> docs) {
        List<Schedule> out = new ArrayList<>(docs.size());
        for (ScheduleDocument d : docs) {
            if (d != null) {
                out.add(toSchedule(d));
            }
        }
        return out;
    }

    static Schedule toSchedule(ScheduleDocument doc) {
        return new Schedule(
                doc.getId(),
                doc.getTenantId(),
                doc.getName(),
                doc.getSourceId(),
                doc.getDestinationId(),
                doc.getKeepN(),
                doc.getCron(),
                doc.isActive(),
                doc.getLastRun(),
                doc.getNextRun(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
