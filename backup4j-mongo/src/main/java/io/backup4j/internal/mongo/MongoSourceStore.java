package io.backup4j.internal.mongo;

import io.backup4j.core.BackupSourceRecord;
import io.backup4j.core.SourceStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for source registrations.
 */
public class MongoSourceStore implements SourceStore {

    private final MongoTemplate mongoTemplate;

    public MongoSourceStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<BackupSourceRecord> findById(String tenantId, String id) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (id == null) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("_id").is(id).and("tenantId").is(tenantId));
        return Optional.ofNullable(mongoTemplate.findOne(q, SourceDocument.class)).map(MongoSourceStore::toRecord);
    }

    /**
     * Insert or replace. A record without an id gets a generated one.
     */
    @Override
    public BackupSourceRecord save(BackupSourceRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(record.tenantId(), "tenantId must not be null");

        SourceDocument doc = new SourceDocument();
        doc.setId(record.id());
        doc.setTenantId(record.tenantId());
        doc.setName(record.name());
        doc.setType(record.type());
        doc.setUrl(record.url());
        doc.setLogin(record.login());
        doc.setPassword(record.password());
        doc.setApiKey(record.apiKey());
        return toRecord(mongoTemplate.save(doc));
    }

    private static BackupSourceRecord toRecord(SourceDocument doc) {
        return new BackupSourceRecord(
                doc.getId(),
                doc.getTenantId(),
                doc.getName(),
                doc.getType(),
                doc.getUrl(),
                doc.getLogin(),
                doc.getPassword(),
                doc.getApiKey()
        );
    }
}
