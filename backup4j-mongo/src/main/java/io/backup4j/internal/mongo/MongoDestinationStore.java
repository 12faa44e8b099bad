package io.backup4j.internal.mongo;

import io.backup4j.core.BackupDestinationRecord;
import io.backup4j.core.DestinationStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Objects;
import java.util.Optional;

public class MongoDestinationStore implements DestinationStore {

    private final MongoTemplate mongoTemplate;

    public MongoDestinationStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<BackupDestinationRecord> findById(String tenantId, String id) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (id == null) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("_id").is(id).and("tenantId").is(tenantId));
        return Optional.ofNullable(mongoTemplate.findOne(q, DestinationDocument.class))
                .map(MongoDestinationStore::toRecord);
    }

    @Override
    public BackupDestinationRecord save(BackupDestinationRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(record.tenantId(), "tenantId must not be null");

        DestinationDocument doc = new DestinationDocument();
        doc.setId(record.id());
        doc.setTenantId(record.tenantId());
        doc.setName(record.name());
        doc.setType(record.type());
        doc.setUrl(record.url());
        doc.setLogin(record.login());
        doc.setPassword(record.password());
        doc.setApiKey(record.apiKey());
        doc.setConfig(record.config());
        return toRecord(mongoTemplate.save(doc));
    }

    private static BackupDestinationRecord toRecord(DestinationDocument doc) {
        return new BackupDestinationRecord(
                doc.getId(),
                doc.getTenantId(),
                doc.getName(),
                doc.getType(),
                doc.getUrl(),
                doc.getLogin(),
                doc.getPassword(),
                doc.getApiKey(),
                doc.getConfig()
        );
    }
}
