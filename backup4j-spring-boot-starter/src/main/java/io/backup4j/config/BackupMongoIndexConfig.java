package io.backup4j.config;

import io.backup4j.internal.mongo.DestinationDocument;
import io.backup4j.internal.mongo.ScheduleDocument;
import io.backup4j.internal.mongo.SourceDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the backup collections.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code backup.ensure-indexes-on-startup=true};
 * in production they are usually managed by migrations.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_tenant_created</b> on {@code backup_schedules}: { tenantId: 1, createdAt: 1 }
 *       <br/>Used by per-tenant schedule listing.</li>
 *   <li><b>idx_tenant</b> on {@code backup_sources} and {@code backup_destinations}: { tenantId: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.backup_schedules.createIndex({ tenantId: 1, createdAt: 1 }, { name: "idx_tenant_created" });
 * db.backup_sources.createIndex({ tenantId: 1 }, { name: "idx_tenant" });
 * db.backup_destinations.createIndex({ tenantId: 1 }, { name: "idx_tenant" });
 * </pre>
 */
public class BackupMongoIndexConfig {

    public static final String IDX_TENANT_CREATED = "idx_tenant_created";
    public static final String IDX_TENANT = "idx_tenant";

    private final MongoTemplate mongoTemplate;

    public BackupMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(tenantCreatedIndex());
        mongoTemplate.indexOps(SourceDocument.class).ensureIndex(tenantIndex());
        mongoTemplate.indexOps(DestinationDocument.class).ensureIndex(tenantIndex());
    }

    public static Index tenantCreatedIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_TENANT_CREATED);
    }

    public static Index tenantIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .named(IDX_TENANT);
    }
}
