package io.backup4j.core.exception;

/**
 * A tenant-scoped schedule, source or destination does not exist.
 */
public class NotFoundException extends BackupException {

    private final String entity;
    private final String id;
    private final String tenantId;

    public NotFoundException(String entity, String id, String tenantId) {
        super(entity + " not found id=" + id + " tenantId=" + tenantId);
        this.entity = entity;
        this.id = id;
        this.tenantId = tenantId;
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }
}
