package io.backup4j.core;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Flat argument records of the four named task operations.
 * Snake-case keys ({@code tenant_id}, {@code keep_n}, ...) are accepted when converting from a map.
 */
public final class TaskArgs {

    public static final String CREATE_BACKUP = "create_backup";
    public static final String LIST_BACKUPS = "list_backups";
    public static final String DELETE_BACKUP = "delete_backup";
    public static final String RESTORE_FROM_BACKUP = "restore_from_backup";

    private TaskArgs() {
    }

    /**
     * @param scheduleId owning schedule, {@code null} for an on-demand backup
     * @param keepN      retention count, {@code null} or 0 for unbounded
     */
    public record CreateBackup(
            @JsonAlias({"source_id", "backup_source_id"}) String sourceId,
            @JsonAlias({"destination_id", "backup_destination_id"}) String destinationId,
            @JsonAlias("tenant_id") String tenantId,
            @JsonAlias("schedule_id") String scheduleId,
            @JsonAlias("keep_n") Integer keepN
    ) {
    }

    public record ListBackups(
            @JsonAlias({"destination_id", "backup_destination_id"}) String destinationId,
            @JsonAlias("tenant_id") String tenantId
    ) {
    }

    public record DeleteBackup(
            @JsonAlias({"destination_id", "backup_destination_id"}) String destinationId,
            @JsonAlias("tenant_id") String tenantId,
            @JsonAlias("backup_key") String backupKey
    ) {
    }

    public record RestoreBackup(
            @JsonAlias({"source_id", "backup_source_id"}) String sourceId,
            @JsonAlias({"destination_id", "backup_destination_id"}) String destinationId,
            @JsonAlias("tenant_id") String tenantId,
            @JsonAlias("backup_key") String backupKey
    ) {
    }
}
