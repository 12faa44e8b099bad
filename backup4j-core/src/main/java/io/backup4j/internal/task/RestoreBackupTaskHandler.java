package io.backup4j.internal.task;

import io.backup4j.TaskHandler;
import io.backup4j.core.TaskArgs;
import io.backup4j.internal.BackupTaskExecutor;

/**
 * {@code restore_from_backup}: {@code false} when the source rejected the artifact.
 */
public class RestoreBackupTaskHandler implements TaskHandler<TaskArgs.RestoreBackup, Boolean> {

    private final BackupTaskExecutor executor;

    public RestoreBackupTaskHandler(BackupTaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String name() {
        return TaskArgs.RESTORE_FROM_BACKUP;
    }

    @Override
    public Class<TaskArgs.RestoreBackup> argsClass() {
        return TaskArgs.RestoreBackup.class;
    }

    @Override
    public Boolean execute(TaskArgs.RestoreBackup args) {
        return executor.restoreBackup(args);
    }
}
