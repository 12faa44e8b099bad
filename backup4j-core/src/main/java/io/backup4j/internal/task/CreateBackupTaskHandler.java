package io.backup4j.internal.task;

import io.backup4j.TaskHandler;
import io.backup4j.core.TaskArgs;
import io.backup4j.internal.BackupTaskExecutor;

/**
 * {@code create_backup}: returns the key of the uploaded artifact.
 */
public class CreateBackupTaskHandler implements TaskHandler<TaskArgs.CreateBackup, String> {

    private final BackupTaskExecutor executor;

    public CreateBackupTaskHandler(BackupTaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String name() {
        return TaskArgs.CREATE_BACKUP;
    }

    @Override
    public Class<TaskArgs.CreateBackup> argsClass() {
        return TaskArgs.CreateBackup.class;
    }

    @Override
    public String execute(TaskArgs.CreateBackup args) {
        return executor.createBackup(args);
    }
}
