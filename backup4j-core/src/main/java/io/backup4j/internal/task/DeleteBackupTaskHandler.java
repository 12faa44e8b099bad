package io.backup4j.internal.task;

import io.backup4j.TaskHandler;
import io.backup4j.core.TaskArgs;
import io.backup4j.internal.BackupTaskExecutor;

public class DeleteBackupTaskHandler implements TaskHandler<TaskArgs.DeleteBackup, Void> {

    private final BackupTaskExecutor executor;

    public DeleteBackupTaskHandler(BackupTaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String name() {
        return TaskArgs.DELETE_BACKUP;
    }

    @Override
    public Class<TaskArgs.DeleteBackup> argsClass() {
        return TaskArgs.DeleteBackup.class;
    }

    @Override
    public Void execute(TaskArgs.DeleteBackup args) {
        executor.deleteBackup(args);
        return null;
    }
}
