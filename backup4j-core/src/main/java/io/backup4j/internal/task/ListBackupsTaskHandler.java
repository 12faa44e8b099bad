package io.backup4j.internal.task;

import io.backup4j.BackupArtifact;
import io.backup4j.TaskHandler;
import io.backup4j.core.TaskArgs;
import io.backup4j.internal.BackupTaskExecutor;

import java.util.List;

public class ListBackupsTaskHandler implements TaskHandler<TaskArgs.ListBackups, List<BackupArtifact>> {

    private final BackupTaskExecutor executor;

    public ListBackupsTaskHandler(BackupTaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String name() {
        return TaskArgs.LIST_BACKUPS;
    }

    @Override
    public Class<TaskArgs.ListBackups> argsClass() {
        return TaskArgs.ListBackups.class;
    }

    @Override
    public List<BackupArtifact> execute(TaskArgs.ListBackups args) {
        return executor.listBackups(args);
    }
}
