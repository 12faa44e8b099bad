package io.backup4j.internal.task;

import io.backup4j.TaskHandler;
import io.backup4j.internal.BackupTaskExecutor;

import java.util.List;

public final class BackupTaskHandlers {

    private BackupTaskHandlers() {
    }

    /**
     * The four task operations bound to one executor.
     */
    public static List<TaskHandler<?, ?>> forExecutor(BackupTaskExecutor executor) {
        return List.of(
                new CreateBackupTaskHandler(executor),
                new ListBackupsTaskHandler(executor),
                new DeleteBackupTaskHandler(executor),
                new RestoreBackupTaskHandler(executor)
        );
    }
}
