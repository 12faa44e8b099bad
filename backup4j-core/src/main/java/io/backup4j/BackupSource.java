package io.backup4j;

import java.nio.file.Path;

/**
 * A system a point-in-time artifact can be produced from and restored into.
 */
public interface BackupSource extends AutoCloseable {

    /**
     * Produce one transportable artifact in the local work directory.
     *
     * @param scheduleId owning schedule, or {@code null} for an on-demand run
     * @return path to the created artifact; the caller owns and deletes it
     */
    Path createBackup(String tenantId, String sourceId, String scheduleId);

    /**
     * Restore this source from an artifact previously produced by {@link #createBackup}.
     * Fails on a corrupt or incompatible artifact.
     */
    void restoreFromBackup(Path artifact);

    boolean testConnection();

    @Override
    default void close() {
    }
}
