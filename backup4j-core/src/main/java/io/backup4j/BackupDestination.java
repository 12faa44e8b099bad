package io.backup4j;

import java.nio.file.Path;
import java.util.List;

/**
 * A storage backend that holds, lists, fetches and removes artifacts.
 *
 * <p>Uploads are atomic: a concurrent {@link #listBackups()} never returns an artifact that is
 * still being written.
 *
 * <p>Instances are opened per operation; {@link #close()} releases any connection they hold.
 */
public interface BackupDestination extends AutoCloseable {

    /**
     * @return the destination-relative key of the stored artifact
     */
    String uploadBackup(Path localArtifact);

    List<BackupArtifact> listBackups();

    void deleteBackup(String key);

    /**
     * Download an artifact.
     *
     * @param localPath target file, or {@code null} to let the destination pick a fresh one
     * @return the local file holding the artifact
     */
    Path getBackup(String key, Path localPath);

    default Path getBackup(String key) {
        return getBackup(key, null);
    }

    boolean testConnection();

    @Override
    default void close() {
    }
}
