package io.backup4j.adapter.source;

import io.backup4j.BackupSource;
import io.backup4j.core.SourceType;
import io.backup4j.core.exception.AdapterTransportException;
import io.backup4j.utils.ArtifactNames;
import io.backup4j.utils.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Naming, work-directory placement and error translation shared by every source.
 *
 * <p>Subclasses only write the artifact bytes to a given path and read them back; a partially
 * written artifact is removed before the failure is reported.
 */
public abstract class AbstractBackupSource implements BackupSource {
    private static final Logger log = LoggerFactory.getLogger(AbstractBackupSource.class);

    private final SourceType type;
    private final Path workDir;
    private final Clock clock;

    protected AbstractBackupSource(SourceType type, Path workDir, Clock clock) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    protected abstract void writeArtifact(Path target) throws IOException, InterruptedException;

    protected abstract void restoreArtifact(Path artifact) throws IOException, InterruptedException;

    /**
     * Backend location for error messages. Never contains credentials.
     */
    protected abstract String describe();

    protected Path workDir() {
        return workDir;
    }

    @Override
    public final Path createBackup(String tenantId, String sourceId, String scheduleId) {
        String name = ArtifactNames.format(type.tag(), tenantId, scheduleId, sourceId,
                LocalDateTime.now(clock), type.extension());
        Path artifact = LocalFiles.ensureDirectory(workDir).resolve(name);

        try {
            writeArtifact(artifact);
            if (!Files.isRegularFile(artifact)) {
                throw new IOException("Backup file was not created: " + artifact.getFileName());
            }
            log.info("Backup created source={} file={} size={}", describe(), name, Files.size(artifact));
            return artifact;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LocalFiles.deleteQuietly(artifact);
            throw new AdapterTransportException("Backup of " + describe() + " interrupted", e);
        } catch (IOException | RuntimeException e) {
            LocalFiles.deleteQuietly(artifact);
            throw new AdapterTransportException("Failed to create backup of " + describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public final void restoreFromBackup(Path artifact) {
        Objects.requireNonNull(artifact, "artifact must not be null");
        if (!Files.isRegularFile(artifact)) {
            throw new AdapterTransportException("Backup file not found: " + artifact);
        }
        try {
            restoreArtifact(artifact);
            log.info("Restore finished source={} file={}", describe(), artifact.getFileName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterTransportException("Restore of " + describe() + " interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new AdapterTransportException("Failed to restore " + describe() + ": " + e.getMessage(), e);
        }
    }
}
