package io.backup4j.adapter.destination;

import io.backup4j.BackupArtifact;
import io.backup4j.BackupDestination;
import io.backup4j.core.exception.AdapterTransportException;
import io.backup4j.utils.ArtifactNames;
import io.backup4j.utils.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared upload, listing and download protocol of every destination.
 *
 * <p>Uploads go to {@code <name>.partial} first and are renamed to the final name only once
 * fully written; on failure the provisional object is removed best-effort and the error is
 * rethrown. Listings skip provisional objects and parse every other name strictly. Subclasses
 * supply the backend primitives and never see the provisional protocol.
 */
public abstract class AbstractBackupDestination implements BackupDestination {
    private static final Logger log = LoggerFactory.getLogger(AbstractBackupDestination.class);

    /**
     * An object as reported by the backend.
     *
     * @param name file name, no directory
     * @param key  what {@link #remove(String)} and {@link #fetch(String, Path)} accept
     */
    protected record StoredObject(String name, String key, long size, Instant modified) {
    }

    /**
     * Write a local file under {@code name} (relative to the destination root).
     */
    protected abstract void put(Path local, String name) throws IOException;

    /**
     * Rename {@code fromName} to {@code toName}, atomically where the backend allows.
     */
    protected abstract void rename(String fromName, String toName) throws IOException;

    protected abstract void remove(String key) throws IOException;

    /**
     * Every regular object directly under the destination root, provisional ones included.
     */
    protected abstract List<StoredObject> list() throws IOException;

    protected abstract void fetch(String key, Path target) throws IOException;

    /**
     * Key returned to callers for an object stored under {@code name}.
     */
    protected abstract String keyOf(String name);

    /**
     * Human-readable location used in error messages. Never contains credentials.
     */
    protected abstract String describe();

    /**
     * Final name for an upload; overridden by backends that must avoid overwriting.
     */
    protected String finalName(String localName) throws IOException {
        return localName;
    }

    @Override
    public final String uploadBackup(Path localArtifact) {
        Objects.requireNonNull(localArtifact, "localArtifact must not be null");
        if (!Files.isRegularFile(localArtifact)) {
            throw new AdapterTransportException("Backup file not found: " + localArtifact);
        }

        String provisional = null;
        try {
            String name = finalName(localArtifact.getFileName().toString());
            provisional = ArtifactNames.provisional(name);
            put(localArtifact, provisional);
            rename(provisional, name);
            log.debug("Upload committed destination={} name={}", describe(), name);
            return keyOf(name);
        } catch (IOException | RuntimeException e) {
            if (provisional != null) {
                removeProvisional(provisional);
            }
            throw new AdapterTransportException("Failed to upload backup to " + describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws AdapterTransportException when the backend fails, or when a non-provisional object
     *                                   does not carry a backup artifact name
     */
    @Override
    public final List<BackupArtifact> listBackups() {
        List<StoredObject> objects;
        try {
            objects = list();
        } catch (IOException | RuntimeException e) {
            throw new AdapterTransportException("Failed to list backups from " + describe() + ": " + e.getMessage(), e);
        }

        List<BackupArtifact> out = new ArrayList<>(objects.size());
        for (StoredObject o : objects) {
            if (ArtifactNames.isProvisional(o.name())) {
                continue;
            }
            ArtifactNames.Parsed parsed;
            try {
                parsed = ArtifactNames.parse(o.name());
            } catch (IllegalArgumentException e) {
                throw new AdapterTransportException("Unrecognized object in " + describe() + ": " + o.name(), e);
            }
            out.add(new BackupArtifact(o.name(), o.key(), o.size(), o.modified(),
                    parsed.sourceType(), parsed.tenantId(), parsed.scheduleId(), parsed.sourceId()));
        }
        return out;
    }

    @Override
    public final void deleteBackup(String key) {
        Objects.requireNonNull(key, "key must not be null");
        try {
            remove(key);
        } catch (IOException | RuntimeException e) {
            throw new AdapterTransportException("Failed to delete backup " + key + " from " + describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public final Path getBackup(String key, Path localPath) {
        Objects.requireNonNull(key, "key must not be null");
        Path target = null;
        try {
            target = localPath != null ? localPath : Files.createTempFile("backup4j-", "-" + ArtifactNames.baseName(key));
            fetch(key, target);
            return target;
        } catch (IOException | RuntimeException e) {
            if (localPath == null && target != null) {
                LocalFiles.deleteQuietly(target);
            }
            throw new AdapterTransportException("Failed to download backup " + key + " from " + describe() + ": " + e.getMessage(), e);
        }
    }

    private void removeProvisional(String provisional) {
        try {
            remove(keyOf(provisional));
        } catch (IOException | RuntimeException cleanup) {
            log.warn("Could not remove provisional upload destination={} name={} msg={}",
                    describe(), provisional, cleanup.getMessage());
        }
    }
}
