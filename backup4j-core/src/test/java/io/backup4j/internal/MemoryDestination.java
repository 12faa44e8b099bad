package io.backup4j.internal;

import io.backup4j.BackupArtifact;
import io.backup4j.BackupDestination;
import io.backup4j.utils.ArtifactNames;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Destination holding artifacts in memory. Individual operations can be made to fail.
 */
class MemoryDestination implements BackupDestination {

    final Map<String, Stored> objects = new LinkedHashMap<>();
    final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();
    final List<String> deleted = new ArrayList<>();
    boolean failUploads;
    int closeCount;

    record Stored(byte[] content, Instant modified) {
    }

    void seed(String name, Instant modified) {
        objects.put(name, new Stored(new byte[]{1}, modified));
    }

    @Override
    public synchronized String uploadBackup(Path localArtifact) {
        if (failUploads) {
            throw new IllegalStateException("destination unavailable");
        }
        try {
            String name = localArtifact.getFileName().toString();
            objects.put(name, new Stored(Files.readAllBytes(localArtifact), Instant.now()));
            return name;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized List<BackupArtifact> listBackups() {
        List<BackupArtifact> out = new ArrayList<>();
        objects.forEach((name, stored) -> {
            ArtifactNames.Parsed p = ArtifactNames.parse(name);
            out.add(new BackupArtifact(name, name, stored.content().length, stored.modified(),
                    p.sourceType(), p.tenantId(), p.scheduleId(), p.sourceId()));
        });
        return out;
    }

    @Override
    public synchronized void deleteBackup(String key) {
        if (failingDeletes.contains(key)) {
            throw new IllegalStateException("cannot delete " + key);
        }
        if (objects.remove(key) == null) {
            throw new IllegalArgumentException("no such key " + key);
        }
        deleted.add(key);
    }

    @Override
    public synchronized Path getBackup(String key, Path localPath) {
        Stored stored = objects.get(key);
        if (stored == null) {
            throw new IllegalArgumentException("no such key " + key);
        }
        try {
            Path target = localPath != null ? localPath : Files.createTempFile("restore-", "-" + key);
            Files.write(target, stored.content());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public boolean testConnection() {
        return true;
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }
}
