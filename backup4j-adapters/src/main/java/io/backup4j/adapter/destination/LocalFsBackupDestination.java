package io.backup4j.adapter.destination;

import io.backup4j.Credentials;
import io.backup4j.core.exception.AdapterTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Destination on a locally mounted directory. The credential URL is the directory, either a
 * plain path or a {@code file:} URI; it is created when absent. Keys are bare file names and
 * can never resolve outside the directory.
 */
public class LocalFsBackupDestination extends AbstractBackupDestination {
    private static final Logger log = LoggerFactory.getLogger(LocalFsBackupDestination.class);

    private final Path backupDir;

    public LocalFsBackupDestination(Credentials credentials) {
        this.backupDir = parseDirectory(credentials.url());
        try {
            Files.createDirectories(backupDir);
        } catch (IOException e) {
            throw new AdapterTransportException("Cannot create backup directory " + backupDir + ": " + e.getMessage(), e);
        }
    }

    static Path parseDirectory(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("local_fs url must be a directory path");
        }
        Path dir = url.startsWith("file:") ? Paths.get(URI.create(url)) : Paths.get(url);
        return dir.toAbsolutePath().normalize();
    }

    public Path getBackupDir() {
        return backupDir;
    }

    @Override
    protected String finalName(String localName) throws IOException {
        if (Files.exists(resolve(localName))) {
            throw new FileAlreadyExistsException(localName);
        }
        return localName;
    }

    @Override
    protected void put(Path local, String name) throws IOException {
        Files.copy(local, resolve(name), StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    protected void rename(String fromName, String toName) throws IOException {
        Files.move(resolve(fromName), resolve(toName), StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    protected void remove(String key) throws IOException {
        Files.delete(resolve(key));
    }

    @Override
    protected List<StoredObject> list() throws IOException {
        List<StoredObject> out = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return out;
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                if (!attrs.isRegularFile()) {
                    continue;
                }
                String name = file.getFileName().toString();
                out.add(new StoredObject(name, name, attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
        }
        return out;
    }

    @Override
    protected void fetch(String key, Path target) throws IOException {
        Files.copy(resolve(key), target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    protected String keyOf(String name) {
        return name;
    }

    @Override
    protected String describe() {
        return "local_fs:" + backupDir;
    }

    @Override
    public boolean testConnection() {
        boolean ok = Files.isDirectory(backupDir) && Files.isReadable(backupDir) && Files.isWritable(backupDir);
        if (!ok) {
            log.warn("Connection test failed: backup directory missing or not read/writable dir={}", backupDir);
        }
        return ok;
    }

    // Absolute keys are accepted only when they point directly into the backup directory.
    private Path resolve(String key) {
        Path candidate = backupDir.resolve(key).normalize();
        if (!candidate.getParent().equals(backupDir)) {
            throw new IllegalArgumentException("Backup path is outside backup directory: " + key);
        }
        return candidate;
    }
}
