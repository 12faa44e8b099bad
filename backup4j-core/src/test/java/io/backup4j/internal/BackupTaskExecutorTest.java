package io.backup4j.internal;

import io.backup4j.BackupArtifact;
import io.backup4j.BackupSource;
import io.backup4j.Credentials;
import io.backup4j.core.AdapterRegistry;
import io.backup4j.core.BackupDestinationRecord;
import io.backup4j.core.BackupSourceRecord;
import io.backup4j.core.DestinationType;
import io.backup4j.core.SourceType;
import io.backup4j.core.TaskArgs;
import io.backup4j.core.exception.AdapterTransportException;
import io.backup4j.core.exception.DecryptionException;
import io.backup4j.core.exception.NotFoundException;
import io.backup4j.crypto.CredentialVault;
import io.backup4j.utils.ArtifactNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackupTaskExecutorTest {

    private static final CredentialVault VAULT = CredentialVault.ofSecret("executor-test-secret");
    private static final String PASSWORD_TOKEN = VAULT.encrypt("pg-password");

    @TempDir
    Path workDir;

    private InMemoryStores.Sources sources;
    private InMemoryStores.Destinations destinations;
    private MemoryDestination destination;
    private final List<Path> createdArtifacts = new ArrayList<>();
    private final AtomicReference<Credentials> seenCredentials = new AtomicReference<>();
    private boolean restoreFails;
    private BackupTaskExecutor executor;

    @BeforeEach
    void setUp() {
        sources = new InMemoryStores.Sources();
        destinations = new InMemoryStores.Destinations();
        destination = new MemoryDestination();

        sources.save(new BackupSourceRecord("src-1", "t1", "pg", "postgres", "postgresql://db/app", "app", PASSWORD_TOKEN, null));
        destinations.save(new BackupDestinationRecord("dst-1", "t1", "mem", "local_fs", "/unused", null, null, null, null));

        AdapterRegistry registry = AdapterRegistry.builder()
                .source(SourceType.POSTGRES, credentials -> {
                    seenCredentials.set(credentials);
                    return new StubSource();
                })
                .destination(DestinationType.LOCAL_FS, credentials -> destination)
                .build();

        executor = new BackupTaskExecutor(sources, destinations, VAULT, registry);
    }

    @Test
    void createBackupShouldUploadDecryptAndRemoveLocalArtifact() {
        String key = executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", "9", null));

        assertTrue(destination.objects.containsKey(key));
        assertEquals("9", ArtifactNames.parse(key).scheduleId());
        assertEquals("pg-password", seenCredentials.get().password());
        assertThat(createdArtifacts).hasSize(1).allSatisfy(p -> assertFalse(Files.exists(p)));
    }

    @Test
    void createBackupShouldKeepOnlyNewestOfSourceType() {
        Instant base = Instant.parse("2020-01-01T00:00:00Z");
        for (int i = 1; i <= 5; i++) {
            destination.seed(name("postgres", i), base.plusSeconds(i * 60L));
        }
        destination.seed(name("qdrant", 1), base);

        String key = executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", "9", 3));

        assertThat(destination.deleted).containsExactly(name("postgres", 1), name("postgres", 2), name("postgres", 3));
        assertThat(destination.objects.keySet())
                .containsExactlyInAnyOrder(name("postgres", 4), name("postgres", 5), key, name("qdrant", 1));
    }

    @Test
    void everyOperationShouldCloseItsDestination() {
        executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", null, 0));
        executor.listBackups(new TaskArgs.ListBackups("dst-1", "t1"));

        assertEquals(2, destination.closeCount);
    }

    @Test
    void keepNZeroShouldMeanUnboundedRetention() {
        for (int i = 1; i <= 4; i++) {
            destination.seed(name("postgres", i), Instant.parse("2020-01-01T00:00:00Z").plusSeconds(i));
        }

        executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", null, 0));

        assertTrue(destination.deleted.isEmpty());
        assertEquals(5, destination.objects.size());
    }

    @Test
    void pruningShouldRunWhenUploadFailsAndFailureShouldPropagate() {
        for (int i = 1; i <= 3; i++) {
            destination.seed(name("postgres", i), Instant.parse("2020-01-01T00:00:00Z").plusSeconds(i));
        }
        destination.failUploads = true;

        AdapterTransportException ex = assertThrows(AdapterTransportException.class,
                () -> executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", "9", 1)));

        assertThat(ex).hasMessageContaining("destination unavailable");
        assertThat(destination.deleted).containsExactly(name("postgres", 1), name("postgres", 2));
        assertThat(createdArtifacts).allSatisfy(p -> assertFalse(Files.exists(p)));
    }

    @Test
    void pruningShouldContinuePastFailedDelete() {
        Instant base = Instant.parse("2020-01-01T00:00:00Z");
        for (int i = 1; i <= 4; i++) {
            destination.seed(name("postgres", i), base.plusSeconds(i));
        }
        destination.failingDeletes.add(name("postgres", 1));

        executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", "9", 2));

        assertThat(destination.deleted).containsExactly(name("postgres", 2), name("postgres", 3));
        assertTrue(destination.objects.containsKey(name("postgres", 1)));
    }

    @Test
    void unknownOrForeignRecordsShouldRaiseNotFound() {
        assertThrows(NotFoundException.class,
                () -> executor.createBackup(new TaskArgs.CreateBackup("src-1", "dst-1", "t2", null, 0)));
        assertThrows(NotFoundException.class,
                () -> executor.listBackups(new TaskArgs.ListBackups("missing", "t1")));
        assertTrue(createdArtifacts.isEmpty());
    }

    @Test
    void undecryptableCredentialsShouldRaiseDecryptionException() {
        String foreignToken = CredentialVault.ofSecret("other-secret").encrypt("pw");
        sources.save(new BackupSourceRecord("src-2", "t1", "pg", "postgres", "postgresql://db/app", "app", foreignToken, null));

        assertThrows(DecryptionException.class,
                () -> executor.createBackup(new TaskArgs.CreateBackup("src-2", "dst-1", "t1", null, 0)));
    }

    @Test
    void listBackupsShouldReturnEveryArtifact() {
        destination.seed(name("postgres", 1), Instant.now());
        destination.seed(name("vault", 1), Instant.now());

        List<BackupArtifact> listing = executor.listBackups(new TaskArgs.ListBackups("dst-1", "t1"));

        assertThat(listing).extracting(BackupArtifact::sourceType).containsExactlyInAnyOrder("postgres", "vault");
    }

    @Test
    void deleteBackupShouldWrapBackendFailure() {
        destination.seed(name("postgres", 1), Instant.now());

        executor.deleteBackup(new TaskArgs.DeleteBackup("dst-1", "t1", name("postgres", 1)));
        assertTrue(destination.objects.isEmpty());

        assertThrows(AdapterTransportException.class,
                () -> executor.deleteBackup(new TaskArgs.DeleteBackup("dst-1", "t1", "missing")));
    }

    @Test
    void restoreShouldReturnFalseWhenSourceRejectsArtifact() {
        destination.seed(name("postgres", 1), Instant.now());

        assertTrue(executor.restoreBackup(new TaskArgs.RestoreBackup("src-1", "dst-1", "t1", name("postgres", 1))));

        restoreFails = true;
        assertFalse(executor.restoreBackup(new TaskArgs.RestoreBackup("src-1", "dst-1", "t1", name("postgres", 1))));
    }

    @Test
    void restoreShouldRaiseWhenDownloadFails() {
        assertThrows(AdapterTransportException.class,
                () -> executor.restoreBackup(new TaskArgs.RestoreBackup("src-1", "dst-1", "t1", "missing")));
    }

    private static String name(String type, int minute) {
        return ArtifactNames.format(type, "t1", "9", "src-1", LocalDateTime.of(2026, 1, 1, 0, minute, 0),
                type.equals("postgres") ? "dump" : "tar.gz");
    }

    private class StubSource implements BackupSource {

        @Override
        public Path createBackup(String tenantId, String sourceId, String scheduleId) {
            try {
                Path file = workDir.resolve(ArtifactNames.format("postgres", tenantId, scheduleId, sourceId,
                        LocalDateTime.of(2026, 2, 1, 12, 0, 0), "dump"));
                Files.writeString(file, "dump-bytes");
                createdArtifacts.add(file);
                return file;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void restoreFromBackup(Path artifact) {
            if (restoreFails) {
                throw new IllegalStateException("incompatible archive");
            }
            assertTrue(Files.exists(artifact));
        }

        @Override
        public boolean testConnection() {
            return true;
        }
    }
}
