package io.backup4j.adapter.source;

import io.backup4j.Credentials;
import io.backup4j.core.exception.AdapterTransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PostgresBackupSourceTest {

    @TempDir
    Path workDir;

    @Test
    void urlShouldProvideDefaultsAndLoginShouldWin() {
        PostgresBackupSource bare = source(Credentials.of("postgresql://db.internal"));
        assertEquals("db.internal", bare.host());
        assertEquals(5432, bare.port());
        assertEquals("postgres", bare.user());
        assertEquals("postgres", bare.database());

        PostgresBackupSource full = source(new Credentials("postgres://urluser:pw@db:6543/app", "admin", "secret", null));
        assertEquals(6543, full.port());
        assertEquals("admin", full.user());
        assertEquals("app", full.database());

        PostgresBackupSource jdbc = source(Credentials.of("jdbc:postgresql://db:5433/orders"));
        assertEquals("orders", jdbc.database());
    }

    @Test
    void nonPostgresUrlShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> source(Credentials.of("mysql://db/app")));
    }

    @Test
    void failedDumpShouldRaiseAndLeaveNoArtifact() throws Exception {
        PostgresBackupSource unreachable = source(new Credentials("postgresql://127.0.0.1:1/app", "u", "p", null));

        assertThrows(AdapterTransportException.class, () -> unreachable.createBackup("t1", "pg-1", null));
        try (var files = Files.list(workDir)) {
            assertThat(files).isEmpty();
        }
        assertFalse(unreachable.testConnection());
    }

    private PostgresBackupSource source(Credentials credentials) {
        return new PostgresBackupSource(credentials, workDir, Clock.systemUTC());
    }
}
