package io.backup4j.adapter.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultKeyValueOperations;
import org.springframework.vault.core.VaultKeyValueOperationsSupport.KeyValueBackend;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.core.VaultSysOperations;
import org.springframework.vault.support.VaultHealth;
import org.springframework.vault.support.VaultResponse;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VaultBackupSourceTest {

    @TempDir
    Path workDir;

    private VaultOperations vault;
    private VaultKeyValueOperations kv;
    private VaultSysOperations sys;
    private VaultBackupSource source;

    @BeforeEach
    void setUp() {
        vault = mock(VaultOperations.class);
        kv = mock(VaultKeyValueOperations.class);
        sys = mock(VaultSysOperations.class);
        when(vault.opsForKeyValue("secret", KeyValueBackend.KV_2)).thenReturn(kv);
        when(vault.opsForSys()).thenReturn(sys);
        source = new VaultBackupSource("http://vault:8200", vault, workDir, Clock.systemUTC(), new ObjectMapper());
    }

    @Test
    void backupShouldWalkSecretsAndSkipBuiltinPolicies() {
        when(kv.list("")).thenReturn(List.of("app/", "root-secret"));
        when(kv.list("app")).thenReturn(List.of("db"));
        when(kv.get("root-secret")).thenReturn(response(Map.of("k", "v")));
        when(kv.get("app/db")).thenReturn(response(Map.of("password", "hunter2")));
        when(vault.read("sys/auth")).thenReturn(response(Map.of("token/", Map.of("type", "token"))));
        when(sys.getPolicyNames()).thenReturn(List.of("root", "default", "ops"));
        when(vault.read("sys/policy/ops")).thenReturn(response(Map.of("rules", "path \"*\" {}")));

        Path artifact = source.createBackup("t1", "v-1", "3");
        source.restoreFromBackup(artifact);

        verify(vault, never()).read("sys/policy/root");
        verify(vault).write("sys/policy/ops", Map.of("policy", "path \"*\" {}"));
        verify(kv).put(eq("app/db"), eq(Map.of("password", "hunter2")));
        verify(kv).put(eq("root-secret"), eq(Map.of("k", "v")));
    }

    @Test
    void restoreShouldContinuePastFailingItems() {
        when(kv.list("")).thenReturn(List.of("a", "b"));
        when(kv.get("a")).thenReturn(response(Map.of("x", "1")));
        when(kv.get("b")).thenReturn(response(Map.of("y", "2")));
        when(sys.getPolicyNames()).thenReturn(List.of());
        Path artifact = source.createBackup("t1", "v-1", null);

        doThrow(new VaultException("permission denied")).when(kv).put(eq("a"), any());
        source.restoreFromBackup(artifact);

        verify(kv).put(eq("b"), eq(Map.of("y", "2")));
    }

    @Test
    void unreadableSecretShouldBeSkippedDuringBackup() {
        when(kv.list("")).thenReturn(List.of("locked", "open"));
        when(kv.get("locked")).thenThrow(new VaultException("403"));
        when(kv.get("open")).thenReturn(response(Map.of("z", "3")));
        when(sys.getPolicyNames()).thenReturn(List.of());

        Path artifact = source.createBackup("t1", "v-1", null);
        source.restoreFromBackup(artifact);

        verify(kv).put(eq("open"), eq(Map.of("z", "3")));
        verify(kv, never()).put(eq("locked"), any());
    }

    @Test
    void healthShouldRequireInitializedAndUnsealed() {
        VaultHealth health = mock(VaultHealth.class);
        when(sys.health()).thenReturn(health);
        when(health.isInitialized()).thenReturn(true);
        when(health.isSealed()).thenReturn(false);
        assertTrue(source.testConnection());

        when(health.isSealed()).thenReturn(true);
        assertFalse(source.testConnection());

        when(sys.health()).thenThrow(new VaultException("connection refused"));
        assertFalse(source.testConnection());
    }

    private static VaultResponse response(Map<String, Object> data) {
        VaultResponse r = new VaultResponse();
        r.setData(data);
        return r;
    }
}
