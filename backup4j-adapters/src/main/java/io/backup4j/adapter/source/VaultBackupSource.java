package io.backup4j.adapter.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.backup4j.Credentials;
import io.backup4j.adapter.JsonHttpClient;
import io.backup4j.core.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.vault.VaultException;
import org.springframework.vault.authentication.ClientAuthentication;
import org.springframework.vault.authentication.TokenAuthentication;
import org.springframework.vault.client.VaultEndpoint;
import org.springframework.vault.core.VaultKeyValueOperations;
import org.springframework.vault.core.VaultKeyValueOperationsSupport.KeyValueBackend;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.support.VaultHealth;
import org.springframework.vault.support.VaultResponse;
import org.springframework.vault.support.VaultToken;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HashiCorp Vault exported through Spring Vault: KV v2 secrets under the {@value #KV_MOUNT} mount
 * (walked recursively), enabled auth methods and every non-builtin ACL policy, written to
 * {@value #EXPORT_FILE}.
 *
 * <p>Authenticates with the credential api key as a token, or with login/password against the
 * userpass auth method. Restore writes policies first, then secrets; a single failing item is
 * logged and skipped.
 */
public class VaultBackupSource extends ArchiveBackupSource {
    private static final Logger log = LoggerFactory.getLogger(VaultBackupSource.class);

    static final String ARCHIVE_ROOT = "vault_backup";
    static final String EXPORT_FILE = "vault_backup.json";
    static final String KV_MOUNT = "secret";
    private static final Set<String> BUILTIN_POLICIES = Set.of("root", "default");

    private final String url;
    private final VaultOperations vault;
    private final ObjectMapper mapper;
    private final Clock clock;

    public VaultBackupSource(Credentials credentials, Path workDir, Clock clock, ObjectMapper mapper) {
        this(credentials.url(),
                new VaultTemplate(VaultEndpoint.from(URI.create(credentials.url())), authentication(credentials, mapper)),
                workDir, clock, mapper);
    }

    VaultBackupSource(String url, VaultOperations vault, Path workDir, Clock clock, ObjectMapper mapper) {
        super(SourceType.VAULT, ARCHIVE_ROOT, workDir, clock);
        this.url = url;
        this.vault = vault;
        this.mapper = mapper;
        this.clock = clock;
    }

    static ClientAuthentication authentication(Credentials credentials, ObjectMapper mapper) {
        if (credentials.hasApiKey()) {
            return new TokenAuthentication(credentials.apiKey());
        }
        if (credentials.hasLogin()) {
            return () -> userpassLogin(credentials, mapper);
        }
        throw new IllegalArgumentException("vault source needs an api key (token) or login/password");
    }

    private static VaultToken userpassLogin(Credentials credentials, ObjectMapper mapper) {
        JsonHttpClient http = new JsonHttpClient(credentials.url(), Map.of(), mapper);
        try {
            JsonNode response = http.post("/v1/auth/userpass/login/" + credentials.login(),
                    Map.of("password", credentials.password()));
            String token = response.path("auth").path("client_token").asText(null);
            if (token == null) {
                throw new VaultException("userpass login returned no client token");
            }
            return VaultToken.of(token);
        } catch (IOException e) {
            throw new VaultException("userpass login failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VaultException("userpass login interrupted", e);
        }
    }

    @Override
    protected void exportTo(Path dir) throws IOException {
        ObjectNode export = mapper.createObjectNode();
        export.put("timestamp", Instant.now(clock).toString());

        ObjectNode secrets = export.putObject("secrets");
        collectSecrets(vault.opsForKeyValue(KV_MOUNT, KeyValueBackend.KV_2), "", secrets);

        VaultResponse auth = vault.read("sys/auth");
        export.set("auth_methods", mapper.valueToTree(auth == null || auth.getData() == null ? Map.of() : auth.getData()));

        ObjectNode policies = export.putObject("policies");
        for (String name : vault.opsForSys().getPolicyNames()) {
            if (BUILTIN_POLICIES.contains(name)) {
                continue;
            }
            VaultResponse policy = vault.read("sys/policy/" + name);
            Object rules = policy == null || policy.getData() == null ? null : policy.getData().get("rules");
            if (rules == null) {
                log.warn("Policy without rules skipped source={} policy={}", describe(), name);
                continue;
            }
            policies.put(name, rules.toString());
        }

        mapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(EXPORT_FILE).toFile(), export);
        log.debug("Exported secrets={} policies={}", secrets.size(), policies.size());
    }

    private void collectSecrets(VaultKeyValueOperations kv, String path, ObjectNode out) {
        List<String> keys = kv.list(path);
        if (keys == null) {
            return;
        }
        for (String key : keys) {
            String full = path.isEmpty() ? key : path + "/" + key;
            if (key.endsWith("/")) {
                collectSecrets(kv, full.substring(0, full.length() - 1), out);
                continue;
            }
            try {
                VaultResponse secret = kv.get(full);
                if (secret != null && secret.getData() != null) {
                    out.set(full, mapper.valueToTree(secret.getData()));
                }
            } catch (VaultException e) {
                log.warn("Secret not readable, skipped source={} path={} msg={}", describe(), full, e.getMessage());
            }
        }
    }

    @Override
    protected void importFrom(Path dir) throws IOException {
        Path file = dir.resolve(EXPORT_FILE);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Archive has no " + EXPORT_FILE);
        }
        JsonNode export = mapper.readTree(file.toFile());

        int failed = 0;
        Iterator<Map.Entry<String, JsonNode>> policies = export.path("policies").fields();
        while (policies.hasNext()) {
            Map.Entry<String, JsonNode> p = policies.next();
            try {
                vault.write("sys/policy/" + p.getKey(), Map.of("policy", p.getValue().asText()));
            } catch (VaultException e) {
                failed++;
                log.error("Failed to restore policy source={} policy={} msg={}", describe(), p.getKey(), e.getMessage());
            }
        }

        VaultKeyValueOperations kv = vault.opsForKeyValue(KV_MOUNT, KeyValueBackend.KV_2);
        Iterator<Map.Entry<String, JsonNode>> secrets = export.path("secrets").fields();
        while (secrets.hasNext()) {
            Map.Entry<String, JsonNode> s = secrets.next();
            try {
                kv.put(s.getKey(), mapper.convertValue(s.getValue(), Map.class));
            } catch (VaultException e) {
                failed++;
                log.error("Failed to restore secret source={} path={} msg={}", describe(), s.getKey(), e.getMessage());
            }
        }
        if (failed > 0) {
            log.warn("Restore finished with failures source={} failed={}", describe(), failed);
        }
    }

    @Override
    protected String describe() {
        return "vault:" + url;
    }

    @Override
    public boolean testConnection() {
        try {
            VaultHealth health = vault.opsForSys().health();
            return health.isInitialized() && !health.isSealed();
        } catch (VaultException e) {
            log.warn("Connection test failed source={} msg={}", describe(), e.getMessage());
            return false;
        }
    }
}
