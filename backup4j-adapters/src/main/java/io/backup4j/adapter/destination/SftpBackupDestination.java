package io.backup4j.adapter.destination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.Credentials;
import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.sftp.FileMode;
import net.schmizz.sshj.sftp.RemoteResourceInfo;
import net.schmizz.sshj.sftp.SFTPClient;
import net.schmizz.sshj.transport.verification.PromiscuousVerifier;
import net.schmizz.sshj.xfer.FileSystemFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote directory reached over SFTP. URL {@code sftp://host[:port]/dir}, password login.
 *
 * <p>The optional JSON config may pin the server key with {@code host_key_fingerprint}; without it
 * any host key is accepted. The connection is opened on first use and held until {@link #close()}.
 */
public class SftpBackupDestination extends AbstractBackupDestination {
    private static final Logger log = LoggerFactory.getLogger(SftpBackupDestination.class);

    static final int DEFAULT_PORT = 22;
    static final String HOST_KEY_FINGERPRINT = "host_key_fingerprint";

    private final String host;
    private final int port;
    private final String directory;
    private final String login;
    private final String password;
    private final String hostKeyFingerprint;

    private SSHClient ssh;
    private SFTPClient sftp;

    public SftpBackupDestination(Credentials credentials, String config, ObjectMapper mapper) {
        URI uri = URI.create(credentials.url());
        if (!"sftp".equals(uri.getScheme()) || uri.getHost() == null) {
            throw new IllegalArgumentException("sftp url must look like sftp://host[:port]/dir");
        }
        this.host = uri.getHost();
        this.port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        String path = uri.getPath() == null ? "" : uri.getPath().replaceAll("/+$", "");
        this.directory = path.isEmpty() ? "." : path;
        this.login = credentials.login();
        this.password = credentials.password();
        this.hostKeyFingerprint = readFingerprint(config, mapper);
    }

    private static String readFingerprint(String config, ObjectMapper mapper) {
        if (config == null || config.isBlank()) {
            return null;
        }
        try {
            JsonNode fingerprint = mapper.readTree(config).path(HOST_KEY_FINGERPRINT);
            return fingerprint.isTextual() ? fingerprint.asText() : null;
        } catch (IOException e) {
            throw new IllegalArgumentException("sftp destination config is not valid JSON", e);
        }
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    String directory() {
        return directory;
    }

    private SFTPClient client() throws IOException {
        if (sftp != null) {
            return sftp;
        }
        SSHClient client = new SSHClient();
        try {
            if (hostKeyFingerprint != null) {
                client.addHostKeyVerifier(hostKeyFingerprint);
            } else {
                log.debug("No host key pinned, accepting any key destination={}", describe());
                client.addHostKeyVerifier(new PromiscuousVerifier());
            }
            client.connect(host, port);
            client.authPassword(login, password == null ? "" : password);
            SFTPClient opened = client.newSFTPClient();
            if (opened.statExistence(directory) == null) {
                opened.mkdirs(directory);
            }
            this.ssh = client;
            this.sftp = opened;
            return opened;
        } catch (IOException | RuntimeException e) {
            try {
                client.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private String remote(String name) {
        return directory + "/" + name;
    }

    @Override
    protected void put(Path local, String name) throws IOException {
        client().put(new FileSystemFile(local.toFile()), remote(name));
    }

    @Override
    protected void rename(String fromName, String toName) throws IOException {
        client().rename(remote(fromName), remote(toName));
    }

    @Override
    protected void remove(String key) throws IOException {
        client().rm(key);
    }

    @Override
    protected List<StoredObject> list() throws IOException {
        List<StoredObject> out = new ArrayList<>();
        for (RemoteResourceInfo info : client().ls(directory)) {
            if (info.getAttributes().getType() != FileMode.Type.REGULAR) {
                continue;
            }
            out.add(new StoredObject(info.getName(), remote(info.getName()),
                    info.getAttributes().getSize(), Instant.ofEpochSecond(info.getAttributes().getMtime())));
        }
        return out;
    }

    @Override
    protected void fetch(String key, Path target) throws IOException {
        client().get(key, new FileSystemFile(target.toFile()));
    }

    @Override
    protected String keyOf(String name) {
        return remote(name);
    }

    @Override
    protected String describe() {
        return "sftp://" + host + ":" + port + directory;
    }

    @Override
    public boolean testConnection() {
        try {
            client().ls(directory);
            return true;
        } catch (IOException e) {
            log.warn("Connection test failed destination={} msg={}", describe(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            if (sftp != null) {
                sftp.close();
            }
            if (ssh != null) {
                ssh.disconnect();
            }
        } catch (IOException e) {
            log.warn("Could not close sftp connection destination={} msg={}", describe(), e.getMessage());
        } finally {
            sftp = null;
            ssh = null;
        }
    }
}
