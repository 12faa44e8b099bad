package io.backup4j.adapter.destination;

import com.hierynomus.msdtyp.AccessMask;
import com.hierynomus.msfscc.FileAttributes;
import com.hierynomus.msfscc.fileinformation.FileIdBothDirectoryInformation;
import com.hierynomus.mssmb2.SMB2CreateDisposition;
import com.hierynomus.mssmb2.SMB2ShareAccess;
import com.hierynomus.smbj.SMBClient;
import com.hierynomus.smbj.auth.AuthenticationContext;
import com.hierynomus.smbj.common.SMBRuntimeException;
import com.hierynomus.smbj.connection.Connection;
import com.hierynomus.smbj.session.Session;
import com.hierynomus.smbj.share.DiskShare;
import com.hierynomus.smbj.share.File;
import io.backup4j.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Windows/Samba share. URL {@code smb://host[:port]/share[/dir]}, NTLM login where the login may
 * carry a domain as {@code DOMAIN\\user}. The directory is created when absent.
 */
public class SmbBackupDestination extends AbstractBackupDestination {
    private static final Logger log = LoggerFactory.getLogger(SmbBackupDestination.class);

    static final int DEFAULT_PORT = 445;

    private final String host;
    private final int port;
    private final String shareName;
    private final String directory;
    private final String user;
    private final String domain;
    private final String password;

    private SMBClient smb;
    private Connection connection;
    private Session session;
    private DiskShare share;

    public SmbBackupDestination(Credentials credentials) {
        URI uri = URI.create(credentials.url());
        if (!"smb".equals(uri.getScheme()) || uri.getHost() == null) {
            throw new IllegalArgumentException("smb url must look like smb://host[:port]/share/dir");
        }
        String[] segments = (uri.getPath() == null ? "" : uri.getPath()).replaceAll("^/+|/+$", "").split("/", 2);
        if (segments[0].isEmpty()) {
            throw new IllegalArgumentException("smb url has no share name: " + credentials.url());
        }
        this.host = uri.getHost();
        this.port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        this.shareName = segments[0];
        this.directory = segments.length > 1 ? segments[1].replace('/', '\\') : "";

        String login = credentials.login() == null ? "" : credentials.login();
        int sep = login.indexOf('\\');
        this.domain = sep > 0 ? login.substring(0, sep) : null;
        this.user = sep > 0 ? login.substring(sep + 1) : login;
        this.password = credentials.password() == null ? "" : credentials.password();
    }

    String shareName() {
        return shareName;
    }

    String directory() {
        return directory;
    }

    String domain() {
        return domain;
    }

    private DiskShare share() throws IOException {
        if (share != null) {
            return share;
        }
        smb = new SMBClient();
        try {
            connection = smb.connect(host, port);
            session = connection.authenticate(new AuthenticationContext(user, password.toCharArray(), domain));
            share = (DiskShare) session.connectShare(shareName);
            ensureDirectory(share);
            return share;
        } catch (IOException | RuntimeException e) {
            close();
            throw e;
        }
    }

    private void ensureDirectory(DiskShare disk) {
        if (directory.isEmpty()) {
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String part : directory.split("\\\\")) {
            if (current.length() > 0) {
                current.append('\\');
            }
            current.append(part);
            if (!disk.folderExists(current.toString())) {
                disk.mkdir(current.toString());
            }
        }
    }

    private String remote(String name) {
        return directory.isEmpty() ? name : directory + "\\" + name;
    }

    @Override
    protected void put(Path local, String name) throws IOException {
        try (File file = share().openFile(remote(name),
                EnumSet.of(AccessMask.GENERIC_WRITE), null, SMB2ShareAccess.ALL,
                SMB2CreateDisposition.FILE_OVERWRITE_IF, null);
             OutputStream out = file.getOutputStream()) {
            Files.copy(local, out);
        }
    }

    @Override
    protected void rename(String fromName, String toName) throws IOException {
        try (File file = share().openFile(remote(fromName),
                EnumSet.of(AccessMask.DELETE, AccessMask.GENERIC_WRITE), null, SMB2ShareAccess.ALL,
                SMB2CreateDisposition.FILE_OPEN, null)) {
            file.rename(remote(toName), false);
        }
    }

    @Override
    protected void remove(String key) throws IOException {
        share().rm(key);
    }

    @Override
    protected List<StoredObject> list() throws IOException {
        List<StoredObject> out = new ArrayList<>();
        for (FileIdBothDirectoryInformation info : share().list(directory)) {
            boolean isDirectory = (info.getFileAttributes() & FileAttributes.FILE_ATTRIBUTE_DIRECTORY.getValue()) != 0;
            if (isDirectory) {
                continue;
            }
            out.add(new StoredObject(info.getFileName(), remote(info.getFileName()), info.getEndOfFile(),
                    Instant.ofEpochMilli(info.getLastWriteTime().toEpochMillis())));
        }
        return out;
    }

    @Override
    protected void fetch(String key, Path target) throws IOException {
        try (File file = share().openFile(key,
                EnumSet.of(AccessMask.GENERIC_READ), null, SMB2ShareAccess.ALL,
                SMB2CreateDisposition.FILE_OPEN, null);
             InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    protected String keyOf(String name) {
        return remote(name);
    }

    @Override
    protected String describe() {
        return "smb://" + host + ":" + port + "/" + shareName + (directory.isEmpty() ? "" : "/" + directory.replace('\\', '/'));
    }

    @Override
    public boolean testConnection() {
        try {
            share().list(directory);
            return true;
        } catch (IOException | SMBRuntimeException e) {
            log.warn("Connection test failed destination={} msg={}", describe(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            if (share != null) {
                share.close();
            }
            if (session != null) {
                session.close();
            }
            if (connection != null) {
                connection.close();
            }
        } catch (IOException e) {
            log.warn("Could not close smb connection destination={} msg={}", describe(), e.getMessage());
        } finally {
            if (smb != null) {
                smb.close();
            }
            share = null;
            session = null;
            connection = null;
            smb = null;
        }
    }
}
