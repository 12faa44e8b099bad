package io.backup4j.adapter.source;

import io.backup4j.Credentials;
import io.backup4j.core.SourceType;
import io.backup4j.utils.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * PostgreSQL database dumped with {@code pg_dump -F c} and restored with {@code pg_restore}.
 *
 * <p>URL form {@code postgresql://[user@]host[:port]/database}; the credential login wins over a
 * user embedded in the URL. Restore drops and recreates the target database through the
 * {@value #MAINTENANCE_DB} maintenance database before loading the dump.
 */
public class PostgresBackupSource extends AbstractBackupSource {
    private static final Logger log = LoggerFactory.getLogger(PostgresBackupSource.class);

    static final String MAINTENANCE_DB = "postgres";
    private static final int DEFAULT_PORT = 5432;
    private static final String DEFAULT_USER = "postgres";
    private static final Duration PROCESS_TIMEOUT = Duration.ofHours(1);

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String database;

    public PostgresBackupSource(Credentials credentials, Path workDir, Clock clock) {
        super(SourceType.POSTGRES, workDir, clock);
        URI uri = URI.create(credentials.url().replaceFirst("^jdbc:", ""));
        if (uri.getScheme() == null || !uri.getScheme().startsWith("postgres")) {
            throw new IllegalArgumentException("postgres url must look like postgresql://host:port/database");
        }
        this.host = uri.getHost() != null ? uri.getHost() : "localhost";
        this.port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;

        String urlUser = null;
        String urlPassword = null;
        if (uri.getUserInfo() != null) {
            String[] parts = uri.getUserInfo().split(":", 2);
            urlUser = parts[0];
            urlPassword = parts.length > 1 ? parts[1] : null;
        }
        this.user = notBlank(credentials.login()) ? credentials.login() : notBlank(urlUser) ? urlUser : DEFAULT_USER;
        this.password = credentials.password() != null ? credentials.password() : urlPassword;

        String path = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/", "");
        this.database = path.isEmpty() ? MAINTENANCE_DB : path;
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    String user() {
        return user;
    }

    String database() {
        return database;
    }

    @Override
    protected void writeArtifact(Path target) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(List.of(
                "pg_dump", "-h", host, "-p", String.valueOf(port), "-U", user,
                "-F", "c", "-f", target.toString(), database));
        run(cmd, "pg_dump");
    }

    @Override
    protected void restoreArtifact(Path artifact) throws IOException, InterruptedException {
        List<String> cmd = new ArrayList<>(List.of(
                "pg_restore", "-h", host, "-p", String.valueOf(port), "-U", user, "-d", database));
        if (MAINTENANCE_DB.equals(database)) {
            // the maintenance database cannot drop itself
            cmd.add("--clean");
            cmd.add("--if-exists");
        } else {
            recreateDatabase();
        }
        cmd.add(artifact.toString());
        run(cmd, "pg_restore");
    }

    @Override
    protected String describe() {
        return "postgres:" + host + ":" + port + "/" + database;
    }

    @Override
    public boolean testConnection() {
        try (Connection c = connect(database);
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("Connection test failed source={} msg={}", describe(), e.getMessage());
            return false;
        }
    }

    private void recreateDatabase() throws IOException {
        String quoted = "\"" + database.replace("\"", "\"\"") + "\"";
        try (Connection c = connect(MAINTENANCE_DB);
             Statement st = c.createStatement()) {
            st.execute("DROP DATABASE IF EXISTS " + quoted + " WITH (FORCE)");
            st.execute("CREATE DATABASE " + quoted);
        } catch (SQLException e) {
            throw new IOException("Could not recreate database " + database + ": " + e.getMessage(), e);
        }
    }

    private Connection connect(String db) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", user);
        if (password != null) {
            props.setProperty("password", password);
        }
        props.setProperty("connectTimeout", "10");
        return DriverManager.getConnection("jdbc:postgresql://" + host + ":" + port + "/" + db, props);
    }

    private void run(List<String> cmd, String tool) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(cmd).redirectErrorStream(true);
        Path output = Files.createTempFile(LocalFiles.ensureDirectory(workDir()), tool + "-", ".log");
        pb.redirectOutput(output.toFile());
        if (password != null) {
            pb.environment().put("PGPASSWORD", password);
        }

        Process process = null;
        try {
            log.debug("Running {} source={}", tool, describe());
            process = pb.start();
            if (!process.waitFor(PROCESS_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException(tool + " did not finish within " + PROCESS_TIMEOUT);
            }
            if (process.exitValue() != 0) {
                String out = Files.readString(output, StandardCharsets.UTF_8).trim();
                throw new IOException(tool + " failed with exit code " + process.exitValue() + ": " + out);
            }
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(output);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
