package io.backup4j.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.BackupDestination;
import io.backup4j.BackupSource;
import io.backup4j.Credentials;
import io.backup4j.adapter.destination.LocalFsBackupDestination;
import io.backup4j.adapter.destination.S3BackupDestination;
import io.backup4j.adapter.destination.SftpBackupDestination;
import io.backup4j.adapter.destination.SmbBackupDestination;
import io.backup4j.adapter.source.ElasticsearchBackupSource;
import io.backup4j.adapter.source.PostgresBackupSource;
import io.backup4j.adapter.source.QdrantBackupSource;
import io.backup4j.adapter.source.VaultBackupSource;
import io.backup4j.core.AdapterRegistry;
import io.backup4j.core.DestinationType;
import io.backup4j.core.SourceType;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Registry with every built-in adapter. Sources write their artifacts under {@code workDir}.
 */
public final class StandardAdapters {

    private StandardAdapters() {
    }

    public static AdapterRegistry registry(Path workDir, ObjectMapper mapper) {
        return registry(workDir, mapper, Clock.systemDefaultZone());
    }

    public static AdapterRegistry registry(Path workDir, ObjectMapper mapper, Clock clock) {
        Objects.requireNonNull(workDir, "workDir must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        AdapterRegistry.Builder builder = AdapterRegistry.builder();
        for (SourceType type : SourceType.values()) {
            builder.source(type, credentials -> source(type, credentials, workDir, mapper, clock));
        }
        for (DestinationType type : DestinationType.values()) {
            builder.destination(type, (Credentials credentials, String config) -> destination(type, credentials, config, mapper));
        }
        return builder.build();
    }

    static BackupSource source(SourceType type, Credentials credentials, Path workDir, ObjectMapper mapper, Clock clock) {
        return switch (type) {
            case POSTGRES -> new PostgresBackupSource(credentials, workDir, clock);
            case QDRANT -> new QdrantBackupSource(credentials, workDir, clock, mapper);
            case VAULT -> new VaultBackupSource(credentials, workDir, clock, mapper);
            case ELASTICSEARCH -> new ElasticsearchBackupSource(credentials, workDir, clock, mapper);
        };
    }

    static BackupDestination destination(DestinationType type, Credentials credentials, String config, ObjectMapper mapper) {
        return switch (type) {
            case S3 -> new S3BackupDestination(credentials);
            case SFTP -> new SftpBackupDestination(credentials, config, mapper);
            case SMB -> new SmbBackupDestination(credentials);
            case LOCAL_FS -> new LocalFsBackupDestination(credentials);
        };
    }
}
