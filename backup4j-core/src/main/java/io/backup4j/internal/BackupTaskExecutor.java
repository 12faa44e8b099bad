package io.backup4j.internal;

import io.backup4j.BackupArtifact;
import io.backup4j.BackupDestination;
import io.backup4j.BackupSource;
import io.backup4j.Credentials;
import io.backup4j.core.AdapterRegistry;
import io.backup4j.core.BackupDestinationRecord;
import io.backup4j.core.BackupSourceRecord;
import io.backup4j.core.DestinationStore;
import io.backup4j.core.SourceStore;
import io.backup4j.core.TaskArgs;
import io.backup4j.core.exception.AdapterTransportException;
import io.backup4j.core.exception.BackupException;
import io.backup4j.core.exception.NotFoundException;
import io.backup4j.crypto.CredentialVault;
import io.backup4j.utils.LocalFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs the four task operations against resolved adapters.
 *
 * <p>Sources and destinations are always looked up by (tenant, id), so a task can never reach
 * another tenant's records. Local artifacts are removed on every exit path. Each operation runs
 * with the tenant id in the {@value #MDC_TENANT} MDC entry.
 */
public class BackupTaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(BackupTaskExecutor.class);

    public static final String MDC_TENANT = "tenant_id";

    private final SourceStore sourceStore;
    private final DestinationStore destinationStore;
    private final CredentialVault vault;
    private final AdapterRegistry adapters;

    public BackupTaskExecutor(SourceStore sourceStore,
                              DestinationStore destinationStore,
                              CredentialVault vault,
                              AdapterRegistry adapters) {
        this.sourceStore = Objects.requireNonNull(sourceStore, "sourceStore must not be null");
        this.destinationStore = Objects.requireNonNull(destinationStore, "destinationStore must not be null");
        this.vault = Objects.requireNonNull(vault, "vault must not be null");
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
    }

    /**
     * Snapshot the source, upload it, then enforce retention.
     *
     * <p>Pruning runs even when the upload failed, so a destination that keeps rejecting
     * uploads still converges to {@code keepN}; the upload failure is rethrown afterwards.
     *
     * @return key of the uploaded artifact
     */
    public String createBackup(TaskArgs.CreateBackup args) {
        Objects.requireNonNull(args, "args must not be null");
        return withTenant(args.tenantId(), () -> {
            BackupSourceRecord sourceRecord = requireSource(args.tenantId(), args.sourceId());
            BackupDestinationRecord destinationRecord = requireDestination(args.tenantId(), args.destinationId());

            try (BackupSource source = openSource(sourceRecord);
                 BackupDestination destination = openDestination(destinationRecord)) {
                log.info("Backup started sourceId={} destinationId={} scheduleId={}",
                        args.sourceId(), args.destinationId(), args.scheduleId());

                Path local = transport("create backup from source " + sourceRecord.id(),
                        () -> source.createBackup(args.tenantId(), args.sourceId(), args.scheduleId()));

                String key = null;
                RuntimeException uploadFailure = null;
                try {
                    key = transport("upload to destination " + destinationRecord.id(),
                            () -> destination.uploadBackup(local));
                } catch (RuntimeException e) {
                    uploadFailure = e;
                } finally {
                    LocalFiles.deleteQuietly(local);
                }

                int keepN = args.keepN() == null ? 0 : args.keepN();
                if (keepN > 0) {
                    prune(destination, sourceRecord.type(), keepN);
                }

                if (uploadFailure != null) {
                    log.error("Backup upload failed sourceId={} destinationId={} msg={}",
                            args.sourceId(), args.destinationId(), uploadFailure.getMessage());
                    throw uploadFailure;
                }
                log.info("Backup stored key={} destinationId={}", key, args.destinationId());
                return key;
            }
        });
    }

    public List<BackupArtifact> listBackups(TaskArgs.ListBackups args) {
        Objects.requireNonNull(args, "args must not be null");
        return withTenant(args.tenantId(), () -> {
            try (BackupDestination destination = openDestination(requireDestination(args.tenantId(), args.destinationId()))) {
                return transport("list destination " + args.destinationId(), destination::listBackups);
            }
        });
    }

    public void deleteBackup(TaskArgs.DeleteBackup args) {
        Objects.requireNonNull(args, "args must not be null");
        withTenant(args.tenantId(), () -> {
            try (BackupDestination destination = openDestination(requireDestination(args.tenantId(), args.destinationId()))) {
                transport("delete " + args.backupKey() + " from destination " + args.destinationId(), () -> {
                    destination.deleteBackup(args.backupKey());
                    return null;
                });
            }
            log.info("Backup deleted key={} destinationId={}", args.backupKey(), args.destinationId());
            return null;
        });
    }

    /**
     * Download an artifact and restore the source from it.
     *
     * @return false when the source rejected the artifact; lookup, credential and download
     * failures are thrown instead
     */
    public boolean restoreBackup(TaskArgs.RestoreBackup args) {
        Objects.requireNonNull(args, "args must not be null");
        return withTenant(args.tenantId(), () -> {
            BackupSourceRecord sourceRecord = requireSource(args.tenantId(), args.sourceId());
            BackupDestinationRecord destinationRecord = requireDestination(args.tenantId(), args.destinationId());

            try (BackupSource source = openSource(sourceRecord);
                 BackupDestination destination = openDestination(destinationRecord)) {
                Path local = transport("download " + args.backupKey() + " from destination " + destinationRecord.id(),
                        () -> destination.getBackup(args.backupKey()));
                try {
                    source.restoreFromBackup(local);
                    log.info("Restore finished key={} sourceId={}", args.backupKey(), args.sourceId());
                    return true;
                } catch (RuntimeException e) {
                    log.error("Restore failed key={} sourceId={} msg={}", args.backupKey(), args.sourceId(), e.getMessage(), e);
                    return false;
                } finally {
                    LocalFiles.deleteQuietly(local);
                }
            }
        });
    }

    // Sequential; one failed delete does not stop the rest.
    private void prune(BackupDestination destination, String sourceType, int keepN) {
        List<BackupArtifact> listing;
        try {
            listing = destination.listBackups();
        } catch (RuntimeException e) {
            log.warn("Retention skipped, listing failed sourceType={} keepN={} msg={}", sourceType, keepN, e.getMessage(), e);
            return;
        }

        List<BackupArtifact> expired = RetentionPolicy.selectExpired(listing, sourceType, keepN);
        for (BackupArtifact artifact : expired) {
            try {
                destination.deleteBackup(artifact.key());
                log.info("Retention removed key={} modified={}", artifact.key(), artifact.modified());
            } catch (RuntimeException e) {
                log.warn("Retention could not remove key={} msg={}", artifact.key(), e.getMessage(), e);
            }
        }
    }

    private BackupSource openSource(BackupSourceRecord record) {
        Credentials credentials = new Credentials(
                record.url(),
                record.login(),
                vault.decryptNullable(record.password()),
                vault.decryptNullable(record.apiKey())
        );
        return adapters.source(record.type(), credentials);
    }

    private BackupDestination openDestination(BackupDestinationRecord record) {
        Credentials credentials = new Credentials(
                record.url(),
                record.login(),
                vault.decryptNullable(record.password()),
                vault.decryptNullable(record.apiKey())
        );
        return adapters.destination(record.type(), credentials, record.config());
    }

    private BackupSourceRecord requireSource(String tenantId, String sourceId) {
        return sourceStore.findById(tenantId, sourceId)
                .orElseThrow(() -> new NotFoundException(ScheduleManager.SOURCE, sourceId, tenantId));
    }

    private BackupDestinationRecord requireDestination(String tenantId, String destinationId) {
        return destinationStore.findById(tenantId, destinationId)
                .orElseThrow(() -> new NotFoundException(ScheduleManager.DESTINATION, destinationId, tenantId));
    }

    /**
     * Run an adapter call, wrapping anything that is not already a {@link BackupException}.
     */
    private static <T> T transport(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (BackupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AdapterTransportException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }

    private static <T> T withTenant(String tenantId, Supplier<T> body) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        String previous = MDC.get(MDC_TENANT);
        MDC.put(MDC_TENANT, tenantId);
        try {
            return body.get();
        } finally {
            if (previous == null) {
                MDC.remove(MDC_TENANT);
            } else {
                MDC.put(MDC_TENANT, previous);
            }
        }
    }
}
