package io.backup4j.core;

import java.util.Optional;

public interface SourceStore {

    Optional<BackupSourceRecord> findById(String tenantId, String id);

    BackupSourceRecord save(BackupSourceRecord record);
}
