package io.backup4j.core;

import java.util.Optional;

public interface DestinationStore {

    Optional<BackupDestinationRecord> findById(String tenantId, String id);

    BackupDestinationRecord save(BackupDestinationRecord record);
}
