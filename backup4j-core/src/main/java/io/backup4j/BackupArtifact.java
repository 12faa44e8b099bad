package io.backup4j;

import java.time.Instant;

/**
 * One artifact found at a destination. Rebuilt on every listing from the stored object's
 * metadata and its structured file name.
 *
 * @param name       file name without any directory or prefix
 * @param key        destination-relative path or object key, accepted by delete/get
 * @param size       size in bytes
 * @param modified   backend modification timestamp
 * @param sourceType source type tag parsed from the name
 * @param tenantId   tenant parsed from the name
 * @param scheduleId schedule parsed from the name, {@code null} for on-demand backups
 * @param sourceId   source parsed from the name
 */
public record BackupArtifact(
        String name,
        String key,
        long size,
        Instant modified,
        String sourceType,
        String tenantId,
        String scheduleId,
        String sourceId
) {
}
