package io.backup4j.core;

/**
 * Stored destination registration. {@code password} and {@code apiKey} hold vault tokens,
 * {@code config} is optional free-form JSON read by the adapter.
 */
public record BackupDestinationRecord(
        String id,
        String tenantId,
        String name,
        String type,
        String url,
        String login,
        String password,
        String apiKey,
        String config
) {
}
