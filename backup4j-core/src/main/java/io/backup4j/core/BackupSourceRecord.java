package io.backup4j.core;

/**
 * Stored source registration. {@code password} and {@code apiKey} hold vault tokens, never
 * plaintext.
 */
public record BackupSourceRecord(
        String id,
        String tenantId,
        String name,
        String type,
        String url,
        String login,
        String password,
        String apiKey
) {
}
