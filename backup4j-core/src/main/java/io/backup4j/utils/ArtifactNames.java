package io.backup4j.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured artifact file names.
 * <p>
 * Format:
 * <pre>
 * &lt;source-type&gt;_backup_usr=&lt;tenant&gt;_sch=&lt;schedule-id|None&gt;_src=&lt;source-id&gt;_created_at=&lt;yyyyMMdd_HHmmss&gt;.&lt;ext&gt;
 * </pre>
 * This is a durable contract: artifacts already written to destinations are parsed with it
 * for listing and retention, so any change must keep old names parseable.
 */
public final class ArtifactNames {

    /**
     * Suffix of an upload that has not been committed yet. Never returned by a listing.
     */
    public static final String PROVISIONAL_SUFFIX = ".partial";

    static final String NO_SCHEDULE = "None";

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Pattern NAME = Pattern.compile(
            "^(?<type>[A-Za-z0-9-]+(?:_[A-Za-z0-9-]+)*?)_backup"
                    + "_usr=(?<tenant>[^_/\\\\]+)"
                    + "_sch=(?<schedule>[^_/\\\\]+)"
                    + "_src=(?<source>[^_/\\\\]+)"
                    + "_created_at=(?<created>\\d{8}_\\d{6})"
                    + "\\.(?<ext>[A-Za-z0-9.]+)$");

    private static final Pattern ID = Pattern.compile("^[^_/\\\\]+$");

    private ArtifactNames() {
    }

    /**
     * Fields recovered from an artifact name.
     *
     * @param scheduleId {@code null} when the artifact was created on demand
     */
    public record Parsed(
            String sourceType,
            String tenantId,
            String scheduleId,
            String sourceId,
            LocalDateTime createdAt,
            String extension
    ) {
    }

    public static String format(String sourceType, String tenantId, String scheduleId, String sourceId,
                                LocalDateTime createdAt, String extension) {
        Objects.requireNonNull(sourceType, "sourceType must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(extension, "extension must not be null");
        requireId("tenantId", tenantId);
        requireId("sourceId", sourceId);
        if (scheduleId != null) {
            requireId("scheduleId", scheduleId);
            if (NO_SCHEDULE.equals(scheduleId)) {
                throw new IllegalArgumentException("scheduleId must not be the literal '" + NO_SCHEDULE + "'");
            }
        }

        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return sourceType
                + "_backup_usr=" + tenantId
                + "_sch=" + (scheduleId == null ? NO_SCHEDULE : scheduleId)
                + "_src=" + sourceId
                + "_created_at=" + TIMESTAMP.format(createdAt)
                + "." + ext;
    }

    /**
     * Parse a file name or a key ending in a file name.
     *
     * @throws IllegalArgumentException when the name does not follow the format; callers must not
     *                                  treat such an object as a known artifact
     */
    public static Parsed parse(String nameOrKey) {
        Objects.requireNonNull(nameOrKey, "nameOrKey must not be null");
        String name = baseName(nameOrKey);
        Matcher m = NAME.matcher(name);
        if (isProvisional(name) || !m.matches()) {
            throw new IllegalArgumentException("Not a backup artifact name: " + name);
        }
        String schedule = m.group("schedule");
        return new Parsed(
                m.group("type"),
                m.group("tenant"),
                NO_SCHEDULE.equals(schedule) ? null : schedule,
                m.group("source"),
                LocalDateTime.parse(m.group("created"), TIMESTAMP),
                m.group("ext")
        );
    }

    public static boolean isProvisional(String nameOrKey) {
        return nameOrKey.endsWith(PROVISIONAL_SUFFIX);
    }

    public static String provisional(String name) {
        return name + PROVISIONAL_SUFFIX;
    }

    /**
     * Last path segment of a key; handles both '/' and '\' separators.
     */
    public static String baseName(String key) {
        int slash = Math.max(key.lastIndexOf('/'), key.lastIndexOf('\\'));
        return slash < 0 ? key : key.substring(slash + 1);
    }

    private static void requireId(String field, String value) {
        if (value == null || !ID.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be non-empty and contain no '_' or path separators: " + value);
        }
    }
}
