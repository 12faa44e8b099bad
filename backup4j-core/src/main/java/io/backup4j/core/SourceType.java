package io.backup4j.core;

import io.backup4j.core.exception.UnsupportedAdapterTypeException;

/**
 * Closed set of source backends. The tag is persisted on source records and is the first
 * segment of every artifact file name.
 */
public enum SourceType {

    POSTGRES("postgres", "dump"),
    QDRANT("qdrant", "tar.gz"),
    VAULT("vault", "tar.gz"),
    ELASTICSEARCH("elasticsearch", "tar.gz");

    private final String tag;
    private final String extension;

    SourceType(String tag, String extension) {
        this.tag = tag;
        this.extension = extension;
    }

    public String tag() {
        return tag;
    }

    /**
     * File extension of the artifacts this source produces, without the leading dot.
     */
    public String extension() {
        return extension;
    }

    public static SourceType fromTag(String tag) {
        for (SourceType t : values()) {
            if (t.tag.equals(tag)) {
                return t;
            }
        }
        throw new UnsupportedAdapterTypeException("source", tag);
    }
}
