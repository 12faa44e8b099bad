package io.backup4j.core;

import io.backup4j.core.exception.UnsupportedAdapterTypeException;

/**
 * Closed set of destination backends, keyed by the tag stored on destination records.
 */
public enum DestinationType {

    S3("s3"),
    SFTP("sftp"),
    SMB("smb"),
    LOCAL_FS("local_fs");

    private final String tag;

    DestinationType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static DestinationType fromTag(String tag) {
        for (DestinationType t : values()) {
            if (t.tag.equals(tag)) {
                return t;
            }
        }
        throw new UnsupportedAdapterTypeException("destination", tag);
    }
}
