package io.backup4j.core.exception;

public class UnsupportedAdapterTypeException extends BackupException {

    private final String tag;

    public UnsupportedAdapterTypeException(String kind, String tag) {
        super("Unsupported " + kind + " type: " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
