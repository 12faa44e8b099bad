package io.backup4j.core;

public enum DispatcherState {
    /**
     * Schedule table built; waiting for the next fire time or reload notification.
     */
    IDLE,
    /**
     * Schedule table is being cleared and rebuilt from the store.
     */
    RELOADING
}
