package io.backup4j;

import io.backup4j.core.DispatcherState;

/**
 * Live periodic dispatcher.
 *
 * <p>Keeps an in-memory table built from the schedule store, rebuilds it whenever a reload
 * notification arrives and submits a backup task each time a schedule's cron fires.
 */
public interface Dispatcher {
    void start();

    void stop();

    /**
     * Clear and rebuild the schedule table from the store. Safe to call repeatedly.
     */
    void reload();

    DispatcherState state();
}
