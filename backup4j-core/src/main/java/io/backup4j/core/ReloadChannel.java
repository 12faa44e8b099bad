package io.backup4j.core;

import java.time.Duration;

/**
 * Consumer side of the reload topic, driven by a single dedicated listener thread.
 *
 * <p>Delivery is at-least-once: messages are acknowledged only after the table rebuild they
 * triggered has completed.
 */
public interface ReloadChannel extends AutoCloseable {

    /**
     * Wait up to {@code timeout} for reload notifications.
     *
     * @return number of notifications received, 0 on timeout
     * @throws Exception on transport failure; the caller reconnects and retries
     */
    int poll(Duration timeout) throws Exception;

    /**
     * Acknowledge every notification returned by the last {@link #poll(Duration)}.
     */
    void acknowledge() throws Exception;

    /**
     * Drop the current connection and open a new one.
     */
    void reconnect() throws Exception;

    /**
     * Interrupt a blocked {@link #poll(Duration)} from another thread.
     */
    default void wakeup() {
    }

    @Override
    void close();
}
