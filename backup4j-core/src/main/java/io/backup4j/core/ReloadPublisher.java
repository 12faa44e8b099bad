package io.backup4j.core;

/**
 * Publishes the "schedule table changed" notification. The message carries no payload.
 */
@FunctionalInterface
public interface ReloadPublisher {
    void publishReload();
}
