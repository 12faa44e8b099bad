package io.backup4j.config;

import io.backup4j.Dispatcher;
import io.backup4j.internal.task.TaskWorkerPool;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Bridges dispatcher and worker pool lifecycle with the Spring container lifecycle.
 *
 * <p>On stop the dispatcher goes first so no new task is submitted while the pool drains.
 */
public class BackupLifecycle implements SmartLifecycle {
    private final Dispatcher dispatcher;
    private final TaskWorkerPool workerPool;
    private final Duration shutdownGrace;
    private volatile boolean running = false;

    public BackupLifecycle(Dispatcher dispatcher, TaskWorkerPool workerPool, Duration shutdownGrace) {
        this.dispatcher = dispatcher;
        this.workerPool = workerPool;
        this.shutdownGrace = shutdownGrace;
    }

    @Override
    public void start() {
        dispatcher.start();
        running = true;
    }

    @Override
    public void stop() {
        dispatcher.stop();
        workerPool.shutdown(shutdownGrace);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
