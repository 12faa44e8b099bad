package io.backup4j.internal.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.TaskHandler;
import io.backup4j.core.TaskHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of daemon workers executing named task handlers.
 *
 * <p>Submission never blocks: work is queued and the returned future completes with the
 * handler's result, its exception, or a {@link TimeoutException} once the wall-clock ceiling
 * is hit (the worker is then interrupted). Failed tasks are not retried.
 */
public class TaskWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(TaskWorkerPool.class);

    private final TaskHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final Duration timeLimit;

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final AtomicBoolean running = new AtomicBoolean(true);

    public TaskWorkerPool(TaskHandlerRegistry registry, ObjectMapper objectMapper, int maxConcurrency, Duration timeLimit) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeLimit = Objects.requireNonNull(timeLimit, "timeLimit must not be null");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        if (timeLimit.isZero() || timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be a positive duration");
        }

        AtomicInteger workerSeq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("backup.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("backup.watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue a task.
     *
     * @param name registered handler name
     * @param args the handler's args record, or any value Jackson can convert to it (a flat map)
     * @throws IllegalArgumentException when no handler has that name or the args do not convert
     * @throws IllegalStateException    after {@link #shutdown(Duration)}
     */
    public <R> CompletableFuture<R> submit(String name, Object args) {
        if (!running.get()) {
            throw new IllegalStateException("TaskWorkerPool is shut down");
        }
        TaskHandler<?, ?> handler = registry.getRequired(name);
        Object typedArgs = convertArgs(handler, args);

        CompletableFuture<R> result = new CompletableFuture<>();
        Future<?> work = workers.submit(() -> run(handler, name, typedArgs, result));

        ScheduledFuture<?> ceiling = watchdog.schedule(() -> {
            if (result.completeExceptionally(new TimeoutException(
                    "Task " + name + " exceeded time limit " + timeLimit))) {
                log.error("Task timed out name={} limit={}", name, timeLimit);
                work.cancel(true);
            }
        }, timeLimit.toMillis(), TimeUnit.MILLISECONDS);
        result.whenComplete((r, e) -> ceiling.cancel(false));

        return result;
    }

    /**
     * Stop accepting tasks and wait up to {@code grace} for running ones.
     */
    public void shutdown(Duration grace) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("TaskWorkerPool stopping...");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        } finally {
            watchdog.shutdownNow();
        }
        log.info("TaskWorkerPool stopped.");
    }

    public boolean isRunning() {
        return running.get();
    }

    private Object convertArgs(TaskHandler<?, ?> handler, Object args) {
        Class<?> argsClass = handler.argsClass();
        if (args == null || argsClass.isInstance(args)) {
            return args;
        }
        return objectMapper.convertValue(args, argsClass);
    }

    @SuppressWarnings("unchecked")
    private <A, R> void run(TaskHandler<?, ?> handler, String name, Object args, CompletableFuture<R> result) {
        if (result.isDone()) {
            return;
        }
        var h = (TaskHandler<A, R>) handler;
        Instant startedAt = Instant.now();
        log.debug("Task started name={} at={}", name, startedAt);
        try {
            R value = h.execute((A) args);
            log.debug("Task succeeded name={} took={}ms", name, Duration.between(startedAt, Instant.now()).toMillis());
            result.complete(value);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.completeExceptionally(e);
        } catch (Exception e) {
            log.error("Task failed name={} msg={}", name, e.getMessage(), e);
            result.completeExceptionally(e);
        }
    }
}
