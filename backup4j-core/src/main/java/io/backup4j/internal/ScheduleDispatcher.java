package io.backup4j.internal;

import io.backup4j.Dispatcher;
import io.backup4j.core.DispatcherState;
import io.backup4j.core.ReloadChannel;
import io.backup4j.core.Schedule;
import io.backup4j.core.ScheduleStore;
import io.backup4j.core.TaskArgs;
import io.backup4j.core.exception.CronValidationException;
import io.backup4j.internal.task.TaskWorkerPool;
import io.backup4j.utils.CronParser;
import io.backup4j.utils.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process periodic dispatcher driven by the schedule store.
 *
 * <p>Two daemon threads:
 * <ul>
 *   <li>{@code backup.dispatcher.timer} takes due entries from a {@link DelayQueue}, submits a
 *   {@code create_backup} task and re-enqueues the schedule's next occurrence;</li>
 *   <li>{@code backup.dispatcher.listener} waits on the {@link ReloadChannel}; each batch of
 *   notifications rebuilds the table once and is acknowledged only after the rebuild.</li>
 * </ul>
 *
 * <p>Each rebuild bumps a generation counter; queue entries of an older generation are dropped
 * when they come due, so a reload never fires a stale entry and repeated reloads converge to
 * the same table.
 *
 * <pre>{@code
 * dispatcher.start();   // builds the table, starts both threads
 * ...
 * dispatcher.stop();
 * }</pre>
 */
public class ScheduleDispatcher implements Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDispatcher.class);

    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);

    private final ScheduleStore store;
    private final ScheduleManager manager;
    private final TaskWorkerPool workerPool;
    private final ReloadChannel reloadChannel;
    private final ZoneId timezone;
    private final Duration pollTimeout;
    private final Duration maxBackoff;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.IDLE);
    private final AtomicLong generation = new AtomicLong();
    private final Object reloadLock = new Object();

    private final DelayQueue<Firing> queue = new DelayQueue<>();
    private volatile Map<String, Entry> table = Map.of();
    private volatile Map<String, CronValidationException> failures = Map.of();

    private Thread timerThread;
    private Thread listenerThread;

    /**
     * A compiled schedule of the current table.
     */
    record Entry(Schedule schedule, CronSchedule cron) {
    }

    private final class Firing implements Delayed {
        private final Entry entry;
        private final Instant runAt;
        private final long generation;

        private Firing(Entry entry, Instant runAt, long generation) {
            this.entry = entry;
            this.runAt = runAt;
            this.generation = generation;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof Firing o) {
                return this.runAt.compareTo(o.runAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public ScheduleDispatcher(ScheduleStore store,
                              ScheduleManager manager,
                              TaskWorkerPool workerPool,
                              ReloadChannel reloadChannel,
                              ZoneId timezone,
                              Duration pollTimeout,
                              Duration maxBackoff,
                              Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool must not be null");
        this.reloadChannel = Objects.requireNonNull(reloadChannel, "reloadChannel must not be null");
        this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be a positive duration");
        }
        if (maxBackoff.compareTo(INITIAL_BACKOFF) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least " + INITIAL_BACKOFF);
        }
    }

    /**
     * Build the table and start both threads. Idempotent.
     *
     * @throws RuntimeException when the initial table cannot be read; the dispatcher stays stopped
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Dispatcher starting with timezone={}, pollTimeout={}, maxBackoff={}", timezone, pollTimeout, maxBackoff);

        try {
            reload();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        timerThread = new Thread(this::timerLoop);
        timerThread.setName("backup.dispatcher.timer");
        timerThread.setDaemon(true);
        timerThread.start();

        listenerThread = new Thread(this::listenerLoop);
        listenerThread.setName("backup.dispatcher.listener");
        listenerThread.setDaemon(true);
        listenerThread.start();

        log.info("Dispatcher started successfully. schedules={} invalid={}", table.size(), failures.size());
    }

    /**
     * Stop both threads and drop the table. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Dispatcher stopping...");

        Thread listener = listenerThread;
        Thread timer = timerThread;
        listenerThread = null;
        timerThread = null;

        reloadChannel.wakeup();
        if (listener != null) {
            listener.interrupt();
        }
        if (timer != null) {
            timer.interrupt();
        }

        generation.incrementAndGet();
        queue.clear();
        table = Map.of();

        // The listener closes the channel on its way out; wait so a restart never races it.
        awaitTermination(listener);
        awaitTermination(timer);
        log.info("Dispatcher stopped successfully.");
    }

    private void awaitTermination(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(STOP_JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (thread.isAlive()) {
            log.warn("Dispatcher thread did not stop within {} thread={}", STOP_JOIN_TIMEOUT, thread.getName());
        }
    }

    /**
     * Clear the table and rebuild it from the store. Inactive schedules are left out; a schedule
     * whose cron does not compile is recorded in {@link #failures()} and skipped without affecting
     * the others.
     */
    @Override
    public void reload() {
        synchronized (reloadLock) {
            state.set(DispatcherState.RELOADING);
            try {
                long gen = generation.incrementAndGet();
                queue.clear();

                Map<String, Entry> nextTable = new LinkedHashMap<>();
                Map<String, CronValidationException> nextFailures = new LinkedHashMap<>();
                Instant now = clock.instant();

                for (Schedule schedule : store.findAll()) {
                    if (!schedule.active()) {
                        continue;
                    }
                    CronSchedule cron;
                    try {
                        cron = CronParser.parse(schedule.cron(), timezone);
                    } catch (CronValidationException e) {
                        log.error("Schedule skipped, invalid cron scheduleId={} tenantId={} cron='{}' msg={}",
                                schedule.id(), schedule.tenantId(), schedule.cron(), e.getMessage());
                        nextFailures.put(schedule.id(), e);
                        continue;
                    }

                    Entry entry = new Entry(schedule, cron);
                    nextTable.put(tableKey(schedule), entry);
                    enqueueNext(entry, now, gen);
                }

                table = Collections.unmodifiableMap(nextTable);
                failures = Collections.unmodifiableMap(nextFailures);
                log.info("Schedule table rebuilt generation={} schedules={} invalid={}", gen, nextTable.size(), nextFailures.size());
            } finally {
                state.set(DispatcherState.IDLE);
            }
        }
    }

    @Override
    public DispatcherState state() {
        return state.get();
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Current table, keyed {@code backup-schedule-<scheduleId>-<tenantId>}.
     */
    public Map<String, Schedule> schedules() {
        Map<String, Schedule> out = new LinkedHashMap<>();
        table.forEach((k, v) -> out.put(k, v.schedule()));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Schedules left out of the current table because their cron did not compile, by id.
     */
    public Map<String, CronValidationException> failures() {
        return failures;
    }

    /**
     * Queued firings belonging to the current table.
     */
    int pendingFirings() {
        long gen = generation.get();
        return (int) queue.stream().filter(f -> f.generation == gen).count();
    }

    /**
     * Fire a table entry immediately, outside its cron cadence.
     *
     * @return false when no such schedule is in the current table
     */
    boolean fireNow(String tenantId, String scheduleId) {
        Entry entry = table.get(tableKey(scheduleId, tenantId));
        if (entry == null) {
            return false;
        }
        fire(entry, clock.instant());
        return true;
    }

    static String tableKey(Schedule schedule) {
        return tableKey(schedule.id(), schedule.tenantId());
    }

    private static String tableKey(String scheduleId, String tenantId) {
        return "backup-schedule-" + scheduleId + "-" + tenantId;
    }

    private void enqueueNext(Entry entry, Instant after, long gen) {
        Instant next = CronParser.nextRunAt(entry.cron(), after);
        if (next == null) {
            log.warn("Schedule has no future fire time scheduleId={} cron='{}'", entry.schedule().id(), entry.schedule().cron());
            return;
        }
        queue.offer(new Firing(entry, next, gen));
    }

    private void timerLoop() {
        while (started.get()) {
            try {
                Firing due = queue.take();
                if (due.generation != generation.get()) {
                    continue;
                }
                fire(due.entry, due.runAt);
                // Fire times missed while behind collapse into this one firing.
                Instant now = clock.instant();
                enqueueNext(due.entry, due.runAt.isAfter(now) ? due.runAt : now, due.generation);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Dispatcher timer failed msg={}", e.getMessage(), e);
            }
        }
    }

    // Never blocks on the backup itself; the worker pool queues it.
    private void fire(Entry entry, Instant firedAt) {
        Schedule s = entry.schedule();
        TaskArgs.CreateBackup args = new TaskArgs.CreateBackup(
                s.sourceId(),
                s.destinationId(),
                s.tenantId(),
                s.id(),
                s.keepN()
        );

        log.info("Schedule fired scheduleId={} tenantId={} at={}", s.id(), s.tenantId(), firedAt);
        try {
            workerPool.<String>submit(TaskArgs.CREATE_BACKUP, args).whenComplete((key, e) -> {
                if (e != null) {
                    log.error("Scheduled backup failed scheduleId={} tenantId={} msg={}", s.id(), s.tenantId(), e.getMessage());
                } else {
                    log.info("Scheduled backup done scheduleId={} tenantId={} key={}", s.id(), s.tenantId(), key);
                }
            });
        } catch (RuntimeException e) {
            log.error("Scheduled backup not submitted scheduleId={} tenantId={} msg={}", s.id(), s.tenantId(), e.getMessage(), e);
        }

        try {
            manager.updateLastRun(s.tenantId(), s.id(), firedAt);
        } catch (RuntimeException e) {
            log.warn("Could not record last run scheduleId={} tenantId={} msg={}", s.id(), s.tenantId(), e.getMessage());
        }
    }

    private void listenerLoop() {
        int failureCount = 0;
        try {
            while (started.get()) {
                try {
                    int received = reloadChannel.poll(pollTimeout);
                    if (received > 0 && started.get()) {
                        log.debug("Reload notifications received count={}", received);
                        reload();
                        reloadChannel.acknowledge();
                    }
                    failureCount = 0;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    if (!started.get()) {
                        break;
                    }
                    failureCount++;
                    Duration sleep = backoff(failureCount);
                    log.error("Reload listener failed attempt={} retryIn={} msg={}", failureCount, sleep, e.getMessage(), e);
                    try {
                        Thread.sleep(sleep.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    reconnect();
                }
            }
        } finally {
            reloadChannel.close();
        }
    }

    private void reconnect() {
        try {
            reloadChannel.reconnect();
            log.info("Reload channel reconnected");
        } catch (Exception e) {
            log.warn("Reload channel reconnect failed msg={}", e.getMessage());
        }
    }

    // 1s, 2s, 4s ... capped at maxBackoff.
    Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(INITIAL_BACKOFF.toMillis() * (1L << exp), maxBackoff.toMillis());
        return Duration.ofMillis(ms);
    }
}
