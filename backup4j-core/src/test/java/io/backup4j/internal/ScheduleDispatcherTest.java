package io.backup4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.TaskHandler;
import io.backup4j.core.DispatcherState;
import io.backup4j.core.ReloadChannel;
import io.backup4j.core.Schedule;
import io.backup4j.core.TaskArgs;
import io.backup4j.core.TaskHandlerRegistry;
import io.backup4j.internal.task.TaskWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleDispatcherTest {

    private InMemoryStores.Schedules store;
    private FakeReloadChannel channel;
    private TaskWorkerPool pool;
    private ScheduleDispatcher dispatcher;
    private final AtomicInteger published = new AtomicInteger();
    private final AtomicReference<TaskArgs.CreateBackup> submitted = new AtomicReference<>();
    private final AtomicInteger executions = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryStores.Schedules();
        channel = new FakeReloadChannel();

        TaskHandler<TaskArgs.CreateBackup, String> capture = new TaskHandler<>() {
            @Override
            public String name() {
                return TaskArgs.CREATE_BACKUP;
            }

            @Override
            public Class<TaskArgs.CreateBackup> argsClass() {
                return TaskArgs.CreateBackup.class;
            }

            @Override
            public String execute(TaskArgs.CreateBackup args) {
                submitted.set(args);
                executions.incrementAndGet();
                return "key";
            }
        };
        pool = new TaskWorkerPool(new TaskHandlerRegistry(List.of(capture)), new ObjectMapper(), 1, Duration.ofSeconds(10));

        ScheduleManager manager = new ScheduleManager(store, new InMemoryStores.Sources(), new InMemoryStores.Destinations(),
                published::incrementAndGet, ZoneOffset.UTC, Clock.systemUTC());
        dispatcher = new ScheduleDispatcher(store, manager, pool, channel, ZoneOffset.UTC,
                Duration.ofMillis(50), Duration.ofSeconds(60), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
        pool.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void startShouldLoadActiveSchedulesAndIsolateInvalidCron() {
        store.put(schedule("1", "t1", "0 3 * * *", true));
        store.put(schedule("2", "t1", "0 3 * *", true));
        store.put(schedule("3", "t2", "*/5 * * * *", true));
        store.put(schedule("4", "t2", "0 3 * * *", false));

        dispatcher.start();

        assertEquals(Set.of("backup-schedule-1-t1", "backup-schedule-3-t2"), dispatcher.schedules().keySet());
        assertEquals(Set.of("2"), dispatcher.failures().keySet());
        assertEquals(2, dispatcher.pendingFirings());
        assertEquals(DispatcherState.IDLE, dispatcher.state());
    }

    @Test
    void repeatedReloadsShouldConvergeToSameTable() {
        store.put(schedule("1", "t1", "0 3 * * *", true));
        store.put(schedule("2", "t1", "*/10 * * * *", true));

        dispatcher.reload();
        Set<String> once = dispatcher.schedules().keySet();
        dispatcher.reload();
        dispatcher.reload();

        assertEquals(once, dispatcher.schedules().keySet());
        assertEquals(2, dispatcher.pendingFirings());
    }

    @Test
    void reloadNotificationShouldRebuildTableThenAcknowledge() throws Exception {
        store.put(schedule("1", "t1", "0 3 * * *", true));
        dispatcher.start();

        store.put(schedule("2", "t1", "0 4 * * *", true));
        store.byId.remove("1");
        channel.notifyReload();

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> channel.acks.get() == 1));
        assertEquals(Set.of("backup-schedule-2-t1"), dispatcher.schedules().keySet());
        assertEquals(1, dispatcher.pendingFirings());
    }

    @Test
    void listenerShouldReconnectAfterTransportFailure() throws Exception {
        dispatcher.start();
        channel.failNextPoll.set(true);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> channel.reconnects.get() == 1));

        store.put(schedule("1", "t1", "0 3 * * *", true));
        channel.notifyReload();

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> channel.acks.get() == 1));
        assertEquals(1, dispatcher.schedules().size());
    }

    @Test
    void firingShouldSubmitCreateBackupAndRecordLastRunWithoutReload() throws Exception {
        store.put(new Schedule("1", "t1", "nightly", "src-1", "dst-1", 3, "0 3 * * *", true,
                null, null, Instant.now(), Instant.now()));
        dispatcher.start();

        assertTrue(dispatcher.fireNow("t1", "1"));
        assertFalse(dispatcher.fireNow("t2", "1"));

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> submitted.get() != null));
        TaskArgs.CreateBackup args = submitted.get();
        assertEquals(new TaskArgs.CreateBackup("src-1", "dst-1", "t1", "1", 3), args);

        Schedule after = store.byId.get("1");
        assertNotNull(after.lastRun());
        assertNotNull(after.nextRun());
        assertEquals(0, published.get());
    }

    @Test
    void stopShouldCloseChannelAndClearTable() throws Exception {
        store.put(schedule("1", "t1", "0 3 * * *", true));
        dispatcher.start();

        dispatcher.stop();

        assertTrue(channel.closed.get());
        assertTrue(dispatcher.schedules().isEmpty());
        assertFalse(dispatcher.isStarted());
    }

    @Test
    void restartRightAfterStopShouldKeepChannelOpen() throws Exception {
        store.put(schedule("1", "t1", "0 3 * * *", true));
        dispatcher.start();
        dispatcher.stop();
        channel.closed.set(false);

        dispatcher.start();
        channel.notifyReload();

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> channel.acks.get() == 1));
        assertFalse(channel.closed.get());
        assertEquals(1, dispatcher.schedules().size());
    }

    @Test
    void timerShouldFireOnceAfterFallingBehind() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:59.500Z"));
        ScheduleManager manager = new ScheduleManager(store, new InMemoryStores.Sources(), new InMemoryStores.Destinations(),
                published::incrementAndGet, ZoneOffset.UTC, clock);
        ScheduleDispatcher lagging = new ScheduleDispatcher(store, manager, pool, channel, ZoneOffset.UTC,
                Duration.ofMillis(50), Duration.ofSeconds(60), clock);
        store.put(schedule("1", "t1", "* * * * *", true));

        try {
            lagging.start();
            // Ten minutes pass before the first due firing is taken.
            clock.set(Instant.parse("2026-01-01T00:10:30Z"));

            assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> executions.get() == 1));
            Thread.sleep(300);

            assertEquals(1, executions.get());
            assertEquals(1, lagging.pendingFirings());
        } finally {
            lagging.stop();
        }
    }

    @Test
    void backoffShouldDoubleFromOneSecondUpToCap() {
        assertEquals(Duration.ofSeconds(1), dispatcher.backoff(1));
        assertEquals(Duration.ofSeconds(2), dispatcher.backoff(2));
        assertEquals(Duration.ofSeconds(32), dispatcher.backoff(6));
        assertEquals(Duration.ofSeconds(60), dispatcher.backoff(7));
        assertEquals(Duration.ofSeconds(60), dispatcher.backoff(40));
    }

    private static Schedule schedule(String id, String tenant, String cron, boolean active) {
        return new Schedule(id, tenant, "s" + id, "src", "dst", 0, cron, active, null, null, Instant.now(), Instant.now());
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    private static final class MutableClock extends Clock {
        private final AtomicReference<Instant> now;

        MutableClock(Instant start) {
            this.now = new AtomicReference<>(start);
        }

        void set(Instant instant) {
            now.set(instant);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }

    private static final class FakeReloadChannel implements ReloadChannel {
        private final BlockingQueue<Object> messages = new LinkedBlockingQueue<>();
        final AtomicInteger acks = new AtomicInteger();
        final AtomicInteger reconnects = new AtomicInteger();
        final AtomicBoolean failNextPoll = new AtomicBoolean();
        final AtomicBoolean closed = new AtomicBoolean();

        void notifyReload() {
            messages.add(new Object());
        }

        @Override
        public int poll(Duration timeout) throws Exception {
            if (failNextPoll.compareAndSet(true, false)) {
                throw new IllegalStateException("broker connection lost");
            }
            Object first = messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (first == null) {
                return 0;
            }
            return 1 + messages.drainTo(new ArrayList<>());
        }

        @Override
        public void acknowledge() {
            acks.incrementAndGet();
        }

        @Override
        public void reconnect() {
            reconnects.incrementAndGet();
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
