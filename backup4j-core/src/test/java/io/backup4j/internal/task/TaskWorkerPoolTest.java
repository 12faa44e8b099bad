package io.backup4j.internal.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.TaskHandler;
import io.backup4j.core.TaskArgs;
import io.backup4j.core.TaskHandlerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskWorkerPoolTest {

    private TaskWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void submitShouldConvertFlatMapArgs() throws Exception {
        pool = newPool(Duration.ofSeconds(5), args -> args.tenantId() + ":" + args.sourceId() + ":" + args.keepN());

        Map<String, Object> flat = new HashMap<>();
        flat.put("backup_source_id", "src-1");
        flat.put("backup_destination_id", "dst-1");
        flat.put("tenant_id", "t1");
        flat.put("schedule_id", null);
        flat.put("keep_n", 3);

        CompletableFuture<String> result = pool.submit(TaskArgs.CREATE_BACKUP, flat);

        assertEquals("t1:src-1:3", result.get(5, TimeUnit.SECONDS));
    }

    @Test
    void submitShouldAcceptTypedArgs() throws Exception {
        pool = newPool(Duration.ofSeconds(5), TaskArgs.CreateBackup::destinationId);

        CompletableFuture<String> result = pool.submit(TaskArgs.CREATE_BACKUP,
                new TaskArgs.CreateBackup("src-1", "dst-9", "t1", null, null));

        assertEquals("dst-9", result.get(5, TimeUnit.SECONDS));
    }

    @Test
    void unknownTaskNameShouldBeRejected() {
        pool = newPool(Duration.ofSeconds(5), args -> "x");

        assertThrows(IllegalArgumentException.class, () -> pool.submit("compact_everything", Map.of()));
    }

    @Test
    void handlerFailureShouldCompleteExceptionally() {
        pool = newPool(Duration.ofSeconds(5), args -> {
            throw new IllegalStateException("boom");
        });

        CompletableFuture<String> result = pool.submit(TaskArgs.CREATE_BACKUP,
                new TaskArgs.CreateBackup("s", "d", "t", null, null));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    @Test
    void taskOverTimeLimitShouldTimeOut() {
        pool = newPool(Duration.ofMillis(200), args -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        });

        CompletableFuture<String> result = pool.submit(TaskArgs.CREATE_BACKUP,
                new TaskArgs.CreateBackup("s", "d", "t", null, null));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertThat(ex.getCause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void submitAfterShutdownShouldFail() {
        pool = newPool(Duration.ofSeconds(5), args -> "x");
        pool.shutdown(Duration.ofSeconds(1));

        assertThrows(IllegalStateException.class, () -> pool.submit(TaskArgs.CREATE_BACKUP, Map.of()));
    }

    private static TaskWorkerPool newPool(Duration limit, Function<TaskArgs.CreateBackup, String> body) {
        TaskHandler<TaskArgs.CreateBackup, String> handler = new TaskHandler<>() {
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
                return body.apply(args);
            }
        };
        return new TaskWorkerPool(new TaskHandlerRegistry(List.of(handler)), new ObjectMapper(), 2, limit);
    }
}
