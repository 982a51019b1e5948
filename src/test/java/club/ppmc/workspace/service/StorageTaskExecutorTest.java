package club.ppmc.workspace.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.workspace.exception.StorageException;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StorageTaskExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final StorageTaskExecutor executor = new StorageTaskExecutor(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            return e.getCause();
        }
        throw new AssertionError("任务应当失败");
    }

    @Test
    void submit_runsTaskOnWorkerThread() {
        String threadName = executor.submit("name", () -> Thread.currentThread().getName()).join();

        assertThat(threadName).isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    void submit_convertsIoExceptionToInternalError() {
        Throwable failure = failureOf(executor.submit("read", () -> {
            throw new IOException("boom");
        }));

        assertThat(failure).isInstanceOfSatisfying(StorageException.class,
                e -> assertThat(e.getKind()).isEqualTo(StorageException.ErrorKind.INTERNAL_ERROR));
    }

    @Test
    void submit_convertsUnexpectedRuntimeExceptionToInternalError() {
        Throwable failure = failureOf(executor.submit("npe", () -> {
            throw new IllegalStateException("unexpected");
        }));

        assertThat(failure).isInstanceOfSatisfying(StorageException.class,
                e -> assertThat(e.getKind()).isEqualTo(StorageException.ErrorKind.INTERNAL_ERROR));
        assertThat(failure.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void submit_passesStorageExceptionsThrough() {
        Throwable failure = failureOf(executor.submit("missing", () -> {
            throw StorageException.notFound("gone");
        }));

        assertThat(failure).isInstanceOfSatisfying(StorageException.class,
                e -> assertThat(e.getKind()).isEqualTo(StorageException.ErrorKind.NOT_FOUND));
    }

    @Test
    void submit_failsFastAfterShutdown() {
        pool.shutdown();

        Throwable failure = failureOf(executor.submit("late", () -> "never"));

        assertThat(failure).isInstanceOf(StorageException.class);
    }
}
