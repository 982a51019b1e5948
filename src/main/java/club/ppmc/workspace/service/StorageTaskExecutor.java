/**
 * StorageTaskExecutor.java
 *
 * 把阻塞的文件系统操作提交到有界的存储线程池（storageExecutor）上执行，并以 CompletableFuture 返回结果，
 * 处理 HTTP 请求的线程因此不会被耗时的遍历、搜索或解压阻塞。
 * 任务中抛出的 IOException 以及意料之外的异常都会被转换为 INTERNAL_ERROR，不会让进程崩溃。
 */
package club.ppmc.workspace.service;

import club.ppmc.workspace.exception.StorageException;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class StorageTaskExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageTaskExecutor.class);

    /** 可以抛出 IOException 的存储任务。 */
    @FunctionalInterface
    public interface StorageTask<T> {
        T call() throws IOException;
    }

    private final ExecutorService executor;

    public StorageTaskExecutor(@Qualifier("storageExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 在存储线程池上异步执行任务。
     *
     * @param operation 操作名称，仅用于日志。
     * @param task 要执行的任务。
     * @return 任务完成时完成的 Future；失败时以 StorageException 异常完成。
     */
    public <T> CompletableFuture<T> submit(String operation, StorageTask<T> task) {
        try {
            return CompletableFuture.supplyAsync(() -> runTask(operation, task), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(StorageException.internal("存储线程池已关闭: " + operation, e));
        }
    }

    private static <T> T runTask(String operation, StorageTask<T> task) {
        try {
            return task.call();
        } catch (StorageException e) {
            throw e;
        } catch (IOException e) {
            throw StorageException.internal(operation + " 失败: " + e.getMessage(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            LOGGER.error("存储任务 '{}' 出现意外异常", operation, e);
            throw StorageException.internal(operation + " 出现意外异常", e);
        }
    }
}
