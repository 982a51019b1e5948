/**
 * AppConfig.java
 *
 * 应用级别的 Bean 定义。
 * 目前只定义文件系统操作使用的有界线程池：目录遍历、内容搜索、压缩包解压等阻塞操作
 * 都在这里执行，不占用处理 HTTP 请求的线程。
 */
package club.ppmc.workspace.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class AppConfig {

    /**
     * 定义存储工作线程池，线程数由 {@code app.storage.worker-threads} 决定。
     * 应用关闭时由 Spring 调用 shutdown。
     *
     * @return 固定大小的线程池。
     */
    @Bean(name = "storageExecutor", destroyMethod = "shutdown")
    public ExecutorService storageExecutor(StorageProperties properties) {
        var threadFactory = new CustomizableThreadFactory("storage-worker-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.resolveWorkerThreads(), threadFactory);
    }
}
