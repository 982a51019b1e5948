/**
 * StorageProperties.java
 *
 * 工作区存储服务的业务配置（{@code app.storage.*}）。
 * 存储根目录、工作线程数，以及搜索和压缩包导入的各项上限保护都在这里集中定义，
 * 其余组件只依赖此类，而不是直接使用 @Value 注解。
 */
package club.ppmc.workspace.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /** 存储根目录。HEAD 文件和所有修订版本目录都位于其下。 */
    @NotBlank
    private String root = "./decisions";

    /** 文件系统工作线程数，0 表示使用可用的 CPU 核数。 */
    @Min(0)
    @Max(1_024)
    private int workerThreads = 0;

    /** 内容搜索时单个文件的大小上限，超过则只参与文件名匹配。 */
    @NotNull
    private DataSize searchMaxContentSize = DataSize.ofBytes(1_000_000);

    /** 单个导入压缩包允许的最大条目数。 */
    @Min(1)
    @Max(10_000_000)
    private int archiveMaxEntries = 10_000;

    /** 单个导入压缩包解压后的总字节数上限。 */
    @NotNull
    private DataSize archiveMaxExtractedSize = DataSize.ofMegabytes(256);

    /**
     * 是否允许访问符号链接。
     * <p>
     * 默认 false：解析出的路径中只要有一级是符号链接，或其真实路径落在存储根目录之外，就视为路径逃逸。
     */
    private boolean allowSymlinks = false;

    public int resolveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
