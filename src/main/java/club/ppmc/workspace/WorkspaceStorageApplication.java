/**
 * WorkspaceStorageApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动工作区存储服务：沙箱文件系统、修订版本（revision）管理、搜索以及压缩包导入/导出。
 * @ConfigurationPropertiesScan 用于注册 StorageProperties 等 {@code app.*} 配置类。
 */
package club.ppmc.workspace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WorkspaceStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceStorageApplication.class, args);
    }
}
