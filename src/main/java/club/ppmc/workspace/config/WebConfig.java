/**
 * WebConfig.java
 *
 * 全局的 Spring Web MVC 配置。
 * 仅在设置了 {@code app.cors.permissive}（通常来自环境变量 CORS_PERMISSIVE）时注册宽松的 CORS 映射，
 * 供开发时前端在不同端口上访问 /api 接口。
 * 只要设置了该变量就视为打开（包括空值和任意内容），唯一的例外是显式的 "false"。
 */
package club.ppmc.workspace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final boolean corsPermissive;

    public WebConfig(@Value("${app.cors.permissive:false}") String corsPermissive) {
        this.corsPermissive = isPermissive(corsPermissive);
    }

    static boolean isPermissive(String value) {
        return value != null && !"false".equalsIgnoreCase(value.trim());
    }

    /**
     * 配置全局 CORS 映射。
     * 使用 {@code allowedOriginPatterns("*")} 而不是 {@code allowedOrigins("*")}，
     * 否则无法与 allowCredentials(true) 同时使用。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (!corsPermissive) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
