/**
 * PathRequest.java
 *
 * 只携带一个路径的请求体，由删除与创建目录接口共用。
 */
package club.ppmc.workspace.model;

import jakarta.validation.constraints.NotBlank;

public record PathRequest(@NotBlank String path) {}
