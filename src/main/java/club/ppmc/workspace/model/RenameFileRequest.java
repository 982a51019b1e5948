/**
 * RenameFileRequest.java
 *
 * 重命名/移动文件或目录的请求体。与旧接口不同，{@code to} 是完整的目标路径而不只是新名称。
 */
package club.ppmc.workspace.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param from 原始相对路径。
 * @param to 目标相对路径。
 */
public record RenameFileRequest(@NotBlank String from, @NotBlank String to) {}
