/**
 * FileContentRequest.java
 *
 * 保存或覆盖文件内容的请求体，由 /api/fs/save 与 /api/fs/write 使用。
 */
package club.ppmc.workspace.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param path 要写入的文件相对于当前修订版本的路径。
 * @param content 完整的新文件内容。
 */
public record FileContentRequest(@NotBlank String path, @NotNull String content) {}
