/**
 * ArchiveImportRequest.java
 *
 * 通过压缩包创建新修订版本的请求体。压缩包为 ZIP 格式，以标准 Base64 文本编码后放在 {@code zip_b64} 字段中。
 */
package club.ppmc.workspace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ArchiveImportRequest(@JsonProperty("zip_b64") String zipBase64) {}
