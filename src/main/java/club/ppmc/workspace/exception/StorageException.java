/**
 * StorageException.java
 *
 * 存储层统一的运行时异常。
 * 每个实例携带一个 {@link ErrorKind}，由 GlobalExceptionHandler 映射为对应的 HTTP 状态码；
 * INTERNAL_ERROR 的详细信息只写日志，不返回给客户端。
 */
package club.ppmc.workspace.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class StorageException extends RuntimeException {

    /** 错误分类。 */
    public enum ErrorKind {
        /** 客户端试图访问沙箱之外的路径。 */
        PATH_ESCAPE,
        /** 地址没有对应的文件、目录或修订版本。 */
        NOT_FOUND,
        /** 请求缺少必需字段或字段不合法。 */
        BAD_REQUEST,
        /** 意外的 IO 失败、压缩包解码/解压失败、HEAD 持久化失败等。 */
        INTERNAL_ERROR
    }

    private final ErrorKind kind;

    public StorageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StorageException pathEscape(String path) {
        return new StorageException(ErrorKind.PATH_ESCAPE, "路径不在允许访问的范围内: " + path);
    }

    public static StorageException notFound(String message) {
        return new StorageException(ErrorKind.NOT_FOUND, message);
    }

    public static StorageException badRequest(String message) {
        return new StorageException(ErrorKind.BAD_REQUEST, message);
    }

    public static StorageException internal(String message, Throwable cause) {
        return new StorageException(ErrorKind.INTERNAL_ERROR, message, cause);
    }

    public boolean isClientError() {
        return kind != ErrorKind.INTERNAL_ERROR;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     * 内部错误只返回通用描述，避免泄露服务器路径等细节。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", kind.name(),
                "message", isClientError() ? getMessage() : "内部错误"
        );
    }
}
