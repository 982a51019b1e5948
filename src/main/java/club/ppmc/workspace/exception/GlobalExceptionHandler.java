/**
 * GlobalExceptionHandler.java
 *
 * 把存储层异常和请求绑定异常统一转换为 HTTP 响应。
 * PATH_ESCAPE / BAD_REQUEST -> 400，NOT_FOUND -> 404，其余 -> 500（只返回通用信息，详细原因写入日志）。
 */
package club.ppmc.workspace.exception;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageException(StorageException e) {
        HttpStatus status = switch (e.getKind()) {
            case PATH_ESCAPE, BAD_REQUEST -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (e.isClientError()) {
            log.debug("请求被拒绝 ({}): {}", e.getKind(), e.getMessage());
        } else {
            log.error("存储操作失败: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(status).body(e.toErrorData());
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("请求参数无效: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("type", StorageException.ErrorKind.BAD_REQUEST.name(), "message", "请求参数无效"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknownException(Exception e) {
        // 未知路由、不支持的方法等由 Spring 自带状态码
        if (e instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(Map.of("type", StorageException.ErrorKind.BAD_REQUEST.name(), "message", String.valueOf(e.getMessage())));
        }
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("type", StorageException.ErrorKind.INTERNAL_ERROR.name(), "message", "内部错误"));
    }
}
