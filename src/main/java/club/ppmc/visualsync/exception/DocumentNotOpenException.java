/**
 * DocumentNotOpenException.java
 *
 * 在没有打开任何文档时调用同步命令会抛出此运行时异常。
 * 它携带结构化的错误信息，Controller 层将其转换为 HTTP 409 响应。
 */
package club.ppmc.visualsync.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class DocumentNotOpenException extends RuntimeException {

    /** 被拒绝的操作名称，例如 "updateAttribute"。 */
    private final String operation;

    public DocumentNotOpenException(String operation) {
        super("当前没有打开的文档，无法执行 " + operation + "。请先调用 /api/sync/open。");
        this.operation = operation;
    }

    /**
     * 将异常信息转换为一个 Map，便于序列化为 JSON。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "DOCUMENT_NOT_OPEN",
                "message", getMessage(),
                "operation", getOperation());
    }
}
