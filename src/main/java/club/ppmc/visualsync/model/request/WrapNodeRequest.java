/**
 * WrapNodeRequest.java
 *
 * 用一个新的包装构造体包住目标节点。
 *
 * @param target 被包装的节点，省略时使用当前选区。
 * @param wrapperName 包装构造体名称，例如 {@code Padding}。
 * @param attributes 包装构造体的附加属性，保持请求中的顺序。
 */
package club.ppmc.visualsync.model.request;

import club.ppmc.visualsync.model.NodeRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record WrapNodeRequest(
        @Valid NodeRef target, @NotBlank String wrapperName, Map<String, Object> attributes) {

    public Map<String, Object> attributesOrEmpty() {
        return attributes == null ? Map.of() : attributes;
    }
}
