/**
 * NodeRef.java
 *
 * 通过 "构造体名称 + 起始行" 标识一个节点。
 * 这是选区和事件中使用的节点身份，行号在编辑后可能漂移，需要借助 LineOffsetTracker 映射。
 */
package club.ppmc.visualsync.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record NodeRef(@NotBlank String constructName, @Positive int startLine) {

    public NodeRef withStartLine(int line) {
        return new NodeRef(constructName, line);
    }
}
