/**
 * InsertNodeRequest.java
 *
 * 插入一段新构造体源码。
 *
 * @param anchor 锚点节点，省略时使用当前选区。
 * @param snippet 要插入的源码片段，例如 {@code Text('Hi')}。
 * @param position 相对于锚点的位置。
 */
package club.ppmc.visualsync.model.request;

import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record InsertNodeRequest(
        @Valid NodeRef anchor, @NotBlank String snippet, @NotNull InsertPosition position) {}
