/**
 * ReorderNodesRequest.java
 *
 * 交换两个节点的源码位置。列号可省略 (为 0 时取该行第一个同名节点)。
 */
package club.ppmc.visualsync.model.request;

import club.ppmc.visualsync.model.NodeRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ReorderNodesRequest(
        @NotNull @Valid NodeRef first, int firstColumn, @NotNull @Valid NodeRef second, int secondColumn) {}
