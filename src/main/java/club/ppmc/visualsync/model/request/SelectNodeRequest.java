/**
 * SelectNodeRequest.java
 *
 * 在构造体树或预览中选中一个节点。
 *
 * @param column 节点的起始列 (从 1 开始)，用于区分同一行上的同名节点；可省略。
 * @param source 发起选择的界面，省略时视为构造体树。
 */
package club.ppmc.visualsync.model.request;

import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.SyncSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SelectNodeRequest(@NotNull @Valid NodeRef node, Integer column, SyncSource source) {

    public int columnOrDefault() {
        return column == null ? 0 : column;
    }

    public SyncSource sourceOrDefault() {
        return source == null ? SyncSource.WIDGET_TREE : source;
    }
}
