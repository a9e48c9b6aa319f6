/**
 * SyncListener.java
 *
 * 同步编排器对外暴露的五个推送式观察通道：选区、属性、代码、同步事件日志以及构造体树。
 * 可视化渲染器、属性面板和代码编辑器只能通过这些通道与引擎交互。
 */
package club.ppmc.visualsync.engine.sync;

import club.ppmc.visualsync.model.Selection;
import club.ppmc.visualsync.model.SourceBuffer;
import club.ppmc.visualsync.model.SyncEvent;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.AttributeValue;
import java.util.Map;

public interface SyncListener {

    /** @param selection 新的选区，清除选区时为 null。 */
    default void onSelectionChanged(Selection selection) {}

    default void onAttributesChanged(Map<String, AttributeValue> attributes) {}

    default void onCodeChanged(SourceBuffer buffer) {}

    default void onSyncEvent(SyncEvent event) {}

    default void onTreeChanged(RootNode root) {}
}
