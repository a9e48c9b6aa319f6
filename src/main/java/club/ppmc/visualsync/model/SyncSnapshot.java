/**
 * SyncSnapshot.java
 *
 * 当前同步会话状态的只读视图，用于 GET /api/sync/state 以及前端重连后的全量刷新。
 */
package club.ppmc.visualsync.model;

import club.ppmc.visualsync.model.tree.RootNode;

public record SyncSnapshot(
        SourceBuffer buffer,
        RootNode tree,
        Selection selection,
        SyncState state,
        boolean canUndo,
        boolean canRedo,
        boolean reparsePending) {}
