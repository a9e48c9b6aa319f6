/**
 * SyncEventType.java
 */
package club.ppmc.visualsync.model;

public enum SyncEventType {
    DOCUMENT_OPENED,
    NODE_SELECTED,
    ATTRIBUTE_UPDATED,
    CODE_UPDATED,
    NODE_INSERTED,
    NODE_DELETED,
    NODE_WRAPPED,
    NODES_REORDERED,
    UNDO,
    REDO
}
