/**
 * SyncSource.java
 *
 * 事件来源的界面部件。
 */
package club.ppmc.visualsync.model;

public enum SyncSource {
    WIDGET_TREE,
    PROPERTIES_PANEL,
    CODE_EDITOR,
    PREVIEW,
    SYSTEM
}
