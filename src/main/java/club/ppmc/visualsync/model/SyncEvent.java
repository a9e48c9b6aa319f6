/**
 * SyncEvent.java
 *
 * 同步事件日志中的一条记录，同时也是撤销/重做历史的条目描述。
 * nodeRef、attrName、attrValue、wrapperName 均为可选字段。
 */
package club.ppmc.visualsync.model;

import java.time.Instant;

public record SyncEvent(
        SyncEventType type,
        SyncSource source,
        Instant timestamp,
        NodeRef nodeRef,
        String attrName,
        Object attrValue,
        String wrapperName) {

    public static SyncEvent of(SyncEventType type, SyncSource source) {
        return new SyncEvent(type, source, Instant.now(), null, null, null, null);
    }

    public static SyncEvent forNode(SyncEventType type, SyncSource source, NodeRef nodeRef) {
        return new SyncEvent(type, source, Instant.now(), nodeRef, null, null, null);
    }

    public static SyncEvent attributeUpdated(NodeRef nodeRef, String name, Object value) {
        return new SyncEvent(
                SyncEventType.ATTRIBUTE_UPDATED,
                SyncSource.PROPERTIES_PANEL,
                Instant.now(),
                nodeRef,
                name,
                value,
                null);
    }

    public static SyncEvent wrapped(NodeRef nodeRef, String wrapperName) {
        return new SyncEvent(
                SyncEventType.NODE_WRAPPED,
                SyncSource.WIDGET_TREE,
                Instant.now(),
                nodeRef,
                null,
                null,
                wrapperName);
    }
}
