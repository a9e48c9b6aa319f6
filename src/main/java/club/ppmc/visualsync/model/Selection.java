/**
 * Selection.java
 *
 * 当前选中的节点：节点引用、起始列、选中时的范围以及属性快照。
 */
package club.ppmc.visualsync.model;

import club.ppmc.visualsync.model.value.AttributeValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Selection(
        NodeRef ref, int column, NodeBounds bounds, Map<String, AttributeValue> attributes) {

    public Selection {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
