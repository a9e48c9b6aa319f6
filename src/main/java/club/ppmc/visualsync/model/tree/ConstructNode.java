/**
 * ConstructNode.java
 *
 * 源代码中一个带位置信息的结构化构造体 (如 {@code Leaf(text: 'A')}) 在树中的节点。
 * 行号从 1 开始且闭区间；字符偏移为左闭右开区间。
 * 它是一个可变 POJO，由 TreeAssembler 组装，组装完成后只读地发布给订阅者。
 */
package club.ppmc.visualsync.model.tree;

import club.ppmc.visualsync.model.ConstructCategory;
import club.ppmc.visualsync.model.NodeBounds;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.value.AttributeValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ConstructNode {

    /** 构造体名称，如 "Column" 或 "EdgeInsets.all"。 */
    private String constructName;

    private int startLine;
    private int endLine;

    /** 起始列 (从 1 开始)，用于区分同一行上同名的构造体。 */
    private int startColumn;

    /** 构造体在全文中的起始字符偏移 (含)。 */
    private int startOffset;

    /** 构造体在全文中的结束字符偏移 (不含)。 */
    private int endOffset;

    /** 命名参数，保持源代码中的顺序。 */
    private Map<String, AttributeValue> attributes = new LinkedHashMap<>();

    /** 位置参数，保持源代码中的顺序。 */
    private List<AttributeValue> positionalArguments = new ArrayList<>();

    private List<ConstructNode> children = new ArrayList<>();

    /** 递归下降时的嵌套深度，顶层构造为 0。 */
    private int nestingLevel;

    /** 该节点作为父节点的哪个命名参数传入，例如 "child"、"children"；位置参数时为 null。 */
    private String slotName;

    /** 截断后的源代码片段。 */
    private String snippet;

    private ConstructCategory category = ConstructCategory.GENERIC;

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    public NodeRef toRef() {
        return new NodeRef(constructName, startLine);
    }

    public NodeBounds toBounds() {
        return new NodeBounds(constructName, startLine, endLine, startOffset, endOffset);
    }
}
