/**
 * NodeBounds.java
 *
 * 节点在源文本中的范围：闭区间行号 [startLine, endLine] 以及左闭右开的字符偏移。
 * 由解析器提供给 StructuralMutator 使用。
 */
package club.ppmc.visualsync.model;

public record NodeBounds(
        String constructName, int startLine, int endLine, int startOffset, int endOffset) {

    /** 两个范围在字符层面是否相交 (包括嵌套)。 */
    public boolean overlaps(NodeBounds other) {
        return startOffset < other.endOffset && other.startOffset < endOffset;
    }
}
