/**
 * RootNode.java
 *
 * 包裹所有顶层构造体的合成根节点。
 * 解析失败时不抛出异常，而是返回一个子节点为空、带有 diagnostic 的根节点。
 */
package club.ppmc.visualsync.model.tree;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RootNode extends ConstructNode {

    public static final String ROOT_NAME = "Root";

    /** 被解析文件的路径。 */
    private String path;

    /** 解析诊断信息；解析完全成功时为 null。 */
    private String diagnostic;

    public RootNode() {
        setConstructName(ROOT_NAME);
        setStartLine(1);
        setEndLine(1);
        setNestingLevel(-1);
    }

    public boolean hasDiagnostic() {
        return diagnostic != null;
    }
}
