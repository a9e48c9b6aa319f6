/**
 * ConstructTreeParser.java
 *
 * 源代码解析器的门面：文本 -> 带位置信息的构造体树。
 * 所有公开方法都不会抛出异常；内部失败时返回子节点为空、带诊断信息的根节点。
 * 每个打开的文档会话持有自己的实例，不存在全局单例。
 */
package club.ppmc.visualsync.engine.parser;

import club.ppmc.visualsync.model.ConstructCategory;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.AttributeValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ConstructTreeParser {

    public static final int DEFAULT_SNIPPET_MAX_LENGTH = 200;

    private final TreeAssembler assembler;

    public ConstructTreeParser() {
        this(DEFAULT_SNIPPET_MAX_LENGTH);
    }

    public ConstructTreeParser(int snippetMaxLength) {
        this.assembler = new TreeAssembler(snippetMaxLength);
    }

    public RootNode parseTree(String text, String path) {
        if (text == null || text.isBlank()) {
            RootNode root = TreeAssembler.emptyRoot(text, path);
            root.setDiagnostic("源文件为空");
            return root;
        }
        try {
            var tokens = new SourceLexer(text).tokenize();
            var scanner = new ConstructScanner(text, tokens);
            var records = scanner.scan();
            RootNode root = assembler.assemble(text, path, records);
            if (!scanner.getProblems().isEmpty()) {
                root.setDiagnostic(String.join("; ", scanner.getProblems()));
                log.debug("解析 {} 时发现可恢复的问题: {}", path, root.getDiagnostic());
            }
            return root;
        } catch (SourceParseException e) {
            log.debug("解析 {} 失败: {}", path, e.getMessage());
            RootNode root = TreeAssembler.emptyRoot(text, path);
            root.setDiagnostic(e.getMessage());
            return root;
        } catch (RuntimeException e) {
            log.error("解析 {} 时发生内部错误", path, e);
            RootNode root = TreeAssembler.emptyRoot(text, path);
            root.setDiagnostic("内部解析错误: " + e.getMessage());
            return root;
        }
    }

    /**
     * 查找某一行上的节点：优先返回前序遍历中第一个从该行开始的节点，
     * 否则返回范围包含该行的最内层节点。
     */
    public Optional<ConstructNode> findNodeAtLine(String text, int line) {
        return findNodeAtLine(parseTree(text, null), line);
    }

    public Optional<ConstructNode> findNodeAtLine(RootNode root, int line) {
        ConstructNode starting = findStartingAt(root.getChildren(), line);
        if (starting != null) {
            return Optional.of(starting);
        }
        return Optional.ofNullable(findInnermostContaining(root.getChildren(), line));
    }

    public Optional<ConstructNode> findNode(String text, NodeRef ref) {
        return findNode(parseTree(text, null), ref);
    }

    public Optional<ConstructNode> findNode(RootNode root, NodeRef ref) {
        return findNodes(root, ref).stream().findFirst();
    }

    /** 前序遍历中所有名称与起始行都匹配的节点 (同一行上可能有多个同名构造体)。 */
    public List<ConstructNode> findNodes(RootNode root, NodeRef ref) {
        var matches = new ArrayList<ConstructNode>();
        collectByRef(root.getChildren(), ref, matches);
        return matches;
    }

    /** 重新提取指定节点的属性，找不到节点时返回空映射。 */
    public Map<String, AttributeValue> extractAttributes(String text, NodeRef ref) {
        return findNode(text, ref).map(ConstructNode::getAttributes).orElseGet(Map::of);
    }

    public ConstructCategory classify(String constructName) {
        return ConstructCatalog.classify(constructName);
    }

    private static ConstructNode findStartingAt(Iterable<ConstructNode> nodes, int line) {
        for (ConstructNode node : nodes) {
            if (node.getStartLine() == line) {
                return node;
            }
            if (node.containsLine(line)) {
                ConstructNode found = findStartingAt(node.getChildren(), line);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static ConstructNode findInnermostContaining(Iterable<ConstructNode> nodes, int line) {
        for (ConstructNode node : nodes) {
            if (node.containsLine(line)) {
                ConstructNode deeper = findInnermostContaining(node.getChildren(), line);
                return deeper != null ? deeper : node;
            }
        }
        return null;
    }

    private static void collectByRef(
            Iterable<ConstructNode> nodes, NodeRef ref, List<ConstructNode> matches) {
        for (ConstructNode node : nodes) {
            if (node.getStartLine() == ref.startLine()
                    && node.getConstructName().equals(ref.constructName())) {
                matches.add(node);
            }
            if (node.containsLine(ref.startLine())) {
                collectByRef(node.getChildren(), ref, matches);
            }
        }
    }
}
