/**
 * TreeAssembler.java
 *
 * 解析器的第二遍：把扁平的构造体记录组装成层级树。
 *
 * 记录按 (起始行, 起始偏移, 嵌套深度) 排序后依次处理，维护一个打开节点的栈。
 * 对每条记录，只要栈顶不是合法容器就出栈。合法容器要求记录的起始行落在栈顶的行范围内，
 * 并且记录的字符范围完全包含在栈顶的字符范围内。只比较嵌套深度会把同一深度的兄弟节点误判为父子，
 * 同一行上的兄弟节点也只能靠字符范围区分。
 */
package club.ppmc.visualsync.engine.parser;

import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.tree.RootNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;

public class TreeAssembler {

    private static final Comparator<ConstructRecord> SOURCE_ORDER =
            Comparator.comparingInt(ConstructRecord::startLine)
                    .thenComparingInt(ConstructRecord::startOffset)
                    .thenComparingInt(ConstructRecord::nestingLevel);

    private final int snippetMaxLength;

    public TreeAssembler(int snippetMaxLength) {
        this.snippetMaxLength = snippetMaxLength;
    }

    public RootNode assemble(String source, String path, List<ConstructRecord> records) {
        var root = emptyRoot(source, path);
        var sorted = new ArrayList<>(records);
        sorted.sort(SOURCE_ORDER);

        Deque<ConstructNode> stack = new ArrayDeque<>();
        for (ConstructRecord record : sorted) {
            ConstructNode node = toNode(source, record);
            while (!stack.isEmpty() && !isValidContainer(stack.peek(), record)) {
                stack.pop();
            }
            if (stack.isEmpty()) {
                root.getChildren().add(node);
            } else {
                stack.peek().getChildren().add(node);
            }
            stack.push(node);
        }
        return root;
    }

    public static RootNode emptyRoot(String source, String path) {
        var root = new RootNode();
        root.setPath(path);
        String text = source == null ? "" : source;
        root.setEndLine(countLines(text));
        root.setStartOffset(0);
        root.setEndOffset(text.length());
        return root;
    }

    static boolean isValidContainer(ConstructNode top, ConstructRecord record) {
        boolean lineContained =
                record.startLine() >= top.getStartLine() && record.startLine() <= top.getEndLine();
        boolean rangeContained =
                record.startOffset() >= top.getStartOffset()
                        && record.endOffset() <= top.getEndOffset();
        return lineContained && rangeContained;
    }

    private ConstructNode toNode(String source, ConstructRecord record) {
        var node = new ConstructNode();
        node.setConstructName(record.constructName());
        node.setStartLine(record.startLine());
        node.setEndLine(record.endLine());
        node.setStartColumn(record.startOffset() - source.lastIndexOf('\n', record.startOffset() - 1));
        node.setStartOffset(record.startOffset());
        node.setEndOffset(record.endOffset());
        node.setAttributes(new LinkedHashMap<>(record.attributes()));
        node.setPositionalArguments(new ArrayList<>(record.positionalArguments()));
        node.setNestingLevel(record.nestingLevel());
        node.setSlotName(record.slotName());
        node.setSnippet(snippet(source, record.startOffset(), record.endOffset()));
        node.setCategory(ConstructCatalog.classify(record.constructName()));
        return node;
    }

    private String snippet(String source, int start, int end) {
        String text = source.substring(start, Math.min(end, source.length()));
        if (text.length() > snippetMaxLength) {
            return text.substring(0, snippetMaxLength) + "...";
        }
        return text;
    }

    public static int countLines(String text) {
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
