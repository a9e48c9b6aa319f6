/**
 * SourceText.java
 *
 * 对源文本的行级视图：行首偏移表、缩进以及 "节点是否独占其所在行" 的判断。
 */
package club.ppmc.visualsync.engine.mutation;

import club.ppmc.visualsync.model.NodeBounds;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.regex.Pattern;

final class SourceText {

    /** 节点首行之前只允许出现空白和可选的 "label:"。 */
    private static final Pattern OWNED_PREFIX = Pattern.compile("\\s*([A-Za-z_$][\\w$]*\\s*:\\s*)?");

    /** 节点末行之后只允许出现空白、可选的分隔符以及行尾注释。 */
    private static final Pattern OWNED_SUFFIX = Pattern.compile("\\s*[,;]?\\s*(//.*)?");

    private final String text;
    private final int[] lineStarts;

    SourceText(String text) {
        this.text = text;
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    String text() {
        return text;
    }

    int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /** 行尾偏移 (不含换行符)。 */
    int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] - 1 : text.length();
    }

    /** 下一行的起始偏移；最后一行返回文本长度。 */
    int nextLineStart(int line) {
        return line < lineStarts.length ? lineStarts[line] : text.length();
    }

    String line(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    String indentation(int line) {
        return leadingWhitespace(line(line));
    }

    int lineOf(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    String prefixOf(NodeBounds bounds) {
        return text.substring(lineStart(lineOf(bounds.startOffset())), bounds.startOffset());
    }

    String suffixOf(NodeBounds bounds) {
        return text.substring(bounds.endOffset(), lineEnd(lineOf(bounds.endOffset())));
    }

    /** 节点是否独占从首行到末行的所有行，此时可以按整行编辑。 */
    boolean ownsLines(NodeBounds bounds) {
        return OWNED_PREFIX.matcher(prefixOf(bounds)).matches()
                && OWNED_SUFFIX.matcher(suffixOf(bounds)).matches();
    }

    boolean isValid(NodeBounds bounds) {
        return bounds != null
                && bounds.startOffset() >= 0
                && bounds.startOffset() < bounds.endOffset()
                && bounds.endOffset() <= text.length();
    }

    static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /** 给每个非空行加上前缀缩进。 */
    static String indentLines(String block, String indentation) {
        var lines = block.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].isBlank()) {
                lines[i] = indentation + lines[i];
            }
        }
        return String.join("\n", lines);
    }
}
