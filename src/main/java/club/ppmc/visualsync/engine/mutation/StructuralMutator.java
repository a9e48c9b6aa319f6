/**
 * StructuralMutator.java
 *
 * 结构化编辑器：根据解析器给出的节点范围，对源文本做定点的文本编辑，保持文件其余部分不变。
 * 支持更新属性、插入、删除、交换顺序以及用包装构造体包裹节点。
 *
 * 所有操作在任何内部失败时都原样返回输入文本，从不抛出异常。
 * 当节点独占其所在的行时按整行编辑；与其他构造体共享同一行时按字符范围编辑。
 * 每次成功编辑后都会调用外部格式化器，格式化失败时返回未格式化但结构正确的文本。
 */
package club.ppmc.visualsync.engine.mutation;

import club.ppmc.visualsync.engine.parser.ConstructCatalog;
import club.ppmc.visualsync.engine.parser.ConstructTreeParser;
import club.ppmc.visualsync.engine.parser.SourceLexer;
import club.ppmc.visualsync.engine.parser.SourceToken;
import club.ppmc.visualsync.engine.parser.TokenKind;
import club.ppmc.visualsync.exception.SourceFormattingException;
import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeBounds;
import club.ppmc.visualsync.model.tree.ConstructNode;
import club.ppmc.visualsync.model.value.OpaqueExpression;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class StructuralMutator {

    private static final String INDENT_UNIT = "  ";

    private final ConstructTreeParser parser;
    private final SourceFormatter formatter;

    public StructuralMutator(ConstructTreeParser parser, SourceFormatter formatter) {
        this.parser = parser;
        this.formatter = formatter;
    }

    // ---------------------------------------------------------------
    // 更新属性
    // ---------------------------------------------------------------

    public String updateAttribute(String text, NodeBounds bounds, String name, Object value) {
        return apply("updateAttribute", text, () -> setArgument(new SourceText(text), bounds, name, value));
    }

    private String setArgument(SourceText source, NodeBounds bounds, String name, Object value) {
        requireValid(source, bounds);
        String text = source.text();
        List<SourceToken> tokens = new SourceLexer(text).tokenize();
        ArgumentList args = ArgumentList.locate(tokens, bounds);

        var existing = args.find(name);
        if (existing.isPresent()) {
            var argument = existing.get();
            int from = args.token(argument.colonIndex()).end();
            int to = argument.hasValue() ? args.token(argument.valueTo() - 1).end() : from;
            if (argument.hasValue()
                    && isCurrentValue(text.substring(args.token(argument.valueFrom()).start(), to), value)) {
                return text;
            }
            return splice(text, from, to, " " + literalFor(args, argument, value));
        }
        return addArgument(source, bounds, args, name + ": " + ValueSerializer.serialize(value));
    }

    /** 新值与参数当前的源代码相同 (解析器对不透明表达式做过空白折叠)。 */
    private static boolean isCurrentValue(String current, Object value) {
        String code = value instanceof OpaqueExpression opaque ? opaque.text()
                : value instanceof String s ? s
                : null;
        return code != null && collapse(code).equals(collapse(current));
    }

    private static String collapse(String code) {
        return code.replaceAll("\\s+", " ").trim();
    }

    /** 原值是字符串字面量时，新的字符串值仍写成字面量；原值含插值时保留插值。 */
    private static String literalFor(ArgumentList args, ArgumentList.NamedArgument argument, Object value) {
        if (!isStringLiteral(args, argument) || !ValueSerializer.isText(value)) {
            return ValueSerializer.serialize(value);
        }
        String text = ValueSerializer.textOf(value);
        return isInterpolated(args, argument) ? ValueSerializer.quoteTemplate(text) : ValueSerializer.quote(text);
    }

    private static boolean isInterpolated(ArgumentList args, ArgumentList.NamedArgument argument) {
        for (int i = argument.valueFrom(); i < argument.valueTo(); i++) {
            if (args.token(i).isInterpolatedString()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStringLiteral(ArgumentList args, ArgumentList.NamedArgument argument) {
        if (!argument.hasValue()) {
            return false;
        }
        for (int i = argument.valueFrom(); i < argument.valueTo(); i++) {
            if (!args.token(i).is(TokenKind.STRING)) {
                return false;
            }
        }
        return true;
    }

    /** 在左括号之后插入新的命名参数。 */
    private String addArgument(SourceText source, NodeBounds bounds, ArgumentList args, String argument) {
        String text = source.text();
        int openLine = args.open().line();
        boolean multiLine = args.close().line() > openLine;

        if (multiLine && args.openEndsLine()) {
            String indent = source.indentation(openLine) + INDENT_UNIT;
            int at = source.nextLineStart(openLine);
            return splice(text, at, at, indent + argument + ",\n");
        }
        if (!multiLine && source.ownsLines(bounds)) {
            // 单行节点转换为多行形式
            String indent = source.indentation(openLine);
            String inner = text.substring(args.open().end(), args.close().start()).trim();
            var rebuilt = new StringBuilder();
            rebuilt.append(text, source.lineStart(openLine), args.open().end()).append('\n');
            rebuilt.append(indent).append(INDENT_UNIT).append(argument).append(',');
            if (!inner.isEmpty()) {
                rebuilt.append('\n').append(indent).append(INDENT_UNIT).append(inner);
                if (!inner.endsWith(",")) {
                    rebuilt.append(',');
                }
            }
            rebuilt.append('\n').append(indent).append(text, args.close().start(), source.lineEnd(openLine));
            return splice(text, source.lineStart(openLine), source.lineEnd(openLine), rebuilt.toString());
        }
        String insertion = args.isEmpty() ? argument : argument + ", ";
        return splice(text, args.open().end(), args.open().end(), insertion);
    }

    // ---------------------------------------------------------------
    // 插入
    // ---------------------------------------------------------------

    /** 以行号定位锚点节点 (优先从该行开始的节点，否则是包含该行的最内层节点)。 */
    public String insertNode(String text, int anchorLine, String newNodeText, InsertPosition position) {
        return parser.findNodeAtLine(text, anchorLine)
                .map(ConstructNode::toBounds)
                .map(bounds -> insertNode(text, bounds, newNodeText, position))
                .orElseGet(() -> {
                    log.debug("第 {} 行没有可作为锚点的节点, 插入被忽略", anchorLine);
                    return text;
                });
    }

    public String insertNode(String text, NodeBounds anchor, String newNodeText, InsertPosition position) {
        return apply("insertNode", text, () -> {
            var source = new SourceText(text);
            requireValid(source, anchor);
            if (newNodeText == null || newNodeText.isBlank()) {
                throw new IllegalArgumentException("新节点文本为空");
            }
            String snippet = newNodeText.strip();
            return switch (position) {
                case BEFORE -> insertSibling(source, anchor, snippet, true);
                case AFTER -> insertSibling(source, anchor, snippet, false);
                case AS_CHILD -> insertChild(source, anchor, snippet);
            };
        });
    }

    private String insertSibling(SourceText source, NodeBounds anchor, String snippet, boolean before) {
        String text = source.text();
        if (!source.ownsLines(anchor)) {
            return before
                    ? splice(text, anchor.startOffset(), anchor.startOffset(), snippet + ", ")
                    : splice(text, anchor.endOffset(), anchor.endOffset(), ", " + snippet);
        }
        int startLine = source.lineOf(anchor.startOffset());
        int endLine = source.lineOf(anchor.endOffset());
        String indent = source.indentation(startLine);
        String suffix = source.suffixOf(anchor).trim();
        boolean statement = suffix.startsWith(";");
        boolean anchorHasComma = suffix.startsWith(",");

        String block = SourceText.indentLines(snippet, indent);
        if (!statement && !block.endsWith(",")) {
            block = block + ",";
        }
        if (before) {
            int at = source.lineStart(startLine);
            return splice(text, at, at, block + "\n");
        }
        // 锚点是列表最后一个元素且没有尾随逗号时需要补上
        String withComma = statement || anchorHasComma
                ? text
                : splice(text, anchor.endOffset(), anchor.endOffset(), ",");
        var shifted = new SourceText(withComma);
        int at = shifted.lineEnd(endLine);
        return splice(withComma, at, at, "\n" + block);
    }

    private String insertChild(SourceText source, NodeBounds anchor, String snippet) {
        String text = source.text();
        List<SourceToken> tokens = new SourceLexer(text).tokenize();
        ArgumentList args = ArgumentList.locate(tokens, anchor);
        String singleSlot = ConstructCatalog.singleChildSlot(anchor.constructName());
        String multiSlot = ConstructCatalog.multiChildSlot(anchor.constructName());
        Set<String> slots = new HashSet<>(List.of(
                singleSlot,
                multiSlot,
                ConstructCatalog.DEFAULT_SINGLE_CHILD_SLOT,
                ConstructCatalog.DEFAULT_MULTI_CHILD_SLOT));

        var slot = args.findFirst(slots);
        if (slot.isEmpty()) {
            return addArgument(source, anchor, args, singleSlot + ": " + snippet);
        }
        var argument = slot.get();
        SourceToken first = argument.hasValue() ? args.token(argument.valueFrom()) : null;
        if (first == null || !first.is(TokenKind.LEFT_BRACKET)) {
            if (argument.label().equals(multiSlot)
                    || argument.label().equals(ConstructCatalog.DEFAULT_MULTI_CHILD_SLOT)) {
                throw new IllegalStateException("多子节点槽位 " + argument.label() + " 的值不是列表字面量");
            }
            int from = args.token(argument.colonIndex()).end();
            int to = argument.hasValue() ? args.token(argument.valueTo() - 1).end() : from;
            return splice(text, from, to, " " + snippet);
        }
        return appendToList(source, tokens, argument.valueFrom(), snippet);
    }

    private String appendToList(SourceText source, List<SourceToken> tokens, int openIndex, String snippet) {
        String text = source.text();
        int closeIndex = ArgumentList.matching(tokens, openIndex);
        if (closeIndex < 0) {
            throw new IllegalStateException("列表未闭合");
        }
        SourceToken open = tokens.get(openIndex);
        SourceToken close = tokens.get(closeIndex);
        SourceToken last = tokens.get(closeIndex - 1);
        if (closeIndex == openIndex + 1) {
            return splice(text, open.end(), open.end(), snippet);
        }
        boolean closeOnOwnLine = source.line(close.line()).trim().startsWith("]");
        if (close.line() > open.line() && closeOnOwnLine) {
            String indent = source.indentation(close.line()) + INDENT_UNIT;
            String block = SourceText.indentLines(snippet, indent) + ",\n";
            int at = source.lineStart(close.line());
            String withBlock = splice(text, at, at, block);
            return last.is(TokenKind.COMMA)
                    ? withBlock
                    : splice(withBlock, last.end(), last.end(), ",");
        }
        String insertion = last.is(TokenKind.COMMA) ? " " + snippet : ", " + snippet;
        return splice(text, last.end(), last.end(), insertion);
    }

    // ---------------------------------------------------------------
    // 删除
    // ---------------------------------------------------------------

    public String deleteNode(String text, NodeBounds bounds) {
        return apply("deleteNode", text, () -> {
            var source = new SourceText(text);
            requireValid(source, bounds);
            if (source.ownsLines(bounds)) {
                int startLine = source.lineOf(bounds.startOffset());
                int endLine = source.lineOf(bounds.endOffset());
                return splice(text, source.lineStart(startLine), source.nextLineStart(endLine), "");
            }
            return deleteInline(text, bounds);
        });
    }

    /** 删除字符范围 (连同其命名参数标签) 以及一个相邻的逗号。 */
    private String deleteInline(String text, NodeBounds bounds) {
        List<SourceToken> tokens = new SourceLexer(text).tokenize();
        int firstIndex = indexAtOffset(tokens, bounds.startOffset());
        int lastIndex = indexEndingAt(tokens, bounds.endOffset());
        if (firstIndex < 0 || lastIndex < 0) {
            throw new IllegalStateException("节点范围与词法单元不对齐");
        }
        if (firstIndex >= 2
                && tokens.get(firstIndex - 1).is(TokenKind.COLON)
                && tokens.get(firstIndex - 2).is(TokenKind.IDENTIFIER)) {
            firstIndex -= 2;
        }
        int from = tokens.get(firstIndex).start();
        int to = tokens.get(lastIndex).end();
        SourceToken next = tokens.get(lastIndex + 1);
        if (next.is(TokenKind.COMMA)) {
            to = next.end();
            while (to < text.length() && text.charAt(to) == ' ') {
                to++;
            }
        } else if (firstIndex > 0 && tokens.get(firstIndex - 1).is(TokenKind.COMMA)) {
            from = tokens.get(firstIndex - 1).start();
        }
        return splice(text, from, to, "");
    }

    // ---------------------------------------------------------------
    // 交换顺序
    // ---------------------------------------------------------------

    /** 交换两个节点的源代码块，与参数顺序无关；范围重叠 (包括嵌套) 时不做任何修改。 */
    public String reorderNodes(String text, NodeBounds a, NodeBounds b) {
        return apply("reorderNodes", text, () -> {
            var source = new SourceText(text);
            requireValid(source, a);
            requireValid(source, b);
            if (a.overlaps(b)) {
                throw new IllegalArgumentException("两个节点的范围重叠");
            }
            NodeBounds first = a.startOffset() < b.startOffset() ? a : b;
            NodeBounds second = first == a ? b : a;
            String firstBlock = text.substring(first.startOffset(), first.endOffset());
            String secondBlock = text.substring(second.startOffset(), second.endOffset());
            return text.substring(0, first.startOffset())
                    + secondBlock
                    + text.substring(first.endOffset(), second.startOffset())
                    + firstBlock
                    + text.substring(second.endOffset());
        });
    }

    // ---------------------------------------------------------------
    // 包裹
    // ---------------------------------------------------------------

    public String wrapNode(String text, NodeBounds bounds, String wrapperName, Map<String, ?> wrapperAttrs) {
        return apply("wrapNode", text, () -> {
            var source = new SourceText(text);
            requireValid(source, bounds);
            if (wrapperName == null || wrapperName.isBlank()) {
                throw new IllegalArgumentException("包装构造体名称为空");
            }
            String slot = ConstructCatalog.singleChildSlot(wrapperName);
            String original = text.substring(bounds.startOffset(), bounds.endOffset());
            Map<String, ?> attrs = wrapperAttrs == null ? Map.of() : wrapperAttrs;

            if (!original.contains("\n")) {
                var inline = new StringBuilder(wrapperName).append('(');
                attrs.forEach((name, value) ->
                        inline.append(name).append(": ").append(ValueSerializer.serialize(value)).append(", "));
                inline.append(slot).append(": ").append(original).append(')');
                return splice(text, bounds.startOffset(), bounds.endOffset(), inline.toString());
            }

            String indent = source.indentation(source.lineOf(bounds.startOffset()));
            String inner = indent + INDENT_UNIT;
            var wrapped = new StringBuilder(wrapperName).append("(\n");
            attrs.forEach((name, value) -> wrapped.append(inner)
                    .append(name).append(": ").append(ValueSerializer.serialize(value)).append(",\n"));
            String[] lines = original.split("\n", -1);
            wrapped.append(inner).append(slot).append(": ").append(lines[0]);
            for (int i = 1; i < lines.length; i++) {
                wrapped.append('\n').append(lines[i].isBlank() ? lines[i] : INDENT_UNIT + lines[i]);
            }
            wrapped.append(",\n").append(indent).append(')');
            return splice(text, bounds.startOffset(), bounds.endOffset(), wrapped.toString());
        });
    }

    // ---------------------------------------------------------------
    // 公共流程
    // ---------------------------------------------------------------

    private String apply(String operation, String text, Supplier<String> edit) {
        if (text == null) {
            return null;
        }
        String result;
        try {
            result = edit.get();
        } catch (RuntimeException e) {
            log.debug("{} 未能定位目标, 源代码保持不变: {}", operation, e.getMessage());
            return text;
        }
        if (result == null || result.equals(text)) {
            return text;
        }
        try {
            return formatter.format(result);
        } catch (SourceFormattingException e) {
            log.warn("{} 之后格式化失败, 返回未格式化的结果: {}", operation, e.getMessage());
            return result;
        }
    }

    private static void requireValid(SourceText source, NodeBounds bounds) {
        if (!source.isValid(bounds)) {
            throw new IllegalArgumentException("节点范围超出源文本: " + bounds);
        }
        String head = bounds.constructName();
        int dot = head.indexOf('.');
        if (dot > 0) {
            head = head.substring(0, dot);
        }
        String text = source.text();
        int at = bounds.startOffset();
        if (text.startsWith("const ", at)) {
            at = skipSpaces(text, at + "const".length());
        } else if (text.startsWith("new ", at)) {
            at = skipSpaces(text, at + "new".length());
        }
        if (!text.startsWith(head, at)) {
            throw new IllegalArgumentException("节点范围处不是 " + bounds.constructName());
        }
    }

    private static int skipSpaces(String text, int at) {
        while (at < text.length() && Character.isWhitespace(text.charAt(at))) {
            at++;
        }
        return at;
    }

    private static int indexAtOffset(List<SourceToken> tokens, int offset) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).start() == offset) {
                return i;
            }
        }
        return -1;
    }

    private static int indexEndingAt(List<SourceToken> tokens, int offset) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).end() == offset && !tokens.get(i).is(TokenKind.EOF)) {
                return i;
            }
        }
        return -1;
    }

    private static String splice(String text, int from, int to, String replacement) {
        return text.substring(0, from) + replacement + text.substring(to);
    }
}
