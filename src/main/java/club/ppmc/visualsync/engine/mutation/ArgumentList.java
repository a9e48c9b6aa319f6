/**
 * ArgumentList.java
 *
 * 基于词法单元定位某个构造体的参数列表，以及其中深度为 1 的命名参数。
 * 嵌套构造体内部的同名参数会被忽略，字符串和注释中的文本也不会被误认为参数标签。
 */
package club.ppmc.visualsync.engine.mutation;

import club.ppmc.visualsync.engine.parser.SourceToken;
import club.ppmc.visualsync.engine.parser.TokenKind;
import club.ppmc.visualsync.model.NodeBounds;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

final class ArgumentList {

    /** 一个命名参数：标签、冒号以及值所在的词法单元下标区间 [valueFrom, valueTo)。 */
    record NamedArgument(String label, int labelIndex, int colonIndex, int valueFrom, int valueTo) {

        boolean hasValue() {
            return valueTo > valueFrom;
        }
    }

    private final List<SourceToken> tokens;
    private final int openIndex;
    private final int closeIndex;
    private final List<NamedArgument> named = new ArrayList<>();

    private ArgumentList(List<SourceToken> tokens, int openIndex, int closeIndex) {
        this.tokens = tokens;
        this.openIndex = openIndex;
        this.closeIndex = closeIndex;
        collectNamedArguments();
    }

    /**
     * 在给定范围内定位构造体的参数列表。
     *
     * @throws IllegalStateException 找不到参数列表或其右括号时。
     */
    static ArgumentList locate(List<SourceToken> tokens, NodeBounds bounds) {
        int open = -1;
        for (int i = 0; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.start() < bounds.startOffset()) {
                continue;
            }
            if (token.start() >= bounds.endOffset()) {
                break;
            }
            if (token.is(TokenKind.LEFT_PAREN)) {
                open = i;
                break;
            }
        }
        if (open < 0) {
            throw new IllegalStateException("未找到 " + bounds.constructName() + " 的参数列表");
        }
        int close = matching(tokens, open);
        if (close < 0 || tokens.get(close).end() > bounds.endOffset()) {
            throw new IllegalStateException(bounds.constructName() + " 的参数列表未闭合");
        }
        return new ArgumentList(tokens, open, close);
    }

    static int matching(List<SourceToken> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (isOpener(kind)) {
                depth++;
            } else if (isCloser(kind)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private void collectNamedArguments() {
        int depth = 0;
        for (int i = openIndex + 1; i < closeIndex; i++) {
            SourceToken token = tokens.get(i);
            if (isOpener(token.kind())) {
                depth++;
            } else if (isCloser(token.kind())) {
                depth--;
            } else if (depth == 0
                    && token.is(TokenKind.IDENTIFIER)
                    && tokens.get(i + 1).is(TokenKind.COLON)
                    && (i == openIndex + 1 || tokens.get(i - 1).is(TokenKind.COMMA))) {
                int valueFrom = i + 2;
                int valueTo = valueEnd(valueFrom);
                named.add(new NamedArgument(token.lexeme(), i, i + 1, valueFrom, valueTo));
                i = valueTo - 1;
            }
        }
    }

    /** 值的结束下标 (不含)：遇到深度为 0 的逗号或参数列表的右括号。 */
    private int valueEnd(int from) {
        int depth = 0;
        int i = from;
        for (; i < closeIndex; i++) {
            TokenKind kind = tokens.get(i).kind();
            if (isOpener(kind)) {
                depth++;
            } else if (isCloser(kind)) {
                depth--;
            } else if (depth == 0 && kind == TokenKind.COMMA) {
                break;
            }
        }
        return i;
    }

    Optional<NamedArgument> find(String label) {
        return named.stream().filter(arg -> arg.label().equals(label)).findFirst();
    }

    /** 第一个标签属于 labels 的命名参数 (按源代码顺序)。 */
    Optional<NamedArgument> findFirst(Collection<String> labels) {
        return named.stream().filter(arg -> labels.contains(arg.label())).findFirst();
    }

    SourceToken open() {
        return tokens.get(openIndex);
    }

    SourceToken close() {
        return tokens.get(closeIndex);
    }

    boolean isEmpty() {
        return closeIndex == openIndex + 1;
    }

    /** 左括号是否为其所在行的最后一个词法单元。 */
    boolean openEndsLine() {
        return tokens.get(openIndex + 1).line() > open().line();
    }

    SourceToken token(int index) {
        return tokens.get(index);
    }

    private static boolean isOpener(TokenKind kind) {
        return kind == TokenKind.LEFT_PAREN || kind == TokenKind.LEFT_BRACKET || kind == TokenKind.LEFT_BRACE;
    }

    private static boolean isCloser(TokenKind kind) {
        return kind == TokenKind.RIGHT_PAREN || kind == TokenKind.RIGHT_BRACKET || kind == TokenKind.RIGHT_BRACE;
    }
}
