/**
 * ConstructScanner.java
 *
 * 解析器的第一遍：对词法单元做一次递归下降遍历，收集扁平的构造体记录列表。
 *
 * 识别规则 (结构性启发式，而非语义分析)：
 * - 首字母大写 (忽略前导下划线) 的标识符后紧跟参数列表即视为构造体，
 *   例如 Foo(...)、const Foo(...)、Foo<T>(...)、EdgeInsets.all(...)。
 * - 进入构造体参数列表时嵌套计数加一，离开时减一。
 * - 命名参数标签通过一个栈来跟踪；位置参数压入 null，列表元素与函数体继承外层标签。
 * - 类型声明体内未跟在 '=' 或 '=>' 之后的 "Name(" 是构造函数/方法声明，不是调用，直接跳过其参数表。
 *
 * 扫描器是宽容的：遇到多余的闭合符号会跳过，直到文件末尾仍未闭合的构造体会在最后一个词法单元处闭合，
 * 并记录一条问题描述，由 ConstructTreeParser 汇总为诊断信息。
 */
package club.ppmc.visualsync.engine.parser;

import club.ppmc.visualsync.model.value.AttributeValue;
import club.ppmc.visualsync.model.value.BoolValue;
import club.ppmc.visualsync.model.value.ListValue;
import club.ppmc.visualsync.model.value.NumberValue;
import club.ppmc.visualsync.model.value.OpaqueExpression;
import club.ppmc.visualsync.model.value.StringValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

public class ConstructScanner {

    private static final Set<TokenKind> OPENERS =
            Set.of(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET, TokenKind.LEFT_BRACE);
    private static final Set<TokenKind> CLOSERS =
            Set.of(TokenKind.RIGHT_PAREN, TokenKind.RIGHT_BRACKET, TokenKind.RIGHT_BRACE);
    private static final Set<TokenKind> EXPRESSION_BOUNDARIES =
            Set.of(
                    TokenKind.COMMA,
                    TokenKind.RIGHT_PAREN,
                    TokenKind.RIGHT_BRACKET,
                    TokenKind.RIGHT_BRACE,
                    TokenKind.SEMICOLON,
                    TokenKind.COLON,
                    TokenKind.EOF);

    private final String source;
    private final List<SourceToken> tokens;
    private final List<ConstructRecord> records = new ArrayList<>();
    private final List<String> problems = new ArrayList<>();

    /** 当前命名参数标签栈，位置参数对应 null。 */
    private final List<String> slotStack = new ArrayList<>();

    private int current = 0;
    private int nesting = 0;

    public ConstructScanner(String source, List<SourceToken> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public List<ConstructRecord> scan() {
        scanRegion(TokenKind.EOF);
        return records;
    }

    /** 扫描过程中发现的可恢复问题。 */
    public List<String> getProblems() {
        return problems;
    }

    // ---------------------------------------------------------------
    // 语句级区域：顶层、代码块、映射字面量
    // ---------------------------------------------------------------

    private void scanRegion(TokenKind closer) {
        while (!isAtEnd() && !check(closer)) {
            scanOne();
        }
    }

    private void scanOne() {
        switch (peek().kind()) {
            case IDENTIFIER -> reference();
            case CONST, NEW -> {
                if (checkNext(TokenKind.IDENTIFIER)) {
                    reference();
                } else {
                    advance();
                }
            }
            case TYPE_DECLARATION -> typeDeclaration();
            case AT -> annotation();
            case LEFT_PAREN -> nestedRegion(TokenKind.RIGHT_PAREN);
            case LEFT_BRACKET -> nestedRegion(TokenKind.RIGHT_BRACKET);
            case LEFT_BRACE -> nestedRegion(TokenKind.RIGHT_BRACE);
            default -> advance();
        }
    }

    private void nestedRegion(TokenKind closer) {
        advance();
        scanRegion(closer);
        match(closer);
    }

    private void typeDeclaration() {
        advance();
        while (!isAtEnd() && !check(TokenKind.LEFT_BRACE) && !check(TokenKind.SEMICOLON)) {
            if (check(TokenKind.LEFT_PAREN)) {
                skipBalanced();
            } else {
                advance();
            }
        }
        if (match(TokenKind.LEFT_BRACE)) {
            typeBody();
            match(TokenKind.RIGHT_BRACE);
        } else {
            match(TokenKind.SEMICOLON);
        }
    }

    private void typeBody() {
        while (!isAtEnd() && !check(TokenKind.RIGHT_BRACE)) {
            switch (peek().kind()) {
                case AT -> annotation();
                case EQUAL, ARROW -> {
                    advance();
                    memberRest(false);
                }
                case COLON -> {
                    // 初始化列表，以方法体或分号结束
                    advance();
                    memberRest(true);
                }
                case LEFT_PAREN -> skipBalanced();
                case LEFT_BRACE -> nestedRegion(TokenKind.RIGHT_BRACE);
                default -> advance();
            }
        }
    }

    private void memberRest(boolean stopAtBody) {
        while (!isAtEnd()
                && !check(TokenKind.SEMICOLON)
                && !check(TokenKind.RIGHT_BRACE)
                && !(stopAtBody && check(TokenKind.LEFT_BRACE))) {
            scanOne();
        }
        match(TokenKind.SEMICOLON);
    }

    private void annotation() {
        advance();
        if (match(TokenKind.IDENTIFIER)) {
            while (check(TokenKind.DOT) && checkNext(TokenKind.IDENTIFIER)) {
                advance();
                advance();
            }
        }
        if (check(TokenKind.LEFT_PAREN)) {
            skipBalanced();
        }
    }

    // ---------------------------------------------------------------
    // 表达式
    // ---------------------------------------------------------------

    private AttributeValue expression() {
        int first = current;
        AttributeValue value = unary();
        if (current == first) {
            return value;
        }
        boolean composite = false;
        boolean conditional = false;
        int pendingColons = 0;
        while (!isAtEnd()) {
            if (check(TokenKind.COLON) && pendingColons > 0) {
                pendingColons--;
                advance();
                continue;
            }
            if (atBoundary()) {
                break;
            }
            composite = true;
            if (match(TokenKind.QUESTION)) {
                conditional = true;
                pendingColons++;
                continue;
            }
            int before = current;
            unary();
            if (current == before) {
                advance();
            }
        }
        if (!composite) {
            return value;
        }
        return conditional ? OpaqueExpression.CONDITIONAL : opaque(first);
    }

    private AttributeValue unary() {
        int first = current;
        if (check(TokenKind.OPERATOR)) {
            SourceToken operator = advance();
            AttributeValue operand = unary();
            if (operator.lexeme().equals("-") && operand instanceof NumberValue number) {
                return number.negate();
            }
            return opaque(first);
        }
        if (match(TokenKind.SPREAD)) {
            unary();
            return opaque(first);
        }
        return primary();
    }

    private AttributeValue primary() {
        int first = current;
        SourceToken token = peek();
        switch (token.kind()) {
            case STRING -> {
                // 相邻字符串字面量自动拼接
                var text = new StringBuilder();
                boolean interpolated = false;
                while (check(TokenKind.STRING)) {
                    SourceToken literal = advance();
                    interpolated |= literal.isInterpolatedString();
                    text.append(literal.literal());
                }
                // 插值字符串保留源代码原文，写回时不会被当成普通文本转义
                AttributeValue value = interpolated ? opaque(first) : new StringValue(text.toString());
                return postfix(first, value);
            }
            case NUMBER -> {
                advance();
                AttributeValue number =
                        token.literal() instanceof Number n
                                ? new NumberValue(n)
                                : new OpaqueExpression(token.lexeme());
                return postfix(first, number);
            }
            case TRUE, FALSE -> {
                advance();
                return postfix(first, new BoolValue(token.kind() == TokenKind.TRUE));
            }
            case NULL -> {
                advance();
                return postfix(first, new OpaqueExpression("null"));
            }
            case IDENTIFIER -> {
                return reference();
            }
            case CONST, NEW -> {
                if (checkNext(TokenKind.IDENTIFIER)) {
                    return reference();
                }
                advance();
                return primary();
            }
            case LEFT_BRACKET -> {
                return postfix(first, listLiteral());
            }
            case LEFT_BRACE -> {
                nestedRegion(TokenKind.RIGHT_BRACE);
                return postfix(first, opaque(first));
            }
            case LEFT_PAREN -> {
                return parenthesized(first);
            }
            case LESS -> {
                // <Widget>[...] 之类带类型实参的字面量
                if (skipTypeArguments()) {
                    return primary();
                }
                advance();
                return opaque(first);
            }
            default -> {
                if (atBoundary()) {
                    return new OpaqueExpression("");
                }
                advance();
                return opaque(first);
            }
        }
    }

    /**
     * 标识符开头的引用：限定名、普通调用、构造体创建或单参数箭头函数。
     */
    private AttributeValue reference() {
        int first = current;
        boolean keyword = match(TokenKind.CONST) || match(TokenKind.NEW);
        SourceToken head = advance();
        if (!keyword && check(TokenKind.ARROW)) {
            lambdaBody();
            return OpaqueExpression.FUNCTION;
        }
        var name = new StringBuilder(head.lexeme());
        skipTypeArguments();
        while (check(TokenKind.DOT) && checkNext(TokenKind.IDENTIFIER)) {
            name.append(advance().lexeme()).append(advance().lexeme());
            skipTypeArguments();
        }

        AttributeValue value;
        if (check(TokenKind.LEFT_PAREN)) {
            value =
                    isConstructName(head.lexeme())
                            ? construct(first, name.toString())
                            : plainCall(name.toString());
        } else {
            value = new OpaqueExpression(name.toString());
        }
        return postfix(first, value);
    }

    private AttributeValue construct(int first, String name) {
        SourceToken startToken = tokens.get(first);
        int level = nesting;
        String slot = currentSlot();
        var attributes = new LinkedHashMap<String, AttributeValue>();
        var positional = new ArrayList<AttributeValue>();
        var displays = new ArrayList<String>();

        advance(); // '('
        nesting++;
        boolean closed = arguments(attributes, positional, displays);
        nesting--;

        SourceToken endToken = previous();
        if (!closed) {
            problems.add(String.format("构造体 %s (第 %d 行) 缺少右括号", name, startToken.line()));
        }
        records.add(
                new ConstructRecord(
                        name,
                        startToken.line(),
                        Math.max(startToken.line(), endToken.line()),
                        startToken.start(),
                        Math.max(startToken.end(), endToken.end()),
                        attributes,
                        positional,
                        level,
                        slot));

        // 具名构造 (如 EdgeInsets.all) 保留完整调用文本，普通构造体只保留占位符
        if (name.contains(".")) {
            return new OpaqueExpression(callText(name, displays));
        }
        return OpaqueExpression.construct(name);
    }

    private AttributeValue plainCall(String name) {
        int line = peek().line();
        advance(); // '('
        var displays = new ArrayList<String>();
        if (!arguments(new LinkedHashMap<>(), new ArrayList<>(), displays)) {
            problems.add(String.format("调用 %s (第 %d 行) 缺少右括号", name, line));
        }
        return new OpaqueExpression(callText(name, displays));
    }

    /**
     * 解析参数列表直到 ')'，调用时 '(' 已被消费。
     *
     * @return 是否遇到了匹配的右括号。
     */
    private boolean arguments(
            Map<String, AttributeValue> attributes,
            List<AttributeValue> positional,
            List<String> displays) {
        while (!isAtEnd() && !check(TokenKind.RIGHT_PAREN)) {
            if (match(TokenKind.COMMA)) {
                continue;
            }
            if (check(TokenKind.IDENTIFIER) && checkNext(TokenKind.COLON)) {
                String label = advance().lexeme();
                advance();
                AttributeValue value = withSlot(label, this::expression);
                attributes.put(label, value);
                displays.add(label + ": " + value.toDisplayString());
                continue;
            }
            int before = current;
            AttributeValue value = withSlot(null, this::expression);
            if (current == before) {
                // 多余的 ']'、'}'、';' 等
                advance();
                continue;
            }
            positional.add(value);
            displays.add(value.toDisplayString());
        }
        return match(TokenKind.RIGHT_PAREN);
    }

    private ListValue listLiteral() {
        int line = peek().line();
        advance(); // '['
        var elements = new ArrayList<AttributeValue>();
        while (!isAtEnd() && !check(TokenKind.RIGHT_BRACKET)) {
            if (match(TokenKind.COMMA)) {
                continue;
            }
            int before = current;
            AttributeValue element = expression();
            if (current == before) {
                if (match(TokenKind.COLON)) {
                    continue;
                }
                problems.add(String.format("第 %d 行的列表缺少右方括号", line));
                return new ListValue(elements);
            }
            elements.add(element);
        }
        if (!match(TokenKind.RIGHT_BRACKET)) {
            problems.add(String.format("第 %d 行的列表缺少右方括号", line));
        }
        return new ListValue(elements);
    }

    private AttributeValue parenthesized(int first) {
        int close = matchingIndex(current);
        if (close > 0 && isLambdaAfterParameters(close + 1)) {
            current = close + 1;
            if (check(TokenKind.IDENTIFIER)) {
                advance(); // async / sync
                if (peek().isOperator("*")) {
                    advance();
                }
            }
            lambdaBody();
            return OpaqueExpression.FUNCTION;
        }
        advance(); // '('
        while (!isAtEnd() && !check(TokenKind.RIGHT_PAREN)) {
            if (match(TokenKind.COMMA)) {
                continue;
            }
            int before = current;
            expression();
            if (current == before) {
                advance();
            }
        }
        match(TokenKind.RIGHT_PAREN);
        return postfix(first, opaque(first));
    }

    private boolean isLambdaAfterParameters(int index) {
        SourceToken after = tokens.get(index);
        if (after.is(TokenKind.ARROW) || after.is(TokenKind.LEFT_BRACE)) {
            return true;
        }
        return after.is(TokenKind.IDENTIFIER)
                && (after.lexeme().equals("async") || after.lexeme().equals("sync"));
    }

    /** 函数体继承外层的命名参数标签。 */
    private void lambdaBody() {
        if (match(TokenKind.ARROW)) {
            expression();
        } else if (check(TokenKind.LEFT_BRACE)) {
            nestedRegion(TokenKind.RIGHT_BRACE);
        }
    }

    /** 后缀链：成员访问、方法调用、下标、非空断言。出现任何后缀时整体退化为不透明表达式。 */
    private AttributeValue postfix(int first, AttributeValue value) {
        boolean extended = false;
        while (true) {
            if (check(TokenKind.DOT) && checkNext(TokenKind.IDENTIFIER)) {
                advance();
                advance();
                skipTypeArguments();
                if (match(TokenKind.LEFT_PAREN)) {
                    arguments(new LinkedHashMap<>(), new ArrayList<>(), new ArrayList<>());
                }
            } else if (check(TokenKind.LEFT_BRACKET)) {
                advance();
                while (!isAtEnd() && !check(TokenKind.RIGHT_BRACKET)) {
                    int before = current;
                    expression();
                    if (current == before && !match(TokenKind.COMMA)) {
                        break;
                    }
                }
                match(TokenKind.RIGHT_BRACKET);
            } else if (check(TokenKind.LEFT_PAREN) && extended) {
                advance();
                arguments(new LinkedHashMap<>(), new ArrayList<>(), new ArrayList<>());
            } else if (peek().isOperator("!")) {
                advance();
            } else {
                break;
            }
            extended = true;
        }
        return extended ? opaque(first) : value;
    }

    // ---------------------------------------------------------------
    // 辅助方法
    // ---------------------------------------------------------------

    private AttributeValue withSlot(String label, Supplier<AttributeValue> body) {
        slotStack.add(label);
        try {
            return body.get();
        } finally {
            slotStack.remove(slotStack.size() - 1);
        }
    }

    private String currentSlot() {
        return slotStack.isEmpty() ? null : slotStack.get(slotStack.size() - 1);
    }

    private static boolean isConstructName(String identifier) {
        int i = 0;
        while (i < identifier.length() && identifier.charAt(i) == '_') {
            i++;
        }
        return i < identifier.length() && Character.isUpperCase(identifier.charAt(i));
    }

    private static String callText(String name, List<String> displays) {
        return name + "(" + String.join(", ", displays) + ")";
    }

    /**
     * 仅当 '<...>' 内全是类型相关的词法单元且其后紧跟调用或字面量时才视为类型实参。
     */
    private boolean skipTypeArguments() {
        if (!check(TokenKind.LESS)) {
            return false;
        }
        int depth = 0;
        int i = current;
        for (; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (kind == TokenKind.LESS) {
                depth++;
            } else if (kind == TokenKind.GREATER) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (kind != TokenKind.IDENTIFIER
                    && kind != TokenKind.COMMA
                    && kind != TokenKind.DOT
                    && kind != TokenKind.QUESTION) {
                return false;
            }
        }
        if (depth != 0 || i + 1 >= tokens.size()) {
            return false;
        }
        TokenKind after = tokens.get(i + 1).kind();
        if (after == TokenKind.LEFT_PAREN
                || after == TokenKind.LEFT_BRACKET
                || after == TokenKind.LEFT_BRACE
                || after == TokenKind.DOT) {
            current = i + 1;
            return true;
        }
        return false;
    }

    private void skipBalanced() {
        int close = matchingIndex(current);
        current = close > 0 ? close + 1 : tokens.size() - 1;
    }

    /** 返回与 index 处开括号匹配的闭括号下标，找不到时返回 -1。 */
    private int matchingIndex(int index) {
        int depth = 0;
        for (int i = index; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).kind();
            if (OPENERS.contains(kind)) {
                depth++;
            } else if (CLOSERS.contains(kind)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private OpaqueExpression opaque(int first) {
        if (current <= first) {
            return new OpaqueExpression("");
        }
        String text = source.substring(tokens.get(first).start(), previous().end());
        return new OpaqueExpression(text.replaceAll("\\s+", " ").trim());
    }

    private boolean atBoundary() {
        return EXPRESSION_BOUNDARIES.contains(peek().kind());
    }

    private boolean isAtEnd() {
        return peek().is(TokenKind.EOF);
    }

    private SourceToken peek() {
        return tokens.get(current);
    }

    private SourceToken previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private SourceToken advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean checkNext(TokenKind kind) {
        return current + 1 < tokens.size() && tokens.get(current + 1).is(kind);
    }

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }
}
