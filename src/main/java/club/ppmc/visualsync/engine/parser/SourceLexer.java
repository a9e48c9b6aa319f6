/**
 * SourceLexer.java
 *
 * 面向类 Dart 源代码的宽容型词法分析器。
 * 只区分结构识别所需的词法单元：标识符、字面量、括号、分隔符以及少量运算符，
 * 其余运算符统一归入 OPERATOR。注释和空白被丢弃，但每个词法单元都保留精确的字符偏移，
 * 以便后续对源代码进行定点文本编辑。
 */
package club.ppmc.visualsync.engine.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SourceLexer {

    private static final Map<String, TokenKind> KEYWORDS =
            Map.of(
                    "true", TokenKind.TRUE,
                    "false", TokenKind.FALSE,
                    "null", TokenKind.NULL,
                    "const", TokenKind.CONST,
                    "new", TokenKind.NEW,
                    "class", TokenKind.TYPE_DECLARATION,
                    "mixin", TokenKind.TYPE_DECLARATION,
                    "extension", TokenKind.TYPE_DECLARATION,
                    "enum", TokenKind.TYPE_DECLARATION);

    private final String source;
    private final List<SourceToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int tokenLine = 1;

    public SourceLexer(String source) {
        this.source = source;
    }

    public List<SourceToken> tokenize() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            scanToken();
        }
        tokens.add(new SourceToken(TokenKind.EOF, "", null, line, source.length(), source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenKind.LEFT_PAREN);
            case ')' -> addToken(TokenKind.RIGHT_PAREN);
            case '[' -> addToken(TokenKind.LEFT_BRACKET);
            case ']' -> addToken(TokenKind.RIGHT_BRACKET);
            case '{' -> addToken(TokenKind.LEFT_BRACE);
            case '}' -> addToken(TokenKind.RIGHT_BRACE);
            case ',' -> addToken(TokenKind.COMMA);
            case ':' -> addToken(TokenKind.COLON);
            case ';' -> addToken(TokenKind.SEMICOLON);
            case '@' -> addToken(TokenKind.AT);
            case '.' -> dot();
            case '?' -> question();
            case '=' -> {
                if (match('>')) {
                    addToken(TokenKind.ARROW);
                } else if (match('=')) {
                    addToken(TokenKind.OPERATOR);
                } else {
                    addToken(TokenKind.EQUAL);
                }
            }
            // 泛型嵌套 List<List<int>> 要求 '<' 与 '>' 逐个成词
            case '<' -> addToken(match('=') ? TokenKind.OPERATOR : TokenKind.LESS);
            case '>' -> addToken(match('=') ? TokenKind.OPERATOR : TokenKind.GREATER);
            case '/' -> slash();
            case '\'', '"' -> string(c, false);
            case ' ', '\r', '\t', '\f' -> {
                // 空白
            }
            case '\n' -> line++;
            default -> {
                if (c == 'r' && (peek() == '\'' || peek() == '"')) {
                    string(advance(), true);
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    operator(c);
                }
            }
        }
    }

    private void dot() {
        if (peek() == '.' && peekNext() == '.') {
            advance();
            advance();
            match('?');
            addToken(TokenKind.SPREAD);
        } else if (match('.')) {
            addToken(TokenKind.DOT);
        } else if (isDigit(peek())) {
            number();
        } else {
            addToken(TokenKind.DOT);
        }
    }

    private void question() {
        if (match('.')) {
            addToken(TokenKind.DOT);
        } else if (match('?')) {
            match('=');
            addToken(TokenKind.OPERATOR);
        } else {
            addToken(TokenKind.QUESTION);
        }
    }

    private void slash() {
        if (match('/')) {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
        } else if (match('*')) {
            blockComment();
        } else {
            match('=');
            addToken(TokenKind.OPERATOR);
        }
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw error("块注释未闭合");
            }
            char c = advance();
            if (c == '\n') {
                line++;
            } else if (c == '/' && match('*')) {
                depth++;
            } else if (c == '*' && match('/')) {
                depth--;
            }
        }
    }

    private void operator(char first) {
        // 复合运算符只需整体成词，具体含义与结构识别无关
        switch (first) {
            case '+', '-', '&', '|', '*' -> {
                if (!match(first)) {
                    match('=');
                }
            }
            case '~' -> {
                match('/');
                match('=');
            }
            case '!' -> {
                if (match('=')) {
                    match('=');
                }
            }
            default -> match('=');
        }
        addToken(TokenKind.OPERATOR);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenKind.IDENTIFIER));
    }

    private void number() {
        String text;
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (Character.digit(peek(), 16) >= 0) {
                advance();
            }
            text = source.substring(start + 2, current);
            addToken(TokenKind.NUMBER, parseLong(text, 16));
            return;
        }
        boolean decimal = source.charAt(start) == '.';
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            decimal = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || peekNext() == '-' || peekNext() == '+')) {
            decimal = true;
            advance();
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        text = source.substring(start, current);
        if (decimal) {
            addToken(TokenKind.NUMBER, Double.parseDouble(text));
        } else {
            Long value = parseLong(text, 10);
            addToken(TokenKind.NUMBER, value != null ? value : Double.parseDouble(text));
        }
    }

    private static Long parseLong(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 扫描字符串字面量，调用时开引号已被消费。
     * 支持三引号、原始字符串以及 ${...} 插值 (插值内部可以再嵌套字符串)。
     */
    private void string(char quote, boolean raw) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        }
        var value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("字符串未闭合");
            }
            char c = advance();
            if (c == quote && (!triple || (peek() == quote && peekNext() == quote))) {
                if (triple) {
                    advance();
                    advance();
                }
                break;
            }
            if (c == '\n') {
                if (!triple) {
                    throw error("字符串未闭合");
                }
                line++;
                value.append(c);
            } else if (c == '\\' && !raw) {
                if (isAtEnd()) {
                    throw error("字符串未闭合");
                }
                value.append(unescape(advance()));
            } else if (c == '$' && !raw && peek() == '{') {
                int interpolationStart = current - 1;
                skipInterpolation();
                value.append(source, interpolationStart, current);
            } else {
                value.append(c);
            }
        }
        addToken(TokenKind.STRING, value.toString());
    }

    private void skipInterpolation() {
        advance(); // '{'
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw error("字符串插值未闭合");
            }
            char c = advance();
            switch (c) {
                case '{' -> depth++;
                case '}' -> depth--;
                case '\n' -> line++;
                case '\'', '"' -> skipNestedString(c);
                default -> {
                    // 插值中的普通字符
                }
            }
        }
    }

    private void skipNestedString(char quote) {
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw error("字符串未闭合");
            }
            char c = advance();
            if (c == '\\') {
                advance();
            } else if (c == quote) {
                return;
            }
        }
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case 'b' -> '\b';
            case 'f' -> '\f';
            default -> c;
        };
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenKind kind) {
        addToken(kind, null);
    }

    private void addToken(TokenKind kind, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new SourceToken(kind, text, literal, tokenLine, start, current));
    }

    private SourceParseException error(String message) {
        return new SourceParseException(line, message);
    }
}
