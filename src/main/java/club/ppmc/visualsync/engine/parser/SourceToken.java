/**
 * SourceToken.java
 *
 * 一个词法单元。start/end 为其在全文中的字符偏移 (左闭右开)，line 为起始行号 (从 1 开始)。
 * literal 对字符串为解转义后的内容，对数字为 Long 或 Double，其余为 null。
 */
package club.ppmc.visualsync.engine.parser;

public record SourceToken(
        TokenKind kind, String lexeme, Object literal, int line, int start, int end) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String text) {
        return kind == TokenKind.OPERATOR && lexeme.equals(text);
    }

    /** 非原始字符串中是否含有未转义的 $name 或 ${...} 插值。 */
    public boolean isInterpolatedString() {
        if (kind != TokenKind.STRING || lexeme.startsWith("r") || lexeme.startsWith("R")) {
            return false;
        }
        for (int i = 0; i < lexeme.length() - 1; i++) {
            char c = lexeme.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '$') {
                char next = lexeme.charAt(i + 1);
                if (next == '{' || next == '_' || Character.isLetter(next)) {
                    return true;
                }
            }
        }
        return false;
    }
}
