/**
 * TokenKind.java
 *
 * SourceLexer 产生的词法单元类型。
 */
package club.ppmc.visualsync.engine.parser;

public enum TokenKind {
    IDENTIFIER,
    STRING,
    NUMBER,
    TRUE,
    FALSE,
    NULL,
    CONST,
    NEW,
    /** class / mixin / extension / enum 声明关键字。 */
    TYPE_DECLARATION,

    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    COLON,
    SEMICOLON,
    /** "."、"?." 或级联 ".."。 */
    DOT,
    /** "..." 或 "...?"。 */
    SPREAD,
    QUESTION,
    ARROW,
    EQUAL,
    LESS,
    GREATER,
    AT,
    /** 其余所有运算符，词素保存在 lexeme 中。 */
    OPERATOR,

    EOF
}
