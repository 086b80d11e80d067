package com.cadenza.compiler.lexer;

/**
 * Token 类型
 */
public enum TokenType {
    // ============ 字面量 ============
    NUMBER_LITERAL,
    STRING_LITERAL,
    STRING_INTERPOLATION,   // $"...{expr}..."，literal 为 List<InterpolationSegment>

    // ============ 标识符 ============
    IDENTIFIER,
    EFFECT,                 // Database、Network 等，literal 为 Effect

    // ============ 关键词 ============
    KW_FUNCTION,
    KW_PURE,
    KW_USES,
    KW_RETURN,
    KW_IF,
    KW_ELSE,
    KW_LET,
    KW_GUARD,
    KW_MATCH,
    KW_MODULE,
    KW_IMPORT,
    KW_EXPORT,
    KW_FROM,
    KW_RESULT,
    KW_OK,
    KW_ERROR,
    KW_OPTION,
    KW_SOME,
    KW_NONE,
    KW_TRUE,
    KW_FALSE,

    // ============ 运算符 ============
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    ASSIGN,         // =
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    AND,            // &&
    OR,             // ||
    NOT,            // !
    QUESTION,       // ?
    ARROW,          // ->

    // ============ 分隔符 ============
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;
    UNDERSCORE,     // _

    // ============ 特殊 ============
    SPEC_BLOCK,     // /*spec ... spec*/，literal 为块内文本
    EOF;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    public boolean isLiteral() {
        return this == NUMBER_LITERAL || this == STRING_LITERAL || this == STRING_INTERPOLATION
                || this == KW_TRUE || this == KW_FALSE;
    }
}
