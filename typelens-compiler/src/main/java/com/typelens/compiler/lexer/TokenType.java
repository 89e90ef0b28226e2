package com.typelens.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    IMAGINARY_LITERAL,      // 1j
    STRING_LITERAL,
    BYTES_LITERAL,          // b"..."
    FSTRING_LITERAL,        // f"..."

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_DEF, KW_CLASS, KW_LAMBDA, KW_IMPORT, KW_FROM, KW_AS,
    KW_GLOBAL, KW_NONLOCAL, KW_DEL, KW_ASYNC, KW_AWAIT,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELIF, KW_ELSE, KW_FOR, KW_WHILE, KW_BREAK, KW_CONTINUE,
    KW_RETURN, KW_YIELD, KW_PASS, KW_RAISE, KW_TRY, KW_EXCEPT, KW_FINALLY,
    KW_WITH, KW_ASSERT,

    // === 关键词 - 运算 ===
    KW_AND, KW_OR, KW_NOT, KW_IN, KW_IS,
    KW_TRUE, KW_FALSE, KW_NONE,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    DOUBLE_STAR,    // **
    SLASH,          // /
    DOUBLE_SLASH,   // //
    PERCENT,        // %
    AT,             // @ (矩阵乘法 / 装饰器)

    // === 操作符 - 位运算 ===
    PIPE,           // |
    CARET,          // ^
    AMPERSAND,      // &
    TILDE,          // ~
    LSHIFT,         // <<
    RSHIFT,         // >>

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 赋值 ===
    ASSIGN,                 // =
    WALRUS,                 // :=
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    STAR_ASSIGN,            // *=
    SLASH_ASSIGN,           // /=
    DOUBLE_SLASH_ASSIGN,    // //=
    PERCENT_ASSIGN,         // %=
    DOUBLE_STAR_ASSIGN,     // **=
    AT_ASSIGN,              // @=
    PIPE_ASSIGN,            // |=
    CARET_ASSIGN,           // ^=
    AMPERSAND_ASSIGN,       // &=
    LSHIFT_ASSIGN,          // <<=
    RSHIFT_ASSIGN,          // >>=

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    COMMA,          // ,
    COLON,          // :
    SEMICOLON,      // ;
    DOT,            // .
    ELLIPSIS,       // ...
    ARROW,          // ->

    // === 布局 ===
    NEWLINE,
    INDENT,
    DEDENT,

    // === 特殊 ===
    ERROR,
    EOF;

    /**
     * 是否为增强赋值运算符
     */
    public boolean isAugmentedAssign() {
        switch (this) {
            case PLUS_ASSIGN: case MINUS_ASSIGN: case STAR_ASSIGN: case SLASH_ASSIGN:
            case DOUBLE_SLASH_ASSIGN: case PERCENT_ASSIGN: case DOUBLE_STAR_ASSIGN:
            case AT_ASSIGN: case PIPE_ASSIGN: case CARET_ASSIGN: case AMPERSAND_ASSIGN:
            case LSHIFT_ASSIGN: case RSHIFT_ASSIGN:
                return true;
            default:
                return false;
        }
    }
}
