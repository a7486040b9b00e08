package com.triflang.compiler.lexer;

/**
 * Trif 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,
    STRING,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_LET, KW_CONST, KW_FN, KW_FUNCTION,

    // === 关键词 - 模块 ===
    KW_IMPORT, KW_EXPORT, KW_FROM, KW_AS, KW_DEFAULT,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_WHILE, KW_FOR, KW_IN, KW_RETURN, KW_SPAWN,

    // === 关键词 - 字面量 ===
    KW_TRUE, KW_FALSE, KW_NULL,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 赋值 ===
    ASSIGN,         // =

    // === 分隔符 ===
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

    // === 特殊 ===
    NEWLINE,
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为函数声明关键词（fn / function）
     */
    public boolean isFunctionKeyword() {
        return this == KW_FN || this == KW_FUNCTION;
    }

    /**
     * 是否为变量声明关键词（let / const）
     */
    public boolean isBindingKeyword() {
        return this == KW_LET || this == KW_CONST;
    }
}
