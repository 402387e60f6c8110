package org.csu.kpiformula.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 公式语言本身只允许数字、变量、四则运算和括号。
 * 其余类型用于识别被禁止的构造，以便语法分析器给出明确的 "Unsafe construct" 诊断。
 */
public enum TokenType {
    // ---- 常量与标识符 ----
    NUMBER,         // 整数或小数, e.g., 100, 0.25
    IDENTIFIER,     // 变量名, e.g., spent, leads

    // ---- 允许的运算符 ----
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /

    // ---- 分隔符 ----
    LPAREN,         // (
    RPAREN,         // )

    // ====== 被禁止的运算符 ======
    DOUBLE_STAR,    // **
    DOUBLE_SLASH,   // //
    PERCENT,        // %
    AT,             // @
    EQUAL_EQUAL,    // ==
    NOT_EQUAL,      // !=
    LESS,           // <
    GREATER,        // >
    LESS_EQUAL,     // <=
    GREATER_EQUAL,  // >=
    AMPERSAND,      // &
    PIPE,           // |
    CARET,          // ^
    TILDE,          // ~
    SHIFT_LEFT,     // <<
    SHIFT_RIGHT,    // >>
    ASSIGN,         // = 或 :=

    // ====== 被禁止的分隔符 ======
    DOT,            // .
    COMMA,          // ,
    COLON,          // :
    LBRACKET,       // [
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }
    STRING_CONST,   // 'text' 或 "text"

    // ====== 保留字 (大小写敏感) ======
    AND,            // "and"
    OR,             // "or"
    NOT,            // "not"
    IS,             // "is"
    IN,             // "in"
    IF,             // "if"
    ELSE,           // "else"
    FOR,            // "for"
    LAMBDA,         // "lambda"
    TRUE,           // "True"
    FALSE,          // "False"
    NONE,           // "None"

    // ---- 特殊 Token ----
    EOF,            // 输入结束
    ILLEGAL         // 非法字符，用于错误处理
}
