package org.csu.binexp.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 前缀表达式中只会出现数字、四种运算符，以及（可选的）符号变量。
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    INTEGER_CONST,  // 非负整数常量, e.g., 123

    // ---- 标识符 (Identifier) ----
    IDENTIFIER,     // 符号变量, e.g., x，仅在允许符号时出现

    // ---- 运算符 (Operators) ----
    PLUS,           // +
    MINUS,          // -
    ASTERISK,       // *
    SLASH,          // /

    // ---- 特殊 Token ----
    EOF             // End-Of-File，表示输入流结束
}
