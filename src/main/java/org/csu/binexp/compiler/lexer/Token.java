package org.csu.binexp.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param position 在输入 Token 序列中的下标 (从0开始)
 */
public record Token(TokenType type, String lexeme, int position) {

    @Override
    public String toString() {
        return String.format("Token[Type=%-13s, Lexeme='%s', Position=%d]", type, lexeme, position);
    }
}
