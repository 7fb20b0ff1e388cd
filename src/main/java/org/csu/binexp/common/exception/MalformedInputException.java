package org.csu.binexp.common.exception;

import org.csu.binexp.compiler.lexer.Token;

/**
 * Token 序列无法组成一棵完整的表达式树：操作数不足、末尾有多余 Token，或节点不完整。
 */
public class MalformedInputException extends ExpressionException {

    private final int position;

    public MalformedInputException(String message) {
        super(message);
        this.position = -1;
    }

    public MalformedInputException(Token token, String expected) {
        super(String.format("Malformed input at token %d: Expected %s, but found '%s' (%s)",
                token.position(),
                expected,
                token.lexeme(),
                token.type()));
        this.position = token.position();
    }

    /**
     * @return 出错 Token 的下标，无法定位时为 -1
     */
    public int getPosition() {
        return position;
    }
}
