package org.csu.binexp.common.exception;

/**
 * 非数字 Token 不属于支持的运算符集合 {+, -, *, /}。
 */
public class InvalidOperatorException extends ExpressionException {

    private final String symbol;

    public InvalidOperatorException(String symbol, int position) {
        super(String.format("Invalid operator at token %d: '%s' is neither a number nor one of + - * /",
                position, symbol));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
