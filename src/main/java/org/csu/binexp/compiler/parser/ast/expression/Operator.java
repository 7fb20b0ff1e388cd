package org.csu.binexp.compiler.parser.ast.expression;

import org.csu.binexp.common.exception.InvalidOperatorException;
import org.csu.binexp.compiler.lexer.Token;
import org.csu.binexp.compiler.lexer.TokenType;

/**
 * 支持的二元运算符，闭集。
 */
public enum Operator {
    PLUS("+", TokenType.PLUS),
    MINUS("-", TokenType.MINUS),
    MULTIPLY("*", TokenType.ASTERISK),
    DIVIDE("/", TokenType.SLASH);

    private final String symbol;
    private final TokenType tokenType;

    Operator(String symbol, TokenType tokenType) {
        this.symbol = symbol;
        this.tokenType = tokenType;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Operator fromToken(Token token) {
        for (Operator operator : values()) {
            if (operator.tokenType == token.type()) {
                return operator;
            }
        }
        throw new InvalidOperatorException(token.lexeme(), token.position());
    }

    @Override
    public String toString() {
        return symbol;
    }
}
