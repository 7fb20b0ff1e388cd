package org.csu.binexp.compiler.parser.ast.expression;

import org.csu.binexp.common.exception.MalformedInputException;
import org.csu.binexp.compiler.lexer.Lexer;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;

import java.math.BigInteger;

/**
 * AST 节点: 表示一个非负整数字面量。
 * 保留原始文本，折叠时再解析为 BigInteger，因此任意长度的数字都不会溢出。
 */
public record LiteralNode(String value) implements ExpressionNode {

    public static final LiteralNode ZERO = new LiteralNode("0");

    public LiteralNode {
        if (!Lexer.isNumber(value)) {
            throw new MalformedInputException("Literal value must be a non-negative integer, but was '" + value + "'");
        }
    }

    public static LiteralNode of(BigInteger number) {
        return new LiteralNode(number.toString());
    }

    public BigInteger numericValue() {
        return new BigInteger(value);
    }

    // "0" 与 "00" 都算作零
    public boolean hasValue(long number) {
        return numericValue().equals(BigInteger.valueOf(number));
    }

    @Override
    public String toString() {
        return "LiteralNode[" + value + "]";
    }
}
