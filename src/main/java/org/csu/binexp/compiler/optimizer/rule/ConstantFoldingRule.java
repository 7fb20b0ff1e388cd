package org.csu.binexp.compiler.optimizer.rule;

import org.csu.binexp.common.exception.FoldingException;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;

import java.math.BigInteger;

/**
 * 常量折叠：两侧都是数字字面量时直接计算结果，例如 + 1 1 => 2。
 * <p>
 * 结果必须仍然是输入语法能表示的字面量 (非负整数)，否则保持原样不折叠：
 * 减法结果为负、除法除不尽时都不折叠。除以零抛出 {@link FoldingException}。
 */
public class ConstantFoldingRule extends AbstractSimplificationRule {

    @Override
    public ExpressionNode apply(BinaryExpressionNode node) {
        if (!(node.left() instanceof LiteralNode left) || !(node.right() instanceof LiteralNode right)) {
            return null;
        }
        BigInteger a = left.numericValue();
        BigInteger b = right.numericValue();

        BigInteger result = switch (node.operator()) {
            case PLUS -> a.add(b);
            case MULTIPLY -> a.multiply(b);
            case MINUS -> a.compareTo(b) >= 0 ? a.subtract(b) : null;
            case DIVIDE -> divide(a, b, node);
        };
        return result == null ? null : LiteralNode.of(result);
    }

    private static BigInteger divide(BigInteger a, BigInteger b, BinaryExpressionNode node) {
        if (b.signum() == 0) {
            throw new FoldingException("Cannot fold '" + node.left().value() + " / " + node.right().value()
                    + "': division by zero");
        }
        BigInteger[] quotientAndRemainder = a.divideAndRemainder(b);
        return quotientAndRemainder[1].signum() == 0 ? quotientAndRemainder[0] : null;
    }

    @Override
    public String getName() {
        return "constant-folding";
    }
}
