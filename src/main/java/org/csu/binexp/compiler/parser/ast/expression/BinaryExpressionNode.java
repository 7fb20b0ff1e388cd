package org.csu.binexp.compiler.parser.ast.expression;

import org.csu.binexp.common.exception.MalformedInputException;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., + 1 2)
 * 两个子节点都必须存在，不允许只有一侧的节点。
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Operator operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        if (left == null || right == null || operator == null) {
            throw new MalformedInputException("Binary expression requires an operator and exactly two operands");
        }
    }

    @Override
    public String value() {
        return operator.getSymbol();
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    public BinaryExpressionNode withChildren(ExpressionNode newLeft, ExpressionNode newRight) {
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new BinaryExpressionNode(newLeft, operator, newRight);
    }
}
