package org.csu.binexp.compiler.optimizer.rule;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;
import org.csu.binexp.compiler.parser.ast.expression.Operator;

/**
 * x * 0 = 0, 0 * x = 0。
 * 另一侧可以是任意子树，包括符号变量，所以必须排在常量折叠之前。
 */
public class MultiplicationByZeroRule extends AbstractSimplificationRule {

    @Override
    public ExpressionNode apply(BinaryExpressionNode node) {
        if (node.operator() != Operator.MULTIPLY) {
            return null;
        }
        if (isLiteral(node.left(), 0) || isLiteral(node.right(), 0)) {
            return LiteralNode.ZERO;
        }
        return null;
    }

    @Override
    public String getName() {
        return "multiplication-by-zero";
    }
}
