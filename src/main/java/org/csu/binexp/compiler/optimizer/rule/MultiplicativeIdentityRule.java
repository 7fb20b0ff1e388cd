package org.csu.binexp.compiler.optimizer.rule;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.Operator;

/**
 * x * 1 = x, 1 * x = x
 */
public class MultiplicativeIdentityRule extends AbstractSimplificationRule {

    @Override
    public ExpressionNode apply(BinaryExpressionNode node) {
        if (node.operator() != Operator.MULTIPLY) {
            return null;
        }
        if (isLiteral(node.left(), 1)) {
            return node.right();
        }
        if (isLiteral(node.right(), 1)) {
            return node.left();
        }
        return null;
    }

    @Override
    public String getName() {
        return "multiplicative-identity";
    }
}
