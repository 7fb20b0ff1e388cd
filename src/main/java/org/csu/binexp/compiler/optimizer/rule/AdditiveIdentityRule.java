package org.csu.binexp.compiler.optimizer.rule;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.Operator;

/**
 * x + 0 = x, 0 + x = x
 */
public class AdditiveIdentityRule extends AbstractSimplificationRule {

    @Override
    public ExpressionNode apply(BinaryExpressionNode node) {
        if (node.operator() != Operator.PLUS) {
            return null;
        }
        if (isLiteral(node.left(), 0)) {
            return node.right();
        }
        if (isLiteral(node.right(), 0)) {
            return node.left();
        }
        return null;
    }

    @Override
    public String getName() {
        return "additive-identity";
    }
}
