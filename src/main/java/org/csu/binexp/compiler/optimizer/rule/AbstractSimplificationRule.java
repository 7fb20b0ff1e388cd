package org.csu.binexp.compiler.optimizer.rule;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;

/**
 * 化简规则的抽象基类。
 * 规则只检查节点的直接子节点，不会递归；递归由 ExpressionSimplifier 负责。
 */
public abstract class AbstractSimplificationRule {

    /**
     * @param node 子节点已经化简完毕的二元节点
     * @return 替换后的节点；规则不适用时返回 null
     */
    public abstract ExpressionNode apply(BinaryExpressionNode node);

    public abstract String getName();

    protected static boolean isLiteral(ExpressionNode node, long number) {
        return node instanceof LiteralNode literal && literal.hasValue(number);
    }

    @Override
    public String toString() {
        return getName();
    }
}
