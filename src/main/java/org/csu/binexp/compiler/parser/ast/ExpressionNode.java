package org.csu.binexp.compiler.parser.ast;

/**
 * 表达式树中所有节点的公共接口。
 * 叶子节点为 {@link org.csu.binexp.compiler.parser.ast.expression.LiteralNode}
 * 或 {@link org.csu.binexp.compiler.parser.ast.expression.IdentifierNode}，
 * 内部节点为 {@link org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode}。
 */
public interface ExpressionNode {

    /**
     * @return 节点自身的文本值：叶子为数字或变量名，二元节点为运算符符号
     */
    String value();

    default boolean isLeaf() {
        return true;
    }
}
