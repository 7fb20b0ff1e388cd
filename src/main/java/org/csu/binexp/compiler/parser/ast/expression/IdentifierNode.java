package org.csu.binexp.compiler.parser.ast.expression;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 符号变量，如 x。
 * 参与恒等式化简，但永远不会被常量折叠。
 */
public record IdentifierNode(String name) implements ExpressionNode {

    @Override
    public String value() {
        return name;
    }

    @Override
    public String toString() {
        return "IdentifierNode[" + name + "]";
    }
}
