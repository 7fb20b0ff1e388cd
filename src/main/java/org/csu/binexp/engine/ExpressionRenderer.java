package org.csu.binexp.engine;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;

/**
 * 表达式渲染器。
 * 把表达式树转换为前缀、中缀或后缀字符串，不修改树本身。
 */
public class ExpressionRenderer {

    public static String render(ExpressionNode node, Notation notation) {
        return switch (notation) {
            case PREFIX -> toPrefix(node);
            case INFIX -> toInfix(node);
            case POSTFIX -> toPostfix(node);
        };
    }

    /**
     * 运算符在前: {@code + 1 2}
     */
    public static String toPrefix(ExpressionNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            return binary.value() + " " + toPrefix(binary.left()) + " " + toPrefix(binary.right());
        }
        return node.value();
    }

    /**
     * 每个二元子表达式都加一对括号，与运算符优先级无关: {@code (1 + (2 * 3))}
     */
    public static String toInfix(ExpressionNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            return "(" + toInfix(binary.left()) + " " + binary.value() + " " + toInfix(binary.right()) + ")";
        }
        return node.value();
    }

    /**
     * 运算符在后: {@code 1 2 +}
     */
    public static String toPostfix(ExpressionNode node) {
        if (node instanceof BinaryExpressionNode binary) {
            return toPostfix(binary.left()) + " " + toPostfix(binary.right()) + " " + binary.value();
        }
        return node.value();
    }

    /**
     * 缩进形式的树，每个节点一行，每深一层多缩进两个空格。调试用。
     */
    public static String toTreeString(ExpressionNode node) {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendTree(StringBuilder sb, ExpressionNode node, int depth) {
        if (depth > 0) {
            sb.append("\n");
        }
        sb.append("  ".repeat(depth)).append(node.value());
        if (node instanceof BinaryExpressionNode binary) {
            appendTree(sb, binary.left(), depth + 1);
            appendTree(sb, binary.right(), depth + 1);
        }
    }
}
