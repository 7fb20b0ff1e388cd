package org.csu.binexp.engine;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;

/**
 * 封装一条表达式处理的全部结果。
 */
public record ExpressionResult(
        String input,               // 原始输入行
        ExpressionNode original,    // 解析得到的树，解析失败时为 null
        ExpressionNode simplified,  // 化简后的树，失败时为 null
        String errorMessage         // 成功时为 null
) {
    public static ExpressionResult newSuccessResult(String input, ExpressionNode original, ExpressionNode simplified) {
        return new ExpressionResult(input, original, simplified, null);
    }

    public static ExpressionResult newErrorResult(String input, ExpressionNode original, String errorMessage) {
        return new ExpressionResult(input, original, null, errorMessage);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public String render(Notation notation) {
        if (!isSuccess()) {
            throw new IllegalStateException("No simplified expression for failed input '" + input + "'");
        }
        return ExpressionRenderer.render(simplified, notation);
    }

    public String prefix() {
        return render(Notation.PREFIX);
    }

    public String infix() {
        return render(Notation.INFIX);
    }

    public String postfix() {
        return render(Notation.POSTFIX);
    }

    @Override
    public String toString() {
        if (!isSuccess()) {
            return "ERROR: " + errorMessage;
        }
        return prefix();
    }
}
