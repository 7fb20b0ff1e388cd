package org.csu.binexp.common.exception;

/**
 * @description: 常量折叠时遇到在整数域上无定义的运算 (例如除以零)
 */
public class FoldingException extends ExpressionException {
    public FoldingException(String message) {
        super(message);
    }
}
