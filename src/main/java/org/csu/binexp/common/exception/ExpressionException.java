package org.csu.binexp.common.exception;

/**
 * 表达式处理过程中所有错误的基类。
 * 所有子类都是非受检异常，由调用方决定捕获、记录或跳过。
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
