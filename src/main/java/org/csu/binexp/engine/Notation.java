package org.csu.binexp.engine;

/**
 * 表达式的三种输出记法。
 */
public enum Notation {
    PREFIX,
    INFIX,
    POSTFIX;

    public static Notation fromName(String name) {
        return Notation.valueOf(name.trim().toUpperCase());
    }
}
