package org.csu.binexp.compiler.optimizer;

/**
 * 一次规则命中的记录，均为前缀形式。
 */
public record SimplificationStep(String rule, String before, String after) {

    @Override
    public String toString() {
        return String.format("%-24s %s  =>  %s", rule, before, after);
    }
}
