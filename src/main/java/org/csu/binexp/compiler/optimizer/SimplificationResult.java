package org.csu.binexp.compiler.optimizer;

import org.csu.binexp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * 化简结果以及按命中顺序 (自底向上) 排列的规则记录。
 */
public record SimplificationResult(ExpressionNode result, List<SimplificationStep> steps) {

    public boolean changed() {
        return !steps.isEmpty();
    }
}
