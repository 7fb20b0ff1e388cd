package org.csu.binexp.compiler.optimizer;

import org.csu.binexp.common.config.ExpressionConfig;
import org.csu.binexp.compiler.optimizer.rule.AbstractSimplificationRule;
import org.csu.binexp.compiler.optimizer.rule.AdditiveIdentityRule;
import org.csu.binexp.compiler.optimizer.rule.ConstantFoldingRule;
import org.csu.binexp.compiler.optimizer.rule.MultiplicationByZeroRule;
import org.csu.binexp.compiler.optimizer.rule.MultiplicativeIdentityRule;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.engine.ExpressionRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 表达式化简器。
 * <p>
 * 自底向上：先化简左右子树，再对当前节点按顺序尝试规则，第一条命中的规则生效。
 * 子树在检查当前节点之前已经完全化简，因此一遍遍历即可，不需要反复迭代到不动点。
 * 规则顺序：
 * <ol>
 *     <li>加法恒等 x + 0 = x</li>
 *     <li>乘法恒等 x * 1 = x</li>
 *     <li>乘零 x * 0 = 0</li>
 *     <li>常量折叠 (可关闭)</li>
 * </ol>
 */
public class ExpressionSimplifier {

    private final List<AbstractSimplificationRule> rules;
    private final boolean debug;

    public ExpressionSimplifier() {
        this(ExpressionConfig.defaults());
    }

    public ExpressionSimplifier(ExpressionConfig config) {
        List<AbstractSimplificationRule> ruleList = new ArrayList<>();
        ruleList.add(new AdditiveIdentityRule());
        ruleList.add(new MultiplicativeIdentityRule());
        ruleList.add(new MultiplicationByZeroRule());
        if (config.isConstantFolding()) {
            ruleList.add(new ConstantFoldingRule());
        }
        this.rules = Collections.unmodifiableList(ruleList);
        this.debug = config.isDebug();
    }

    public ExpressionNode simplify(ExpressionNode node) {
        return simplify(node, null);
    }

    public SimplificationResult simplifyWithTrace(ExpressionNode node) {
        List<SimplificationStep> steps = new ArrayList<>();
        ExpressionNode result = simplify(node, steps);
        return new SimplificationResult(result, List.copyOf(steps));
    }

    public List<AbstractSimplificationRule> getRules() {
        return rules;
    }

    private ExpressionNode simplify(ExpressionNode node, List<SimplificationStep> steps) {
        if (!(node instanceof BinaryExpressionNode binary)) {
            return node;
        }
        ExpressionNode left = simplify(binary.left(), steps);
        ExpressionNode right = simplify(binary.right(), steps);
        BinaryExpressionNode current = binary.withChildren(left, right);

        for (AbstractSimplificationRule rule : rules) {
            ExpressionNode rewritten = rule.apply(current);
            if (rewritten != null) {
                record(rule, current, rewritten, steps);
                return rewritten;
            }
        }
        return current;
    }

    private void record(AbstractSimplificationRule rule, ExpressionNode before, ExpressionNode after,
                        List<SimplificationStep> steps) {
        if (steps == null && !debug) {
            return;
        }
        SimplificationStep step = new SimplificationStep(rule.getName(),
                ExpressionRenderer.toPrefix(before), ExpressionRenderer.toPrefix(after));
        if (steps != null) {
            steps.add(step);
        }
        if (debug) {
            System.out.println("[DEBUG] " + step);
        }
    }
}
