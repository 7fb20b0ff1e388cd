package org.csu.binexp.compiler.optimizer;

import org.csu.binexp.common.config.ExpressionConfig;
import org.csu.binexp.common.exception.FoldingException;
import org.csu.binexp.compiler.optimizer.rule.AbstractSimplificationRule;
import org.csu.binexp.compiler.parser.ExpressionParser;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;
import org.csu.binexp.engine.ExpressionRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 化简器测试。
 * 常量折叠是可选规则，所以场景用例对“折叠”和“仅恒等式”两种策略分别给出期望。
 */
public class ExpressionSimplifierTest {

    private final ExpressionSimplifier folding = new ExpressionSimplifier(ExpressionConfig.defaults());
    private final ExpressionSimplifier identityOnly = new ExpressionSimplifier(ExpressionConfig.identityOnly());

    private static String simplify(ExpressionSimplifier simplifier, String input) {
        return ExpressionRenderer.toPrefix(simplifier.simplify(ExpressionParser.parse(input, true)));
    }

    @ParameterizedTest(name = "{0} => folding: {1}, identity only: {2}")
    @CsvSource(delimiter = '|', value = {
            "+ 1 + 2 0 | 3 | + 1 2",
            "+ 1 * 2 1 | 3 | + 1 2",
            "* 1 * 3 1 | 3 | 3",
            "* 1 0     | 0 | 0",
            "+ 1 * 0 1 | 1 | 1"
    })
    void testReferenceScenarios(String input, String withFolding, String withoutFolding) {
        System.out.println("--- Test: " + input + " ---");
        assertEquals(withFolding, simplify(folding, input));
        assertEquals(withoutFolding, simplify(identityOnly, input));
    }

    @ParameterizedTest(name = "{0} => {1}")
    @CsvSource(delimiter = '|', value = {
            "+ 7 0         | 7",
            "+ 0 7         | 7",
            "* 7 1         | 7",
            "* 1 7         | 7",
            "* 0 5         | 0",
            "* 5 0         | 0",
            "- 7 0         | - 7 0",
            "/ 7 1         | / 7 1",
            "+ * 2 0 5     | 5",
            "* + 1 1 + 0 0 | 0",
            "* + 3 4 1     | + 3 4"
    })
    void testIdentityRulesWithoutFolding(String input, String expected) {
        assertEquals(expected, simplify(identityOnly, input));
    }

    @ParameterizedTest(name = "{0} => {1}")
    @CsvSource(delimiter = '|', value = {
            "+ 2 3                           | 5",
            "* 4 5                           | 20",
            "- 5 3                           | 2",
            "- 3 3                           | 0",
            "/ 6 3                           | 2",
            "* + 1 2 - 10 4                  | 18",
            "* 99999999999999999999 2        | 199999999999999999998"
    })
    void testConstantFolding(String input, String expected) {
        assertEquals(expected, simplify(folding, input));
    }

    @Test
    void testFoldingSkipsResultsOutsideTheLiteralGrammar() {
        // 负数和非整除的结果无法作为字面量表示，保持原样
        assertEquals("- 3 5", simplify(folding, "- 3 5"));
        assertEquals("/ 7 2", simplify(folding, "/ 7 2"));
        assertEquals("+ 1 - 3 5", simplify(folding, "+ 1 - 3 5"));
    }

    @Test
    void testDivisionByZeroIsAFoldingError() {
        FoldingException e = assertThrows(FoldingException.class, () -> simplify(folding, "+ 1 / 4 0"));
        assertTrue(e.getMessage().contains("division by zero"));

        // 不折叠时除以零只是一个普通节点
        assertEquals("+ 1 / 4 0", simplify(identityOnly, "+ 1 / 4 0"));
        // 子树先于父节点化简，所以外层的乘零也挡不住
        assertThrows(FoldingException.class, () -> simplify(folding, "* / 4 0 0"));
    }

    @Test
    void testLeafSimplifiesToItself() {
        ExpressionNode leaf = new LiteralNode("42");
        assertSame(leaf, folding.simplify(leaf));
    }

    @Test
    void testSymbolicOperandsAreNeverFolded() {
        assertEquals("+ x 1", simplify(folding, "+ x 1"));
        assertEquals("x", simplify(folding, "+ 0 x"));
        assertEquals("0", simplify(folding, "* x 0"));
        assertEquals("x", simplify(folding, "* 1 + x 0"));
        assertEquals("* y 6", simplify(folding, "* y * 2 3"));
        assertEquals("x", simplify(folding, "+ x 00"));
    }

    @Test
    void testRulesOnlyInspectImmediateChildren() {
        // 规则本身不递归：直接对未化简的节点调用规则不会看到深层的 0
        ExpressionNode tree = ExpressionParser.parse("* + 0 0 5");
        for (AbstractSimplificationRule rule : identityOnly.getRules()) {
            assertNull(rule.apply((BinaryExpressionNode) tree));
        }
        // 入口方法先化简子树，于是 + 0 0 => 0 暴露出乘零
        assertEquals("0", ExpressionRenderer.toPrefix(identityOnly.simplify(tree)));
    }

    @Test
    void testTraceListsRulesBottomUp() {
        SimplificationResult result = folding.simplifyWithTrace(ExpressionParser.parse("+ 1 + 2 0"));
        List<SimplificationStep> steps = result.steps();

        assertEquals(2, steps.size());
        assertEquals(new SimplificationStep("additive-identity", "+ 2 0", "2"), steps.get(0));
        assertEquals(new SimplificationStep("constant-folding", "+ 1 2", "3"), steps.get(1));
        assertEquals(new LiteralNode("3"), result.result());
        assertTrue(result.changed());
    }

    @Test
    void testMultiplicationByZeroWinsOverFolding() {
        SimplificationResult result = folding.simplifyWithTrace(ExpressionParser.parse("* 0 5"));
        assertEquals("multiplication-by-zero", result.steps().get(0).rule());
        assertEquals(LiteralNode.ZERO, result.result());
    }

    @Test
    void testNoRuleLeavesTreeUnchanged() {
        ExpressionNode tree = ExpressionParser.parse("- 9 / 8 3");
        SimplificationResult result = identityOnly.simplifyWithTrace(tree);
        assertFalse(result.changed());
        assertSame(tree, result.result());
    }

    @Test
    void testDebugModePrintsEachFiredRule() {
        ExpressionSimplifier debugging = new ExpressionSimplifier(ExpressionConfig.defaults().withDebug(true));
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertEquals(new LiteralNode("3"), debugging.simplify(ExpressionParser.parse("+ 1 + 2 0")));
        } finally {
            System.setOut(originalOut);
        }

        String text = captured.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("[DEBUG] additive-identity"));
        assertTrue(text.contains("+ 2 0  =>  2"));
        assertTrue(text.contains("[DEBUG] constant-folding"));
    }

    @Test
    void testRuleSetFollowsFoldingPolicy() {
        assertEquals(4, folding.getRules().size());
        assertEquals(3, identityOnly.getRules().size());
        assertEquals("constant-folding", folding.getRules().get(3).getName());
    }
}
