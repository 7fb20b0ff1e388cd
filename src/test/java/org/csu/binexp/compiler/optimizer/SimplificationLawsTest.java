package org.csu.binexp.compiler.optimizer;

import org.csu.binexp.common.config.ExpressionConfig;
import org.csu.binexp.compiler.parser.ExpressionParser;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;
import org.csu.binexp.compiler.parser.ast.expression.Operator;
import org.csu.binexp.engine.ExpressionRenderer;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 对一组样例树检查代数性质：往返解析、幂等、恒等律、零乘律。
 * 两种折叠策略都要满足。
 */
public class SimplificationLawsTest {

    private static final List<String> SAMPLES = List.of(
            "0",
            "1",
            "x",
            "+ 1 2",
            "* x 1",
            "+ 1 + 2 0",
            "* 1 * 3 1",
            "+ 1 * 0 1",
            "- * x 2 / 8 4",
            "* + y 0 + 1 1",
            "/ + 2 3 - 9 x",
            "* * 1 1 + 0 z"
    );

    static Stream<Arguments> cases() {
        return Stream.of(ExpressionConfig.defaults(), ExpressionConfig.identityOnly())
                .flatMap(config -> SAMPLES.stream().map(sample -> Arguments.of(
                        sample, config.isConstantFolding(), new ExpressionSimplifier(config))));
    }

    private static ExpressionNode tree(String sample) {
        return ExpressionParser.parse(sample, true);
    }

    @ParameterizedTest(name = "{0} (folding={1})")
    @MethodSource("cases")
    void roundTripThroughPrefix(String sample, boolean folding, ExpressionSimplifier simplifier) {
        ExpressionNode original = tree(sample);
        assertEquals(original, tree(ExpressionRenderer.toPrefix(original)));

        ExpressionNode simplified = simplifier.simplify(original);
        assertEquals(simplified, tree(ExpressionRenderer.toPrefix(simplified)));
    }

    @ParameterizedTest(name = "{0} (folding={1})")
    @MethodSource("cases")
    void simplifyIsIdempotent(String sample, boolean folding, ExpressionSimplifier simplifier) {
        ExpressionNode once = simplifier.simplify(tree(sample));
        assertEquals(once, simplifier.simplify(once));
    }

    @ParameterizedTest(name = "{0} (folding={1})")
    @MethodSource("cases")
    void identityLaws(String sample, boolean folding, ExpressionSimplifier simplifier) {
        ExpressionNode x = tree(sample);
        ExpressionNode expected = simplifier.simplify(x);
        LiteralNode zero = new LiteralNode("0");
        LiteralNode one = new LiteralNode("1");

        assertEquals(expected, simplifier.simplify(new BinaryExpressionNode(x, Operator.PLUS, zero)));
        assertEquals(expected, simplifier.simplify(new BinaryExpressionNode(zero, Operator.PLUS, x)));
        assertEquals(expected, simplifier.simplify(new BinaryExpressionNode(x, Operator.MULTIPLY, one)));
        assertEquals(expected, simplifier.simplify(new BinaryExpressionNode(one, Operator.MULTIPLY, x)));
    }

    @ParameterizedTest(name = "{0} (folding={1})")
    @MethodSource("cases")
    void annihilationLaw(String sample, boolean folding, ExpressionSimplifier simplifier) {
        ExpressionNode x = tree(sample);
        LiteralNode zero = new LiteralNode("0");

        assertEquals(zero, simplifier.simplify(new BinaryExpressionNode(x, Operator.MULTIPLY, zero)));
        assertEquals(zero, simplifier.simplify(new BinaryExpressionNode(zero, Operator.MULTIPLY, x)));
    }
}
