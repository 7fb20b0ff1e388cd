package org.csu.binexp.compiler.parser;

import org.csu.binexp.compiler.lexer.Lexer;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * 词法分析 + 语法分析的便捷入口。
 */
public final class ExpressionParser {

    private ExpressionParser() {
    }

    public static ExpressionNode parse(String input) {
        return parse(input, false);
    }

    public static ExpressionNode parse(String input, boolean allowSymbols) {
        return new Parser(new Lexer(input, allowSymbols).tokenize()).parse();
    }

    public static ExpressionNode parse(List<String> tokens) {
        return parse(tokens, false);
    }

    public static ExpressionNode parse(List<String> tokens, boolean allowSymbols) {
        return new Parser(new Lexer(tokens, allowSymbols).tokenize()).parse();
    }
}
