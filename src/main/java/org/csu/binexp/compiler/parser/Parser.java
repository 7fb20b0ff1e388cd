package org.csu.binexp.compiler.parser;

import org.csu.binexp.common.exception.MalformedInputException;
import org.csu.binexp.compiler.lexer.Token;
import org.csu.binexp.compiler.lexer.TokenType;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.binexp.compiler.parser.ast.expression.IdentifierNode;
import org.csu.binexp.compiler.parser.ast.expression.LiteralNode;
import org.csu.binexp.compiler.parser.ast.expression.Operator;

import java.util.List;
import java.util.Set;

/**
 * @description: 语法分析器
 * 采用递归下降法，按前缀顺序从左到右消费Token流，构造表达式树。
 * Token 列表本身不会被修改，只移动游标 position。
 */
public class Parser {

    /** 默认的最大嵌套深度，超过后按输入错误处理，避免后续递归栈溢出 */
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private final int maxDepth;
    private int position = 0;

    private static final Set<TokenType> OPERATORS = Set.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.ASTERISK, TokenType.SLASH
    );

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, but was " + maxDepth);
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must be terminated by EOF");
        }
        this.tokens = List.copyOf(tokens);
        this.maxDepth = maxDepth;
    }

    /**
     * 解析整个Token流。表达式之后如果还有剩余Token，视为输入错误。
     */
    public ExpressionNode parse() {
        if (isAtEnd()) {
            throw new MalformedInputException(peek(), "an expression, the input is empty");
        }
        ExpressionNode root = parseExpression();
        if (!isAtEnd()) {
            throw new MalformedInputException(peek(), "end of input after the top-level expression");
        }
        return root;
    }

    /**
     * 从当前游标处解析一个完整的表达式，游标停在它之后。
     * 通过 {@link #getPosition()} 可以得知已消费的Token数量。
     */
    public ExpressionNode parseExpression() {
        return parseExpression(1);
    }

    private ExpressionNode parseExpression(int depth) {
        if (depth > maxDepth) {
            throw new MalformedInputException(peek(), "nesting depth at most " + maxDepth);
        }
        if (match(TokenType.INTEGER_CONST)) {
            return new LiteralNode(previous().lexeme());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (OPERATORS.contains(peek().type())) {
            Operator operator = Operator.fromToken(advance());
            // 先左后右，与先序遍历的顺序一致
            ExpressionNode left = parseOperand(operator, "left", depth + 1);
            ExpressionNode right = parseOperand(operator, "right", depth + 1);
            return new BinaryExpressionNode(left, operator, right);
        }
        throw new MalformedInputException(peek(), "a number or an operator");
    }

    private ExpressionNode parseOperand(Operator operator, String side, int depth) {
        if (isAtEnd()) {
            throw new MalformedInputException(peek(), side + " operand of '" + operator.getSymbol() + "'");
        }
        return parseExpression(depth);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasRemaining() {
        return !isAtEnd();
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
