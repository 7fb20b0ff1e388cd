package org.csu.binexp.compiler.lexer;

import org.csu.binexp.common.exception.InvalidOperatorException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器
 *
 * 输入已经是按空白分隔、前缀顺序排列的 Token 文本，这里只负责给每个 Token 分类，
 * 并在末尾追加 EOF。
 */
public class Lexer {

    private final List<String> rawTokens;
    private final boolean allowSymbols;

    // 运算符映射表
    private static final Map<String, TokenType> operators;

    static {
        operators = new HashMap<>();
        operators.put("+", TokenType.PLUS);
        operators.put("-", TokenType.MINUS);
        operators.put("*", TokenType.ASTERISK);
        operators.put("/", TokenType.SLASH);
    }

    public Lexer(String input) {
        this(input, false);
    }

    public Lexer(String input, boolean allowSymbols) {
        this(splitWhitespace(input), allowSymbols);
    }

    public Lexer(List<String> rawTokens) {
        this(rawTokens, false);
    }

    public Lexer(List<String> rawTokens, boolean allowSymbols) {
        this.rawTokens = List.copyOf(rawTokens);
        this.allowSymbols = allowSymbols;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>(rawTokens.size() + 1);
        for (int i = 0; i < rawTokens.size(); i++) {
            tokens.add(classify(rawTokens.get(i), i));
        }
        tokens.add(new Token(TokenType.EOF, "", rawTokens.size()));
        return tokens;
    }

    private Token classify(String lexeme, int position) {
        if (isNumber(lexeme)) {
            return new Token(TokenType.INTEGER_CONST, lexeme, position);
        }
        TokenType operatorType = operators.get(lexeme);
        if (operatorType != null) {
            return new Token(operatorType, lexeme, position);
        }
        if (allowSymbols && isIdentifier(lexeme)) {
            return new Token(TokenType.IDENTIFIER, lexeme, position);
        }
        throw new InvalidOperatorException(lexeme, position);
    }

    public static boolean isNumber(String lexeme) {
        if (lexeme == null || lexeme.isEmpty()) {
            return false;
        }
        for (int i = 0; i < lexeme.length(); i++) {
            if (!isDigit(lexeme.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIdentifier(String lexeme) {
        if (lexeme.isEmpty() || !isLetter(lexeme.charAt(0))) {
            return false;
        }
        for (int i = 1; i < lexeme.length(); i++) {
            char c = lexeme.charAt(i);
            if (!isLetter(c) && !isDigit(c)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    // 只接受 ASCII 数字，Character.isDigit 会放过全角数字
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static List<String> splitWhitespace(String input) {
        String trimmed = input == null ? "" : input.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
