package org.csu.binexp.engine;

import lombok.Getter;
import org.csu.binexp.common.config.ExpressionConfig;
import org.csu.binexp.common.exception.ExpressionException;
import org.csu.binexp.compiler.lexer.Lexer;
import org.csu.binexp.compiler.optimizer.ExpressionSimplifier;
import org.csu.binexp.compiler.optimizer.SimplificationResult;
import org.csu.binexp.compiler.parser.Parser;
import org.csu.binexp.compiler.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 处理流程：词法分析 -> 语法分析 -> 化简。
 * 单条表达式出错不会抛出，而是记录在 {@link ExpressionResult} 中，调用方可以跳过它继续处理其余输入。
 */
public class ExpressionProcessor {

    @Getter
    private final ExpressionConfig config;
    @Getter
    private final ExpressionSimplifier simplifier;

    public ExpressionProcessor() {
        this(ExpressionConfig.load());
    }

    public ExpressionProcessor(ExpressionConfig config) {
        this.config = config;
        this.simplifier = new ExpressionSimplifier(config);
    }

    /**
     * 解析一行前缀表达式，错误直接抛出。
     */
    public ExpressionNode parse(String line) {
        Lexer lexer = new Lexer(line, config.isAllowSymbols());
        Parser parser = new Parser(lexer.tokenize(), config.getMaxDepth());
        return parser.parse();
    }

    public SimplificationResult explain(String line) {
        return simplifier.simplifyWithTrace(parse(line));
    }

    public ExpressionResult process(String line) {
        ExpressionNode original = null;
        try {
            original = parse(line);
            ExpressionNode simplified = simplifier.simplify(original);
            return ExpressionResult.newSuccessResult(line, original, simplified);
        } catch (ExpressionException e) {
            System.err.println("[ERROR] Failed to process '" + line + "': " + e.getMessage());
            return ExpressionResult.newErrorResult(line, original, e.getMessage());
        }
    }

    public List<ExpressionResult> processAll(List<String> lines) {
        List<ExpressionResult> results = new ArrayList<>(lines.size());
        for (String line : lines) {
            results.add(process(line));
        }
        return results;
    }

    /**
     * 并行处理多条独立的表达式，结果顺序与输入一致。
     */
    public List<ExpressionResult> processAllParallel(List<String> lines) {
        return processAllParallel(lines, config.getThreads());
    }

    public List<ExpressionResult> processAllParallel(List<String> lines, int threads) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ExpressionResult>> futures = new ArrayList<>(lines.size());
            for (String line : lines) {
                futures.add(executor.submit(() -> process(line)));
            }
            List<ExpressionResult> results = new ArrayList<>(lines.size());
            for (Future<ExpressionResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing expressions", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Expression worker failed", e.getCause());
        } finally {
            executor.shutdown();
        }
    }
}
