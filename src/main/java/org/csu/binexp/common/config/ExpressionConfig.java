package org.csu.binexp.common.config;

import lombok.Getter;
import org.csu.binexp.compiler.parser.Parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 运行配置。
 * 默认值来自 classpath 上的 binexp.properties，同名的系统属性 (-Dbinexp.xxx) 优先。
 */
@Getter
public class ExpressionConfig {

    public static final String RESOURCE_NAME = "binexp.properties";

    public static final String CONSTANT_FOLDING = "binexp.simplifier.constant-folding";
    public static final String ALLOW_SYMBOLS = "binexp.lexer.allow-symbols";
    public static final String THREADS = "binexp.processor.threads";
    public static final String DEBUG = "binexp.debug";
    public static final String MAX_DEPTH = "binexp.parser.max-depth";

    /** 是否启用第4条规则 (常量折叠)。关闭时只做恒等式消除。 */
    private final boolean constantFolding;
    /** 是否允许 x、rate 这样的符号变量作为叶子 */
    private final boolean allowSymbols;
    private final int threads;
    private final boolean debug;
    /** 表达式树的最大嵌套深度，更深的输入按格式错误拒绝 */
    private final int maxDepth;

    public ExpressionConfig(boolean constantFolding, boolean allowSymbols, int threads, boolean debug, int maxDepth) {
        if (threads < 1) {
            throw new IllegalArgumentException(THREADS + " must be at least 1, but was " + threads);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException(MAX_DEPTH + " must be at least 1, but was " + maxDepth);
        }
        this.constantFolding = constantFolding;
        this.allowSymbols = allowSymbols;
        this.threads = threads;
        this.debug = debug;
        this.maxDepth = maxDepth;
    }

    public static ExpressionConfig defaults() {
        return new ExpressionConfig(true, false, 4, false, Parser.DEFAULT_MAX_DEPTH);
    }

    /**
     * 只应用加法恒等、乘法恒等和乘零三条规则，不做常量折叠。
     */
    public static ExpressionConfig identityOnly() {
        return defaults().withConstantFolding(false);
    }

    public static ExpressionConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ExpressionConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    public static ExpressionConfig fromProperties(Properties properties) {
        ExpressionConfig defaults = defaults();
        return new ExpressionConfig(
                readBoolean(properties, CONSTANT_FOLDING, defaults.constantFolding),
                readBoolean(properties, ALLOW_SYMBOLS, defaults.allowSymbols),
                readInt(properties, THREADS, defaults.threads),
                readBoolean(properties, DEBUG, defaults.debug),
                readInt(properties, MAX_DEPTH, defaults.maxDepth));
    }

    public ExpressionConfig withConstantFolding(boolean enabled) {
        return new ExpressionConfig(enabled, allowSymbols, threads, debug, maxDepth);
    }

    public ExpressionConfig withAllowSymbols(boolean enabled) {
        return new ExpressionConfig(constantFolding, enabled, threads, debug, maxDepth);
    }

    public ExpressionConfig withThreads(int count) {
        return new ExpressionConfig(constantFolding, allowSymbols, count, debug, maxDepth);
    }

    public ExpressionConfig withDebug(boolean enabled) {
        return new ExpressionConfig(constantFolding, allowSymbols, threads, enabled, maxDepth);
    }

    public ExpressionConfig withMaxDepth(int depth) {
        return new ExpressionConfig(constantFolding, allowSymbols, threads, debug, depth);
    }

    private static String lookup(Properties properties, String key) {
        String value = System.getProperty(key);
        return value != null ? value : properties.getProperty(key);
    }

    private static boolean readBoolean(Properties properties, String key, boolean fallback) {
        String value = lookup(properties, key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static int readInt(Properties properties, String key, int fallback) {
        String value = lookup(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return "ExpressionConfig[constantFolding=" + constantFolding + ", allowSymbols=" + allowSymbols
                + ", threads=" + threads + ", debug=" + debug + ", maxDepth=" + maxDepth + "]";
    }
}
