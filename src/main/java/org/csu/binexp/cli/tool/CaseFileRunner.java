package org.csu.binexp.cli.tool;

import org.csu.binexp.common.config.ExpressionConfig;
import org.csu.binexp.engine.ExpressionProcessor;
import org.csu.binexp.engine.ExpressionResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于文件的测试用例执行器。
 * <p>
 * 用例文件每行一条：{@code <前缀表达式> => <期望的化简结果(前缀)>}。
 * 期望为 {@code !error} 表示该输入应当报错。空行和以 # 开头的行被忽略。
 * <pre>
 * # 加法恒等
 * + 1 + 2 0 => 3
 * * 1 0     => 0
 * + 1       => !error
 * </pre>
 */
public class CaseFileRunner {

    public static final String SEPARATOR = "=>";
    public static final String EXPECT_ERROR = "!error";

    private final ExpressionProcessor processor;

    public CaseFileRunner(ExpressionProcessor processor) {
        this.processor = processor;
    }

    public record Report(int passed, List<String> failures) {
        public int failed() {
            return failures.size();
        }

        public boolean allPassed() {
            return failures.isEmpty();
        }
    }

    public Report run(Path caseFile) throws IOException {
        return run(Files.readAllLines(caseFile, StandardCharsets.UTF_8));
    }

    public Report run(List<String> lines) {
        int passed = 0;
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int separator = line.indexOf(SEPARATOR);
            if (separator < 0) {
                failures.add(String.format("line %d: missing '%s' in '%s'", i + 1, SEPARATOR, line));
                continue;
            }
            String input = line.substring(0, separator).trim();
            String expected = line.substring(separator + SEPARATOR.length()).trim();

            ExpressionResult result = processor.process(input);
            String actual = result.isSuccess() ? result.prefix() : EXPECT_ERROR;
            if (actual.equals(expected)) {
                passed++;
            } else {
                String detail = result.isSuccess() ? actual : EXPECT_ERROR + " (" + result.errorMessage() + ")";
                failures.add(String.format("line %d: '%s' expected '%s' but got '%s'", i + 1, input, expected, detail));
            }
        }
        return new Report(passed, failures);
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: CaseFileRunner <case-file> [--identity-only]");
            System.exit(2);
        }
        ExpressionConfig config = ExpressionConfig.load();
        if (args.length > 1 && "--identity-only".equals(args[1])) {
            config = config.withConstantFolding(false);
        }
        CaseFileRunner runner = new CaseFileRunner(new ExpressionProcessor(config));
        try {
            Report report = runner.run(Path.of(args[0]));
            report.failures().forEach(failure -> System.out.println("[FAIL] " + failure));
            System.out.println("[INFO] " + report.passed() + " passed, " + report.failed() + " failed.");
            System.exit(report.allPassed() ? 0 : 1);
        } catch (IOException e) {
            System.err.println("ERROR: Could not read case file " + args[0] + ": " + e.getMessage());
            System.exit(2);
        }
    }
}
