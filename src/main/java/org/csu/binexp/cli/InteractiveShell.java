package org.csu.binexp.cli;

import org.csu.binexp.common.exception.ExpressionException;
import org.csu.binexp.compiler.optimizer.SimplificationResult;
import org.csu.binexp.compiler.optimizer.SimplificationStep;
import org.csu.binexp.engine.ExpressionProcessor;
import org.csu.binexp.engine.ExpressionRenderer;
import org.csu.binexp.engine.ExpressionResult;
import org.csu.binexp.engine.Notation;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * 交互式命令行：每输入一行前缀表达式，打印化简后的结果。
 * <pre>
 * binexp> + 1 * 0 1
 * 1
 * binexp> mode all
 * binexp> explain * 1 * 3 1
 * </pre>
 * 首个单词是命令名时按命令处理；允许符号时，名为 exit、tree 等的变量需要写成 {@code eval exit}。
 */
public class InteractiveShell {

    private static final String PROMPT = "binexp> ";

    private final ExpressionProcessor processor;
    private final BufferedReader in;
    private final PrintStream out;
    // null 表示三种记法都打印
    private Notation mode = Notation.PREFIX;

    public InteractiveShell(ExpressionProcessor processor, BufferedReader in, PrintStream out) {
        this.processor = processor;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        ExpressionProcessor processor = new ExpressionProcessor();
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        InteractiveShell shell = new InteractiveShell(processor, console, System.out);
        System.out.println("Binary expression simplifier. " + processor.getConfig());
        System.out.println("Type 'help' for commands, 'exit' to quit.");
        try {
            shell.run();
        } catch (IOException e) {
            System.err.println("Could not read from console: " + e.getMessage());
        }
        System.out.println("Bye!");
    }

    public void run() throws IOException {
        while (true) {
            out.print(PROMPT);
            String line = in.readLine();
            if (line == null || !handleLine(line)) {
                break;
            }
        }
    }

    /**
     * @return false 表示用户要求退出
     */
    public boolean handleLine(String rawLine) {
        String line = rawLine.trim();
        if (line.endsWith(";")) {
            line = line.substring(0, line.length() - 1).trim();
        }
        if (line.isEmpty() || line.startsWith("#")) {
            return true;
        }
        String command = line.split("\\s+", 2)[0].toLowerCase();
        String argument = line.length() > command.length() ? line.substring(command.length()).trim() : "";

        switch (command) {
            case "exit", "quit" -> {
                return false;
            }
            case "help" -> printHelp();
            case "mode" -> changeMode(argument);
            case "source" -> executeFile(argument);
            case "tree" -> printTree(argument);
            case "explain" -> explain(argument);
            case "eval" -> evaluate(argument);
            default -> evaluate(line);
        }
        return true;
    }

    private void evaluate(String expression) {
        ExpressionResult result = processor.process(expression);
        if (!result.isSuccess()) {
            out.println("ERROR: " + result.errorMessage());
            return;
        }
        if (mode != null) {
            out.println(result.render(mode));
            return;
        }
        for (Notation notation : Notation.values()) {
            out.printf("%-8s %s%n", notation.name().toLowerCase() + ":", result.render(notation));
        }
    }

    private void changeMode(String argument) {
        if (argument.equalsIgnoreCase("all")) {
            mode = null;
            out.println("Output mode: all");
            return;
        }
        try {
            mode = Notation.fromName(argument);
            out.println("Output mode: " + mode.name().toLowerCase());
        } catch (IllegalArgumentException e) {
            out.println("ERROR: Unknown mode '" + argument + "', expected prefix, infix, postfix or all");
        }
    }

    private void printTree(String expression) {
        try {
            out.println(ExpressionRenderer.toTreeString(processor.parse(expression)));
        } catch (ExpressionException e) {
            out.println("ERROR: " + e.getMessage());
        }
    }

    private void explain(String expression) {
        try {
            SimplificationResult result = processor.explain(expression);
            if (!result.changed()) {
                out.println("No rule applies.");
            }
            for (SimplificationStep step : result.steps()) {
                out.println("  " + step);
            }
            out.println("Result: " + ExpressionRenderer.toPrefix(result.result()));
        } catch (ExpressionException e) {
            out.println("ERROR: " + e.getMessage());
        }
    }

    private void executeFile(String path) {
        File file = new File(path);
        if (!file.exists()) {
            out.println("ERROR: File not found: " + file.getAbsolutePath());
            return;
        }
        out.println("Executing expressions from: " + path);
        try {
            List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
            for (String line : lines) {
                String expression = line.trim();
                if (expression.isEmpty() || expression.startsWith("#")) {
                    continue;
                }
                out.println(PROMPT + expression);
                evaluate(expression);
            }
        } catch (IOException e) {
            out.println("ERROR: Failed to read file: " + e.getMessage());
        }
    }

    private void printHelp() {
        out.println("  <prefix expression>          simplify, e.g. + 1 * 2 1");
        out.println("  mode prefix|infix|postfix|all  choose output notation");
        out.println("  tree <expr>                  show the parsed tree");
        out.println("  explain <expr>               list the rules that fire");
        out.println("  source <file>                simplify every line of a file");
        out.println("  eval <expr>                  simplify <expr> even if it starts with a command word");
        out.println("  exit                         quit");
        out.println("Command words win over symbols: with symbols enabled, 'exit' quits; use 'eval exit' for the symbol.");
    }

    public Notation getMode() {
        return mode;
    }
}
