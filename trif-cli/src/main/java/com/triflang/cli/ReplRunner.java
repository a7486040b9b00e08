package com.triflang.cli;

import com.triflang.compiler.CompilationException;
import com.triflang.compiler.compiler.CompilerConfig;
import com.triflang.compiler.compiler.Target;
import com.triflang.compiler.compiler.TrifCompiler;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL：每段输入编译后打印生成的目标代码
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";

    private final TrifCompiler compiler;
    private final PrintStream out;
    private Target target = Target.PYTHON;
    private boolean optimize = true;

    public ReplRunner() {
        this(System.out);
    }

    ReplRunner(PrintStream out) {
        // 片段通常没有 main，入口调用只会干扰阅读
        this.compiler = new TrifCompiler(new CompilerConfig().setFileName("<repl>").setEmitEntryPoint(false));
        this.out = out;
    }

    Target getTarget() {
        return target;
    }

    boolean isOptimize() {
        return optimize;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Trif v" + VERSION + " - 输入 Trif 代码查看生成结果");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            System.err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop();
        }

        out.println("\n再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                String line = reader.readLine(prompt(buffer));
                if (line == null) break;
                if (!feed(buffer, line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                out.print(prompt(buffer));
                out.flush();
                String line = reader.readLine();
                if (line == null) break;
                if (!feed(buffer, line)) break;
            } catch (IOException e) {
                System.err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    private String prompt(StringBuilder buffer) {
        return buffer.length() > 0 ? "... " : "trif> ";
    }

    /**
     * 处理一行输入，括号未闭合时累积到 buffer
     *
     * @return false 表示退出
     */
    boolean feed(StringBuilder buffer, String line) {
        if (buffer.length() == 0 && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        buffer.append(line).append('\n');
        if (hasUnclosedBrackets(buffer.toString())) {
            return true;
        }

        String source = buffer.toString();
        buffer.setLength(0);
        if (!source.trim().isEmpty()) {
            compileAndPrint(source);
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号（忽略字符串内的括号）
     */
    static boolean hasUnclosedBrackets(String text) {
        int depth = 0;
        boolean inString = false;
        char stringChar = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == stringChar) {
                    inString = false;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                inString = true;
                stringChar = c;
                continue;
            }

            switch (c) {
                case '{':
                case '(':
                case '[':
                    depth++;
                    break;
                case '}':
                case ')':
                case ']':
                    depth--;
                    break;
                default:
                    break;
            }
        }

        return depth > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (command.startsWith(":target")) {
            String name = command.substring(":target".length()).trim();
            if (name.isEmpty()) {
                out.println("当前目标: " + target);
                return true;
            }
            try {
                Target selected = Target.fromName(name);
                if (selected.isBinary()) {
                    out.println("REPL 只支持文本目标: python, javascript");
                } else {
                    target = selected;
                    out.println("目标已切换为 " + target);
                }
            } catch (IllegalArgumentException e) {
                out.println("错误: " + e.getMessage());
            }
            return true;
        }

        if (command.startsWith(":opt")) {
            String arg = command.substring(":opt".length()).trim();
            if ("on".equals(arg)) {
                optimize = true;
            } else if ("off".equals(arg)) {
                optimize = false;
            } else {
                out.println("用法: :opt on|off");
                return true;
            }
            out.println("常量折叠: " + (optimize ? "开启" : "关闭"));
            return true;
        }

        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    /**
     * 编译并打印生成代码
     */
    void compileAndPrint(String source) {
        try {
            out.print(compiler.compileSource(source, target, optimize).getText());
        } catch (CompilationException e) {
            out.println("错误: " + e.getMessage());
        }
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h               显示此帮助");
        out.println("  :quit, :q, :exit        退出 REPL");
        out.println("  :target python|javascript  切换目标语言");
        out.println("  :opt on|off             开关常量折叠");
        out.println();
        out.println("示例:");
        out.println("  let x = 1 + 2           定义变量");
        out.println("  fn add(a, b) { return a + b }   定义函数");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
