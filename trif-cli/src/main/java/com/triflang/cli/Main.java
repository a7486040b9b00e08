package com.triflang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Trif CLI 入口点（picocli）。不带子命令时进入 REPL。
 */
@Command(name = "trif", version = "Trif v0.1.0",
         mixinStandardHelpOptions = true,
         description = "Trif 源到源编译器",
         subcommands = {CompileCommand.class, AstCommand.class, DecryptCommand.class})
public class Main implements Callable<Integer> {

    @Option(names = "--verbose", description = "输出编译各阶段的调试日志到 stderr")
    void setVerbose(boolean verbose) {
        if (verbose) {
            enableVerboseLogging();
        }
    }

    @Override
    public Integer call() {
        new ReplRunner().run();
        return 0;
    }

    /**
     * 配置根 logger：FINE 级别输出到 stderr
     */
    static void enableVerboseLogging() {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.FINE);
        rootLogger.addHandler(stderrHandler);
        Logger.getLogger("com.triflang").setLevel(Level.FINE);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
