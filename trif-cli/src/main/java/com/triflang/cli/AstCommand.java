package com.triflang.cli;

import com.triflang.compiler.compiler.CompilerConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli ast 子命令：以 JSON 输出语法树
 */
@Command(name = "ast", description = "输出语法树（JSON）")
public class AstCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件")
    String sourceFile;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认打印到标准输出）")
    String output;

    @Option(names = "--no-opt", description = "输出未经常量折叠的语法树")
    boolean noOptimize;

    @Override
    public Integer call() {
        return new CompileRunner(new CompilerConfig()).dumpAst(sourceFile, output, !noOptimize);
    }
}
