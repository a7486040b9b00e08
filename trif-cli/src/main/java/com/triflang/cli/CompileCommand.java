package com.triflang.cli;

import com.triflang.compiler.compiler.CompilerConfig;
import com.triflang.compiler.compiler.Target;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：编译到 Python / JavaScript / bytecode
 */
@Command(name = "compile", description = "编译 Trif 源文件")
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件")
    String sourceFile;

    @Option(names = {"-t", "--target"}, defaultValue = "python",
            description = "目标：python, javascript, bytecode（默认 python）")
    String target;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认替换源文件扩展名）")
    String output;

    @Option(names = "--no-opt", description = "关闭常量折叠")
    boolean noOptimize;

    @Option(names = "--encrypt", paramLabel = "<passphrase>", description = "用口令混淆输出")
    String passphrase;

    @Option(names = "--indent", defaultValue = "4", description = "缩进宽度（默认 4）")
    int indentSize;

    @Option(names = "--no-entry", description = "不自动追加 main() 入口调用")
    boolean noEntry;

    @Override
    public Integer call() {
        Target resolved;
        try {
            resolved = Target.fromName(target);
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return 1;
        }
        CompilerConfig config = new CompilerConfig()
                .setIndentSize(indentSize)
                .setEmitEntryPoint(!noEntry);
        return new CompileRunner(config).compileFile(sourceFile, resolved, output, !noOptimize, passphrase);
    }
}
