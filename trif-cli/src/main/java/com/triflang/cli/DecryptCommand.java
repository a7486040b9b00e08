package com.triflang.cli;

import com.triflang.compiler.compiler.CompilerConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli decrypt 子命令：还原 compile --encrypt 的输出
 */
@Command(name = "decrypt", description = "还原经 --encrypt 混淆的输出")
public class DecryptCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "混淆后的文件")
    String inputFile;

    @Option(names = "--password", required = true, description = "混淆时使用的口令")
    String password;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认打印到标准输出）")
    String output;

    @Override
    public Integer call() {
        return new CompileRunner(new CompilerConfig()).decryptFile(inputFile, password, output);
    }
}
