package com.triflang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.triflang.compiler.CompilationException;
import com.triflang.compiler.ast.Program;
import com.triflang.compiler.compiler.CompileResult;
import com.triflang.compiler.compiler.CompilerConfig;
import com.triflang.compiler.compiler.Target;
import com.triflang.compiler.compiler.TrifCompiler;
import com.triflang.compiler.optimizer.Optimizer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * 编译、语法树导出、解混淆执行器
 *
 * <p>所有错误在此处统一打印为 "错误: ..." 并返回退出码 1。</p>
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    private final CompilerConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public CompileRunner(CompilerConfig config) {
        this(config, System.out, System.err);
    }

    CompileRunner(CompilerConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件；passphrase 非空时混淆输出文本
     */
    public int compileFile(String filePath, Target target, String outputPath, boolean optimize, String passphrase) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        Path outPath = outputPath != null ? Paths.get(outputPath) : defaultOutputPath(path, target.getExtension());
        if (sameFile(path, outPath)) {
            err.println("错误: 输出路径与源文件相同 - " + outPath);
            return 1;
        }
        try {
            TrifCompiler compiler = new TrifCompiler(config);
            CompileResult result = compiler.compileFile(path, target, optimize);

            if (passphrase != null) {
                String encrypted = compiler.encryptOutput(result.getText(), passphrase);
                Files.write(outPath, encrypted.getBytes(StandardCharsets.UTF_8));
            } else {
                Files.write(outPath, result.getBytes());
            }
            LOG.fine("wrote " + outPath);
            out.println("编译成功: " + outPath);
            return 0;
        } catch (CompilationException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 读写文件失败 - " + e.getMessage());
            return 1;
        }
    }

    /**
     * 以 JSON 导出语法树；outputPath 为 null 时打印到标准输出
     */
    public int dumpAst(String filePath, String outputPath, boolean optimize) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            CompilerConfig fileConfig = new CompilerConfig().setFileName(path.toString());
            Program program = new TrifCompiler(fileConfig).parse(source);
            if (optimize) {
                program = Optimizer.createDefault().optimize(program);
            }

            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            String json = gson.toJson(new AstJsonWriter().write(program));
            writeOrPrint(json, outputPath);
            return 0;
        } catch (CompilationException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 读写文件失败 - " + e.getMessage());
            return 1;
        }
    }

    /**
     * 解混淆；outputPath 为 null 时打印到标准输出
     */
    public int decryptFile(String filePath, String passphrase, String outputPath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return 1;
        }

        try {
            String encoded = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            String text = new TrifCompiler(config).decryptOutput(encoded, passphrase);
            writeOrPrint(text, outputPath);
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 读写文件失败 - " + e.getMessage());
            return 1;
        }
    }

    private void writeOrPrint(String text, String outputPath) throws IOException {
        if (outputPath == null) {
            out.print(text);
            if (!text.endsWith("\n")) {
                out.println();
            }
            out.flush();
        } else {
            Files.write(Paths.get(outputPath), text.getBytes(StandardCharsets.UTF_8));
        }
    }

    static boolean sameFile(Path source, Path output) {
        return source.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize());
    }

    /**
     * 默认输出路径：替换源文件扩展名
     */
    static Path defaultOutputPath(Path source, String extension) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return source.resolveSibling(base + extension);
    }
}
