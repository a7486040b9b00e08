package com.triflang.compiler.compiler;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.codegen.CodeGenerator;
import com.triflang.compiler.codegen.JavaScriptGenerator;
import com.triflang.compiler.codegen.PythonGenerator;
import com.triflang.compiler.lexer.Lexer;
import com.triflang.compiler.lexer.Token;
import com.triflang.compiler.optimizer.Optimizer;
import com.triflang.compiler.parser.Parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Trif 编译器入口
 *
 * <p>源码 → Token → AST →（可选）常量折叠 → 目标代码。各阶段的异常
 * （{@link com.triflang.compiler.lexer.LexException}、
 * {@link com.triflang.compiler.parser.ParseException}、
 * {@link com.triflang.compiler.codegen.CodegenException}）原样抛出。</p>
 *
 * <p>实例不持有可变状态，可在多个线程间共享。</p>
 */
public class TrifCompiler {

    private static final Logger LOG = Logger.getLogger(TrifCompiler.class.getName());

    private final CompilerConfig config;
    private final CodeGenerator pythonGenerator = new PythonGenerator();
    private final CodeGenerator javaScriptGenerator = new JavaScriptGenerator();

    public TrifCompiler() {
        this(CompilerConfig.defaults());
    }

    public TrifCompiler(CompilerConfig config) {
        this.config = config;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    /**
     * 词法分析
     */
    public List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source).scanTokens();
        LOG.fine("lexed " + tokens.size() + " tokens from " + config.getFileName());
        return tokens;
    }

    /**
     * 词法 + 语法分析
     */
    public Program parse(String source) {
        Program program = new Parser(tokenize(source), config.getFileName()).parse();
        LOG.fine("parsed " + program.getStatements().size() + " top-level statements");
        return program;
    }

    /**
     * 编译源码字符串
     *
     * @param optimize 是否执行常量折叠
     */
    public CompileResult compileSource(String source, Target target, boolean optimize) {
        Program program = parse(source);
        if (optimize) {
            program = Optimizer.createDefault().optimize(program);
        }
        return generate(program, target);
    }

    /**
     * 从已有 AST 生成目标代码
     */
    public CompileResult generate(Program program, Target target) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("generating " + target + " for " + config.getFileName());
        }
        switch (target) {
            case PYTHON:
                return CompileResult.ofText(target, pythonGenerator.generate(program, config.toCodegenContext()));
            case JAVASCRIPT:
                return CompileResult.ofText(target, javaScriptGenerator.generate(program, config.toCodegenContext()));
            case BYTECODE:
                String python = pythonGenerator.generate(program, config.toCodegenContext());
                return CompileResult.ofBytes(target, python.getBytes(StandardCharsets.UTF_8));
            default:
                throw new IllegalArgumentException("Unsupported target: " + target);
        }
    }

    /**
     * 读取 UTF-8 源文件并编译。位置信息使用该文件名，不修改当前配置。
     *
     * @throws IOException 读取失败
     */
    public CompileResult compileFile(Path path, Target target, boolean optimize) throws IOException {
        String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        CompilerConfig fileConfig = copyConfig().setFileName(path.toString());
        return new TrifCompiler(fileConfig).compileSource(source, target, optimize);
    }

    /**
     * 混淆输出文本，见 {@link OutputObfuscator}
     */
    public String encryptOutput(String text, String passphrase) {
        return OutputObfuscator.encrypt(text, passphrase);
    }

    public String decryptOutput(String encoded, String passphrase) {
        return OutputObfuscator.decrypt(encoded, passphrase);
    }

    private CompilerConfig copyConfig() {
        return new CompilerConfig()
                .setFileName(config.getFileName())
                .setIndentSize(config.getIndentSize())
                .setRuntimeHandle(config.getRuntimeHandle())
                .setPythonRuntimeModule(config.getPythonRuntimeModule())
                .setJavaScriptRuntimePath(config.getJavaScriptRuntimePath())
                .setEmitEntryPoint(config.isEmitEntryPoint());
    }
}
