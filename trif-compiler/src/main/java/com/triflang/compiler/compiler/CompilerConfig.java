package com.triflang.compiler.compiler;

import com.triflang.compiler.codegen.CodegenContext;

/**
 * 编译器配置
 */
public class CompilerConfig {
    private String fileName = "<input>";
    private int indentSize = CodegenContext.DEFAULT_INDENT_SIZE;
    private String runtimeHandle = CodegenContext.DEFAULT_RUNTIME_HANDLE;
    private String pythonRuntimeModule = CodegenContext.DEFAULT_PYTHON_RUNTIME_MODULE;
    private String javaScriptRuntimePath = CodegenContext.DEFAULT_JAVASCRIPT_RUNTIME_PATH;
    private boolean emitEntryPoint = true;

    public CompilerConfig() {
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    /** 源文件名，用于 AST 位置信息 */
    public String getFileName() {
        return fileName;
    }

    public CompilerConfig setFileName(String fileName) {
        this.fileName = fileName;
        return this;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public CompilerConfig setIndentSize(int indentSize) {
        this.indentSize = indentSize;
        return this;
    }

    public String getRuntimeHandle() {
        return runtimeHandle;
    }

    public CompilerConfig setRuntimeHandle(String runtimeHandle) {
        this.runtimeHandle = runtimeHandle;
        return this;
    }

    public String getPythonRuntimeModule() {
        return pythonRuntimeModule;
    }

    public CompilerConfig setPythonRuntimeModule(String pythonRuntimeModule) {
        this.pythonRuntimeModule = pythonRuntimeModule;
        return this;
    }

    public String getJavaScriptRuntimePath() {
        return javaScriptRuntimePath;
    }

    public CompilerConfig setJavaScriptRuntimePath(String javaScriptRuntimePath) {
        this.javaScriptRuntimePath = javaScriptRuntimePath;
        return this;
    }

    public boolean isEmitEntryPoint() {
        return emitEntryPoint;
    }

    public CompilerConfig setEmitEntryPoint(boolean emitEntryPoint) {
        this.emitEntryPoint = emitEntryPoint;
        return this;
    }

    /** 生成一份不可变的代码生成上下文快照 */
    public CodegenContext toCodegenContext() {
        return new CodegenContext(runtimeHandle, pythonRuntimeModule, javaScriptRuntimePath,
                indentSize, emitEntryPoint);
    }
}
