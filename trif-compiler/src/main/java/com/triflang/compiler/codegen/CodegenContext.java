package com.triflang.compiler.codegen;

/**
 * 代码生成参数（不可变）
 */
public final class CodegenContext {
    public static final String DEFAULT_RUNTIME_HANDLE = "runtime";
    public static final String DEFAULT_PYTHON_RUNTIME_MODULE = "trif_lang.runtime";
    public static final String DEFAULT_JAVASCRIPT_RUNTIME_PATH = "./trif_runtime.mjs";
    public static final int DEFAULT_INDENT_SIZE = 4;

    private final String runtimeHandle;
    private final String pythonRuntimeModule;
    private final String javaScriptRuntimePath;
    private final int indentSize;
    private final boolean emitEntryPoint;

    public CodegenContext(String runtimeHandle, String pythonRuntimeModule, String javaScriptRuntimePath,
                          int indentSize, boolean emitEntryPoint) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        this.runtimeHandle = runtimeHandle;
        this.pythonRuntimeModule = pythonRuntimeModule;
        this.javaScriptRuntimePath = javaScriptRuntimePath;
        this.indentSize = indentSize;
        this.emitEntryPoint = emitEntryPoint;
    }

    public static CodegenContext defaults() {
        return new CodegenContext(DEFAULT_RUNTIME_HANDLE, DEFAULT_PYTHON_RUNTIME_MODULE,
                DEFAULT_JAVASCRIPT_RUNTIME_PATH, DEFAULT_INDENT_SIZE, true);
    }

    /** 生成代码中引用运行时对象的名称 */
    public String getRuntimeHandle() {
        return runtimeHandle;
    }

    public String getPythonRuntimeModule() {
        return pythonRuntimeModule;
    }

    public String getJavaScriptRuntimePath() {
        return javaScriptRuntimePath;
    }

    public int getIndentSize() {
        return indentSize;
    }

    /** 声明了 main 且顶层未调用时，是否追加入口调用 */
    public boolean isEmitEntryPoint() {
        return emitEntryPoint;
    }
}
