package com.triflang.compiler.codegen;

/**
 * 生成代码调用的运行时接口。
 * 两个目标语言的命名风格不同；为 null 表示该目标没有对应函数。
 */
public enum RuntimeFunction {
    IMPORT_MODULE("import_module", "importModule"),
    ITERATE("iterate", "iterate"),
    SPAWN("spawn", "spawn"),
    EXTRACT_EXPORT("extract_export", "extractExport"),
    EXTRACT_DEFAULT("extract_default", "extractDefault"),
    REGISTER_EXPORTS("register_module_exports", "registerModuleExports"),
    MAKE_MAP(null, "makeMap");

    private final String pythonName;
    private final String javaScriptName;

    RuntimeFunction(String pythonName, String javaScriptName) {
        this.pythonName = pythonName;
        this.javaScriptName = javaScriptName;
    }

    public String getPythonName() {
        return pythonName;
    }

    public String getJavaScriptName() {
        return javaScriptName;
    }
}
