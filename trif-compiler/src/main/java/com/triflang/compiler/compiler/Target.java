package com.triflang.compiler.compiler;

import java.util.Locale;

/**
 * 编译目标
 */
public enum Target {
    PYTHON("python", ".py"),
    JAVASCRIPT("javascript", ".js"),
    /** Python 源码的 UTF-8 字节，不是独立的虚拟机格式 */
    BYTECODE("bytecode", ".trifc");

    private final String name;
    private final String extension;

    Target(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    /** 输出文件扩展名（含点） */
    public String getExtension() {
        return extension;
    }

    public boolean isBinary() {
        return this == BYTECODE;
    }

    /**
     * 按名称查找目标（忽略大小写），接受 js / py 简写
     *
     * @throws IllegalArgumentException 未知目标
     */
    public static Target fromName(String name) {
        String lower = name.trim().toLowerCase(Locale.ROOT);
        if ("py".equals(lower)) return PYTHON;
        if ("js".equals(lower)) return JAVASCRIPT;
        for (Target target : values()) {
            if (target.name.equals(lower)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target '" + name + "', expected python, javascript or bytecode");
    }

    @Override
    public String toString() {
        return name;
    }
}
