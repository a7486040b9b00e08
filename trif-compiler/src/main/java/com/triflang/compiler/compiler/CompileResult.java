package com.triflang.compiler.compiler;

import java.nio.charset.StandardCharsets;

/**
 * 编译结果：文本（python / javascript）或字节（bytecode）
 */
public final class CompileResult {
    private final Target target;
    private final String text;
    private final byte[] bytes;

    private CompileResult(Target target, String text, byte[] bytes) {
        this.target = target;
        this.text = text;
        this.bytes = bytes;
    }

    public static CompileResult ofText(Target target, String text) {
        return new CompileResult(target, text, null);
    }

    public static CompileResult ofBytes(Target target, byte[] bytes) {
        return new CompileResult(target, null, bytes.clone());
    }

    public Target getTarget() {
        return target;
    }

    public boolean isBinary() {
        return bytes != null;
    }

    /**
     * 文本结果；字节结果按 UTF-8 解码
     */
    public String getText() {
        return text != null ? text : new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 字节结果；文本结果按 UTF-8 编码。返回副本
     */
    public byte[] getBytes() {
        return bytes != null ? bytes.clone() : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "CompileResult(" + target + ", " + (isBinary() ? bytes.length + " bytes" : text.length() + " chars") + ")";
    }
}
