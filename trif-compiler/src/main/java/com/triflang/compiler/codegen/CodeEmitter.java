package com.triflang.compiler.codegen;

/**
 * 按行输出的代码缓冲区，跟踪缩进层级
 */
public class CodeEmitter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;

    public CodeEmitter(int indentSize) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        this.indentUnit = sb.toString();
    }

    public void indent() {
        indentLevel++;
    }

    /**
     * @throws CodegenException 缩进已为 0 时
     */
    public void dedent() {
        if (indentLevel == 0) {
            throw new CodegenException("Indentation underflow");
        }
        indentLevel--;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    /**
     * 输出一行（自动加当前缩进）；空文本输出空行且不带缩进
     */
    public void line(String text) {
        if (!text.isEmpty()) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            output.append(text);
        }
        output.append('\n');
    }

    /**
     * 追加空行（避免连续多个空行，文件开头不输出）
     */
    public void blankLine() {
        if (output.length() == 0) {
            return;
        }
        int len = output.length();
        if (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n') {
            return;
        }
        output.append('\n');
    }

    public String getOutput() {
        return output.toString();
    }
}
