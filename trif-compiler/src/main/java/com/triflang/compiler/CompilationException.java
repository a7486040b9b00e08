package com.triflang.compiler;

/**
 * 编译期错误基类
 *
 * <p>词法、语法、代码生成阶段的错误都派生自此类，一旦抛出即终止本次编译，
 * 不返回任何部分结果。</p>
 */
public abstract class CompilationException extends RuntimeException {
    private final int line;
    private final int column;

    protected CompilationException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /** 出错行号（1 起始），未知时为 0 */
    public int getLine() {
        return line;
    }

    /** 出错列号（1 起始），未知时为 0 */
    public int getColumn() {
        return column;
    }
}
