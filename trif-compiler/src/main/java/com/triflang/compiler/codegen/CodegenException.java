package com.triflang.compiler.codegen;

import com.triflang.compiler.CompilationException;
import com.triflang.compiler.ast.SourceLocation;

/**
 * 代码生成内部错误（如缩进失衡），正常输入不会触发
 */
public class CodegenException extends CompilationException {

    public CodegenException(String message) {
        super(message, 0, 0);
    }

    public CodegenException(String message, SourceLocation location) {
        super(message + " at " + location, location.getLine(), location.getColumn());
    }
}
