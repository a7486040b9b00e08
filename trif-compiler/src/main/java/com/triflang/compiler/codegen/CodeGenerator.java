package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.Program;

/**
 * 代码生成后端。
 * 实现必须无状态：每次 generate 使用独立的输出缓冲，可被多线程共享。
 */
public interface CodeGenerator {

    /** 目标语言名称 */
    String getName();

    /**
     * 把程序翻译为目标语言源码
     *
     * @throws CodegenException 内部不一致时
     */
    String generate(Program program, CodegenContext context);
}
