package com.triflang.compiler.optimizer;

import com.triflang.compiler.ast.Program;

/**
 * AST 优化 pass 接口。
 */
public interface AstPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 对程序执行优化，不修改输入。
     */
    Program run(Program program);
}
