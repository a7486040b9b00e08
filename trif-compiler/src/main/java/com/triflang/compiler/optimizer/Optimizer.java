package com.triflang.compiler.optimizer;

import com.triflang.compiler.ast.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AST 优化管线，按顺序执行各 pass。
 */
public class Optimizer {

    private static final Logger LOG = Logger.getLogger(Optimizer.class.getName());

    private final List<AstPass> passes = new ArrayList<>();

    public Optimizer() {
    }

    /**
     * 创建默认管线（仅常量折叠）。
     */
    public static Optimizer createDefault() {
        Optimizer optimizer = new Optimizer();
        optimizer.addPass(new ConstantFolding());
        return optimizer;
    }

    public void addPass(AstPass pass) {
        passes.add(pass);
    }

    public List<AstPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 依次执行所有 pass。输入不被修改，总是返回新的 Program 实例。
     */
    public Program optimize(Program program) {
        Program result = program;
        for (AstPass pass : passes) {
            long start = System.nanoTime();
            result = pass.run(result);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("pass %s finished in %d us",
                        pass.getName(), (System.nanoTime() - start) / 1000));
            }
        }
        return new Program(result.getLocation(), result.getStatements());
    }
}
