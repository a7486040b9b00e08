package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.CallExpr;

/**
 * spawn 语句：把一次函数调用交给运行时异步执行
 */
public class SpawnStmt extends Statement {
    private final CallExpr call;

    public SpawnStmt(SourceLocation location, CallExpr call) {
        super(location);
        this.call = call;
    }

    public CallExpr getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpawnStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpawnStmt)) return false;
        return call.equals(((SpawnStmt) o).call);
    }

    @Override
    public int hashCode() {
        return call.hashCode();
    }

    @Override
    public String toString() {
        return "Spawn(" + call + ")";
    }
}
