package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

/**
 * 默认导出表达式：{@code export default expr}
 */
public class ExportDefaultStmt extends Statement {
    private final Expression value;

    public ExportDefaultStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExportDefaultStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExportDefaultStmt)) return false;
        return value.equals(((ExportDefaultStmt) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ExportDefault(" + value + ")";
    }
}
