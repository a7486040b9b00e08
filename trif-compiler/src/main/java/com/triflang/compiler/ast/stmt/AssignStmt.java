package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * 赋值语句，目标只能是 Identifier 或 MemberExpr
 */
public class AssignStmt extends Statement {
    private final Expression target;
    private final Expression value;

    public AssignStmt(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssignStmt)) return false;
        AssignStmt that = (AssignStmt) o;
        return target.equals(that.target) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value);
    }

    @Override
    public String toString() {
        return "Assign(" + target + " = " + value + ")";
    }
}
