package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /** 被调用者是否为给定名称的标识符 */
    public boolean isCallTo(String name) {
        return callee instanceof Identifier && ((Identifier) callee).getName().equals(name);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallExpr)) return false;
        CallExpr that = (CallExpr) o;
        return callee.equals(that.callee) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, args);
    }

    @Override
    public String toString() {
        return "Call(" + callee + ", " + args + ")";
    }
}
