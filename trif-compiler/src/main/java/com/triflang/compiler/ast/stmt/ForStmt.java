package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * For-in 循环：{@code for x in items { ... }}
 */
public class ForStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final List<Statement> body;

    public ForStmt(SourceLocation location, String variable, Expression iterable, List<Statement> body) {
        super(location);
        this.variable = variable;
        this.iterable = iterable;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ForStmt)) return false;
        ForStmt that = (ForStmt) o;
        return variable.equals(that.variable) && iterable.equals(that.iterable) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, iterable, body);
    }

    @Override
    public String toString() {
        return "For(" + variable + " in " + iterable + ", " + body + ")";
    }
}
