package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * While 循环
 */
public class WhileStmt extends Statement {
    private final Expression test;
    private final List<Statement> body;

    public WhileStmt(SourceLocation location, Expression test, List<Statement> body) {
        super(location);
        this.test = test;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WhileStmt)) return false;
        WhileStmt that = (WhileStmt) o;
        return test.equals(that.test) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, body);
    }

    @Override
    public String toString() {
        return "While(" + test + ", " + body + ")";
    }
}
