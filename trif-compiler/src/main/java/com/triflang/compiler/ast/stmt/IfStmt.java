package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * If 语句。else if 链表示为 elseBody 中唯一的嵌套 IfStmt
 */
public class IfStmt extends Statement {
    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> elseBody;

    public IfStmt(SourceLocation location, Expression test, List<Statement> body, List<Statement> elseBody) {
        super(location);
        this.test = test;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
        this.elseBody = Collections.unmodifiableList(new ArrayList<Statement>(elseBody));
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    /** else 分支，无 else 时为空列表 */
    public List<Statement> getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return !elseBody.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IfStmt)) return false;
        IfStmt that = (IfStmt) o;
        return test.equals(that.test) && body.equals(that.body) && elseBody.equals(that.elseBody);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, body, elseBody);
    }

    @Override
    public String toString() {
        return "If(" + test + ", " + body + ", " + elseBody + ")";
    }
}
