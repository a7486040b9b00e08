package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 成员访问表达式：target.member
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberExpr)) return false;
        MemberExpr that = (MemberExpr) o;
        return target.equals(that.target) && member.equals(that.member);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, member);
    }

    @Override
    public String toString() {
        return target + "." + member;
    }
}
