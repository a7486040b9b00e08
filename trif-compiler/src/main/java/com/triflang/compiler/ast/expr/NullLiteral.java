package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

/**
 * null 字面量
 */
public class NullLiteral extends Expression {

    public NullLiteral(SourceLocation location) {
        super(location);
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNullLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NullLiteral;
    }

    @Override
    public int hashCode() {
        return NullLiteral.class.hashCode();
    }

    @Override
    public String toString() {
        return "Null";
    }
}
