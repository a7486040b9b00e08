package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

/**
 * 布尔字面量
 */
public class BooleanLiteral extends Expression {
    private final boolean value;

    public BooleanLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBooleanLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanLiteral)) return false;
        return value == ((BooleanLiteral) o).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return "Boolean(" + value + ")";
    }
}
