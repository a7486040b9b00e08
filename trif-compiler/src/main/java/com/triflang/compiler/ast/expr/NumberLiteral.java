package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

/**
 * 数字字面量（双精度）
 */
public class NumberLiteral extends Expression {
    private final double value;

    public NumberLiteral(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    /** 值为有限整数（渲染时不带小数部分） */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && !Double.isNaN(value) && value == Math.rint(value);
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumberLiteral)) return false;
        // Double.compare 使 NaN 与自身相等，保证折叠结果可比较
        return Double.compare(value, ((NumberLiteral) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Number(" + value + ")";
    }
}
