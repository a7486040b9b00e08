package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryExpr)) return false;
        BinaryExpr that = (BinaryExpr) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSourceString() + " " + right + ")";
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 逻辑
        OR("||"),
        AND("&&"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 Trif 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isLogical() {
            return this == OR || this == AND;
        }
    }
}
