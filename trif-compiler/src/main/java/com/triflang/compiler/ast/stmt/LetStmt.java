package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.Expression;

import java.util.Objects;

/**
 * 变量声明：let（可变）或 const（不可变），可带 export / export default
 */
public class LetStmt extends Statement {
    private final String name;
    private final Expression initializer;
    private final boolean mutable;
    private final boolean exported;
    private final boolean isDefault;

    public LetStmt(SourceLocation location, String name, Expression initializer,
                   boolean mutable, boolean exported, boolean isDefault) {
        super(location);
        this.name = name;
        this.initializer = initializer;
        this.mutable = mutable;
        this.exported = exported;
        this.isDefault = isDefault;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean isMutable() {
        return mutable;
    }

    public boolean isExported() {
        return exported;
    }

    public boolean isDefault() {
        return isDefault;
    }

    /** 替换初始值，其余属性不变 */
    public LetStmt withInitializer(Expression newInitializer) {
        return new LetStmt(location, name, newInitializer, mutable, exported, isDefault);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLetStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LetStmt)) return false;
        LetStmt that = (LetStmt) o;
        return mutable == that.mutable && exported == that.exported && isDefault == that.isDefault
                && name.equals(that.name) && initializer.equals(that.initializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initializer, mutable, exported, isDefault);
    }

    @Override
    public String toString() {
        return (mutable ? "Let(" : "Const(") + name + " = " + initializer + ")";
    }
}
