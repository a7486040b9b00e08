package com.triflang.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点构造后不可变；{@code equals}/{@code hashCode} 只比较结构，忽略源码位置。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
