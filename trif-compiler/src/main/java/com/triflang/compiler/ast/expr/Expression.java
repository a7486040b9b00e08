package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstNode;
import com.triflang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /** 是否为字面量（数字、字符串、布尔、null） */
    public boolean isLiteral() {
        return false;
    }
}
