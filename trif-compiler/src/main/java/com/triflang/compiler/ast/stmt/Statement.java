package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstNode;
import com.triflang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
