package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表字面量 [a, b, c]
 */
public class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<Expression>(elements));
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListLiteral)) return false;
        return elements.equals(((ListLiteral) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "List" + elements;
    }
}
