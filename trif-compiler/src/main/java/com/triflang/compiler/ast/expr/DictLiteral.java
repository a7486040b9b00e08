package com.triflang.compiler.ast.expr;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 字典字面量 { key: value, ... }，键为任意表达式
 */
public class DictLiteral extends Expression {
    private final List<Entry> entries;

    public DictLiteral(SourceLocation location, List<Entry> entries) {
        super(location);
        this.entries = Collections.unmodifiableList(new ArrayList<Entry>(entries));
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictLiteral(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictLiteral)) return false;
        return entries.equals(((DictLiteral) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Dict" + entries;
    }

    /**
     * 键值对
     */
    public static class Entry {
        private final Expression key;
        private final Expression value;

        public Entry(Expression key, Expression value) {
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry that = (Entry) o;
            return key.equals(that.key) && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, value);
        }

        @Override
        public String toString() {
            return key + ": " + value;
        }
    }
}
