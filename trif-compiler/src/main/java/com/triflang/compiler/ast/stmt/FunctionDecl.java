package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数声明：{@code fn name(a, b) { ... }}
 */
public class FunctionDecl extends Statement {
    /** 匿名默认导出函数使用的名称 */
    public static final String DEFAULT_EXPORT_NAME = "_default_export";

    private final String name;
    private final List<String> params;
    private final List<Statement> body;
    private final boolean exported;
    private final boolean isDefault;

    public FunctionDecl(SourceLocation location, String name, List<String> params, List<Statement> body,
                        boolean exported, boolean isDefault) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<String>(params));
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
        this.exported = exported;
        this.isDefault = isDefault;
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isExported() {
        return exported;
    }

    public boolean isDefault() {
        return isDefault;
    }

    /** 函数体最后一条语句是否为 return */
    public boolean endsWithReturn() {
        return !body.isEmpty() && body.get(body.size() - 1) instanceof ReturnStmt;
    }

    public FunctionDecl withBody(List<Statement> newBody) {
        return new FunctionDecl(location, name, params, newBody, exported, isDefault);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionDecl)) return false;
        FunctionDecl that = (FunctionDecl) o;
        return exported == that.exported && isDefault == that.isDefault
                && name.equals(that.name) && params.equals(that.params) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params, body, exported, isDefault);
    }

    @Override
    public String toString() {
        return "Function(" + name + params + " " + body + ")";
    }
}
