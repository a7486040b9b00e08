package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 从模块导入：默认绑定、命名空间绑定和命名说明符
 *
 * <pre>
 * import def, { a, b as c } from mod
 * import * as ns from "./lib.trif"
 * </pre>
 */
public class ImportFromStmt extends Statement {
    private final String module;
    private final List<Specifier> specifiers;
    private final String defaultBinding;
    private final String namespaceBinding;

    public ImportFromStmt(SourceLocation location, String module, List<Specifier> specifiers,
                          String defaultBinding, String namespaceBinding) {
        super(location);
        this.module = module;
        this.specifiers = Collections.unmodifiableList(new ArrayList<Specifier>(specifiers));
        this.defaultBinding = defaultBinding;
        this.namespaceBinding = namespaceBinding;
    }

    public String getModule() {
        return module;
    }

    public List<Specifier> getSpecifiers() {
        return specifiers;
    }

    public String getDefaultBinding() {
        return defaultBinding;
    }

    public String getNamespaceBinding() {
        return namespaceBinding;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportFromStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportFromStmt)) return false;
        ImportFromStmt that = (ImportFromStmt) o;
        return module.equals(that.module)
                && specifiers.equals(that.specifiers)
                && Objects.equals(defaultBinding, that.defaultBinding)
                && Objects.equals(namespaceBinding, that.namespaceBinding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, specifiers, defaultBinding, namespaceBinding);
    }

    @Override
    public String toString() {
        return "ImportFrom(" + module + ", default=" + defaultBinding
                + ", ns=" + namespaceBinding + ", " + specifiers + ")";
    }
}
