package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 命名导出：{@code export { a, b as c } [from mod]}
 *
 * <p>说明符的 name 为本地名（或再导出时源模块中的名称），有效名为对外名称。</p>
 */
public class ExportNamesStmt extends Statement {
    private final List<Specifier> specifiers;
    private final String sourceModule;

    public ExportNamesStmt(SourceLocation location, List<Specifier> specifiers, String sourceModule) {
        super(location);
        this.specifiers = Collections.unmodifiableList(new ArrayList<Specifier>(specifiers));
        this.sourceModule = sourceModule;
    }

    public List<Specifier> getSpecifiers() {
        return specifiers;
    }

    /** 再导出的源模块，本地导出时为 null */
    public String getSourceModule() {
        return sourceModule;
    }

    public boolean isReExport() {
        return sourceModule != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExportNamesStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExportNamesStmt)) return false;
        ExportNamesStmt that = (ExportNamesStmt) o;
        return specifiers.equals(that.specifiers) && Objects.equals(sourceModule, that.sourceModule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specifiers, sourceModule);
    }

    @Override
    public String toString() {
        return "Export(" + specifiers + (sourceModule != null ? " from " + sourceModule : "") + ")";
    }
}
