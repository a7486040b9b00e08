package com.triflang.compiler.ast.stmt;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 整模块导入：{@code import std.io [as io]} 或 {@code import "./lib.trif" [as lib]}
 */
public class ImportStmt extends Statement {
    private final String module;
    private final boolean path;
    private final String alias;

    public ImportStmt(SourceLocation location, String module, boolean path, String alias) {
        super(location);
        this.module = module;
        this.path = path;
        this.alias = alias;
    }

    public String getModule() {
        return module;
    }

    /** 模块以字符串路径给出 */
    public boolean isPath() {
        return path;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * 本地绑定名。
     * 无别名时：点分模块名的 '.' 替换为 '_'；路径取不带扩展名的文件名并清洗为合法标识符。
     */
    public String getLocalName() {
        if (alias != null) {
            return alias;
        }
        if (!path) {
            return module.replace('.', '_');
        }
        String base = module;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        return sanitizeIdentifier(base);
    }

    private static String sanitizeIdentifier(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9') || c == '_';
            sb.append(ok ? c : '_');
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportStmt(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportStmt)) return false;
        ImportStmt that = (ImportStmt) o;
        return path == that.path && module.equals(that.module) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, path, alias);
    }

    @Override
    public String toString() {
        return "Import(" + module + (alias != null ? " as " + alias : "") + ")";
    }
}
