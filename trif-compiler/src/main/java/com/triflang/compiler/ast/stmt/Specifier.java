package com.triflang.compiler.ast.stmt;

import java.util.Objects;

/**
 * 导入/导出说明符：{@code name [as alias]}
 *
 * <p>导入时 name 为源模块中的导出名；导出时 name 为本地绑定名，alias 为对外名称。
 * 未写 {@code as} 时 alias 等于 name，因此 {@code a} 与 {@code a as a} 相等。</p>
 */
public class Specifier {
    private final String name;
    private final String alias;

    public Specifier(String name, String alias) {
        this.name = name;
        this.alias = alias != null ? alias : name;
    }

    public Specifier(String name) {
        this(name, null);
    }

    public String getName() {
        return name;
    }

    /** 别名，未指定时与 name 相同 */
    public String getAlias() {
        return alias;
    }

    /** 绑定或导出时实际使用的名字 */
    public String getEffectiveName() {
        return alias;
    }

    public boolean hasExplicitAlias() {
        return !alias.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Specifier)) return false;
        Specifier that = (Specifier) o;
        return name.equals(that.name) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias);
    }

    @Override
    public String toString() {
        return hasExplicitAlias() ? name + " as " + alias : name;
    }
}
