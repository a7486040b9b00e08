package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.triflang.compiler.ast.stmt.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * 两个后端共用的发射器骨架。
 *
 * <p>语句 visit 方法直接写入 {@link CodeEmitter} 并返回 null；
 * 表达式 visit 方法返回渲染后的文本。每次生成都新建实例。</p>
 */
abstract class BaseEmitter implements AstVisitor<String, Void> {

    static final String EXPORTS_TABLE = "__trif_exports__";
    static final String DEFAULT_EXPORT = "__trif_default_export__";

    protected final CodegenContext context;
    protected final CodeEmitter out;
    private int tempCounter = 0;

    BaseEmitter(CodegenContext context) {
        this.context = context;
        this.out = new CodeEmitter(context.getIndentSize());
    }

    String emit(Program program) {
        program.accept(this, null);
        if (out.getIndentLevel() != 0) {
            throw new CodegenException("Unbalanced indentation after generation: " + out.getIndentLevel());
        }
        return out.getOutput();
    }

    // ============ 目标语言差异 ============

    protected abstract void emitPreamble(Program program);

    protected abstract void emitEpilogue(Program program);

    /** 运行时函数在目标语言中的名称 */
    protected abstract String runtimeName(RuntimeFunction fn);

    /** 语句结束符 */
    protected abstract String terminator();

    protected abstract String binaryOperator(BinaryOp op);

    protected abstract String unaryOperator(UnaryOp op);

    /** 双引号字符串字面量 */
    protected abstract String quote(String value);

    /** inf / -inf / nan 的目标语言写法 */
    protected abstract String nonFiniteNumber(double value);

    /** 负零的目标语言写法，须保留符号 */
    protected abstract String negativeZero();

    // ============ 辅助方法 ============

    protected void emitStatements(List<Statement> stmts) {
        for (Statement stmt : stmts) {
            stmt.accept(this, null);
        }
    }

    protected String expr(Expression expr) {
        return expr.accept(this, null);
    }

    protected String joinExprs(List<Expression> exprs) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr(exprs.get(i)));
        }
        return sb.toString();
    }

    protected String newTemp(String prefix) {
        return "__trif_" + prefix + "_" + (tempCounter++);
    }

    protected String runtimeCall(RuntimeFunction fn, String... args) {
        StringBuilder sb = new StringBuilder();
        sb.append(context.getRuntimeHandle()).append('.').append(runtimeName(fn)).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(args[i]);
        }
        return sb.append(')').toString();
    }

    protected CodegenException unavailable(RuntimeFunction fn) {
        return new CodegenException("Runtime function " + fn + " is not available for this target");
    }

    /** 模块名、导出名使用的单引号字面量 */
    protected static String singleQuoted(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '\'') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('\'').toString();
    }

    protected boolean needsEntryCall(Program program) {
        return context.isEmitEntryPoint() && EntryPoints.needsEntryCall(program);
    }

    /** 把 value 写入导出表 exportedName 项的完整语句 */
    protected abstract String exportTableWrite(String exportedName, String value);

    /** 为声明补充导出登记 */
    protected void emitExportRegistration(String name, boolean exported, boolean isDefault) {
        if (exported) {
            out.line(exportTableWrite(name, name));
        }
        if (isDefault) {
            out.line(DEFAULT_EXPORT + " = " + name + terminator());
        }
    }

    /**
     * 数值渲染：整数值不带小数部分
     */
    protected String renderNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return nonFiniteNumber(value);
        }
        if (value == 0.0 && Double.doubleToRawLongBits(value) != 0L) {
            return negativeZero();
        }
        if (value == Math.rint(value)) {
            if (Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return new BigDecimal(value).toPlainString();
        }
        return Double.toString(value);
    }

    // ============ 程序 ============

    @Override
    public String visitProgram(Program node, Void ctx) {
        emitPreamble(node);
        emitStatements(node.getStatements());
        emitEpilogue(node);
        return null;
    }

    // ============ 通用语句 ============

    @Override
    public String visitAssignStmt(AssignStmt node, Void ctx) {
        out.line(expr(node.getTarget()) + " = " + expr(node.getValue()) + terminator());
        return null;
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        out.line(expr(node.getExpression()) + terminator());
        return null;
    }

    @Override
    public String visitExportDefaultStmt(ExportDefaultStmt node, Void ctx) {
        out.line(DEFAULT_EXPORT + " = " + expr(node.getValue()) + terminator());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitNumberLiteral(NumberLiteral node, Void ctx) {
        return renderNumber(node.getValue());
    }

    @Override
    public String visitStringLiteral(StringLiteral node, Void ctx) {
        return quote(node.getValue());
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return "(" + expr(node.getLeft()) + " " + binaryOperator(node.getOperator()) + " "
                + expr(node.getRight()) + ")";
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        return "(" + unaryOperator(node.getOperator()) + expr(node.getOperand()) + ")";
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        return expr(node.getCallee()) + "(" + joinExprs(node.getArgs()) + ")";
    }

    @Override
    public String visitMemberExpr(MemberExpr node, Void ctx) {
        String target = expr(node.getTarget());
        // 数字字面量后直接跟 '.' 会被当作小数点
        if (node.getTarget() instanceof NumberLiteral) {
            target = "(" + target + ")";
        }
        return target + "." + node.getMember();
    }

    @Override
    public String visitListLiteral(ListLiteral node, Void ctx) {
        return "[" + joinExprs(node.getElements()) + "]";
    }
}
