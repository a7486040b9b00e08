package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.stmt.*;

import java.util.List;

/**
 * 入口函数检测：顶层声明的 main 与顶层代码中对 main 的无条件调用。
 * 函数体、控制流分支、循环体以及 {@code &&}/{@code ||} 右操作数里的调用都不一定执行，不计入。
 */
public final class EntryPoints {

    public static final String MAIN = "main";

    private EntryPoints() {
    }

    /** 是否在顶层声明了 main 函数 */
    public static boolean declaresMain(Program program) {
        for (Statement stmt : program.getStatements()) {
            if (stmt instanceof FunctionDecl && MAIN.equals(((FunctionDecl) stmt).getName())) {
                return true;
            }
        }
        return false;
    }

    /** 顶层代码是否无条件地调用 main(...) */
    public static boolean callsMainAtTopLevel(Program program) {
        return anyStatementCallsMain(program.getStatements());
    }

    /** 需要由生成器追加一次 main() 调用 */
    public static boolean needsEntryCall(Program program) {
        return declaresMain(program) && !callsMainAtTopLevel(program);
    }

    private static boolean anyStatementCallsMain(List<Statement> stmts) {
        for (Statement stmt : stmts) {
            if (statementCallsMain(stmt)) return true;
        }
        return false;
    }

    private static boolean statementCallsMain(Statement stmt) {
        if (stmt instanceof ExpressionStmt) {
            return callsMain(((ExpressionStmt) stmt).getExpression());
        }
        if (stmt instanceof LetStmt) {
            return callsMain(((LetStmt) stmt).getInitializer());
        }
        if (stmt instanceof AssignStmt) {
            AssignStmt assign = (AssignStmt) stmt;
            return callsMain(assign.getTarget()) || callsMain(assign.getValue());
        }
        if (stmt instanceof ExportDefaultStmt) {
            return callsMain(((ExportDefaultStmt) stmt).getValue());
        }
        if (stmt instanceof SpawnStmt) {
            return callsMain(((SpawnStmt) stmt).getCall());
        }
        // 条件与可迭代对象总会求值一次，分支和循环体则不一定
        if (stmt instanceof IfStmt) {
            return callsMain(((IfStmt) stmt).getTest());
        }
        if (stmt instanceof WhileStmt) {
            return callsMain(((WhileStmt) stmt).getTest());
        }
        if (stmt instanceof ForStmt) {
            return callsMain(((ForStmt) stmt).getIterable());
        }
        if (stmt instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) stmt;
            return ret.hasValue() && callsMain(ret.getValue());
        }
        // FunctionDecl 体、import、export 名单不计
        return false;
    }

    private static boolean callsMain(Expression expr) {
        if (expr instanceof CallExpr) {
            CallExpr call = (CallExpr) expr;
            if (call.isCallTo(MAIN)) return true;
            if (callsMain(call.getCallee())) return true;
            for (Expression arg : call.getArgs()) {
                if (callsMain(arg)) return true;
            }
            return false;
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) expr;
            if (bin.getOperator() == BinaryExpr.BinaryOp.AND || bin.getOperator() == BinaryExpr.BinaryOp.OR) {
                // 短路：右操作数可能不求值
                return callsMain(bin.getLeft());
            }
            return callsMain(bin.getLeft()) || callsMain(bin.getRight());
        }
        if (expr instanceof UnaryExpr) {
            return callsMain(((UnaryExpr) expr).getOperand());
        }
        if (expr instanceof MemberExpr) {
            return callsMain(((MemberExpr) expr).getTarget());
        }
        if (expr instanceof ListLiteral) {
            for (Expression element : ((ListLiteral) expr).getElements()) {
                if (callsMain(element)) return true;
            }
            return false;
        }
        if (expr instanceof DictLiteral) {
            for (DictLiteral.Entry entry : ((DictLiteral) expr).getEntries()) {
                if (callsMain(entry.getKey()) || callsMain(entry.getValue())) return true;
            }
            return false;
        }
        return false;
    }
}
