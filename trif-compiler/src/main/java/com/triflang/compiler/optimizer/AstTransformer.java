package com.triflang.compiler.optimizer;

import com.triflang.compiler.ast.AstNode;
import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * AST 恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点。
 * 子类覆盖 {@link #transformExpr} 或特定 visit 方法实现优化 pass。
 */
public class AstTransformer implements AstVisitor<AstNode, Void> {

    public Program transform(Program program) {
        return (Program) program.accept(this, null);
    }

    // ==================== 辅助方法 ====================

    protected Expression transformExpr(Expression expr) {
        if (expr == null) return null;
        return (Expression) expr.accept(this, null);
    }

    protected Statement transformStmt(Statement stmt) {
        return (Statement) stmt.accept(this, null);
    }

    /**
     * 变换语句列表，全部未变时返回原列表
     */
    protected List<Statement> transformStmts(List<Statement> stmts) {
        List<Statement> result = null;
        for (int i = 0; i < stmts.size(); i++) {
            Statement original = stmts.get(i);
            Statement transformed = transformStmt(original);
            if (transformed != original && result == null) {
                result = new ArrayList<Statement>(stmts.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result != null ? result : stmts;
    }

    protected List<Expression> transformExprs(List<Expression> exprs) {
        List<Expression> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expression original = exprs.get(i);
            Expression transformed = transformExpr(original);
            if (transformed != original && result == null) {
                result = new ArrayList<Expression>(exprs.subList(0, i));
            }
            if (result != null) {
                result.add(transformed);
            }
        }
        return result != null ? result : exprs;
    }

    // ==================== 程序 ====================

    @Override
    public AstNode visitProgram(Program node, Void ctx) {
        List<Statement> stmts = transformStmts(node.getStatements());
        if (stmts == node.getStatements()) return node;
        return new Program(node.getLocation(), stmts);
    }

    // ==================== 语句 ====================

    @Override
    public AstNode visitImportStmt(ImportStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitImportFromStmt(ImportFromStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitLetStmt(LetStmt node, Void ctx) {
        Expression init = transformExpr(node.getInitializer());
        if (init == node.getInitializer()) return node;
        return node.withInitializer(init);
    }

    @Override
    public AstNode visitAssignStmt(AssignStmt node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        Expression value = transformExpr(node.getValue());
        if (target == node.getTarget() && value == node.getValue()) return node;
        return new AssignStmt(node.getLocation(), target, value);
    }

    @Override
    public AstNode visitFunctionDecl(FunctionDecl node, Void ctx) {
        List<Statement> body = transformStmts(node.getBody());
        if (body == node.getBody()) return node;
        return node.withBody(body);
    }

    @Override
    public AstNode visitExportNamesStmt(ExportNamesStmt node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitExportDefaultStmt(ExportDefaultStmt node, Void ctx) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) return node;
        return new ExportDefaultStmt(node.getLocation(), value);
    }

    @Override
    public AstNode visitReturnStmt(ReturnStmt node, Void ctx) {
        Expression value = transformExpr(node.getValue());
        if (value == node.getValue()) return node;
        return new ReturnStmt(node.getLocation(), value);
    }

    @Override
    public AstNode visitIfStmt(IfStmt node, Void ctx) {
        Expression test = transformExpr(node.getTest());
        List<Statement> body = transformStmts(node.getBody());
        List<Statement> elseBody = transformStmts(node.getElseBody());
        if (test == node.getTest() && body == node.getBody() && elseBody == node.getElseBody()) return node;
        return new IfStmt(node.getLocation(), test, body, elseBody);
    }

    @Override
    public AstNode visitWhileStmt(WhileStmt node, Void ctx) {
        Expression test = transformExpr(node.getTest());
        List<Statement> body = transformStmts(node.getBody());
        if (test == node.getTest() && body == node.getBody()) return node;
        return new WhileStmt(node.getLocation(), test, body);
    }

    @Override
    public AstNode visitForStmt(ForStmt node, Void ctx) {
        Expression iterable = transformExpr(node.getIterable());
        List<Statement> body = transformStmts(node.getBody());
        if (iterable == node.getIterable() && body == node.getBody()) return node;
        return new ForStmt(node.getLocation(), node.getVariable(), iterable, body);
    }

    @Override
    public AstNode visitSpawnStmt(SpawnStmt node, Void ctx) {
        Expression call = transformExpr(node.getCall());
        if (call == node.getCall()) return node;
        // 调用节点的变换结果仍是调用
        return new SpawnStmt(node.getLocation(), (CallExpr) call);
    }

    @Override
    public AstNode visitExpressionStmt(ExpressionStmt node, Void ctx) {
        Expression expr = transformExpr(node.getExpression());
        if (expr == node.getExpression()) return node;
        return new ExpressionStmt(node.getLocation(), expr);
    }

    // ==================== 表达式 ====================

    @Override
    public AstNode visitIdentifier(Identifier node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitNumberLiteral(NumberLiteral node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitStringLiteral(StringLiteral node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitBooleanLiteral(BooleanLiteral node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitNullLiteral(NullLiteral node, Void ctx) {
        return node;
    }

    @Override
    public AstNode visitBinaryExpr(BinaryExpr node, Void ctx) {
        Expression left = transformExpr(node.getLeft());
        Expression right = transformExpr(node.getRight());
        if (left == node.getLeft() && right == node.getRight()) return node;
        return new BinaryExpr(node.getLocation(), left, node.getOperator(), right);
    }

    @Override
    public AstNode visitUnaryExpr(UnaryExpr node, Void ctx) {
        Expression operand = transformExpr(node.getOperand());
        if (operand == node.getOperand()) return node;
        return new UnaryExpr(node.getLocation(), node.getOperator(), operand);
    }

    @Override
    public AstNode visitCallExpr(CallExpr node, Void ctx) {
        Expression callee = transformExpr(node.getCallee());
        List<Expression> args = transformExprs(node.getArgs());
        if (callee == node.getCallee() && args == node.getArgs()) return node;
        return new CallExpr(node.getLocation(), callee, args);
    }

    @Override
    public AstNode visitMemberExpr(MemberExpr node, Void ctx) {
        Expression target = transformExpr(node.getTarget());
        if (target == node.getTarget()) return node;
        return new MemberExpr(node.getLocation(), target, node.getMember());
    }

    @Override
    public AstNode visitListLiteral(ListLiteral node, Void ctx) {
        List<Expression> elements = transformExprs(node.getElements());
        if (elements == node.getElements()) return node;
        return new ListLiteral(node.getLocation(), elements);
    }

    @Override
    public AstNode visitDictLiteral(DictLiteral node, Void ctx) {
        List<DictLiteral.Entry> entries = new ArrayList<DictLiteral.Entry>(node.getEntries().size());
        boolean changed = false;
        for (DictLiteral.Entry entry : node.getEntries()) {
            Expression key = transformExpr(entry.getKey());
            Expression value = transformExpr(entry.getValue());
            if (key != entry.getKey() || value != entry.getValue()) {
                changed = true;
                entries.add(new DictLiteral.Entry(key, value));
            } else {
                entries.add(entry);
            }
        }
        if (!changed) return node;
        return new DictLiteral(node.getLocation(), entries);
    }
}
