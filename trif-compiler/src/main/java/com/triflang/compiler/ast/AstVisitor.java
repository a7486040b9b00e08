package com.triflang.compiler.ast;

import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法均为抽象方法：新增节点类型时，每个后端、优化器和导出工具都必须在编译期补齐处理。</p>
 */
public interface AstVisitor<R, C> {

    R visitProgram(Program node, C ctx);

    // ============ 语句 ============

    R visitImportStmt(ImportStmt node, C ctx);

    R visitImportFromStmt(ImportFromStmt node, C ctx);

    R visitLetStmt(LetStmt node, C ctx);

    R visitAssignStmt(AssignStmt node, C ctx);

    R visitFunctionDecl(FunctionDecl node, C ctx);

    R visitExportNamesStmt(ExportNamesStmt node, C ctx);

    R visitExportDefaultStmt(ExportDefaultStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitSpawnStmt(SpawnStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    // ============ 表达式 ============

    R visitIdentifier(Identifier node, C ctx);

    R visitNumberLiteral(NumberLiteral node, C ctx);

    R visitStringLiteral(StringLiteral node, C ctx);

    R visitBooleanLiteral(BooleanLiteral node, C ctx);

    R visitNullLiteral(NullLiteral node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitListLiteral(ListLiteral node, C ctx);

    R visitDictLiteral(DictLiteral node, C ctx);
}
