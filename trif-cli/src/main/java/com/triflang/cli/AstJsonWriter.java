package com.triflang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.triflang.compiler.ast.AstNode;
import com.triflang.compiler.ast.AstVisitor;
import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.stmt.*;

import java.util.List;

/**
 * 把 AST 转为 gson 的 JSON 树。每个节点含 "type" 与 "line"/"column"。
 */
public class AstJsonWriter implements AstVisitor<JsonElement, Void> {

    public JsonObject write(Program program) {
        return (JsonObject) program.accept(this, null);
    }

    private JsonObject node(String type, AstNode node) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", type);
        obj.addProperty("line", node.getLocation().getLine());
        obj.addProperty("column", node.getLocation().getColumn());
        return obj;
    }

    private JsonElement nullable(AstNode node) {
        return node == null ? JsonNull.INSTANCE : node.accept(this, null);
    }

    private JsonElement nullable(String value) {
        return value == null ? JsonNull.INSTANCE : new JsonPrimitive(value);
    }

    private JsonArray nodes(List<? extends AstNode> list) {
        JsonArray array = new JsonArray();
        for (AstNode item : list) {
            array.add(item.accept(this, null));
        }
        return array;
    }

    private JsonArray specifiers(List<Specifier> list) {
        JsonArray array = new JsonArray();
        for (Specifier spec : list) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", spec.getName());
            obj.addProperty("alias", spec.getAlias());
            array.add(obj);
        }
        return array;
    }

    private JsonArray strings(List<String> list) {
        JsonArray array = new JsonArray();
        for (String s : list) {
            array.add(s);
        }
        return array;
    }

    @Override
    public JsonElement visitProgram(Program node, Void ctx) {
        JsonObject obj = node("Program", node);
        obj.add("body", nodes(node.getStatements()));
        return obj;
    }

    // ============ 语句 ============

    @Override
    public JsonElement visitImportStmt(ImportStmt node, Void ctx) {
        JsonObject obj = node("Import", node);
        obj.addProperty("module", node.getModule());
        obj.addProperty("path", node.isPath());
        obj.add("alias", nullable(node.getAlias()));
        return obj;
    }

    @Override
    public JsonElement visitImportFromStmt(ImportFromStmt node, Void ctx) {
        JsonObject obj = node("ImportFrom", node);
        obj.addProperty("module", node.getModule());
        obj.add("default", nullable(node.getDefaultBinding()));
        obj.add("namespace", nullable(node.getNamespaceBinding()));
        obj.add("names", specifiers(node.getSpecifiers()));
        return obj;
    }

    @Override
    public JsonElement visitLetStmt(LetStmt node, Void ctx) {
        JsonObject obj = node("Let", node);
        obj.addProperty("name", node.getName());
        obj.addProperty("mutable", node.isMutable());
        obj.addProperty("exported", node.isExported());
        obj.addProperty("isDefault", node.isDefault());
        obj.add("value", node.getInitializer().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitAssignStmt(AssignStmt node, Void ctx) {
        JsonObject obj = node("Assign", node);
        obj.add("target", node.getTarget().accept(this, null));
        obj.add("value", node.getValue().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitFunctionDecl(FunctionDecl node, Void ctx) {
        JsonObject obj = node("FunctionDef", node);
        obj.addProperty("name", node.getName());
        obj.add("params", strings(node.getParams()));
        obj.addProperty("exported", node.isExported());
        obj.addProperty("isDefault", node.isDefault());
        obj.add("body", nodes(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitExportNamesStmt(ExportNamesStmt node, Void ctx) {
        JsonObject obj = node("ExportNames", node);
        obj.add("names", specifiers(node.getSpecifiers()));
        obj.add("source", nullable(node.getSourceModule()));
        return obj;
    }

    @Override
    public JsonElement visitExportDefaultStmt(ExportDefaultStmt node, Void ctx) {
        JsonObject obj = node("ExportDefault", node);
        obj.add("value", node.getValue().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitReturnStmt(ReturnStmt node, Void ctx) {
        JsonObject obj = node("Return", node);
        obj.add("value", nullable(node.getValue()));
        return obj;
    }

    @Override
    public JsonElement visitIfStmt(IfStmt node, Void ctx) {
        JsonObject obj = node("If", node);
        obj.add("test", node.getTest().accept(this, null));
        obj.add("body", nodes(node.getBody()));
        obj.add("orelse", nodes(node.getElseBody()));
        return obj;
    }

    @Override
    public JsonElement visitWhileStmt(WhileStmt node, Void ctx) {
        JsonObject obj = node("While", node);
        obj.add("test", node.getTest().accept(this, null));
        obj.add("body", nodes(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitForStmt(ForStmt node, Void ctx) {
        JsonObject obj = node("For", node);
        obj.addProperty("target", node.getVariable());
        obj.add("iter", node.getIterable().accept(this, null));
        obj.add("body", nodes(node.getBody()));
        return obj;
    }

    @Override
    public JsonElement visitSpawnStmt(SpawnStmt node, Void ctx) {
        JsonObject obj = node("Spawn", node);
        obj.add("call", node.getCall().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitExpressionStmt(ExpressionStmt node, Void ctx) {
        JsonObject obj = node("Expr", node);
        obj.add("value", node.getExpression().accept(this, null));
        return obj;
    }

    // ============ 表达式 ============

    @Override
    public JsonElement visitIdentifier(Identifier node, Void ctx) {
        JsonObject obj = node("Name", node);
        obj.addProperty("id", node.getName());
        return obj;
    }

    @Override
    public JsonElement visitNumberLiteral(NumberLiteral node, Void ctx) {
        JsonObject obj = node("Number", node);
        double value = node.getValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            // JSON 无法表示非有限数
            obj.addProperty("value", Double.toString(value));
        } else {
            obj.addProperty("value", value);
        }
        return obj;
    }

    @Override
    public JsonElement visitStringLiteral(StringLiteral node, Void ctx) {
        JsonObject obj = node("String", node);
        obj.addProperty("value", node.getValue());
        return obj;
    }

    @Override
    public JsonElement visitBooleanLiteral(BooleanLiteral node, Void ctx) {
        JsonObject obj = node("Boolean", node);
        obj.addProperty("value", node.getValue());
        return obj;
    }

    @Override
    public JsonElement visitNullLiteral(NullLiteral node, Void ctx) {
        return node("Null", node);
    }

    @Override
    public JsonElement visitBinaryExpr(BinaryExpr node, Void ctx) {
        JsonObject obj = node("BinaryOp", node);
        obj.addProperty("op", node.getOperator().toSourceString());
        obj.add("left", node.getLeft().accept(this, null));
        obj.add("right", node.getRight().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitUnaryExpr(UnaryExpr node, Void ctx) {
        JsonObject obj = node("UnaryOp", node);
        obj.addProperty("op", node.getOperator().toSourceString());
        obj.add("operand", node.getOperand().accept(this, null));
        return obj;
    }

    @Override
    public JsonElement visitCallExpr(CallExpr node, Void ctx) {
        JsonObject obj = node("Call", node);
        obj.add("func", node.getCallee().accept(this, null));
        obj.add("args", nodes(node.getArgs()));
        return obj;
    }

    @Override
    public JsonElement visitMemberExpr(MemberExpr node, Void ctx) {
        JsonObject obj = node("Attribute", node);
        obj.add("value", node.getTarget().accept(this, null));
        obj.addProperty("attr", node.getMember());
        return obj;
    }

    @Override
    public JsonElement visitListLiteral(ListLiteral node, Void ctx) {
        JsonObject obj = node("List", node);
        obj.add("elements", nodes(node.getElements()));
        return obj;
    }

    @Override
    public JsonElement visitDictLiteral(DictLiteral node, Void ctx) {
        JsonObject obj = node("Dict", node);
        JsonArray pairs = new JsonArray();
        for (DictLiteral.Entry entry : node.getEntries()) {
            JsonArray pair = new JsonArray();
            pair.add(entry.getKey().accept(this, null));
            pair.add(entry.getValue().accept(this, null));
            pairs.add(pair);
        }
        obj.add("pairs", pairs);
        return obj;
    }
}
