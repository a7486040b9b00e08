package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.triflang.compiler.ast.stmt.*;

import java.util.List;

/**
 * JavaScript（ES module）后端
 *
 * <p>导出表为 {@code Map}，模块末尾同时以 ES 导出暴露；字典字面量经由 {@code runtime.makeMap}。</p>
 */
public class JavaScriptGenerator implements CodeGenerator {

    @Override
    public String getName() {
        return "javascript";
    }

    @Override
    public String generate(Program program, CodegenContext context) {
        return new Emitter(context).emit(program);
    }

    private static final class Emitter extends BaseEmitter {

        private static final String MAIN_MODULE_TEST =
                "process.argv[1] !== undefined && import.meta.url === pathToFileURL(process.argv[1]).href";

        Emitter(CodegenContext context) {
            super(context);
        }

        @Override
        protected void emitPreamble(Program program) {
            String handle = context.getRuntimeHandle();
            String binding = "runtime".equals(handle) ? "runtime" : "runtime as " + handle;
            out.line("import { " + binding + " } from " + singleQuoted(context.getJavaScriptRuntimePath()) + ";");
            if (needsEntryCall(program)) {
                out.line("import { pathToFileURL } from 'node:url';");
            }
            out.line("const " + EXPORTS_TABLE + " = new Map();");
            out.line("let " + DEFAULT_EXPORT + " = null;");
            out.blankLine();
        }

        @Override
        protected void emitEpilogue(Program program) {
            out.blankLine();
            out.line(runtimeCall(RuntimeFunction.REGISTER_EXPORTS, EXPORTS_TABLE, DEFAULT_EXPORT) + ";");
            out.line("export default " + DEFAULT_EXPORT + ";");
            out.line("export { " + EXPORTS_TABLE + " as exports };");
            if (needsEntryCall(program)) {
                out.blankLine();
                // 仅当本模块是 node 的启动脚本时调用
                out.line("if (" + MAIN_MODULE_TEST + ") {");
                out.indent();
                out.line(EntryPoints.MAIN + "();");
                out.dedent();
                out.line("}");
            }
        }

        @Override
        protected String runtimeName(RuntimeFunction fn) {
            if (fn.getJavaScriptName() == null) {
                throw unavailable(fn);
            }
            return fn.getJavaScriptName();
        }

        @Override
        protected String terminator() {
            return ";";
        }

        @Override
        protected String exportTableWrite(String exportedName, String value) {
            return EXPORTS_TABLE + ".set(" + singleQuoted(exportedName) + ", " + value + ");";
        }

        private void emitBlock(List<Statement> body) {
            out.indent();
            emitStatements(body);
            out.dedent();
        }

        // ============ 语句 ============

        @Override
        public String visitImportStmt(ImportStmt node, Void ctx) {
            out.line("const " + node.getLocalName() + " = "
                    + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getModule())) + ";");
            return null;
        }

        @Override
        public String visitImportFromStmt(ImportFromStmt node, Void ctx) {
            String temp = newTemp("import");
            out.line("const " + temp + " = "
                    + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getModule())) + ";");
            if (node.getNamespaceBinding() != null) {
                out.line("const " + node.getNamespaceBinding() + " = " + temp + ";");
            }
            if (node.getDefaultBinding() != null) {
                out.line("const " + node.getDefaultBinding() + " = "
                        + runtimeCall(RuntimeFunction.EXTRACT_DEFAULT, temp) + ";");
            }
            for (Specifier spec : node.getSpecifiers()) {
                out.line("const " + spec.getEffectiveName() + " = "
                        + runtimeCall(RuntimeFunction.EXTRACT_EXPORT, temp, singleQuoted(spec.getName())) + ";");
            }
            return null;
        }

        @Override
        public String visitLetStmt(LetStmt node, Void ctx) {
            out.line((node.isMutable() ? "let " : "const ") + node.getName() + " = "
                    + expr(node.getInitializer()) + ";");
            emitExportRegistration(node.getName(), node.isExported(), node.isDefault());
            return null;
        }

        @Override
        public String visitFunctionDecl(FunctionDecl node, Void ctx) {
            out.blankLine();
            out.line("function " + node.getName() + "(" + String.join(", ", node.getParams()) + ") {");
            out.indent();
            emitStatements(node.getBody());
            if (!node.endsWithReturn()) {
                out.line("return null;");
            }
            out.dedent();
            out.line("}");
            emitExportRegistration(node.getName(), node.isExported(), node.isDefault());
            out.blankLine();
            return null;
        }

        @Override
        public String visitExportNamesStmt(ExportNamesStmt node, Void ctx) {
            if (node.isReExport()) {
                String temp = newTemp("export");
                out.line("const " + temp + " = "
                        + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getSourceModule())) + ";");
                for (Specifier spec : node.getSpecifiers()) {
                    out.line(exportTableWrite(spec.getEffectiveName(),
                            runtimeCall(RuntimeFunction.EXTRACT_EXPORT, temp, singleQuoted(spec.getName()))));
                }
            } else {
                for (Specifier spec : node.getSpecifiers()) {
                    out.line(exportTableWrite(spec.getEffectiveName(), spec.getName()));
                }
            }
            return null;
        }

        @Override
        public String visitReturnStmt(ReturnStmt node, Void ctx) {
            out.line(node.hasValue() ? "return " + expr(node.getValue()) + ";" : "return null;");
            return null;
        }

        @Override
        public String visitIfStmt(IfStmt node, Void ctx) {
            out.line("if (" + expr(node.getTest()) + ") {");
            emitIfRest(node);
            return null;
        }

        /** 输出 if 体及其 else / else if 链，最后关闭大括号 */
        private void emitIfRest(IfStmt node) {
            emitBlock(node.getBody());
            List<Statement> elseBody = node.getElseBody();
            if (elseBody.size() == 1 && elseBody.get(0) instanceof IfStmt) {
                IfStmt next = (IfStmt) elseBody.get(0);
                out.line("} else if (" + expr(next.getTest()) + ") {");
                emitIfRest(next);
                return;
            }
            if (!elseBody.isEmpty()) {
                out.line("} else {");
                emitBlock(elseBody);
            }
            out.line("}");
        }

        @Override
        public String visitWhileStmt(WhileStmt node, Void ctx) {
            out.line("while (" + expr(node.getTest()) + ") {");
            emitBlock(node.getBody());
            out.line("}");
            return null;
        }

        @Override
        public String visitForStmt(ForStmt node, Void ctx) {
            out.line("for (const " + node.getVariable() + " of "
                    + runtimeCall(RuntimeFunction.ITERATE, expr(node.getIterable())) + ") {");
            emitBlock(node.getBody());
            out.line("}");
            return null;
        }

        @Override
        public String visitSpawnStmt(SpawnStmt node, Void ctx) {
            out.line(runtimeCall(RuntimeFunction.SPAWN, "() => " + expr(node.getCall())) + ";");
            return null;
        }

        // ============ 表达式 ============

        @Override
        protected String binaryOperator(BinaryOp op) {
            return op.toSourceString();
        }

        @Override
        protected String unaryOperator(UnaryOp op) {
            return op.toSourceString();
        }

        @Override
        protected String quote(String value) {
            StringBuilder sb = new StringBuilder(value.length() + 2);
            sb.append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '\\': sb.append("\\\\"); break;
                    case '"':  sb.append("\\\""); break;
                    case '\n': sb.append("\\n"); break;
                    case '\r': sb.append("\\r"); break;
                    case '\t': sb.append("\\t"); break;
                    default:
                        if (c < 0x20 || c == 0x7f || c == 0x2028 || c == 0x2029) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                }
            }
            return sb.append('"').toString();
        }

        @Override
        protected String nonFiniteNumber(double value) {
            if (Double.isNaN(value)) return "NaN";
            return value > 0 ? "Infinity" : "-Infinity";
        }

        @Override
        protected String negativeZero() {
            return "-0";
        }

        @Override
        public String visitBooleanLiteral(BooleanLiteral node, Void ctx) {
            return node.getValue() ? "true" : "false";
        }

        @Override
        public String visitNullLiteral(NullLiteral node, Void ctx) {
            return "null";
        }

        @Override
        public String visitDictLiteral(DictLiteral node, Void ctx) {
            StringBuilder pairs = new StringBuilder();
            List<DictLiteral.Entry> entries = node.getEntries();
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) pairs.append(", ");
                pairs.append('[').append(expr(entries.get(i).getKey())).append(", ")
                        .append(expr(entries.get(i).getValue())).append(']');
            }
            return runtimeCall(RuntimeFunction.MAKE_MAP, "[" + pairs + "]");
        }
    }
}
