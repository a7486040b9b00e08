package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.triflang.compiler.ast.stmt.*;

import java.util.List;

/**
 * Python 后端
 *
 * <p>const 绑定写作 {@code name: Final = value}；for 循环经由 {@code runtime.iterate}；
 * spawn 包装为 lambda 交给 {@code runtime.spawn}。</p>
 */
public class PythonGenerator implements CodeGenerator {

    @Override
    public String getName() {
        return "python";
    }

    @Override
    public String generate(Program program, CodegenContext context) {
        return new Emitter(context).emit(program);
    }

    private static final class Emitter extends BaseEmitter {

        Emitter(CodegenContext context) {
            super(context);
        }

        @Override
        protected void emitPreamble(Program program) {
            out.line("from typing import Final");
            String handle = context.getRuntimeHandle();
            String importLine = "from " + context.getPythonRuntimeModule() + " import runtime";
            if (!"runtime".equals(handle)) {
                importLine += " as " + handle;
            }
            out.line(importLine);
            out.line(EXPORTS_TABLE + " = {}");
            out.line(DEFAULT_EXPORT + " = None");
            out.blankLine();
        }

        @Override
        protected void emitEpilogue(Program program) {
            out.blankLine();
            out.line(runtimeCall(RuntimeFunction.REGISTER_EXPORTS, "__name__", EXPORTS_TABLE, DEFAULT_EXPORT));
            if (needsEntryCall(program)) {
                out.blankLine();
                out.line("if __name__ == '__main__':");
                out.indent();
                out.line(EntryPoints.MAIN + "()");
                out.dedent();
            }
        }

        @Override
        protected String runtimeName(RuntimeFunction fn) {
            if (fn.getPythonName() == null) {
                throw unavailable(fn);
            }
            return fn.getPythonName();
        }

        @Override
        protected String terminator() {
            return "";
        }

        @Override
        protected String exportTableWrite(String exportedName, String value) {
            return EXPORTS_TABLE + "[" + singleQuoted(exportedName) + "] = " + value;
        }

        /** 缩进输出块；空块补 pass */
        private void emitBlock(List<Statement> body) {
            out.indent();
            if (body.isEmpty()) {
                out.line("pass");
            } else {
                emitStatements(body);
            }
            out.dedent();
        }

        // ============ 语句 ============

        @Override
        public String visitImportStmt(ImportStmt node, Void ctx) {
            out.line(node.getLocalName() + " = "
                    + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getModule())));
            return null;
        }

        @Override
        public String visitImportFromStmt(ImportFromStmt node, Void ctx) {
            String temp = newTemp("import");
            out.line(temp + " = " + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getModule())));
            if (node.getNamespaceBinding() != null) {
                out.line(node.getNamespaceBinding() + " = " + temp);
            }
            if (node.getDefaultBinding() != null) {
                out.line(node.getDefaultBinding() + " = " + runtimeCall(RuntimeFunction.EXTRACT_DEFAULT, temp));
            }
            for (Specifier spec : node.getSpecifiers()) {
                out.line(spec.getEffectiveName() + " = "
                        + runtimeCall(RuntimeFunction.EXTRACT_EXPORT, temp, singleQuoted(spec.getName())));
            }
            return null;
        }

        @Override
        public String visitLetStmt(LetStmt node, Void ctx) {
            String value = expr(node.getInitializer());
            if (node.isMutable()) {
                out.line(node.getName() + " = " + value);
            } else {
                out.line(node.getName() + ": Final = " + value);
            }
            emitExportRegistration(node.getName(), node.isExported(), node.isDefault());
            return null;
        }

        @Override
        public String visitFunctionDecl(FunctionDecl node, Void ctx) {
            out.blankLine();
            out.line("def " + node.getName() + "(" + String.join(", ", node.getParams()) + "):");
            out.indent();
            emitStatements(node.getBody());
            if (!node.endsWithReturn()) {
                out.line("return None");
            }
            out.dedent();
            emitExportRegistration(node.getName(), node.isExported(), node.isDefault());
            out.blankLine();
            return null;
        }

        @Override
        public String visitExportNamesStmt(ExportNamesStmt node, Void ctx) {
            if (node.isReExport()) {
                String temp = newTemp("export");
                out.line(temp + " = "
                        + runtimeCall(RuntimeFunction.IMPORT_MODULE, singleQuoted(node.getSourceModule())));
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
            out.line(node.hasValue() ? "return " + expr(node.getValue()) : "return None");
            return null;
        }

        @Override
        public String visitIfStmt(IfStmt node, Void ctx) {
            emitIfChain(node, "if");
            return null;
        }

        private void emitIfChain(IfStmt node, String keyword) {
            out.line(keyword + " " + expr(node.getTest()) + ":");
            emitBlock(node.getBody());
            List<Statement> elseBody = node.getElseBody();
            if (elseBody.size() == 1 && elseBody.get(0) instanceof IfStmt) {
                emitIfChain((IfStmt) elseBody.get(0), "elif");
            } else if (!elseBody.isEmpty()) {
                out.line("else:");
                emitBlock(elseBody);
            }
        }

        @Override
        public String visitWhileStmt(WhileStmt node, Void ctx) {
            out.line("while " + expr(node.getTest()) + ":");
            emitBlock(node.getBody());
            return null;
        }

        @Override
        public String visitForStmt(ForStmt node, Void ctx) {
            out.line("for " + node.getVariable() + " in "
                    + runtimeCall(RuntimeFunction.ITERATE, expr(node.getIterable())) + ":");
            emitBlock(node.getBody());
            return null;
        }

        @Override
        public String visitSpawnStmt(SpawnStmt node, Void ctx) {
            out.line(runtimeCall(RuntimeFunction.SPAWN, "lambda: " + expr(node.getCall())));
            return null;
        }

        // ============ 表达式 ============

        @Override
        protected String binaryOperator(BinaryOp op) {
            switch (op) {
                case AND: return "and";
                case OR:  return "or";
                default:  return op.toSourceString();
            }
        }

        @Override
        protected String unaryOperator(UnaryOp op) {
            return op == UnaryOp.NOT ? "not " : op.toSourceString();
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
                        if (c < 0x20 || c == 0x7f) {
                            sb.append(String.format("\\x%02x", (int) c));
                        } else {
                            sb.append(c);
                        }
                }
            }
            return sb.append('"').toString();
        }

        @Override
        protected String nonFiniteNumber(double value) {
            if (Double.isNaN(value)) return "float('nan')";
            return value > 0 ? "float('inf')" : "float('-inf')";
        }

        @Override
        protected String negativeZero() {
            return "-0.0";
        }

        @Override
        public String visitBooleanLiteral(BooleanLiteral node, Void ctx) {
            return node.getValue() ? "True" : "False";
        }

        @Override
        public String visitNullLiteral(NullLiteral node, Void ctx) {
            return "None";
        }

        @Override
        public String visitDictLiteral(DictLiteral node, Void ctx) {
            StringBuilder sb = new StringBuilder("{");
            List<DictLiteral.Entry> entries = node.getEntries();
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(expr(entries.get(i).getKey())).append(": ").append(expr(entries.get(i).getValue()));
            }
            return sb.append('}').toString();
        }
    }
}
