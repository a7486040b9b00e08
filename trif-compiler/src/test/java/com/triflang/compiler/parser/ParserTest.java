package com.triflang.compiler.parser;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.stmt.*;
import com.triflang.compiler.lexer.Lexer;
import com.triflang.compiler.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source).scanTokens(), "<test>").parse();
    }

    private Statement single(String source) {
        List<Statement> stmts = parse(source).getStatements();
        assertEquals(1, stmts.size(), "Expected single statement from: " + source);
        return stmts.get(0);
    }

    private Expression expr(String source) {
        Statement stmt = single(source);
        assertInstanceOf(ExpressionStmt.class, stmt);
        return ((ExpressionStmt) stmt).getExpression();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    @Nested
    @DisplayName("程序结构")
    class ProgramTests {

        @Test
        @DisplayName("分隔符可选且可重复")
        void testSeparators() {
            Program program = parse("\n\nlet a = 1;;\n\nlet b = 2 let c = 3\n");
            assertEquals(3, program.getStatements().size());
        }

        @Test
        @DisplayName("空程序")
        void testEmpty() {
            assertTrue(parse("").getStatements().isEmpty());
            assertTrue(parse("\n;\n").getStatements().isEmpty());
        }

        @Test
        @DisplayName("解析结果确定")
        void testDeterministic() {
            String source = "fn f(a) { if a > 1 { return a } else { return 0 } }\nf(3)";
            assertEquals(parse(source), parse(source));
        }

        @Test
        @DisplayName("位置信息")
        void testLocation() {
            Statement stmt = parse("\n  let x = 1").getStatements().get(0);
            assertEquals(2, stmt.getLocation().getLine());
            assertEquals(3, stmt.getLocation().getColumn());
            assertEquals("<test>", stmt.getLocation().getFile());
        }
    }

    @Nested
    @DisplayName("声明与语句")
    class StatementTests {

        @Test
        @DisplayName("let 与 const")
        void testLet() {
            LetStmt let = (LetStmt) single("let x = 1");
            assertEquals("x", let.getName());
            assertTrue(let.isMutable());
            assertFalse(let.isExported());
            assertEquals(1.0, ((NumberLiteral) let.getInitializer()).getValue());

            LetStmt constant = (LetStmt) single("const y = 'a'");
            assertFalse(constant.isMutable());
        }

        @Test
        @DisplayName("let 必须带初始值")
        void testLetRequiresInitializer() {
            ParseException e = parseError("let x");
            assertEquals("ASSIGN", e.getExpected());
            assertThat(e.getMessage()).contains("Expected '=' in variable declaration");
        }

        @Test
        @DisplayName("函数声明（fn / function）")
        void testFunction() {
            FunctionDecl fn = (FunctionDecl) single("fn add(a, b) {\n  return a + b\n}");
            assertEquals("add", fn.getName());
            assertEquals(List.of("a", "b"), fn.getParams());
            assertEquals(1, fn.getBody().size());
            assertTrue(fn.endsWithReturn());

            FunctionDecl empty = (FunctionDecl) single("function noop() {}");
            assertTrue(empty.getParams().isEmpty());
            assertTrue(empty.getBody().isEmpty());
        }

        @Test
        @DisplayName("非默认导出的函数必须有名字")
        void testAnonymousFunctionRejected() {
            parseError("fn () {}");
        }

        @Test
        @DisplayName("return 值可省略")
        void testReturn() {
            FunctionDecl fn = (FunctionDecl) single("fn f() { return }");
            assertFalse(((ReturnStmt) fn.getBody().get(0)).hasValue());

            fn = (FunctionDecl) single("fn f() {\n return\n}");
            assertFalse(((ReturnStmt) fn.getBody().get(0)).hasValue());

            fn = (FunctionDecl) single("fn f() { return; }");
            assertFalse(((ReturnStmt) fn.getBody().get(0)).hasValue());
        }

        @Test
        @DisplayName("if / else / else if")
        void testIf() {
            IfStmt ifStmt = (IfStmt) single("if a { x = 1 } else { x = 2 }");
            assertEquals(1, ifStmt.getBody().size());
            assertEquals(1, ifStmt.getElseBody().size());

            IfStmt chain = (IfStmt) single("if a { } else if b { } else { c() }");
            assertTrue(chain.getBody().isEmpty());
            IfStmt nested = (IfStmt) chain.getElseBody().get(0);
            assertEquals(new Identifier(null, "b"), nested.getTest());
            assertEquals(1, nested.getElseBody().size());
        }

        @Test
        @DisplayName("while 与 for")
        void testLoops() {
            WhileStmt whileStmt = (WhileStmt) single("while i < 10 { i = i + 1 }");
            assertInstanceOf(BinaryExpr.class, whileStmt.getTest());

            ForStmt forStmt = (ForStmt) single("for item in items {\n print(item)\n}");
            assertEquals("item", forStmt.getVariable());
            assertEquals(new Identifier(null, "items"), forStmt.getIterable());
            assertEquals(1, forStmt.getBody().size());
        }

        @Test
        @DisplayName("spawn 必须是调用")
        void testSpawn() {
            SpawnStmt spawn = (SpawnStmt) single("spawn worker(1)");
            assertTrue(spawn.getCall().isCallTo("worker"));

            ParseException e = parseError("spawn worker");
            assertThat(e.getMessage()).contains("spawn expects a function call");
        }

        @Test
        @DisplayName("赋值目标")
        void testAssign() {
            AssignStmt assign = (AssignStmt) single("obj.field = 3");
            assertInstanceOf(MemberExpr.class, assign.getTarget());

            ParseException e = parseError("f() = 3");
            assertThat(e.getMessage()).contains("Invalid assignment target");
            parseError("1 = 2");
        }

        @Test
        @DisplayName("未闭合代码块")
        void testUnclosedBlock() {
            ParseException e = parseError("fn f() {\n let a = 1\n");
            assertEquals(TokenType.EOF, e.getToken().getType());
            assertEquals("RBRACE", e.getExpected());
        }
    }

    @Nested
    @DisplayName("import / export")
    class ModuleTests {

        @Test
        @DisplayName("点分模块名")
        void testDottedImport() {
            ImportStmt imp = (ImportStmt) single("import std.io");
            assertEquals("std.io", imp.getModule());
            assertNull(imp.getAlias());
            assertEquals("std_io", imp.getLocalName());

            ImportStmt aliased = (ImportStmt) single("import std.net as net");
            assertEquals("net", aliased.getLocalName());
        }

        @Test
        @DisplayName("字符串路径")
        void testPathImport() {
            ImportStmt imp = (ImportStmt) single("import \"./lib/my-utils.trif\"");
            assertTrue(imp.isPath());
            assertEquals("./lib/my-utils.trif", imp.getModule());
            assertEquals("my_utils", imp.getLocalName());
        }

        @Test
        @DisplayName("命名导入，允许别名与尾随逗号")
        void testNamedImport() {
            ImportFromStmt imp = (ImportFromStmt) single("import { a, b as c, } from pkg.mod");
            assertEquals("pkg.mod", imp.getModule());
            assertEquals(List.of(new Specifier("a"), new Specifier("b", "c")), imp.getSpecifiers());
            assertEquals("a", imp.getSpecifiers().get(0).getAlias());
            assertNull(imp.getDefaultBinding());
            assertNull(imp.getNamespaceBinding());
        }

        @Test
        @DisplayName("省略别名等同于以原名作别名")
        void testImplicitAliasEqualsExplicit() {
            Statement implicit = single("import { a } from m");
            Statement explicit = single("import { a as a } from m");
            assertEquals(((ImportFromStmt) explicit).getSpecifiers(), ((ImportFromStmt) implicit).getSpecifiers());
            assertEquals("a", ((ImportFromStmt) implicit).getSpecifiers().get(0).toString());
            assertEquals(new Specifier("x", "x"), new Specifier("x"));
            assertNotEquals(new Specifier("x", "y"), new Specifier("x"));
        }

        @Test
        @DisplayName("默认导入与命名导入组合")
        void testDefaultImport() {
            ImportFromStmt imp = (ImportFromStmt) single("import def, { x } from \"./m.trif\"");
            assertEquals("def", imp.getDefaultBinding());
            assertEquals("./m.trif", imp.getModule());
            assertEquals(1, imp.getSpecifiers().size());

            ImportFromStmt onlyDefault = (ImportFromStmt) single("import def from m");
            assertEquals("def", onlyDefault.getDefaultBinding());
            assertTrue(onlyDefault.getSpecifiers().isEmpty());
        }

        @Test
        @DisplayName("命名空间导入")
        void testNamespaceImport() {
            ImportFromStmt imp = (ImportFromStmt) single("import * as ns from m");
            assertEquals("ns", imp.getNamespaceBinding());

            ImportFromStmt combined = (ImportFromStmt) single("import d, * as ns from m");
            assertEquals("d", combined.getDefaultBinding());
            assertEquals("ns", combined.getNamespaceBinding());
        }

        @Test
        @DisplayName("默认绑定后逗号必须接 { 或 *")
        void testBadDefaultImport() {
            ParseException e = parseError("import a, b from m");
            assertThat(e.getMessage()).contains("Expected named import list after comma");
        }

        @Test
        @DisplayName("from 形式缺少 from")
        void testMissingFrom() {
            ParseException e = parseError("import { a } m");
            assertEquals("KW_FROM", e.getExpected());
        }

        @Test
        @DisplayName("导出声明")
        void testExportDeclarations() {
            FunctionDecl fn = (FunctionDecl) single("export fn f() {}");
            assertTrue(fn.isExported());
            assertFalse(fn.isDefault());

            LetStmt let = (LetStmt) single("export const k = 1");
            assertTrue(let.isExported());
            assertFalse(let.isMutable());
        }

        @Test
        @DisplayName("默认导出")
        void testExportDefault() {
            FunctionDecl anon = (FunctionDecl) single("export default fn () { return 1 }");
            assertEquals(FunctionDecl.DEFAULT_EXPORT_NAME, anon.getName());
            assertTrue(anon.isDefault());
            assertTrue(anon.isExported());

            LetStmt let = (LetStmt) single("export default let v = 2");
            assertTrue(let.isDefault());

            ExportDefaultStmt value = (ExportDefaultStmt) single("export default 1 + 2");
            assertInstanceOf(BinaryExpr.class, value.getValue());
        }

        @Test
        @DisplayName("命名导出与再导出")
        void testExportNames() {
            ExportNamesStmt local = (ExportNamesStmt) single("export { a, b as c }");
            assertFalse(local.isReExport());
            assertEquals(2, local.getSpecifiers().size());

            ExportNamesStmt re = (ExportNamesStmt) single("export { x } from other.mod");
            assertEquals("other.mod", re.getSourceModule());
        }

        @Test
        @DisplayName("不支持的导出")
        void testBadExport() {
            ParseException e = parseError("export 42");
            assertThat(e.getMessage()).contains("Unsupported export statement");
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("1 + 2 * 3");
            assertEquals(BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("逻辑运算优先级最低，|| 低于 &&")
        void testLogicalPrecedence() {
            BinaryExpr or = (BinaryExpr) expr("a && b || c == d");
            assertEquals(BinaryOp.OR, or.getOperator());
            assertEquals(BinaryOp.AND, ((BinaryExpr) or.getLeft()).getOperator());
            assertEquals(BinaryOp.EQ, ((BinaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("左结合")
        void testLeftAssociative() {
            BinaryExpr sub = (BinaryExpr) expr("a - b - c");
            assertInstanceOf(BinaryExpr.class, sub.getLeft());
            assertEquals(new Identifier(null, "c"), sub.getRight());
        }

        @Test
        @DisplayName("括号改变优先级")
        void testGrouping() {
            BinaryExpr mul = (BinaryExpr) expr("(1 + 2) * 3");
            assertEquals(BinaryOp.MUL, mul.getOperator());
        }

        @Test
        @DisplayName("前缀运算符可嵌套")
        void testUnary() {
            UnaryExpr not = (UnaryExpr) expr("!!a");
            assertEquals(UnaryExpr.UnaryOp.NOT, not.getOperator());
            assertInstanceOf(UnaryExpr.class, not.getOperand());

            BinaryExpr mul = (BinaryExpr) expr("-a * b");
            assertInstanceOf(UnaryExpr.class, mul.getLeft());
        }

        @Test
        @DisplayName("调用与成员访问链")
        void testPostfixChain() {
            CallExpr call = (CallExpr) expr("io.print(1, 'x').flush()");
            MemberExpr flush = (MemberExpr) call.getCallee();
            assertEquals("flush", flush.getMember());
            CallExpr inner = (CallExpr) flush.getTarget();
            assertEquals(2, inner.getArgs().size());
        }

        @Test
        @DisplayName("关键词可作成员名")
        void testKeywordMember() {
            MemberExpr member = (MemberExpr) expr("task.spawn");
            assertEquals("spawn", member.getMember());
        }

        @Test
        @DisplayName("字面量")
        void testLiterals() {
            assertEquals(new BooleanLiteral(null, true), expr("true"));
            assertEquals(new NullLiteral(null), expr("null"));
            assertEquals(new StringLiteral(null, "s"), expr("\"s\""));

            ListLiteral list = (ListLiteral) expr("[1, 2, 3]");
            assertEquals(3, list.getElements().size());
            assertTrue(((ListLiteral) expr("[]")).getElements().isEmpty());
        }

        @Test
        @DisplayName("字典键为任意表达式")
        void testDict() {
            DictLiteral dict = (DictLiteral) expr("{'a': 1, k + 1: [2]}");
            assertEquals(2, dict.getEntries().size());
            assertInstanceOf(BinaryExpr.class, dict.getEntries().get(1).getKey());
            assertTrue(((DictLiteral) expr("{}")).getEntries().isEmpty());
        }

        @Test
        @DisplayName("括号内换行被忽略")
        void testNewlinesInsideBrackets() {
            CallExpr call = (CallExpr) expr("f(\n  1,\n  2\n)");
            assertEquals(2, call.getArgs().size());

            LetStmt let = (LetStmt) single("let cfg = {\n  'a': 1,\n  'b': [\n    2,\n    3\n  ]\n}");
            assertEquals(2, ((DictLiteral) let.getInitializer()).getEntries().size());
        }

        @Test
        @DisplayName("意外 token 报告期望与实际")
        void testUnexpectedToken() {
            ParseException e = parseError("let x = )");
            assertEquals(TokenType.RPAREN, e.getToken().getType());
            assertEquals("expression", e.getExpected());
            assertThat(e.getMessage())
                    .contains("line 1, column 9")
                    .contains("found RPAREN ')'")
                    .contains("expected: expression");
        }
    }
}
