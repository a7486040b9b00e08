package com.triflang.compiler.optimizer;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.stmt.*;
import com.triflang.compiler.lexer.Lexer;
import com.triflang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 常量折叠测试
 */
class ConstantFoldingTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source).scanTokens(), "<test>").parse();
    }

    private Program fold(String source) {
        return new ConstantFolding().run(parse(source));
    }

    /** 折叠 "let x = ..." 后的初始值 */
    private Expression foldInit(String initializer) {
        Program program = fold("let x = " + initializer);
        return ((LetStmt) program.getStatements().get(0)).getInitializer();
    }

    private static NumberLiteral num(double value) {
        return new NumberLiteral(null, value);
    }

    @Nested
    @DisplayName("数字运算")
    class NumberTests {

        @Test
        void testAddition() {
            assertEquals(num(5), foldInit("2 + 3"));
        }

        @Test
        void testNested() {
            assertEquals(num(9), foldInit("(1 + 2) * 3"));
            assertEquals(num(-1), foldInit("2 - 3"));
        }

        @Test
        @DisplayName("除数非零时折叠")
        void testDivision() {
            assertEquals(num(2.5), foldInit("5 / 2"));
        }

        @Test
        @DisplayName("除零保持原样")
        void testDivisionByZero() {
            Expression result = foldInit("1 / 0");
            assertInstanceOf(BinaryExpr.class, result);
            assertEquals(BinaryExpr.BinaryOp.DIV, ((BinaryExpr) result).getOperator());
        }

        @Test
        @DisplayName("取模与比较不折叠")
        void testNotFolded() {
            assertInstanceOf(BinaryExpr.class, foldInit("7 % 2"));
            assertInstanceOf(BinaryExpr.class, foldInit("1 < 2"));
            assertInstanceOf(BinaryExpr.class, foldInit("1 == 1"));
        }

        @Test
        @DisplayName("取负")
        void testNegation() {
            assertEquals(num(-4), foldInit("-4"));
            assertEquals(num(4), foldInit("--4"));
            assertEquals(num(-6), foldInit("-(2 * 3)"));
        }

        @Test
        @DisplayName("负零保留符号")
        void testNegativeZero() {
            assertEquals(num(-0.0), foldInit("-0"));
            assertNotEquals(num(0.0), foldInit("-0"));
            assertInstanceOf(BinaryExpr.class, foldInit("1 / -0"));
        }
    }

    @Nested
    @DisplayName("字符串与布尔")
    class OtherLiteralTests {

        @Test
        @DisplayName("字符串拼接")
        void testConcat() {
            assertEquals(new StringLiteral(null, "ab"), foldInit("\"a\" + \"b\""));
            assertEquals(new StringLiteral(null, "abc"), foldInit("'a' + 'b' + 'c'"));
        }

        @Test
        @DisplayName("字符串与数字混合不折叠")
        void testMixed() {
            assertInstanceOf(BinaryExpr.class, foldInit("'a' + 1"));
            assertInstanceOf(BinaryExpr.class, foldInit("'a' - 'b'"));
        }

        @Test
        @DisplayName("布尔取反")
        void testNot() {
            assertEquals(new BooleanLiteral(null, false), foldInit("!true"));
            assertEquals(new BooleanLiteral(null, true), foldInit("!!true"));
        }

        @Test
        @DisplayName("非布尔取反不折叠")
        void testNotOnNumber() {
            assertInstanceOf(UnaryExpr.class, foldInit("!1"));
        }
    }

    @Nested
    @DisplayName("遍历范围")
    class TraversalTests {

        @Test
        @DisplayName("标识符不做常量传播")
        void testIdentifiers() {
            Program program = fold("let a = 2\nlet b = a + 3");
            Expression init = ((LetStmt) program.getStatements().get(1)).getInitializer();
            assertInstanceOf(BinaryExpr.class, init);
        }

        @Test
        @DisplayName("部分折叠")
        void testPartial() {
            BinaryExpr expr = (BinaryExpr) foldInit("a * (2 + 3)");
            assertEquals(new Identifier(null, "a"), expr.getLeft());
            assertEquals(num(5), expr.getRight());
        }

        @Test
        @DisplayName("函数体、控制流与调用参数")
        void testNestedStatements() {
            Program program = fold("fn f() {\n  if 1 + 1 { return 2 * 2 }\n  g(3 - 1, [1 + 1], {'k': 'a' + 'b'})\n}");
            FunctionDecl fn = (FunctionDecl) program.getStatements().get(0);
            IfStmt ifStmt = (IfStmt) fn.getBody().get(0);
            assertEquals(num(2), ifStmt.getTest());
            assertEquals(num(4), ((ReturnStmt) ifStmt.getBody().get(0)).getValue());

            CallExpr call = (CallExpr) ((ExpressionStmt) fn.getBody().get(1)).getExpression();
            assertEquals(num(2), call.getArgs().get(0));
            assertEquals(num(2), ((ListLiteral) call.getArgs().get(1)).getElements().get(0));
            DictLiteral dict = (DictLiteral) call.getArgs().get(2);
            assertEquals(new StringLiteral(null, "ab"), dict.getEntries().get(0).getValue());
        }

        @Test
        @DisplayName("幂等")
        void testIdempotent() {
            Program once = fold("let x = 1 + 2 * 3\nwhile x < 10 - 1 { x = x + 1 }");
            Program twice = new ConstantFolding().run(once);
            assertEquals(once, twice);
        }

        @Test
        @DisplayName("不修改输入")
        void testInputUnchanged() {
            Program original = parse("let x = 2 + 3");
            Program copy = parse("let x = 2 + 3");
            new ConstantFolding().run(original);
            assertEquals(copy, original);
        }

        @Test
        @DisplayName("无可折叠内容时结构不变")
        void testNothingToFold() {
            Program original = parse("let x = a + b\nprint(x)");
            assertEquals(original, new ConstantFolding().run(original));
        }
    }
}
