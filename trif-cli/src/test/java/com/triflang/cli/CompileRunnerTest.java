package com.triflang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.triflang.compiler.compiler.CompilerConfig;
import com.triflang.compiler.compiler.OutputObfuscator;
import com.triflang.compiler.compiler.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * CompileRunner 测试
 */
class CompileRunnerTest {

    private Path dir;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void setUp(@TempDir Path tempDir) {
        dir = tempDir;
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private CompileRunner runner(CompilerConfig config) {
        return new CompileRunner(config,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private CompileRunner runner() {
        return runner(new CompilerConfig());
    }

    private String out() {
        return new String(stdout.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
    }

    private Path source(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("compile")
    class CompileTests {

        @Test
        @DisplayName("默认输出路径替换扩展名")
        void testCompilePython() throws IOException {
            Path file = source("hello.trif", "let x = 2 * 3\nfn main() { print(x) }\n");

            int code = runner().compileFile(file.toString(), Target.PYTHON, null, true, null);

            Path expected = dir.resolve("hello.py");
            assertEquals(0, code);
            assertTrue(Files.exists(expected));
            assertThat(read(expected)).contains("x = 6\n").contains("if __name__ == '__main__':");
            assertThat(out()).contains("编译成功: " + expected);
            assertEquals("", err());
        }

        @Test
        void testCompileJavaScriptToExplicitPath() throws IOException {
            Path file = source("mod.trif", "export const k = 1\n");
            Path target = dir.resolve("out.mjs");

            int code = runner().compileFile(file.toString(), Target.JAVASCRIPT, target.toString(), false, null);

            assertEquals(0, code);
            assertThat(read(target)).contains("__trif_exports__.set('k', k);");
        }

        @Test
        @DisplayName("bytecode 与 Python 文本字节一致")
        void testCompileBytecode() throws IOException {
            Path file = source("b.trif", "let s = \"字节\"\n");

            assertEquals(0, runner().compileFile(file.toString(), Target.PYTHON, null, true, null));
            assertEquals(0, runner().compileFile(file.toString(), Target.BYTECODE, null, true, null));

            assertArrayEquals(Files.readAllBytes(dir.resolve("b.py")), Files.readAllBytes(dir.resolve("b.trifc")));
        }

        @Test
        @DisplayName("--encrypt 写出可还原的混淆文本")
        void testEncrypt() throws IOException {
            Path file = source("e.trif", "let x = 1\n");

            assertEquals(0, runner().compileFile(file.toString(), Target.PYTHON, null, true, "pw"));

            String encoded = read(dir.resolve("e.py"));
            assertThat(encoded).doesNotContain("x = 1");
            assertThat(OutputObfuscator.decrypt(encoded, "pw")).contains("x = 1\n");
        }

        @Test
        @DisplayName("配置生效")
        void testConfigApplied() throws IOException {
            Path file = source("c.trif", "fn main() { return 1 }\n");
            CompilerConfig config = new CompilerConfig().setIndentSize(2).setEmitEntryPoint(false);

            assertEquals(0, runner(config).compileFile(file.toString(), Target.PYTHON, null, true, null));

            assertThat(read(dir.resolve("c.py")))
                    .contains("def main():\n  return 1\n")
                    .doesNotContain("__main__");
        }

        @Test
        @DisplayName("输出路径与源文件相同时拒绝覆盖")
        void testOutputWouldOverwriteSource() throws IOException {
            String content = "let x = 1\n";
            Path file = source("x.js", content);

            int code = runner().compileFile(file.toString(), Target.JAVASCRIPT, null, true, null);

            assertEquals(1, code);
            assertThat(err()).startsWith("错误: 输出路径与源文件相同 - ");
            assertEquals(content, read(file));

            String viaDotSegment = dir.resolve(".").resolve("x.js").toString();
            assertEquals(1, runner().compileFile(file.toString(), Target.PYTHON, viaDotSegment, true, null));
            assertEquals(content, read(file));
        }

        @Test
        void testMissingFile() {
            int code = runner().compileFile(dir.resolve("nope.trif").toString(), Target.PYTHON, null, true, null);
            assertEquals(1, code);
            assertThat(err()).startsWith("错误: 文件不存在 - ");
        }

        @Test
        @DisplayName("语法错误不写出文件")
        void testSyntaxError() throws IOException {
            Path file = source("bad.trif", "let x = (1 + \n");

            int code = runner().compileFile(file.toString(), Target.PYTHON, null, true, null);

            assertEquals(1, code);
            assertThat(err()).startsWith("错误: ").contains("line");
            assertFalse(Files.exists(dir.resolve("bad.py")));
        }

        @Test
        void testLexError() throws IOException {
            Path file = source("lex.trif", "let x = 1 $ 2\n");
            assertEquals(1, runner().compileFile(file.toString(), Target.JAVASCRIPT, null, true, null));
            assertThat(err()).contains("Unexpected character '$' at line 1, column 11");
        }

        @Test
        void testInvalidIndent() throws IOException {
            Path file = source("i.trif", "let x = 1\n");
            CompilerConfig config = new CompilerConfig().setIndentSize(0);
            assertEquals(1, runner(config).compileFile(file.toString(), Target.PYTHON, null, true, null));
            assertThat(err()).startsWith("错误: ");
        }

        @Test
        void testUnwritableOutput() throws IOException {
            Path file = source("w.trif", "let x = 1\n");
            Path target = dir.resolve("missing-dir").resolve("w.py");
            assertEquals(1, runner().compileFile(file.toString(), Target.PYTHON, target.toString(), true, null));
            assertThat(err()).startsWith("错误: 读写文件失败 - ");
        }
    }

    @Nested
    @DisplayName("ast")
    class AstTests {

        @Test
        void testDumpToStdout() throws IOException {
            Path file = source("a.trif", "let x = 2 * 3\n");

            assertEquals(0, runner().dumpAst(file.toString(), null, true));

            JsonObject root = JsonParser.parseString(out()).getAsJsonObject();
            assertEquals("Program", root.get("type").getAsString());
            JsonObject let = root.getAsJsonArray("body").get(0).getAsJsonObject();
            assertEquals("Let", let.get("type").getAsString());
            assertEquals("Number", let.getAsJsonObject("value").get("type").getAsString());
            assertEquals(6.0, let.getAsJsonObject("value").get("value").getAsDouble());
        }

        @Test
        void testDumpWithoutOptimization() throws IOException {
            Path file = source("a.trif", "let x = 2 * 3\n");
            Path target = dir.resolve("a.json");

            assertEquals(0, runner().dumpAst(file.toString(), target.toString(), false));

            JsonObject root = JsonParser.parseString(read(target)).getAsJsonObject();
            JsonArray body = root.getAsJsonArray("body");
            JsonObject value = body.get(0).getAsJsonObject().getAsJsonObject("value");
            assertEquals("BinaryOp", value.get("type").getAsString());
            assertEquals("*", value.get("op").getAsString());
            assertEquals("", out());
        }

        @Test
        void testDumpSyntaxError() throws IOException {
            Path file = source("a.trif", "export 1\n");
            assertEquals(1, runner().dumpAst(file.toString(), null, true));
            assertThat(err()).contains("Unsupported export statement");
        }
    }

    @Nested
    @DisplayName("decrypt")
    class DecryptTests {

        @Test
        void testDecryptToStdout() throws IOException {
            Path file = source("x.enc", OutputObfuscator.encrypt("print(1)\n", "k"));
            assertEquals(0, runner().decryptFile(file.toString(), "k", null));
            assertEquals("print(1)\n", out());
        }

        @Test
        void testDecryptToFile() throws IOException {
            Path file = source("x.enc", OutputObfuscator.encrypt("let y = 2", "k") + "\n");
            Path target = dir.resolve("x.txt");
            assertEquals(0, runner().decryptFile(file.toString(), "k", target.toString()));
            assertEquals("let y = 2", read(target));
        }

        @Test
        void testMalformedInput() throws IOException {
            Path file = source("x.enc", "%%% not base64 %%%");
            assertEquals(1, runner().decryptFile(file.toString(), "k", null));
            assertThat(err()).startsWith("错误: ");
        }

        @Test
        void testEmptyPassphrase() throws IOException {
            Path file = source("x.enc", "eA==");
            assertEquals(1, runner().decryptFile(file.toString(), "", null));
            assertThat(err()).contains("Passphrase must not be empty");
        }
    }

    @Test
    void testDefaultOutputPath() {
        assertEquals(Paths.get("src", "app.py"),
                CompileRunner.defaultOutputPath(Paths.get("src", "app.trif"), ".py"));
        assertEquals(Paths.get("a.b.js"), CompileRunner.defaultOutputPath(Paths.get("a.b.trif"), ".js"));
        assertEquals(Paths.get("noext.trifc"), CompileRunner.defaultOutputPath(Paths.get("noext"), ".trifc"));
        assertEquals(Paths.get(".hidden.py"), CompileRunner.defaultOutputPath(Paths.get(".hidden"), ".py"));
    }
}
