package com.triflang.compiler.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeEmitterTest {

    @Test
    void testIndentation() {
        CodeEmitter out = new CodeEmitter(2);
        out.line("a");
        out.indent();
        out.line("b");
        out.indent();
        out.line("c");
        out.dedent();
        out.dedent();
        out.line("d");
        assertEquals("a\n  b\n    c\nd\n", out.getOutput());
    }

    @Test
    void testEmptyLineHasNoIndent() {
        CodeEmitter out = new CodeEmitter(4);
        out.indent();
        out.line("");
        assertEquals("\n", out.getOutput());
    }

    @Test
    void testBlankLineCollapses() {
        CodeEmitter out = new CodeEmitter(4);
        out.blankLine();
        out.line("x");
        out.blankLine();
        out.blankLine();
        out.line("y");
        assertEquals("x\n\ny\n", out.getOutput());
    }

    @Test
    void testDedentUnderflow() {
        CodeEmitter out = new CodeEmitter(4);
        CodegenException e = assertThrows(CodegenException.class, out::dedent);
        assertEquals("Indentation underflow", e.getMessage());
    }

    @Test
    void testContextRejectsNonPositiveIndent() {
        assertThrows(IllegalArgumentException.class,
                () -> new CodegenContext("runtime", "m", "./m.mjs", 0, true));
    }
}
