package com.triflang.compiler.compiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetTest {

    @Test
    void testFromName() {
        assertEquals(Target.PYTHON, Target.fromName("python"));
        assertEquals(Target.PYTHON, Target.fromName("py"));
        assertEquals(Target.JAVASCRIPT, Target.fromName("JavaScript"));
        assertEquals(Target.JAVASCRIPT, Target.fromName(" js "));
        assertEquals(Target.BYTECODE, Target.fromName("bytecode"));
    }

    @Test
    void testUnknownTarget() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Target.fromName("wasm"));
        assertTrue(e.getMessage().contains("wasm"));
    }

    @Test
    void testExtensions() {
        assertEquals(".py", Target.PYTHON.getExtension());
        assertEquals(".js", Target.JAVASCRIPT.getExtension());
        assertEquals(".trifc", Target.BYTECODE.getExtension());
        assertTrue(Target.BYTECODE.isBinary());
        assertFalse(Target.PYTHON.isBinary());
        assertEquals("javascript", Target.JAVASCRIPT.toString());
    }
}
