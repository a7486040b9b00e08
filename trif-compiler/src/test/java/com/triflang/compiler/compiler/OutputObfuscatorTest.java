package com.triflang.compiler.compiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputObfuscatorTest {

    @Test
    void testKnownVectors() {
        assertEquals("W8pkPQ81ksqB", OutputObfuscator.encrypt("print(1)\n", "secret"));
        assertEquals("Zuxuzz-vcJm-", OutputObfuscator.encrypt("中文 ok", "k"));
        assertEquals("", OutputObfuscator.encrypt("", "k"));
    }

    @Test
    void testKeyRepeatsBeyondDigestLength() {
        String text = "xxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxx";
        String encoded = OutputObfuscator.encrypt(text, "pw");
        assertEquals("SLEqgslau4EN53reoSRPIMo-zIaaQe0DVTeWPpoZCLxIsSqCyVq7gQ==", encoded);
        assertEquals(text, OutputObfuscator.decrypt(encoded, "pw"));
    }

    @Test
    void testRoundTrip() {
        String[] samples = {"", "a", "def f():\n    return None\n", "中文与 emoji 😀", "x\u0000y"};
        for (String sample : samples) {
            assertEquals(sample, OutputObfuscator.decrypt(OutputObfuscator.encrypt(sample, "口令"), "口令"));
        }
    }

    @Test
    void testUrlSafeAlphabet() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 256; i++) {
            sb.append((char) i);
        }
        String encoded = OutputObfuscator.encrypt(sb.toString(), "alphabet");
        assertFalse(encoded.contains("+"));
        assertFalse(encoded.contains("/"));
    }

    @Test
    void testWrongPassphrase() {
        String encoded = OutputObfuscator.encrypt("print(\"secret data\")", "right");
        assertNotEquals("print(\"secret data\")", OutputObfuscator.decrypt(encoded, "wrong"));
    }

    @Test
    void testSurroundingWhitespaceIgnored() {
        String encoded = OutputObfuscator.encrypt("hello", "k");
        assertEquals("hello", OutputObfuscator.decrypt("  " + encoded + "\n", "k"));
    }

    @Test
    void testEmptyPassphraseRejected() {
        assertThrows(IllegalArgumentException.class, () -> OutputObfuscator.encrypt("x", ""));
        assertThrows(IllegalArgumentException.class, () -> OutputObfuscator.decrypt("eA==", null));
    }

    @Test
    void testMalformedInputRejected() {
        assertThrows(IllegalArgumentException.class, () -> OutputObfuscator.decrypt("not base64!", "k"));
    }

    @Test
    void testKeyIsSha256() {
        assertEquals(32, OutputObfuscator.deriveKey("anything").length);
    }
}
