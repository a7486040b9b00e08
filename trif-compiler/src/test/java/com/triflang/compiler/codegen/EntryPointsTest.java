package com.triflang.compiler.codegen;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.lexer.Lexer;
import com.triflang.compiler.parser.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntryPointsTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source).scanTokens(), "<test>").parse();
    }

    @Test
    void testNoMain() {
        Program program = parse("fn helper() {}\nhelper()");
        assertFalse(EntryPoints.declaresMain(program));
        assertFalse(EntryPoints.needsEntryCall(program));
    }

    @Test
    void testMainWithoutCall() {
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}")));
    }

    @Test
    void testExplicitTopLevelCall() {
        Program program = parse("fn main() {}\nmain()");
        assertTrue(EntryPoints.callsMainAtTopLevel(program));
        assertFalse(EntryPoints.needsEntryCall(program));
    }

    @Test
    void testUnconditionalTopLevelCall() {
        assertFalse(EntryPoints.needsEntryCall(parse("fn main() {}\nspawn main()")));
        assertFalse(EntryPoints.needsEntryCall(parse("fn main() {}\nprint([main()])")));
        assertFalse(EntryPoints.needsEntryCall(parse("fn main() {}\nif main() { }")));
        assertFalse(EntryPoints.needsEntryCall(parse("fn main() {}\nfor x in main() { }")));
    }

    @Test
    void testConditionalCallDoesNotCount() {
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\nif ready { let r = main() }")));
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\nif ready { } else { main() }")));
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\nwhile busy { main() }")));
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\nfor x in xs { main() }")));
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\nready && main()")));
        assertFalse(EntryPoints.needsEntryCall(parse("fn main() {}\nmain() || fallback()")));
    }

    @Test
    void testCallInsideFunctionBodyIgnored() {
        Program program = parse("fn main() {}\nfn run() { main() }");
        assertFalse(EntryPoints.callsMainAtTopLevel(program));
        assertTrue(EntryPoints.needsEntryCall(program));
    }

    @Test
    void testMemberCallIsNotMain() {
        assertTrue(EntryPoints.needsEntryCall(parse("fn main() {}\napp.main()")));
    }
}
