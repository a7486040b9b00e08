package com.triflang.compiler.lexer;

import com.triflang.compiler.CompilationException;

/**
 * 词法异常：当前位置无法匹配任何 token
 */
public class LexException extends CompilationException {
    private final char character;

    public LexException(String message, char character, int line, int column) {
        super(message, line, column);
        this.character = character;
    }

    /** 引发错误的字符 */
    public char getCharacter() {
        return character;
    }

    @Override
    public String getMessage() {
        return String.format("%s '%s' at line %d, column %d",
                super.getMessage(), printable(character), getLine(), getColumn());
    }

    private static String printable(char c) {
        switch (c) {
            case '\n': return "\\n";
            case '\t': return "\\t";
            case '\0': return "\\0";
            default:   return String.valueOf(c);
        }
    }
}
