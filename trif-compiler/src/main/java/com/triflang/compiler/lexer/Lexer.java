package com.triflang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Trif 词法分析器
 *
 * <p>单遍扫描，无回溯。空白（换行除外）与注释直接丢弃；每个 '\n' 产生一个 NEWLINE token；
 * 结尾总是追加一个位于源码末尾的 EOF token。遇到无法识别的字符立即抛出 {@link LexException}。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起点（字符串可跨行，因此不能由结束位置反推）
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("let", TokenType.KW_LET);
        map.put("const", TokenType.KW_CONST);
        map.put("fn", TokenType.KW_FN);
        map.put("function", TokenType.KW_FUNCTION);

        // 模块
        map.put("import", TokenType.KW_IMPORT);
        map.put("export", TokenType.KW_EXPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);
        map.put("default", TokenType.KW_DEFAULT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);
        map.put("spawn", TokenType.KW_SPAWN);

        // 字面量
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     *
     * @throws LexException 遇到无法识别的字符、未闭合的块注释或非法转义
     */
    public List<Token> scanTokens() {
        tokens.clear();
        start = 0;
        current = 0;
        line = 1;
        column = 1;

        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return Collections.unmodifiableList(new ArrayList<Token>(tokens));
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;

            // 可能是多字符的 Token
            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (!match('&')) {
                    throw error("Unexpected character", c);
                }
                addToken(TokenType.AND);
                break;

            case '|':
                if (!match('|')) {
                    throw error("Unexpected character", c);
                }
                addToken(TokenType.OR);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                newLine();
                break;

            // 字符串
            case '"':
            case '\'':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character", c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    private LexException error(String message, char c) {
        return new LexException(message, c, startLine, startColumn);
    }

    // === 复杂 Token 扫描 ===

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分：'.' 后必须紧跟数字，否则 '.' 属于成员访问
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }

        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) break;
                escape(value);
            } else {
                value.append(c);
                if (c == '\n') newLine();
            }
        }

        if (isAtEnd()) {
            // 未闭合：引号本身无法匹配任何 token
            throw error("Unterminated string literal starting with", quote);
        }

        advance(); // 闭合的引号
        addToken(TokenType.STRING, value.toString());
    }

    private void escape(StringBuilder value) {
        int escapeLine = line;
        int escapeColumn = column - 1;
        char c = advance();
        switch (c) {
            case 'n':  value.append('\n'); break;
            case 'r':  value.append('\r'); break;
            case 't':  value.append('\t'); break;
            case 'b':  value.append('\b'); break;
            case 'f':  value.append('\f'); break;
            case 'v':  value.append('\u000B'); break;
            case 'a':  value.append('\u0007'); break;
            case '0':  value.append('\0'); break;
            case '\\': value.append('\\'); break;
            case '\'': value.append('\''); break;
            case '"':  value.append('"'); break;
            case 'x':  value.append(hexEscape(2, escapeLine, escapeColumn)); break;
            case 'u':  value.append(hexEscape(4, escapeLine, escapeColumn)); break;
            case '\n':
                // 反斜杠续行：两个字符都丢弃，行号照常推进
                newLine();
                break;
            default:
                // 未知转义保留反斜杠
                value.append('\\').append(c);
                break;
        }
    }

    private char hexEscape(int digits, int escapeLine, int escapeColumn) {
        int result = 0;
        for (int i = 0; i < digits; i++) {
            if (isAtEnd() || !isHexDigit(peek())) {
                throw new LexException("Invalid hex escape", '\\', escapeLine, escapeColumn);
            }
            result = result * 16 + Character.digit(advance(), 16);
        }
        return (char) result;
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') newLine();
        }
        throw error("Unterminated block comment", '/');
    }
}
