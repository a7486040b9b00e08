package com.triflang.compiler.parser;

import com.triflang.compiler.ast.Program;
import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.stmt.Statement;
import com.triflang.compiler.lexer.Token;
import com.triflang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.triflang.compiler.lexer.TokenType.*;

/**
 * Trif 语法分析器（递归下降）
 *
 * <p>单 token 前瞻；仅在判断 import 形式时额外查看下一个 token。
 * 遇到第一个错误即抛出 {@link ParseException}，不做错误恢复。</p>
 */
public class Parser {

    private final List<Token> tokens;
    final String fileName;
    private int pos;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.pos = 0;
        this.current = tokens.get(0);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，EOF 处停止
     */
    Token advance() {
        previous = current;
        if (current.getType() != EOF) {
            pos++;
            current = tokens.get(pos);
        }
        return previous;
    }

    /**
     * 查看当前 token 之后的 token（不消费）
     */
    Token peek() {
        if (pos + 1 >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(pos + 1);
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /**
     * 解析成员名：标识符或关键字（. 后允许关键字作为成员名，如 task.spawn）
     */
    String expectMemberName() {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException("Expected member name", current, "IDENTIFIER");
    }

    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn());
    }

    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    void skipSeparators() {
        while (matchAny(NEWLINE, SEMICOLON)) {
            // 跳过换行符和分号
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析程序
     *
     * @throws ParseException 遇到第一个语法错误时
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(stmtParser.parseStatement());
            skipSeparators();
        }
        return new Program(loc, statements);
    }
}
