package com.triflang.compiler.parser;

import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.CallExpr;
import com.triflang.compiler.ast.expr.Expression;
import com.triflang.compiler.ast.expr.Identifier;
import com.triflang.compiler.ast.expr.MemberExpr;
import com.triflang.compiler.ast.stmt.*;
import com.triflang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.triflang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类（含 import / export）
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        switch (parser.current.getType()) {
            case KW_IMPORT:
                return parseImport();
            case KW_EXPORT:
                return parseExport();
            case KW_LET:
            case KW_CONST:
                return parseLet(false, false);
            case KW_FN:
            case KW_FUNCTION:
                return parseFunction(false, false);
            case KW_RETURN:
                return parseReturn();
            case KW_IF:
                return parseIf();
            case KW_WHILE:
                return parseWhile();
            case KW_FOR:
                return parseFor();
            case KW_SPAWN:
                return parseSpawn();
            default:
                return parseExpressionOrAssign();
        }
    }

    /**
     * 解析代码块 { ... }
     */
    List<Statement> parseBlock() {
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}'");
        return statements;
    }

    // ============ 声明 ============

    /**
     * let / const 声明，'=' 初始值必填
     */
    LetStmt parseLet(boolean exported, boolean isDefault) {
        SourceLocation loc = parser.location();
        boolean mutable = parser.advance().getType() == KW_LET;
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        parser.expect(ASSIGN, "Expected '=' in variable declaration");
        Expression initializer = parser.exprParser.parseExpression();
        return new LetStmt(loc, name, initializer, mutable, exported, isDefault);
    }

    /**
     * fn / function 声明；仅 export default 允许省略函数名
     */
    FunctionDecl parseFunction(boolean exported, boolean isDefault) {
        SourceLocation loc = parser.location();
        parser.advance(); // fn / function

        String name;
        if (parser.check(IDENTIFIER)) {
            name = parser.advance().getLexeme();
        } else if (isDefault) {
            name = FunctionDecl.DEFAULT_EXPORT_NAME;
        } else {
            throw new ParseException("Function declaration requires a name", parser.current, "IDENTIFIER");
        }

        parser.expect(LPAREN, "Expected '(' after function name");
        List<String> params = new ArrayList<String>();
        parser.skipNewlines();
        if (!parser.check(RPAREN)) {
            do {
                parser.skipNewlines();
                params.add(parser.expect(IDENTIFIER, "Expected parameter name").getLexeme());
                parser.skipNewlines();
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");

        List<Statement> body = parseBlock();
        return new FunctionDecl(loc, name, params, body, exported, isDefault);
    }

    // ============ 控制流 ============

    private ReturnStmt parseReturn() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression value = null;
        if (!parser.checkAny(RBRACE, NEWLINE, SEMICOLON, EOF)) {
            value = parser.exprParser.parseExpression();
        }
        return new ReturnStmt(loc, value);
    }

    private IfStmt parseIf() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        Expression test = parser.exprParser.parseExpression();
        List<Statement> body = parseBlock();

        List<Statement> elseBody = Collections.emptyList();
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBody = Collections.<Statement>singletonList(parseIf());
            } else {
                elseBody = parseBlock();
            }
        }
        return new IfStmt(loc, test, body, elseBody);
    }

    private WhileStmt parseWhile() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression test = parser.exprParser.parseExpression();
        List<Statement> body = parseBlock();
        return new WhileStmt(loc, test, body);
    }

    private ForStmt parseFor() {
        SourceLocation loc = parser.location();
        parser.advance();
        String variable = parser.expect(IDENTIFIER, "Expected loop variable").getLexeme();
        parser.expect(KW_IN, "Expected 'in' after loop variable");
        Expression iterable = parser.exprParser.parseExpression();
        List<Statement> body = parseBlock();
        return new ForStmt(loc, variable, iterable, body);
    }

    private SpawnStmt parseSpawn() {
        SourceLocation loc = parser.location();
        Token spawnToken = parser.advance();
        Expression expr = parser.exprParser.parseExpression();
        if (!(expr instanceof CallExpr)) {
            throw new ParseException("spawn expects a function call", spawnToken, "call expression");
        }
        return new SpawnStmt(loc, (CallExpr) expr);
    }

    private Statement parseExpressionOrAssign() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();
        if (parser.check(ASSIGN)) {
            if (!(expr instanceof Identifier) && !(expr instanceof MemberExpr)) {
                throw new ParseException("Invalid assignment target", parser.current);
            }
            parser.advance();
            Expression value = parser.exprParser.parseExpression();
            return new AssignStmt(loc, expr, value);
        }
        return new ExpressionStmt(loc, expr);
    }

    // ============ 模块 ============

    /**
     * import 语句的五种形式：
     * <pre>
     * import "path" [as x]
     * import def [, { a, b as c } | , * as ns] from mod
     * import { a, b as c } from mod
     * import * as ns from mod
     * import std.io [as io]
     * </pre>
     */
    private Statement parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");

        if (parser.check(STRING)) {
            String path = (String) parser.advance().getLiteral();
            String alias = parseOptionalAlias();
            return new ImportStmt(loc, path, true, alias);
        }

        String defaultBinding = null;
        String namespaceBinding = null;
        List<Specifier> specifiers = Collections.emptyList();
        boolean fromForm = false;

        if (parser.check(IDENTIFIER) && (parser.peek().is(COMMA) || parser.peek().is(KW_FROM))) {
            defaultBinding = parser.advance().getLexeme();
            fromForm = true;
            if (parser.match(COMMA)) {
                if (parser.check(LBRACE)) {
                    specifiers = parseSpecifierList();
                } else if (parser.check(MUL)) {
                    namespaceBinding = parseNamespaceBinding();
                } else {
                    throw new ParseException("Expected named import list after comma", parser.current, "'{' or '*'");
                }
            }
        } else if (parser.check(LBRACE)) {
            specifiers = parseSpecifierList();
            fromForm = true;
        } else if (parser.check(MUL)) {
            namespaceBinding = parseNamespaceBinding();
            fromForm = true;
        }

        if (fromForm) {
            parser.expect(KW_FROM, "Expected 'from' in import statement");
            String module = parseModuleSpecifier();
            return new ImportFromStmt(loc, module, specifiers, defaultBinding, namespaceBinding);
        }

        String module = parseDottedName();
        String alias = parseOptionalAlias();
        return new ImportStmt(loc, module, false, alias);
    }

    /**
     * export 语句
     */
    private Statement parseExport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_EXPORT, "Expected 'export'");

        if (parser.match(KW_DEFAULT)) {
            if (parser.current.getType().isFunctionKeyword()) {
                return parseFunction(true, true);
            }
            if (parser.current.getType().isBindingKeyword()) {
                return parseLet(true, true);
            }
            Expression value = parser.exprParser.parseExpression();
            return new ExportDefaultStmt(loc, value);
        }
        if (parser.current.getType().isFunctionKeyword()) {
            return parseFunction(true, false);
        }
        if (parser.current.getType().isBindingKeyword()) {
            return parseLet(true, false);
        }
        if (parser.check(LBRACE)) {
            List<Specifier> specifiers = parseSpecifierList();
            String source = null;
            if (parser.match(KW_FROM)) {
                source = parseModuleSpecifier();
            }
            return new ExportNamesStmt(loc, specifiers, source);
        }
        throw new ParseException("Unsupported export statement", parser.current,
                "default, fn, function, let, const or '{'");
    }

    /**
     * { name [as alias], ... }，允许尾随逗号与换行
     */
    private List<Specifier> parseSpecifierList() {
        parser.expect(LBRACE, "Expected '{'");
        List<Specifier> specifiers = new ArrayList<Specifier>();
        parser.skipNewlines();
        while (!parser.check(RBRACE)) {
            String name = parser.expect(IDENTIFIER, "Expected name in specifier list").getLexeme();
            String alias = parseOptionalAlias();
            specifiers.add(new Specifier(name, alias));
            parser.skipNewlines();
            if (!parser.match(COMMA)) break;
            parser.skipNewlines();
        }
        parser.expect(RBRACE, "Expected '}' after specifier list");
        return specifiers;
    }

    private String parseNamespaceBinding() {
        parser.expect(MUL, "Expected '*'");
        parser.expect(KW_AS, "Expected 'as' after '*'");
        return parser.expect(IDENTIFIER, "Expected namespace name").getLexeme();
    }

    private String parseOptionalAlias() {
        if (parser.match(KW_AS)) {
            return parser.expect(IDENTIFIER, "Expected alias name").getLexeme();
        }
        return null;
    }

    /**
     * 模块说明：字符串路径或点分名称
     */
    private String parseModuleSpecifier() {
        if (parser.check(STRING)) {
            return (String) parser.advance().getLiteral();
        }
        return parseDottedName();
    }

    private String parseDottedName() {
        StringBuilder sb = new StringBuilder();
        sb.append(parser.expect(IDENTIFIER, "Expected module name").getLexeme());
        while (parser.match(DOT)) {
            sb.append('.').append(parser.expect(IDENTIFIER, "Expected module name after '.'").getLexeme());
        }
        return sb.toString();
    }
}
