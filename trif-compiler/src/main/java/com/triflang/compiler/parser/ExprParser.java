package com.triflang.compiler.parser;

import com.triflang.compiler.ast.SourceLocation;
import com.triflang.compiler.ast.expr.*;
import com.triflang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.triflang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.triflang.compiler.lexer.Token;
import com.triflang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.triflang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级（由低到高）：{@code ||}、{@code &&}、{@code == !=}、{@code < > <= >=}、
 * {@code + -}、{@code * / %}、前缀 {@code - !}、后缀调用与成员访问、基本表达式。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression expr = parseAnd();
        while (parser.check(OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            expr = new BinaryExpr(loc, expr, BinaryOp.OR, parseAnd());
        }
        return expr;
    }

    private Expression parseAnd() {
        Expression expr = parseEquality();
        while (parser.check(AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            expr = new BinaryExpr(loc, expr, BinaryOp.AND, parseEquality());
        }
        return expr;
    }

    private Expression parseEquality() {
        Expression expr = parseComparison();
        while (parser.checkAny(EQ, NE)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            expr = new BinaryExpr(loc, expr, op, parseComparison());
        }
        return expr;
    }

    private Expression parseComparison() {
        Expression expr = parseTerm();
        while (parser.checkAny(LT, GT, LE, GE)) {
            SourceLocation loc = parser.location();
            BinaryOp op;
            switch (parser.advance().getType()) {
                case LT: op = BinaryOp.LT; break;
                case GT: op = BinaryOp.GT; break;
                case LE: op = BinaryOp.LE; break;
                default: op = BinaryOp.GE; break;
            }
            expr = new BinaryExpr(loc, expr, op, parseTerm());
        }
        return expr;
    }

    private Expression parseTerm() {
        Expression expr = parseFactor();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            expr = new BinaryExpr(loc, expr, op, parseFactor());
        }
        return expr;
    }

    private Expression parseFactor() {
        Expression expr = parseUnary();
        while (parser.checkAny(MUL, DIV, MOD)) {
            SourceLocation loc = parser.location();
            BinaryOp op;
            switch (parser.advance().getType()) {
                case MUL: op = BinaryOp.MUL; break;
                case DIV: op = BinaryOp.DIV; break;
                default: op = BinaryOp.MOD; break;
            }
            expr = new BinaryExpr(loc, expr, op, parseUnary());
        }
        return expr;
    }

    private Expression parseUnary() {
        if (parser.checkAny(MINUS, NOT)) {
            SourceLocation loc = parser.location();
            UnaryOp op = parser.advance().is(MINUS) ? UnaryOp.NEG : UnaryOp.NOT;
            return new UnaryExpr(loc, op, parseUnary());
        }
        return parsePostfix();
    }

    /**
     * 后缀：调用 (...) 与成员访问 .name，左结合可链式
     */
    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            if (parser.check(LPAREN)) {
                SourceLocation loc = parser.location();
                parser.advance();
                List<Expression> args = parseExpressionList(RPAREN);
                parser.expect(RPAREN, "Expected ')' after arguments");
                expr = new CallExpr(loc, expr, args);
            } else if (parser.check(DOT)) {
                SourceLocation loc = parser.location();
                parser.advance();
                expr = new MemberExpr(loc, expr, parser.expectMemberName());
            } else {
                break;
            }
        }
        return expr;
    }

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case NUMBER:
                parser.advance();
                return new NumberLiteral(loc, (Double) token.getLiteral());
            case STRING:
                parser.advance();
                return new StringLiteral(loc, (String) token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return new BooleanLiteral(loc, true);
            case KW_FALSE:
                parser.advance();
                return new BooleanLiteral(loc, false);
            case KW_NULL:
                parser.advance();
                return new NullLiteral(loc);
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                parser.advance();
                parser.skipNewlines();
                Expression expr = parseExpression();
                parser.skipNewlines();
                parser.expect(RPAREN, "Expected ')' after expression");
                return expr;
            }
            case LBRACKET: {
                parser.advance();
                List<Expression> elements = parseExpressionList(RBRACKET);
                parser.expect(RBRACKET, "Expected ']' after list elements");
                return new ListLiteral(loc, elements);
            }
            case LBRACE:
                return parseDict();
            default:
                throw new ParseException("Unexpected token", token, "expression");
        }
    }

    /**
     * 逗号分隔的表达式列表（不消费结束符），括号内换行被忽略
     */
    private List<Expression> parseExpressionList(TokenType closing) {
        List<Expression> items = new ArrayList<Expression>();
        parser.skipNewlines();
        if (parser.check(closing)) {
            return items;
        }
        do {
            parser.skipNewlines();
            items.add(parseExpression());
            parser.skipNewlines();
        } while (parser.match(COMMA));
        return items;
    }

    private DictLiteral parseDict() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<DictLiteral.Entry> entries = new ArrayList<DictLiteral.Entry>();
        parser.skipNewlines();
        if (!parser.check(RBRACE)) {
            do {
                parser.skipNewlines();
                Expression key = parseExpression();
                parser.skipNewlines();
                parser.expect(COLON, "Expected ':' after dictionary key");
                parser.skipNewlines();
                Expression value = parseExpression();
                parser.skipNewlines();
                entries.add(new DictLiteral.Entry(key, value));
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACE, "Expected '}' after dictionary entries");
        return new DictLiteral(loc, entries);
    }
}
