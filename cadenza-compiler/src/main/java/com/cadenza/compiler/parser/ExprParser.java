package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.expr.*;
import com.cadenza.compiler.ast.stmt.ExpressionStatement;
import com.cadenza.compiler.lexer.InterpolationSegment;
import com.cadenza.compiler.lexer.Lexer;
import com.cadenza.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.cadenza.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 * <p>优先级由低到高：三元、||、&amp;&amp;、相等、关系、加减、乘除模、一元、后缀（? 调用 成员 下标）。</p>
 */
class ExprParser {

    final Parser parser;

    // '?' 所在下标 -> 是否开始三元表达式；试探结果只取决于 token 序列
    private final Map<Integer, Boolean> ternaryDecisions = new HashMap<Integer, Boolean>();

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseTernaryExpr();
    }

    // 三元表达式 condition ? thenExpr : elseExpr（右结合）
    private Expression parseTernaryExpr() {
        Expression condition = parseOrExpr();

        if (parser.check(QUESTION)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression thenExpr = parseTernaryExpr();
            parser.expect(COLON, "Expected ':' in ternary expression");
            Expression elseExpr = parseTernaryExpr();
            return new TernaryExpression(loc, condition, thenExpr, elseExpr);
        }

        return condition;
    }

    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        while (parser.check(OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseAndExpr();
            left = new BinaryExpression(loc, left, BinaryExpression.BinaryOp.OR, right);
        }
        return left;
    }

    private Expression parseAndExpr() {
        Expression left = parseEqualityExpr();
        while (parser.check(AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseEqualityExpr();
            left = new BinaryExpression(loc, left, BinaryExpression.BinaryOp.AND, right);
        }
        return left;
    }

    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();
        while (parser.checkAny(EQ, NE)) {
            SourceLocation loc = parser.location();
            Token op = parser.advance();
            BinaryExpression.BinaryOp binOp = op.is(EQ) ? BinaryExpression.BinaryOp.EQ : BinaryExpression.BinaryOp.NE;
            Expression right = parseComparisonExpr();
            left = new BinaryExpression(loc, left, binOp, right);
        }
        return left;
    }

    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.checkAny(LT, GT, LE, GE)) {
            SourceLocation loc = parser.location();
            Token op = parser.advance();
            BinaryExpression.BinaryOp binOp;
            switch (op.getType()) {
                case LT: binOp = BinaryExpression.BinaryOp.LT; break;
                case GT: binOp = BinaryExpression.BinaryOp.GT; break;
                case LE: binOp = BinaryExpression.BinaryOp.LE; break;
                default: binOp = BinaryExpression.BinaryOp.GE; break;
            }
            Expression right = parseAdditiveExpr();
            left = new BinaryExpression(loc, left, binOp, right);
        }
        return left;
    }

    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            Token op = parser.advance();
            BinaryExpression.BinaryOp binOp = op.is(PLUS) ? BinaryExpression.BinaryOp.ADD : BinaryExpression.BinaryOp.SUB;
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpression(loc, left, binOp, right);
        }
        return left;
    }

    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();
        while (parser.checkAny(MUL, DIV, MOD)) {
            SourceLocation loc = parser.location();
            Token op = parser.advance();
            BinaryExpression.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpression.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpression.BinaryOp.DIV; break;
                default: binOp = BinaryExpression.BinaryOp.MOD; break;
            }
            Expression right = parseUnaryExpr();
            left = new BinaryExpression(loc, left, binOp, right);
        }
        return left;
    }

    private Expression parseUnaryExpr() {
        if (parser.check(NOT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new UnaryExpression(loc, UnaryExpression.UnaryOp.NOT, parseUnaryExpr());
        }
        if (parser.check(MINUS)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new UnaryExpression(loc, UnaryExpression.UnaryOp.NEG, parseUnaryExpr());
        }
        return parsePostfixExpr();
    }

    // 后缀：expr?、.member、.method(args)、[index]
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.check(QUESTION)) {
                if (startsTernary()) {
                    break;
                }
                SourceLocation loc = parser.location();
                parser.advance();
                expr = new ErrorPropagation(loc, expr);
            } else if (parser.check(DOT)) {
                SourceLocation loc = parser.location();
                parser.advance();
                String member = parser.expectName("Expected member name after '.'");
                if (parser.check(LPAREN)) {
                    List<Expression> args = parseArguments();
                    expr = new MethodCallExpression(loc, expr, member, args);
                } else {
                    expr = new MemberAccessExpression(loc, expr, member);
                }
            } else if (parser.check(LBRACKET)) {
                SourceLocation loc = parser.location();
                parser.advance();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpression(loc, expr, index);
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * 当前 '?' 是否开始一个三元表达式：试探解析 "? then :"，成功则交给三元层处理
     * <p>判定按下标缓存，嵌套三元不会在试探中重复试探。</p>
     */
    private boolean startsTernary() {
        if (!canStartExpression(parser.peek(1))) {
            return false;
        }
        Integer at = parser.position();
        Boolean known = ternaryDecisions.get(at);
        if (known == null) {
            known = tryTernary();
            ternaryDecisions.put(at, known);
        }
        return known;
    }

    private boolean tryTernary() {
        parser.mark();
        try {
            parser.advance(); // ?
            parseTernaryExpr();
            return parser.check(COLON);
        } catch (ParseException e) {
            // 试探失败，按错误传播处理
            return false;
        } finally {
            parser.reset();
        }
    }

    private static boolean canStartExpression(Token token) {
        return token.isOneOf(IDENTIFIER, EFFECT, NUMBER_LITERAL, STRING_LITERAL, STRING_INTERPOLATION,
                KW_TRUE, KW_FALSE, KW_OK, KW_ERROR, KW_SOME, KW_NONE, KW_MATCH,
                LPAREN, LBRACKET, NOT, MINUS);
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current();

        switch (token.getType()) {
            case NUMBER_LITERAL:
                parser.advance();
                return new NumberLiteral(loc, (Number) token.getLiteral());
            case STRING_LITERAL:
                parser.advance();
                return new StringLiteral(loc, (String) token.getLiteral());
            case STRING_INTERPOLATION:
                parser.advance();
                return parseInterpolation(loc, token);
            case KW_TRUE:
                parser.advance();
                return new BooleanLiteral(loc, true);
            case KW_FALSE:
                parser.advance();
                return new BooleanLiteral(loc, false);
            case KW_OK:
            case KW_ERROR: {
                parser.advance();
                parser.expect(LPAREN, "Expected '(' after " + token.getLexeme());
                Expression value = parseExpression();
                parser.expect(RPAREN, "Expected ')' after " + token.getLexeme() + " value");
                ResultExpression.Variant variant = token.is(KW_OK)
                        ? ResultExpression.Variant.OK : ResultExpression.Variant.ERROR;
                return new ResultExpression(loc, variant, value);
            }
            case KW_SOME: {
                parser.advance();
                parser.expect(LPAREN, "Expected '(' after Some");
                Expression value = parseExpression();
                parser.expect(RPAREN, "Expected ')' after Some value");
                return new OptionExpression(loc, value);
            }
            case KW_NONE:
                parser.advance();
                return new OptionExpression(loc, null);
            case KW_MATCH:
                return parseMatch();
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return inner;
            }
            case LBRACKET:
                return parseListLiteral();
            case IDENTIFIER:
            case EFFECT:
                return parseNameExpr();
            default:
                throw new ParseException("Expected expression", token, "expression");
        }
    }

    /**
     * 标识符开头：f(args)、Module.fn(args)（折叠为带限定名的调用），否则为标识符
     */
    private Expression parseNameExpr() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();

        if (parser.check(LPAREN)) {
            return new CallExpression(loc, name, parseArguments());
        }

        // 向前看 A.B.c( 形式
        int offset = 0;
        StringBuilder qualified = new StringBuilder(name);
        while (parser.peek(offset).is(DOT) && parser.peek(offset + 1).isOneOf(IDENTIFIER, EFFECT)) {
            qualified.append('.').append(parser.peek(offset + 1).getLexeme());
            offset += 2;
            if (parser.peek(offset).is(LPAREN)) {
                for (int i = 0; i < offset; i++) {
                    parser.advance();
                }
                return new CallExpression(loc, qualified.toString(), parseArguments());
            }
        }

        return new Identifier(loc, name);
    }

    List<Expression> parseArguments() {
        parser.expect(LPAREN, "Expected '('");
        List<Expression> args = new ArrayList<Expression>();
        if (!parser.check(RPAREN)) {
            do {
                args.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parseListLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");
        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACKET)) {
            do {
                elements.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACKET, "Expected ']' after list elements");
        return new ListExpression(loc, elements);
    }

    /**
     * 插值字符串：嵌入表达式按其源码位置重新词法/语法分析
     */
    @SuppressWarnings("unchecked")
    private Expression parseInterpolation(SourceLocation loc, Token token) {
        List<InterpolationSegment> segments = (List<InterpolationSegment>) token.getLiteral();
        List<Expression> parts = new ArrayList<Expression>();
        for (InterpolationSegment segment : segments) {
            SourceLocation segLoc = new SourceLocation(parser.fileName, segment.getLine(), segment.getColumn());
            if (segment.isExpression()) {
                List<Token> inner = new Lexer(segment.getText(), segment.getLine(), segment.getColumn()).tokenize();
                parts.add(new Parser(inner, parser.fileName).parseStandaloneExpression());
            } else {
                parts.add(new StringLiteral(segLoc, segment.getText()));
            }
        }
        return new StringInterpolation(loc, parts);
    }

    // ============ match ============

    private Expression parseMatch() {
        SourceLocation loc = parser.location();
        parser.expect(KW_MATCH, "Expected 'match'");
        Expression scrutinee = parseExpression();
        parser.expect(LBRACE, "Expected '{' after match value");

        List<MatchCase> cases = new ArrayList<MatchCase>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            cases.add(parseMatchCase());
            parser.match(COMMA);
            parser.skipSemicolons();
        }
        parser.expect(RBRACE, "Expected '}' after match cases");

        if (cases.isEmpty()) {
            throw new ParseException("Match expression requires at least one case", parser.previous());
        }
        return new MatchExpression(loc, scrutinee, cases);
    }

    private MatchCase parseMatchCase() {
        SourceLocation loc = parser.location();
        MatchPattern pattern = parsePattern();
        parser.expect(ARROW, "Expected '->' after match pattern");

        if (parser.check(LBRACE)) {
            List<Statement> body = parser.parseBlock();
            return new MatchCase(loc, pattern, body, true);
        }

        SourceLocation exprLoc = parser.location();
        Expression value = parseExpression();
        List<Statement> body = Collections.<Statement>singletonList(new ExpressionStatement(exprLoc, value));
        return new MatchCase(loc, pattern, body, false);
    }

    private MatchPattern parsePattern() {
        Token token = parser.current();
        switch (token.getType()) {
            case KW_OK:
                parser.advance();
                return MatchPattern.variant(MatchPattern.Kind.OK, parseBinding());
            case KW_ERROR:
                parser.advance();
                return MatchPattern.variant(MatchPattern.Kind.ERROR, parseBinding());
            case KW_SOME:
                parser.advance();
                return MatchPattern.variant(MatchPattern.Kind.SOME, parseBinding());
            case KW_NONE:
                parser.advance();
                return MatchPattern.variant(MatchPattern.Kind.NONE, null);
            case UNDERSCORE:
                parser.advance();
                return MatchPattern.wildcard();
            case NUMBER_LITERAL:
            case STRING_LITERAL:
                parser.advance();
                return MatchPattern.literal(token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return MatchPattern.literal(Boolean.TRUE);
            case KW_FALSE:
                parser.advance();
                return MatchPattern.literal(Boolean.FALSE);
            case MINUS:
                if (parser.checkAhead(1, NUMBER_LITERAL)) {
                    parser.advance();
                    Number n = (Number) parser.advance().getLiteral();
                    Number negated = n instanceof Integer ? (Number) Integer.valueOf(-n.intValue())
                            : (Number) Double.valueOf(-n.doubleValue());
                    return MatchPattern.literal(negated);
                }
                throw new ParseException("Invalid match pattern", token, "Ok, Error, Some, None, literal or _");
            default:
                throw new ParseException("Invalid match pattern", token, "Ok, Error, Some, None, literal or _");
        }
    }

    /** 可选绑定 (name) 或 (_)，返回 null 表示不绑定 */
    private String parseBinding() {
        if (!parser.match(LPAREN)) {
            return null;
        }
        String binding = null;
        if (!parser.match(UNDERSCORE)) {
            binding = parser.expect(IDENTIFIER, "Expected binding name in pattern").getLexeme();
        }
        parser.expect(RPAREN, "Expected ')' after pattern binding");
        return binding;
    }
}
