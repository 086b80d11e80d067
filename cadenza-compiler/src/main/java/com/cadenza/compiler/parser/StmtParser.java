package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.stmt.*;
import com.cadenza.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.cadenza.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(KW_LET)) {
            return parseLetStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_GUARD)) {
            return parseGuardStmt();
        }
        if (parser.checkAny(KW_FUNCTION, KW_PURE, KW_MODULE, KW_IMPORT, KW_EXPORT)) {
            throw new ParseException("Declarations are only allowed at top level or inside a module",
                    parser.current());
        }

        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression();
        return new ExpressionStatement(loc, expr);
    }

    /**
     * 解析 { statements }
     */
    List<Statement> parseBlock() {
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        parser.skipSemicolons();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
            parser.skipSemicolons();
        }
        parser.expect(RBRACE, "Expected '}' after block");
        return statements;
    }

    private Statement parseLetStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LET, "Expected 'let'");
        String name = parser.expect(IDENTIFIER, "Expected variable name after 'let'").getLexeme();

        TypeRef type = null;
        if (parser.match(COLON)) {
            type = parser.parseType();
        }

        parser.expect(ASSIGN, "Expected '=' in let statement");
        Expression initializer = parser.parseExpression();
        return new LetStatement(loc, name, type, initializer);
    }

    private Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");

        if (parser.checkAny(RBRACE, SEMICOLON, EOF)) {
            return new ReturnStatement(loc, null);
        }
        return new ReturnStatement(loc, parser.parseExpression());
    }

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        Expression condition = parser.parseExpression();
        List<Statement> thenBody = parseBlock();

        List<Statement> elseBody = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                elseBody = Collections.singletonList(parseIfStmt());
            } else {
                elseBody = parseBlock();
            }
        }
        return new IfStatement(loc, condition, thenBody, elseBody);
    }

    /**
     * guard condition else { ... }，else 块必须以 return 结束
     */
    private Statement parseGuardStmt() {
        SourceLocation loc = parser.location();
        Token guardToken = parser.expect(KW_GUARD, "Expected 'guard'");
        Expression condition = parser.parseExpression();
        parser.expect(KW_ELSE, "Expected 'else' after guard condition");
        List<Statement> elseBody = parseBlock();

        if (!terminates(elseBody)) {
            throw new ParseException("Guard else block must exit the enclosing function with 'return'", guardToken);
        }
        return new GuardStatement(loc, condition, elseBody);
    }

    /**
     * 语句序列是否在所有路径上返回
     */
    static boolean terminates(List<Statement> statements) {
        if (statements.isEmpty()) {
            return false;
        }
        Statement last = statements.get(statements.size() - 1);
        if (last instanceof ReturnStatement) {
            return true;
        }
        if (last instanceof IfStatement) {
            IfStatement ifStmt = (IfStatement) last;
            return ifStmt.hasElse() && terminates(ifStmt.getThenBody()) && terminates(ifStmt.getElseBody());
        }
        return false;
    }
}
