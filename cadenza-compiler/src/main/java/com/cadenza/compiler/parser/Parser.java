package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.Program;
import com.cadenza.compiler.lexer.Token;
import com.cadenza.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.cadenza.compiler.lexer.TokenType.*;

/**
 * Cadenza 语法分析器（递归下降）
 * <p>声明、语句、表达式、类型分别委托给 {@link DeclParser}、{@link StmtParser}、
 * {@link ExprParser}、{@link TypeParser}。第一处错误即抛出 {@link ParseException}。</p>
 */
public class Parser {

    final List<Token> tokens;
    final String fileName;
    private int position = 0;

    // mark/reset 回溯支持
    private final List<Integer> marks = new ArrayList<Integer>(4);

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
    }

    public Parser(List<Token> tokens) {
        this(tokens, "<input>");
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(position);
    }

    Token previous() {
        return position > 0 ? tokens.get(position - 1) : tokens.get(0);
    }

    /**
     * 向前看 offset 个 token，越界时返回 EOF
     */
    Token peek(int offset) {
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 前进到下一个 token，EOF 处不再移动
     */
    Token advance() {
        Token token = current();
        if (!token.is(EOF)) {
            position++;
        }
        return token;
    }

    /**
     * 标记当前位置，用于回溯
     */
    void mark() {
        marks.add(position);
    }

    /**
     * 回溯到最近的标记
     */
    void reset() {
        position = marks.remove(marks.size() - 1);
    }

    /** 当前 token 下标 */
    int position() {
        return position;
    }

    boolean check(TokenType type) {
        return current().getType() == type;
    }

    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    boolean checkAhead(int offset, TokenType type) {
        return peek(offset).getType() == type;
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
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
        throw new ParseException(message, current(), type.name());
    }

    /**
     * 名字位置：普通标识符，副作用名也可用作模块名或函数名
     */
    boolean checkName() {
        return checkAny(IDENTIFIER, EFFECT);
    }

    String expectName(String message) {
        if (checkName()) {
            return advance().getLexeme();
        }
        throw new ParseException(message, current(), "IDENTIFIER");
    }

    /** 跳过可选的分号 */
    void skipSemicolons() {
        while (match(SEMICOLON)) {
            // 分号只作分隔
        }
    }

    SourceLocation location() {
        return locationOf(current());
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序；只允许顶层声明（function、module、import、export）
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();
        skipSemicolons();
        while (!isAtEnd()) {
            statements.add(declParser.parseTopLevel());
            skipSemicolons();
        }
        return new Program(loc, fileName, statements);
    }

    /**
     * 解析单个独立表达式，必须消费到 EOF（用于插值字符串中的嵌入表达式）
     */
    public Expression parseStandaloneExpression() {
        Expression expr = exprParser.parseExpression();
        if (!isAtEnd()) {
            throw new ParseException("Unexpected token after expression", current());
        }
        return expr;
    }

    // ============ 委托方法 ============

    TypeRef parseType() { return typeParser.parseType(); }

    Statement parseStatement() { return stmtParser.parseStatement(); }

    List<Statement> parseBlock() { return stmtParser.parseBlock(); }

    Expression parseExpression() { return exprParser.parseExpression(); }
}
