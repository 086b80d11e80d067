package com.cadenza.compiler.lexer;

import com.cadenza.compiler.ast.Effect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cadenza 词法分析器
 * <p>顺序扫描，遇到第一处错误立即抛出 {@link LexException}，不产生部分结果。
 * 空白、换行与注释不生成 Token，流末尾恰好有一个 EOF。</p>
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<Token>();

    private int start = 0;
    private int current = 0;
    private int line;
    private int column;

    // 当前 Token 起点
    private int tokenLine;
    private int tokenColumn;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明
        map.put("function", TokenType.KW_FUNCTION);
        map.put("pure", TokenType.KW_PURE);
        map.put("uses", TokenType.KW_USES);
        map.put("let", TokenType.KW_LET);
        map.put("module", TokenType.KW_MODULE);
        map.put("import", TokenType.KW_IMPORT);
        map.put("export", TokenType.KW_EXPORT);
        map.put("from", TokenType.KW_FROM);

        // 控制流
        map.put("return", TokenType.KW_RETURN);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("guard", TokenType.KW_GUARD);
        map.put("match", TokenType.KW_MATCH);

        // Result / Option
        map.put("Result", TokenType.KW_RESULT);
        map.put("Ok", TokenType.KW_OK);
        map.put("Error", TokenType.KW_ERROR);
        map.put("Option", TokenType.KW_OPTION);
        map.put("Some", TokenType.KW_SOME);
        map.put("None", TokenType.KW_NONE);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this(source, 1, 1);
    }

    /**
     * 从指定位置开始计数，用于重新扫描插值字符串中的嵌入表达式
     */
    public Lexer(String source, int startLine, int startColumn) {
        this.source = source;
        this.line = startLine;
        this.column = startColumn;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     *
     * @throws LexException 未闭合的字符串/插值/块注释，或非法字符
     */
    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            start = current;
            tokenLine = line;
            tokenColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (c == '/' && peekNext() == '/') {
                // 单行注释
                while (peek() != '\n' && !isAtEnd()) advance();
            } else if (c == '/' && peekNext() == '*' && !startsSpecBlock()) {
                blockComment();
            } else {
                break;
            }
        }
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
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;
            case '?': addToken(TokenType.QUESTION); break;

            // 可能是多字符的 Token
            case '-':
                addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
                break;

            case '/':
                if (peek() == '*') {
                    // 只有 /*spec 会走到这里
                    advance();
                    specBlock();
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
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    throw error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    throw error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.UNDERSCORE);
                }
                break;

            // 字符串
            case '"':
                string();
                break;

            case '$':
                if (match('"')) {
                    interpolatedString();
                } else {
                    throw error("Unexpected character '$'. String interpolation must start with $\"");
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: " + c);
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

    private boolean startsWith(String text) {
        return source.startsWith(text, current);
    }

    /** "/*spec" 后必须紧跟空白，否则只是普通块注释 */
    private boolean startsSpecBlock() {
        int after = current + 6;
        return startsWith("/*spec") && after < source.length() && Character.isWhitespace(source.charAt(after));
    }

    private void newLine() {
        line++;
        column = 1;
    }

    /** 消耗一个字符，若为换行则更新行号 */
    private char advanceTracking() {
        char c = advance();
        if (c == '\n') newLine();
        return c;
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

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(unescape(advanceTracking()));
            } else {
                value.append(advanceTracking());
            }
        }

        if (isAtEnd()) {
            throw errorAtToken("Unterminated string");
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void interpolatedString() {
        List<InterpolationSegment> segments = new ArrayList<InterpolationSegment>();
        StringBuilder text = new StringBuilder();
        int textLine = line;
        int textColumn = column;

        while (!isAtEnd() && peek() != '"') {
            char c = peek();
            if (c == '\\') {
                advance();
                if (isAtEnd()) break;
                text.append(unescape(advanceTracking()));
            } else if (c == '{') {
                if (text.length() > 0) {
                    segments.add(InterpolationSegment.literal(text.toString(), textLine, textColumn));
                    text.setLength(0);
                }
                advance(); // {
                int exprLine = line;
                int exprColumn = column;
                int exprStart = current;
                skipInterpolatedExpression();
                String exprSource = source.substring(exprStart, current);
                advance(); // }
                if (exprSource.trim().isEmpty()) {
                    throw new LexException("Empty interpolation expression", exprLine, exprColumn);
                }
                segments.add(InterpolationSegment.expression(exprSource, exprLine, exprColumn));
                textLine = line;
                textColumn = column;
            } else {
                text.append(advanceTracking());
            }
        }

        if (isAtEnd()) {
            throw errorAtToken("Unterminated interpolated string");
        }
        if (text.length() > 0) {
            segments.add(InterpolationSegment.literal(text.toString(), textLine, textColumn));
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_INTERPOLATION, Collections.unmodifiableList(segments));
    }

    /**
     * 跳过 {...} 内的表达式源码，停在匹配的 '}' 上；嵌套花括号与内层字符串均被跳过
     */
    private void skipInterpolatedExpression() {
        int depth = 1;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return;
                }
            } else if (c == '"') {
                advance();
                while (!isAtEnd() && peek() != '"') {
                    if (peek() == '\\') advance();
                    if (!isAtEnd()) advanceTracking();
                }
                if (isAtEnd()) break;
            }
            advanceTracking();
        }
        throw errorAtToken("Unterminated interpolation expression");
    }

    /**
     * 转义字符映射；无法识别的转义去掉反斜杠，保留后一个字符
     */
    private static char unescape(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 't':  return '\t';
            case 'r':  return '\r';
            case '\\': return '\\';
            case '"':  return '"';
            default:   return c;
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            addToken(TokenType.NUMBER_LITERAL, Double.valueOf(text));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER_LITERAL, Integer.valueOf(text));
        } catch (NumberFormatException e) {
            throw new LexException("Invalid integer literal: " + text, tokenLine, tokenColumn);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type != null) {
            addToken(type);
            return;
        }
        Effect effect = Effect.fromName(text);
        if (effect != null) {
            addToken(TokenType.EFFECT, effect);
        } else {
            addToken(TokenType.IDENTIFIER);
        }
    }

    private void blockComment() {
        int commentLine = line;
        int commentColumn = column;
        advance(); // /
        advance(); // *
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advanceTracking();
        }
        throw new LexException("Unterminated block comment", commentLine, commentColumn);
    }

    /**
     * 规约块 /*spec ... spec*&#47;，此时已消费 "/*"
     */
    private void specBlock() {
        // 消费 "spec"
        for (int i = 0; i < 4; i++) advance();
        int bodyStart = current;
        while (!isAtEnd()) {
            if (startsWith("spec*/")) {
                String body = source.substring(bodyStart, current).trim();
                for (int i = 0; i < 6; i++) advance();
                addToken(TokenType.SPEC_BLOCK, body);
                return;
            }
            advanceTracking();
        }
        throw errorAtToken("Unterminated specification block");
    }

    private LexException error(String message) {
        return new LexException(message, line, column - 1);
    }

    private LexException errorAtToken(String message) {
        return new LexException(message, tokenLine, tokenColumn);
    }
}
