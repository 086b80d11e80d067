package com.cadenza.compiler.lexer;

/**
 * 插值字符串的一段：字面文本（已反转义）或嵌入表达式的源码
 */
public final class InterpolationSegment {
    private final boolean expression;
    private final String text;
    private final int line;
    private final int column;

    public InterpolationSegment(boolean expression, String text, int line, int column) {
        this.expression = expression;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public static InterpolationSegment literal(String text, int line, int column) {
        return new InterpolationSegment(false, text, line, column);
    }

    public static InterpolationSegment expression(String source, int line, int column) {
        return new InterpolationSegment(true, source, line, column);
    }

    public boolean isExpression() {
        return expression;
    }

    public String getText() {
        return text;
    }

    /** 片段首字符所在行 */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return expression ? "{" + text + "}" : "\"" + text + "\"";
    }
}
