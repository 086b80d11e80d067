package com.cadenza.compiler;

/**
 * 诊断条目 {line, column, message}
 */
public final class Diagnostic {

    public enum Severity {
        ERROR, WARNING, INFO
    }

    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;

    public Diagnostic(Severity severity, String message, int line, int column) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    public boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (hasPosition()) {
            return severity + " " + line + ":" + column + ": " + message;
        }
        return severity + ": " + message;
    }
}
