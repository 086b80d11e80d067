package com.cadenza.compiler.lexer;

import com.cadenza.compiler.CadenzaException;
import com.cadenza.compiler.Diagnostic;

/**
 * 词法错误，遇到第一处即终止
 */
public class LexException extends CadenzaException {
    private final String reason;
    private final int line;
    private final int column;

    public LexException(String reason, int line, int column) {
        super(reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return reason + " at line " + line + ", column " + column;
    }

    @Override
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, reason, line, column);
    }
}
