package com.cadenza.compiler.analysis;

import com.cadenza.compiler.CadenzaException;
import com.cadenza.compiler.Diagnostic;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 语义错误：解析成功但违反副作用/Result 约定或模块可见性
 */
public class SemanticException extends CadenzaException {
    private final SourceLocation location;

    public SemanticException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location.getLine() > 0) {
            return super.getMessage() + " at line " + location.getLine() + ", column " + location.getColumn();
        }
        return super.getMessage();
    }

    @Override
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, super.getMessage(), location.getLine(), location.getColumn());
    }
}
