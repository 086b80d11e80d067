package com.cadenza.targets;

import com.cadenza.compiler.CadenzaException;
import com.cadenza.compiler.Diagnostic;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 后端生成失败：只影响该目标，由多目标编译器捕获并记录
 */
public class GenerationException extends CadenzaException {
    private final TargetPlatform target;
    private final SourceLocation location;

    public GenerationException(TargetPlatform target, String message) {
        this(target, message, SourceLocation.UNKNOWN);
    }

    public GenerationException(TargetPlatform target, String message, SourceLocation location) {
        super(message);
        this.target = target;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public TargetPlatform getTarget() {
        return target;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (target != null) {
            sb.append('[').append(target.getDisplayName()).append("] ");
        }
        sb.append(super.getMessage());
        if (location.getLine() > 0) {
            sb.append(" at line ").append(location.getLine()).append(", column ").append(location.getColumn());
        }
        return sb.toString();
    }

    @Override
    public Diagnostic toDiagnostic() {
        return new Diagnostic(Diagnostic.Severity.ERROR, super.getMessage(), location.getLine(), location.getColumn());
    }
}
