package com.cadenza.compiler.ast.stmt;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

/**
 * return 语句
 */
public final class ReturnStatement extends Statement {
    private final Expression value;

    public ReturnStatement(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    /** 可能为 null */
    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
