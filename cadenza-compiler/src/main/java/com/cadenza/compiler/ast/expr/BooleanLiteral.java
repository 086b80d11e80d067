package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * true / false
 */
public final class BooleanLiteral extends Expression {
    private final boolean value;

    public BooleanLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBoolean(this, context);
    }
}
