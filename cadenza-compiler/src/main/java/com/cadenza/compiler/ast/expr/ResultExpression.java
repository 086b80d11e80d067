package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * Ok(value) / Error(value)
 */
public final class ResultExpression extends Expression {

    public enum Variant {
        OK, ERROR
    }

    private final Variant variant;
    private final Expression value;

    public ResultExpression(SourceLocation location, Variant variant, Expression value) {
        super(location);
        this.variant = variant;
        this.value = value;
    }

    public Variant getVariant() {
        return variant;
    }

    public boolean isOk() {
        return variant == Variant.OK;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitResult(this, context);
    }
}
