package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * Some(value) / None
 */
public final class OptionExpression extends Expression {
    private final Expression value;

    public OptionExpression(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    /** None 时为 null */
    public Expression getValue() {
        return value;
    }

    public boolean isSome() {
        return value != null;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitOption(this, context);
    }
}
