package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 标识符引用
 */
public final class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
