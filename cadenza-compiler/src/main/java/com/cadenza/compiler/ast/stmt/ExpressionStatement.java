package com.cadenza.compiler.ast.stmt;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

/**
 * 表达式语句
 */
public final class ExpressionStatement extends Statement {
    private final Expression expression;

    public ExpressionStatement(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStatement(this, context);
    }
}
