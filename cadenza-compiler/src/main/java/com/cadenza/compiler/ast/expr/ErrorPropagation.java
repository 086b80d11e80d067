package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 错误传播 expr?
 * <p>expr 求值为 Error 时立即从外层函数返回该 Result，否则得到其中的值。</p>
 */
public final class ErrorPropagation extends Expression {
    private final Expression expression;

    public ErrorPropagation(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitErrorPropagation(this, context);
    }
}
