package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 数字字面量，值为 Integer 或 Double
 */
public final class NumberLiteral extends Expression {
    private final Number value;

    public NumberLiteral(SourceLocation location, Number value) {
        super(location);
        this.value = value;
    }

    public Number getValue() {
        return value;
    }

    public boolean isInteger() {
        return value instanceof Integer;
    }

    /** 源码形式，整数不带小数点 */
    public String toSourceString() {
        return value.toString();
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitNumber(this, context);
    }
}
