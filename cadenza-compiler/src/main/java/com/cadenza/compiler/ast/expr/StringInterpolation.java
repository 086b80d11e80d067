package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 字符串插值 $"Hello {name}!"
 * <p>parts 按源码顺序排列，字面文本为 {@link StringLiteral}，其余为嵌入表达式。</p>
 */
public final class StringInterpolation extends Expression {
    private final List<Expression> parts;

    public StringInterpolation(SourceLocation location, List<Expression> parts) {
        super(location);
        this.parts = Collections.unmodifiableList(new ArrayList<Expression>(parts));
    }

    public List<Expression> getParts() {
        return parts;
    }

    /** 嵌入表达式，按出现顺序 */
    public List<Expression> getExpressions() {
        List<Expression> result = new ArrayList<Expression>();
        for (Expression part : parts) {
            if (!(part instanceof StringLiteral)) {
                result.add(part);
            }
        }
        return result;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitInterpolation(this, context);
    }
}
