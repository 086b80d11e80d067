package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用；name 可以是限定名 Module.fn，由符号表解析而非解析器
 */
public final class CallExpression extends Expression {
    private final String name;
    private final List<Expression> arguments;

    public CallExpression(SourceLocation location, String name, List<Expression> arguments) {
        super(location);
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public boolean isQualified() {
        return name.indexOf('.') >= 0;
    }

    /** 限定名的模块部分，非限定名返回 null */
    public String getQualifier() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? null : name.substring(0, dot);
    }

    /** 限定名的最后一段 */
    public String getSimpleName() {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
