package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法调用 receiver.method(args)，receiver 不是模块名
 */
public final class MethodCallExpression extends Expression {
    private final Expression receiver;
    private final String methodName;
    private final List<Expression> arguments;

    public MethodCallExpression(SourceLocation location, Expression receiver, String methodName, List<Expression> arguments) {
        super(location);
        this.receiver = receiver;
        this.methodName = methodName;
        this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCall(this, context);
    }
}
