package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public final class BinaryExpression extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpression(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    /**
     * 二元运算符，precedence 越大结合越紧
     */
    public enum BinaryOp {
        // 逻辑
        OR("||", 1),
        AND("&&", 2),

        // 比较
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 4),
        LE("<=", 4),
        GT(">", 4),
        GE(">=", 4),

        // 算术
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        MOD("%", 6);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符，目标语言沿用同一写法 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isComparison() {
            return precedence == 3 || precedence == 4;
        }
    }
}
