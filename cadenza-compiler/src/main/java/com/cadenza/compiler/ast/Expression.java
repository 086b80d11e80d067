package com.cadenza.compiler.ast;

/**
 * 表达式节点基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
