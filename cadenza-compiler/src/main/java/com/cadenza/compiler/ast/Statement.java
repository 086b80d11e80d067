package com.cadenza.compiler.ast;

/**
 * 语句节点基类（声明也是语句）
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
