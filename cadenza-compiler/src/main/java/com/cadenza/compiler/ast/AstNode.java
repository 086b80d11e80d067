package com.cadenza.compiler.ast;

/**
 * AST 节点基类
 * <p>节点由解析器一次性构造，此后只读；整棵树归 {@link com.cadenza.compiler.ast.decl.Program} 所有。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
