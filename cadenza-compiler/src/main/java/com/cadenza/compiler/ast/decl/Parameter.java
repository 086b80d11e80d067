package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.AstNode;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.TypeRef;

/**
 * 函数参数 name: type
 */
public final class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }
}
