package com.cadenza.compiler.ast.stmt;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;
import com.cadenza.compiler.ast.TypeRef;

/**
 * let name[: type] = initializer
 */
public final class LetStatement extends Statement {
    private final String name;
    private final TypeRef type;
    private final Expression initializer;

    public LetStatement(SourceLocation location, String name, TypeRef type, Expression initializer) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    /** 未声明类型时为 null */
    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
