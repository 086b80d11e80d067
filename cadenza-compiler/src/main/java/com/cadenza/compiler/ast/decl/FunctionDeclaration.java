package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.Effect;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;
import com.cadenza.compiler.ast.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明
 * <p>isPure 为 true 时 effects 必为空；effects 保持声明顺序但语义上无序。</p>
 */
public final class FunctionDeclaration extends Statement {
    private final String name;
    private final List<Parameter> parameters;
    private final TypeRef returnType;
    private final List<Statement> body;
    private final boolean pure;
    private final List<Effect> effects;
    private final boolean exported;
    private final SpecificationBlock specification;

    public FunctionDeclaration(SourceLocation location, String name, List<Parameter> parameters,
                               TypeRef returnType, List<Statement> body, boolean pure,
                               List<Effect> effects, boolean exported, SpecificationBlock specification) {
        super(location);
        if (pure && !effects.isEmpty()) {
            throw new IllegalArgumentException("Pure function '" + name + "' cannot declare effects");
        }
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
        this.returnType = returnType;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
        this.pure = pure;
        this.effects = Collections.unmodifiableList(new ArrayList<Effect>(effects));
        this.exported = exported;
        this.specification = specification;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    /** 省略 "-> T" 时为 Unit */
    public TypeRef getReturnType() {
        return returnType;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isPure() {
        return pure;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public boolean hasEffects() {
        return !effects.isEmpty();
    }

    public boolean isExported() {
        return exported;
    }

    /** 可能为 null */
    public SpecificationBlock getSpecification() {
        return specification;
    }

    public boolean returnsResult() {
        return returnType.isResult();
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
