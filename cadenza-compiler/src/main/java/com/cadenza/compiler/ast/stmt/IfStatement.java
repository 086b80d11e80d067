package com.cadenza.compiler.ast.stmt;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * if 语句；else if 链表示为仅含一个 IfStatement 的 else 分支
 */
public final class IfStatement extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;

    public IfStatement(SourceLocation location, Expression condition, List<Statement> thenBody, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(new ArrayList<Statement>(thenBody));
        this.elseBody = elseBody == null ? null : Collections.unmodifiableList(new ArrayList<Statement>(elseBody));
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBody() {
        return thenBody;
    }

    /** 无 else 时为 null */
    public List<Statement> getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    /** else 分支是否为 else if */
    public boolean isElseIf() {
        return elseBody != null && elseBody.size() == 1 && elseBody.get(0) instanceof IfStatement;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
