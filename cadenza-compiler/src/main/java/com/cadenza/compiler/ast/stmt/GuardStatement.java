package com.cadenza.compiler.ast.stmt;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * guard 语句：guard condition else { elseBody }
 * <p>语义为条件不成立时执行 elseBody，elseBody 必须从函数中返回。</p>
 */
public final class GuardStatement extends Statement {
    private final Expression condition;
    private final List<Statement> elseBody;

    public GuardStatement(SourceLocation location, Expression condition, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.elseBody = Collections.unmodifiableList(new ArrayList<Statement>(elseBody));
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitGuard(this, context);
    }
}
