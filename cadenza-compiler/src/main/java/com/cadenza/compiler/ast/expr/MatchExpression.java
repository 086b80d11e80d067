package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.ExpressionVisitor;
import com.cadenza.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * match 表达式
 */
public final class MatchExpression extends Expression {
    private final Expression scrutinee;
    private final List<MatchCase> cases;

    public MatchExpression(SourceLocation location, Expression scrutinee, List<MatchCase> cases) {
        super(location);
        this.scrutinee = scrutinee;
        this.cases = Collections.unmodifiableList(new ArrayList<MatchCase>(cases));
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchCase> getCases() {
        return cases;
    }

    public boolean hasWildcard() {
        for (MatchCase c : cases) {
            if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD) {
                return true;
            }
        }
        return false;
    }

    public boolean hasCase(MatchPattern.Kind kind) {
        for (MatchCase c : cases) {
            if (c.getPattern().getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    /** 是否匹配 Result 的分支 */
    public boolean isResultMatch() {
        return hasCase(MatchPattern.Kind.OK) || hasCase(MatchPattern.Kind.ERROR);
    }

    public boolean isOptionMatch() {
        return hasCase(MatchPattern.Kind.SOME) || hasCase(MatchPattern.Kind.NONE);
    }

    /**
     * 分支是否穷尽：Result 需同时有 Ok/Error，Option 需同时有 Some/None，其余需要通配符
     */
    public boolean isExhaustive() {
        if (hasWildcard()) {
            return true;
        }
        if (isResultMatch()) {
            return hasCase(MatchPattern.Kind.OK) && hasCase(MatchPattern.Kind.ERROR);
        }
        if (isOptionMatch()) {
            return hasCase(MatchPattern.Kind.SOME) && hasCase(MatchPattern.Kind.NONE);
        }
        return false;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitMatch(this, context);
    }
}
