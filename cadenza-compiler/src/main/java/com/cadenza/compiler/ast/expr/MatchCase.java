package com.cadenza.compiler.ast.expr;

import com.cadenza.compiler.ast.AstNode;
import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.stmt.ExpressionStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * match 分支 Pattern -&gt; body
 * <p>单表达式分支的 body 是一条 {@link ExpressionStatement}。</p>
 */
public final class MatchCase extends AstNode {
    private final MatchPattern pattern;
    private final List<Statement> body;
    private final boolean blockBody;

    public MatchCase(SourceLocation location, MatchPattern pattern, List<Statement> body, boolean blockBody) {
        super(location);
        this.pattern = pattern;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
        this.blockBody = blockBody;
    }

    public MatchPattern getPattern() {
        return pattern;
    }

    public String getBindingName() {
        return pattern.getBindingName();
    }

    public List<Statement> getBody() {
        return body;
    }

    /** 分支是否写成 { ... } 块 */
    public boolean isBlockBody() {
        return blockBody;
    }

    /** 单表达式分支的表达式，块分支返回 null */
    public Expression getValueExpression() {
        if (!blockBody && body.size() == 1 && body.get(0) instanceof ExpressionStatement) {
            return ((ExpressionStatement) body.get(0)).getExpression();
        }
        return null;
    }
}
