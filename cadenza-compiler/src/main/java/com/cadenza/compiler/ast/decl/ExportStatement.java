package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 导出语句 export { a, b }
 */
public final class ExportStatement extends Statement {
    private final List<String> names;

    public ExportStatement(SourceLocation location, List<String> names) {
        super(location);
        this.names = Collections.unmodifiableList(new ArrayList<String>(names));
    }

    public List<String> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitExport(this, context);
    }
}
