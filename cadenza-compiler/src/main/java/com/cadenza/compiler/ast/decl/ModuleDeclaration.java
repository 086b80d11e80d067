package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 模块声明 module Name { ... }
 * <p>模块内出现 export 时只有导出的名字对外可见，否则全部函数可见。</p>
 */
public final class ModuleDeclaration extends Statement {
    private final String name;
    private final List<Statement> body;
    private final Set<String> exports;
    private final SpecificationBlock specification;

    public ModuleDeclaration(SourceLocation location, String name, List<Statement> body,
                             Set<String> exports, SpecificationBlock specification) {
        super(location);
        this.name = name;
        this.body = Collections.unmodifiableList(new ArrayList<Statement>(body));
        this.exports = exports == null ? null : Collections.unmodifiableSet(new LinkedHashSet<String>(exports));
        this.specification = specification;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    /** 显式导出列表；模块内没有任何 export 时为 null */
    public Set<String> getExports() {
        return exports;
    }

    public boolean hasExportList() {
        return exports != null;
    }

    public SpecificationBlock getSpecification() {
        return specification;
    }

    public List<FunctionDeclaration> getFunctions() {
        List<FunctionDeclaration> result = new ArrayList<FunctionDeclaration>();
        for (Statement stmt : body) {
            if (stmt instanceof FunctionDeclaration) {
                result.add((FunctionDeclaration) stmt);
            }
        }
        return result;
    }

    public FunctionDeclaration findFunction(String functionName) {
        for (FunctionDeclaration fn : getFunctions()) {
            if (fn.getName().equals(functionName)) {
                return fn;
            }
        }
        return null;
    }

    /** 对模块外是否可见 */
    public boolean isVisible(String functionName) {
        if (findFunction(functionName) == null) {
            return false;
        }
        return exports == null || exports.contains(functionName);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
