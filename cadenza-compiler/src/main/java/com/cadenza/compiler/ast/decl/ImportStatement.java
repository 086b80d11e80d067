package com.cadenza.compiler.ast.decl;

import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.StatementVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 导入语句
 * <ul>
 *   <li>{@code import M.{a, b}} / {@code import {a, b} from M}：选择性导入</li>
 *   <li>{@code import M.*}：通配导入</li>
 *   <li>{@code import M}：仅引入模块，使用限定名调用</li>
 * </ul>
 */
public final class ImportStatement extends Statement {
    private final String moduleName;
    private final List<String> specificNames;
    private final boolean wildcard;

    public ImportStatement(SourceLocation location, String moduleName, List<String> specificNames, boolean wildcard) {
        super(location);
        this.moduleName = moduleName;
        this.specificNames = Collections.unmodifiableList(new ArrayList<String>(specificNames));
        this.wildcard = wildcard;
    }

    public String getModuleName() {
        return moduleName;
    }

    /** 选择性导入的名字，非选择性导入时为空 */
    public List<String> getSpecificNames() {
        return specificNames;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public boolean isSelective() {
        return !specificNames.isEmpty();
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitImport(this, context);
    }
}
