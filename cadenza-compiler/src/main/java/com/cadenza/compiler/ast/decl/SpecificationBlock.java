package com.cadenza.compiler.ast.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 附着在函数或模块上的规约块（意图、业务规则、后置条件、来源文档）
 */
public final class SpecificationBlock {
    private final String intent;
    private final List<String> rules;
    private final List<String> postconditions;
    private final String sourceDoc;

    public SpecificationBlock(String intent, List<String> rules, List<String> postconditions, String sourceDoc) {
        this.intent = intent;
        this.rules = Collections.unmodifiableList(new ArrayList<String>(rules));
        this.postconditions = Collections.unmodifiableList(new ArrayList<String>(postconditions));
        this.sourceDoc = sourceDoc;
    }

    public String getIntent() {
        return intent;
    }

    public List<String> getRules() {
        return rules;
    }

    public List<String> getPostconditions() {
        return postconditions;
    }

    /** 可能为 null */
    public String getSourceDoc() {
        return sourceDoc;
    }
}
