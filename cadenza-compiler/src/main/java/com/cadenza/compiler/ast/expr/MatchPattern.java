package com.cadenza.compiler.ast.expr;

/**
 * match 分支模式：Ok/Error/Some/None（可带绑定名）、字面量或通配符 _
 */
public final class MatchPattern {

    public enum Kind {
        OK, ERROR, SOME, NONE, LITERAL, WILDCARD
    }

    private final Kind kind;
    private final String bindingName;
    private final Object literal;

    private MatchPattern(Kind kind, String bindingName, Object literal) {
        this.kind = kind;
        this.bindingName = bindingName;
        this.literal = literal;
    }

    public static MatchPattern variant(Kind kind, String bindingName) {
        return new MatchPattern(kind, bindingName, null);
    }

    /** 字面量为 Integer、Double、String 或 Boolean */
    public static MatchPattern literal(Object value) {
        return new MatchPattern(Kind.LITERAL, null, value);
    }

    public static MatchPattern wildcard() {
        return new MatchPattern(Kind.WILDCARD, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** 可能为 null */
    public String getBindingName() {
        return bindingName;
    }

    public boolean hasBinding() {
        return bindingName != null;
    }

    public Object getLiteral() {
        return literal;
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return literal instanceof String ? "\"" + literal + "\"" : String.valueOf(literal);
            case WILDCARD:
                return "_";
            default:
                String name = kind.name().charAt(0) + kind.name().substring(1).toLowerCase();
                return bindingName == null ? name : name + "(" + bindingName + ")";
        }
    }
}
