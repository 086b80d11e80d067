package com.cadenza.compiler.ast;

import java.util.Collections;
import java.util.List;

/**
 * 类型引用：int、string、Result&lt;T, E&gt;、Option&lt;T&gt;、List&lt;T&gt; 或用户类型名
 */
public final class TypeRef {
    public static final String RESULT = "Result";
    public static final String OPTION = "Option";
    public static final String LIST = "List";
    public static final String UNIT = "Unit";

    public static final TypeRef UNIT_TYPE = new TypeRef(UNIT, Collections.<TypeRef>emptyList());

    private final String name;
    private final List<TypeRef> arguments;

    public TypeRef(String name, List<TypeRef> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public static TypeRef simple(String name) {
        return new TypeRef(name, Collections.<TypeRef>emptyList());
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getArguments() {
        return arguments;
    }

    public boolean isResult() {
        return RESULT.equals(name) && arguments.size() == 2;
    }

    public boolean isOption() {
        return OPTION.equals(name) && arguments.size() == 1;
    }

    public boolean isList() {
        return LIST.equals(name) && arguments.size() == 1;
    }

    public boolean isUnit() {
        return UNIT.equals(name);
    }

    /** Result 的成功类型，非 Result 返回 null */
    public TypeRef getOkType() {
        return isResult() ? arguments.get(0) : null;
    }

    /** Result 的错误类型，非 Result 返回 null */
    public TypeRef getErrorType() {
        return isResult() ? arguments.get(1) : null;
    }

    /** Option / List 的元素类型 */
    public TypeRef getElementType() {
        return arguments.size() == 1 ? arguments.get(0) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + arguments.hashCode();
    }

    /** 源码写法，如 Result&lt;int, string&gt; */
    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append('>').toString();
    }
}
