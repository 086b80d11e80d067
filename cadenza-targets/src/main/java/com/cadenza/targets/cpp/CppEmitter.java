package com.cadenza.targets.cpp;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.analysis.ResolvedCall;
import com.cadenza.compiler.ast.Effect;
import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.FunctionDeclaration;
import com.cadenza.compiler.ast.decl.ModuleDeclaration;
import com.cadenza.compiler.ast.decl.Parameter;
import com.cadenza.compiler.ast.expr.*;
import com.cadenza.targets.GenerationException;
import com.cadenza.targets.TargetCapabilities;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetPlatform;
import com.cadenza.targets.support.SourceEmitter;
import com.cadenza.targets.support.TargetStrings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * C++17 源码输出
 * <p>所有函数位于命名空间 cadenza_program，模块为其中的嵌套命名空间；先输出前置声明，函数顺序不受调用关系约束。</p>
 */
final class CppEmitter extends SourceEmitter {
    static final String PROGRAM_NAMESPACE = "cadenza_program";

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "alignas", "alignof", "and", "asm", "auto", "bool", "break", "case", "catch", "char", "class",
            "const", "constexpr", "const_cast", "continue", "decltype", "default", "delete", "do", "double",
            "dynamic_cast", "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend",
            "goto", "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "not", "nullptr",
            "operator", "or", "private", "protected", "public", "register", "reinterpret_cast", "return",
            "short", "signed", "sizeof", "static", "static_assert", "static_cast", "struct", "switch",
            "template", "this", "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned",
            "using", "virtual", "void", "volatile", "while", "xor", "std", "cadenza"
    ));

    CppEmitter(AnalyzedProgram analyzed, TargetConfiguration config, TargetCapabilities capabilities) {
        super(analyzed, config, TargetPlatform.NATIVE, capabilities);
    }

    // ============ 程序结构 ============

    @Override
    protected void emitProgram() {
        out.line("// Generated by the Cadenza compiler from " + program.getFileName());
        out.line("#include \"" + CppGenerator.RUNTIME_FILE + "\"");
        out.blankLine();
        out.line("#include <string>");
        out.line("#include <vector>");
        out.blankLine();
        out.line("namespace " + PROGRAM_NAMESPACE + " {");
        out.blankLine();

        emitForwardDeclarations();

        for (FunctionDeclaration fn : program.getFunctions()) {
            out.blankLine();
            fn.accept(this, null);
        }
        for (ModuleDeclaration module : program.getModules()) {
            out.blankLine();
            module.accept(this, null);
        }
        out.blankLine();
        out.line("}  // namespace " + PROGRAM_NAMESPACE);

        ResolvedCall entry = entryPoint();
        if (entry != null) {
            out.blankLine();
            out.openBlock("int main()");
            String callee = entry.getModuleName() == null
                    ? PROGRAM_NAMESPACE + "::" + name(entry.getFunctionName())
                    : PROGRAM_NAMESPACE + "::" + moduleFunction(entry.getModuleName(), entry.getFunctionName());
            out.line(callee + "();");
            out.line("return 0;");
            out.closeBlock("}");
        }
    }

    private void emitForwardDeclarations() {
        for (FunctionDeclaration fn : program.getFunctions()) {
            out.line(signature(fn, false) + ";");
        }
        for (ModuleDeclaration module : program.getModules()) {
            out.line("namespace " + module.getName() + " {");
            for (FunctionDeclaration fn : module.getFunctions()) {
                out.line(signature(fn, !module.isVisible(fn.getName())) + ";");
            }
            out.line("}  // namespace " + module.getName());
        }
    }

    private String signature(FunctionDeclaration fn, boolean internal) {
        List<String> params = new ArrayList<String>();
        for (Parameter p : fn.getParameters()) {
            params.add(type(p.getType()) + " " + name(p.getName()));
        }
        String returnType = fn.getReturnType().isUnit() ? "void" : type(fn.getReturnType());
        return (internal ? "static " : "") + returnType + " " + name(fn.getName()) + "(" + join(params) + ")";
    }

    @Override
    protected void emitModule(ModuleDeclaration module) {
        if (module.getSpecification() != null) {
            out.line("// " + module.getSpecification().getIntent());
        }
        out.line("namespace " + module.getName() + " {");
        for (FunctionDeclaration fn : module.getFunctions()) {
            out.blankLine();
            fn.accept(this, null);
        }
        out.blankLine();
        out.line("}  // namespace " + module.getName());
    }

    @Override
    protected void emitFunction(FunctionDeclaration fn) {
        for (String l : summaryLines(fn)) {
            out.line(l.isEmpty() ? "//" : "// " + l);
        }
        boolean internal = false;
        if (currentModule != null) {
            ModuleDeclaration module = program.findModule(currentModule);
            internal = module != null && !module.isVisible(fn.getName());
        }
        out.openBlock(signature(fn, internal));
        emitFunctionBody(fn);
        out.closeBlock("}");
    }

    // ============ 类型 ============

    @Override
    protected String type(TypeRef type) {
        String name = type.getName();
        if ("string".equals(name)) return "std::string";
        if ("float".equals(name)) return "double";
        if (type.isUnit()) return "cadenza::Unit";
        if (type.isResult()) {
            return "cadenza::Result<" + type(type.getOkType()) + ", " + type(type.getErrorType()) + ">";
        }
        if (type.isOption()) {
            return "cadenza::Option<" + type(type.getElementType()) + ">";
        }
        if (type.isList()) {
            return "std::vector<" + type(type.getElementType()) + ">";
        }
        return name;
    }

    // ============ 语句钩子 ============

    @Override
    protected void emitLocal(String name, TypeRef type, String value) {
        out.line((type == null ? "auto" : type(type)) + " " + name + " = " + value + ";");
    }

    @Override
    protected void emitDeclaration(String name, TypeRef type, SourceLocation location) {
        if (type == null) {
            throw new GenerationException(platform,
                    "Variable '" + name + "' needs a type annotation when a match arm is a block", location);
        }
        out.line(type(type) + " " + name + ";");
    }

    @Override
    protected String tempName(String base, int index) {
        return "cz_" + base + index;
    }

    @Override
    protected String discard(String value) {
        return "static_cast<void>(" + value + ");";
    }

    @Override
    protected String abort(String message) {
        return "cadenza::panic(" + stringLiteral(message) + ");";
    }

    @Override
    protected String trackEffects(FunctionDeclaration fn, List<Effect> effects) {
        List<String> names = new ArrayList<String>();
        for (Effect effect : effects) {
            names.add(TargetStrings.quote(effect.getDisplayName()));
        }
        return "cadenza::track_effects(" + TargetStrings.quote(fn.getName()) + ", {" + join(names) + "});";
    }

    // ============ Result / Option ============

    @Override
    protected String resultIsOk(String target) {
        return target + ".is_ok()";
    }

    @Override
    protected String resultIsError(String target) {
        return target + ".is_error()";
    }

    @Override
    protected String resultValue(String target) {
        return target + ".value()";
    }

    @Override
    protected String resultError(String target) {
        return target + ".error()";
    }

    @Override
    protected String propagateError(String target) {
        return "cadenza::err(" + resultError(target) + ")";
    }

    @Override
    protected String okValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return type(expected) + "(cadenza::Ok, " + value + ")";
        }
        return "cadenza::ok(" + value + ")";
    }

    @Override
    protected String errorValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return type(expected) + "(cadenza::Err, " + value + ")";
        }
        return "cadenza::err(" + value + ")";
    }

    @Override
    protected String optionHasValue(String target) {
        return target + ".has_value()";
    }

    @Override
    protected String optionIsEmpty(String target) {
        return target + ".is_none()";
    }

    @Override
    protected String optionValue(String target) {
        return target + ".value()";
    }

    @Override
    protected String someValue(String value, TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return type(expected) + "(" + value + ")";
        }
        return "cadenza::some(" + value + ")";
    }

    @Override
    protected String noneValue(TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return type(expected) + "()";
        }
        return "cadenza::none";
    }

    // ============ 表达式钩子 ============

    @Override
    protected String index(String target, String index) {
        return target + ".at(" + index + ")";
    }

    @Override
    protected String stringLiteral(String value) {
        return "std::string(\"" + TargetStrings.escapeCpp(value) + "\")";
    }

    @Override
    protected String interpolation(StringInterpolation node) {
        List<String> args = new ArrayList<String>();
        for (Expression part : node.getParts()) {
            if (part instanceof StringLiteral) {
                args.add("\"" + TargetStrings.escapeCpp(((StringLiteral) part).getValue()) + "\"");
            } else {
                args.add(expr(part));
            }
        }
        return "cadenza::format(" + join(args) + ")";
    }

    @Override
    protected String listLiteral(List<String> elements) {
        TypeRef expected = expectedType();
        if (expected != null && expected.isList()) {
            return type(expected) + "{" + join(elements) + "}";
        }
        return "std::vector{" + join(elements) + "}";
    }

    @Override
    protected String literal(Object value) {
        if (value instanceof String) {
            return "\"" + TargetStrings.escapeCpp((String) value) + "\"";
        }
        return String.valueOf(value);
    }

    /**
     * 表达式位置的 match：立即调用的 lambda，内部为条件链
     */
    @Override
    protected String matchExpression(MatchExpression node, String scrutinee) {
        String temp = tempName("v", 0);
        StringBuilder sb = new StringBuilder("[&]() { const auto& ").append(temp).append(" = ")
                .append(scrutinee).append("; ");
        boolean closed = false;
        for (MatchCase c : node.getCases()) {
            MatchPattern pattern = c.getPattern();
            String value = "return " + expr(c.getValueExpression()) + "; ";
            String binding = binding(c, temp);
            if (pattern.getKind() == MatchPattern.Kind.WILDCARD) {
                sb.append(binding).append(value);
                closed = true;
                break;
            }
            sb.append("if (").append(patternTest(temp, pattern)).append(") { ").append(binding).append(value).append("} ");
        }
        if (!closed) {
            sb.append(abort("Non-exhaustive match at line " + node.getLocation().getLine())).append(' ');
        }
        return sb.append("}()").toString();
    }

    private String binding(MatchCase c, String temp) {
        if (c.getBindingName() == null) return "";
        switch (c.getPattern().getKind()) {
            case OK:
                return "const auto& " + name(c.getBindingName()) + " = " + resultValue(temp) + "; ";
            case ERROR:
                return "const auto& " + name(c.getBindingName()) + " = " + resultError(temp) + "; ";
            case SOME:
                return "const auto& " + name(c.getBindingName()) + " = " + optionValue(temp) + "; ";
            default:
                return "";
        }
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String moduleFunction(String moduleName, String functionName) {
        return moduleName + "::" + name(functionName);
    }

    @Override
    protected String topLevelFunction(String functionName) {
        return PROGRAM_NAMESPACE + "::" + name(functionName);
    }
}
