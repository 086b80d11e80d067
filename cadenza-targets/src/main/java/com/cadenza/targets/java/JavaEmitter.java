package com.cadenza.targets.java;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.analysis.ResolvedCall;
import com.cadenza.compiler.ast.Effect;
import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.SourceLocation;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.FunctionDeclaration;
import com.cadenza.compiler.ast.decl.ModuleDeclaration;
import com.cadenza.compiler.ast.decl.Parameter;
import com.cadenza.compiler.ast.decl.SpecificationBlock;
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
 * Java 源码输出：单个 CadenzaProgram 类，模块为其中的静态嵌套类
 */
final class JavaEmitter extends SourceEmitter {
    static final String PROGRAM_CLASS = "CadenzaProgram";

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "var", "yield", "record", "null", "true", "false", "_"
    ));

    private final String packageName;

    JavaEmitter(AnalyzedProgram analyzed, TargetConfiguration config, TargetCapabilities capabilities,
                String packageName) {
        super(analyzed, config, TargetPlatform.JAVA, capabilities);
        this.packageName = packageName;
    }

    // ============ 程序结构 ============

    @Override
    protected void emitProgram() {
        out.line("// Generated by the Cadenza compiler from " + program.getFileName());
        out.line("package " + packageName + ";");
        out.blankLine();
        out.line("import " + packageName + ".CadenzaRuntime.Option;");
        out.line("import " + packageName + ".CadenzaRuntime.Result;");
        out.line("import java.util.List;");
        out.line("import java.util.Objects;");
        out.blankLine();
        out.openBlock("public final class " + PROGRAM_CLASS);
        out.blankLine();
        out.line("private " + PROGRAM_CLASS + "() {");
        out.line("}");

        ResolvedCall entry = entryPoint();
        if (entry != null) {
            out.blankLine();
            out.openBlock("public static void main(String[] args)");
            String callee = entry.getModuleName() == null
                    ? name(entry.getFunctionName())
                    : moduleFunction(entry.getModuleName(), entry.getFunctionName());
            out.line(callee + "();");
            out.closeBlock("}");
        }

        for (FunctionDeclaration fn : program.getFunctions()) {
            out.blankLine();
            fn.accept(this, null);
        }
        for (ModuleDeclaration module : program.getModules()) {
            out.blankLine();
            module.accept(this, null);
        }
        out.closeBlock("}");
    }

    @Override
    protected void emitModule(ModuleDeclaration module) {
        SpecificationBlock spec = module.getSpecification();
        if (spec != null) {
            out.line("/** " + javadoc(spec.getIntent()) + " */");
        }
        out.openBlock("public static final class " + module.getName());
        out.blankLine();
        out.line("private " + module.getName() + "() {");
        out.line("}");
        for (FunctionDeclaration fn : module.getFunctions()) {
            out.blankLine();
            fn.accept(this, null);
        }
        out.closeBlock("}");
    }

    @Override
    protected void emitFunction(FunctionDeclaration fn) {
        emitJavadoc(fn);
        boolean visible = true;
        if (currentModule != null) {
            ModuleDeclaration module = program.findModule(currentModule);
            visible = module == null || module.isVisible(fn.getName());
        }
        List<String> params = new ArrayList<String>();
        for (Parameter p : fn.getParameters()) {
            params.add(type(p.getType()) + " " + name(p.getName()));
        }
        String returnType = fn.getReturnType().isUnit() ? "void" : type(fn.getReturnType());
        out.openBlock((visible ? "public" : "private") + " static " + returnType + " " + name(fn.getName())
                + "(" + join(params) + ")");
        emitFunctionBody(fn);
        out.closeBlock("}");
    }

    private void emitJavadoc(FunctionDeclaration fn) {
        List<String> lines = summaryLines(fn);
        for (Parameter p : fn.getParameters()) {
            if (lines.size() > 0 && p == fn.getParameters().get(0)) lines.add("");
            lines.add("@param " + p.getName() + " Parameter of type " + p.getType());
        }
        if (!fn.getReturnType().isUnit()) {
            lines.add("@return Returns " + fn.getReturnType());
        }
        if (lines.isEmpty()) return;
        out.line("/**");
        for (String l : lines) {
            out.line(l.isEmpty() ? " *" : " * " + javadoc(l));
        }
        out.line(" */");
    }

    private static String javadoc(String text) {
        return text.replace("*/", "*&#47;").replace("<", "&lt;").replace(">", "&gt;");
    }

    // ============ 类型 ============

    @Override
    protected String type(TypeRef type) {
        String name = type.getName();
        if ("string".equals(name)) return "String";
        if ("bool".equals(name)) return "boolean";
        if ("float".equals(name)) return "double";
        if (type.isUnit()) return "CadenzaRuntime.Unit";
        if (type.isResult()) {
            return "Result<" + boxed(type.getOkType()) + ", " + boxed(type.getErrorType()) + ">";
        }
        if (type.isOption()) {
            return "Option<" + boxed(type.getElementType()) + ">";
        }
        if (type.isList()) {
            return "List<" + boxed(type.getElementType()) + ">";
        }
        return name;
    }

    /** 泛型参数位置的类型，基本类型装箱 */
    private String boxed(TypeRef type) {
        String mapped = type(type);
        switch (mapped) {
            case "int":
                return "Integer";
            case "boolean":
                return "Boolean";
            case "double":
                return "Double";
            default:
                return mapped;
        }
    }

    // ============ 语句钩子 ============

    @Override
    protected void emitLocal(String name, TypeRef type, String value) {
        out.line((type == null ? "var" : type(type)) + " " + name + " = " + value + ";");
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
    protected String discard(String value) {
        return "CadenzaRuntime.discard(" + value + ");";
    }

    @Override
    protected String abort(String message) {
        return "throw new IllegalStateException(" + TargetStrings.quote(message) + ");";
    }

    @Override
    protected String trackEffects(FunctionDeclaration fn, List<Effect> effects) {
        StringBuilder sb = new StringBuilder("CadenzaRuntime.trackEffects(");
        sb.append(TargetStrings.quote(fn.getName()));
        for (Effect effect : effects) {
            sb.append(", ").append(TargetStrings.quote(effect.getDisplayName()));
        }
        return sb.append(");").toString();
    }

    // ============ Result / Option ============

    @Override
    protected String resultIsOk(String target) {
        return target + ".isOk()";
    }

    @Override
    protected String resultIsError(String target) {
        return target + ".isError()";
    }

    @Override
    protected String resultValue(String target) {
        return target + ".getValue()";
    }

    @Override
    protected String resultError(String target) {
        return target + ".getError()";
    }

    @Override
    protected String propagateError(String target) {
        // 返回语境推断出外层函数的类型参数
        return "Result.error(" + resultError(target) + ")";
    }

    @Override
    protected String okValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return "Result.<" + boxed(expected.getOkType()) + ", " + boxed(expected.getErrorType()) + ">ok(" + value + ")";
        }
        return "Result.ok(" + value + ")";
    }

    @Override
    protected String errorValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return "Result.<" + boxed(expected.getOkType()) + ", " + boxed(expected.getErrorType()) + ">error(" + value + ")";
        }
        return "Result.error(" + value + ")";
    }

    @Override
    protected String optionHasValue(String target) {
        return target + ".isSome()";
    }

    @Override
    protected String optionIsEmpty(String target) {
        return target + ".isNone()";
    }

    @Override
    protected String optionValue(String target) {
        return target + ".getValue()";
    }

    @Override
    protected String someValue(String value, TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return "Option.<" + boxed(expected.getElementType()) + ">some(" + value + ")";
        }
        return "Option.some(" + value + ")";
    }

    @Override
    protected String noneValue(TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return "Option.<" + boxed(expected.getElementType()) + ">none()";
        }
        return "Option.none()";
    }

    // ============ 表达式钩子 ============

    @Override
    protected String binary(BinaryExpression.BinaryOp op, String left, String right, BinaryExpression node) {
        if ((op == BinaryExpression.BinaryOp.EQ || op == BinaryExpression.BinaryOp.NE)
                && !isPrimitiveLiteral(node.getLeft()) && !isPrimitiveLiteral(node.getRight())) {
            // 引用类型（字符串、装箱值）按值比较
            String test = "Objects.equals(" + left + ", " + right + ")";
            return op == BinaryExpression.BinaryOp.EQ ? test : "!" + test;
        }
        return super.binary(op, left, right, node);
    }

    private static boolean isPrimitiveLiteral(Expression e) {
        return e instanceof NumberLiteral || e instanceof BooleanLiteral
                || (e instanceof UnaryExpression && ((UnaryExpression) e).getOperand() instanceof NumberLiteral);
    }

    @Override
    protected String literalEquals(String target, String literal, Object rawValue) {
        if (rawValue instanceof String) {
            return literal + ".equals(" + target + ")";
        }
        return target + " == " + literal;
    }

    @Override
    protected String index(String target, String index) {
        return target + ".get(" + index + ")";
    }

    @Override
    protected String stringLiteral(String value) {
        return TargetStrings.quote(value);
    }

    @Override
    protected String interpolation(StringInterpolation node) {
        List<String> pieces = new ArrayList<String>();
        for (Expression part : node.getParts()) {
            if (part instanceof StringLiteral) {
                pieces.add(stringLiteral(((StringLiteral) part).getValue()));
            } else {
                String text = expr(part);
                if (part instanceof BinaryExpression || part instanceof TernaryExpression) {
                    text = "(" + text + ")";
                }
                pieces.add(text);
            }
        }
        if (pieces.isEmpty()) {
            return "\"\"";
        }
        // 首段不是字符串时 + 会先做数值加法
        if (!(node.getParts().get(0) instanceof StringLiteral)) {
            pieces.add(0, "\"\"");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pieces.size(); i++) {
            if (i > 0) sb.append(" + ");
            sb.append(pieces.get(i));
        }
        return sb.toString();
    }

    @Override
    protected String listLiteral(List<String> elements) {
        return "List.of(" + join(elements) + ")";
    }

    @Override
    protected String matchExpression(MatchExpression node, String scrutinee) {
        String fallback = "CadenzaRuntime.panic("
                + TargetStrings.quote("Non-exhaustive match at line " + node.getLocation().getLine()) + ")";
        String receiver = receiverOf(node, scrutinee);
        if (node.isResultMatch()) {
            return receiver + ".match(" + lambda(node, MatchPattern.Kind.OK, fallback) + ", "
                    + lambda(node, MatchPattern.Kind.ERROR, fallback) + ")";
        }
        if (node.isOptionMatch()) {
            MatchCase none = caseFor(node, MatchPattern.Kind.NONE);
            return receiver + ".match(" + lambda(node, MatchPattern.Kind.SOME, fallback)
                    + ", () -> " + (none != null ? expr(none.getValueExpression()) : fallback) + ")";
        }
        if (switchable(node)) {
            StringBuilder sb = new StringBuilder("switch (").append(scrutinee).append(") { ");
            boolean wildcard = false;
            for (MatchCase c : node.getCases()) {
                if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD) {
                    sb.append("default -> ").append(expr(c.getValueExpression())).append("; ");
                    wildcard = true;
                    break;
                }
                sb.append("case ").append(literal(c.getPattern().getLiteral())).append(" -> ")
                        .append(expr(c.getValueExpression())).append("; ");
            }
            if (!wildcard) {
                sb.append("default -> throw new IllegalStateException(")
                        .append(TargetStrings.quote("Non-exhaustive match at line " + node.getLocation().getLine()))
                        .append("); ");
            }
            return sb.append("}").toString();
        }
        // boolean 与小数不能用于 switch，退化为条件表达式链
        StringBuilder sb = new StringBuilder("(");
        String tail = fallback;
        for (MatchCase c : node.getCases()) {
            if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD) {
                tail = expr(c.getValueExpression());
                break;
            }
            sb.append("Objects.equals(").append(scrutinee).append(", ").append(literal(c.getPattern().getLiteral()))
                    .append(") ? ").append(expr(c.getValueExpression())).append(" : ");
        }
        return sb.append(tail).append(")").toString();
    }

    private static boolean switchable(MatchExpression node) {
        for (MatchCase c : node.getCases()) {
            Object literal = c.getPattern().getLiteral();
            if (c.getPattern().getKind() == MatchPattern.Kind.LITERAL
                    && !(literal instanceof Integer) && !(literal instanceof String)) {
                return false;
            }
        }
        return true;
    }

    private String receiverOf(MatchExpression node, String scrutinee) {
        Expression e = node.getScrutinee();
        if (e instanceof Identifier || e instanceof CallExpression || e instanceof MethodCallExpression
                || e instanceof MemberAccessExpression) {
            return scrutinee;
        }
        return "(" + scrutinee + ")";
    }

    private String lambda(MatchExpression node, MatchPattern.Kind kind, String fallback) {
        MatchCase c = caseFor(node, kind);
        if (c == null) {
            return "ignored -> " + fallback;
        }
        String param = c.getBindingName() != null ? name(c.getBindingName()) : "ignored";
        return param + " -> " + expr(c.getValueExpression());
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String moduleFunction(String moduleName, String functionName) {
        return moduleName + "." + name(functionName);
    }

    @Override
    protected String topLevelFunction(String functionName) {
        return PROGRAM_CLASS + "." + name(functionName);
    }
}
