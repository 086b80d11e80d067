package com.cadenza.targets.csharp;

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
 * C# 源码输出：顶层函数放入静态类 CadenzaProgram，模块映射为 Cadenza.Modules.M 命名空间下的静态类
 */
final class CSharpEmitter extends SourceEmitter {
    static final String PROGRAM_CLASS = "CadenzaProgram";
    static final String MODULE_NAMESPACE = "Cadenza.Modules.";

    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked",
            "class", "const", "continue", "decimal", "default", "delegate", "do", "double", "else",
            "enum", "event", "explicit", "extern", "false", "finally", "fixed", "float", "for",
            "foreach", "goto", "if", "implicit", "in", "int", "interface", "internal", "is", "lock",
            "long", "namespace", "new", "null", "object", "operator", "out", "override", "params",
            "private", "protected", "public", "readonly", "ref", "return", "sbyte", "sealed", "short",
            "sizeof", "stackalloc", "static", "string", "struct", "switch", "this", "throw", "true",
            "try", "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort", "using", "virtual",
            "void", "volatile", "while"
    ));

    CSharpEmitter(AnalyzedProgram analyzed, TargetConfiguration config, TargetCapabilities capabilities) {
        super(analyzed, config, TargetPlatform.CSHARP, capabilities);
    }

    @Override
    protected boolean braceOnNewLine() {
        return true;
    }

    // ============ 程序结构 ============

    @Override
    protected void emitProgram() {
        out.line("// <auto-generated>");
        out.line("// Generated by the Cadenza compiler from " + program.getFileName());
        out.line("// </auto-generated>");
        out.line("using System;");
        out.line("using System.Collections.Generic;");
        out.line("using System.Linq;");
        out.line("using Cadenza.Runtime;");
        out.blankLine();

        ResolvedCall entry = entryPoint();
        if (entry != null) {
            String callee = entry.getModuleName() == null
                    ? PROGRAM_CLASS + "." + name(entry.getFunctionName())
                    : moduleFunction(entry.getModuleName(), entry.getFunctionName());
            out.line(callee + "();");
            out.blankLine();
        }

        if (!program.getFunctions().isEmpty()) {
            out.openBlock("public static class " + PROGRAM_CLASS);
            boolean first = true;
            for (FunctionDeclaration fn : program.getFunctions()) {
                if (!first) out.blankLine();
                first = false;
                fn.accept(this, null);
            }
            out.closeBlock("}");
        }

        for (ModuleDeclaration module : program.getModules()) {
            out.blankLine();
            module.accept(this, null);
        }
    }

    @Override
    protected void emitModule(ModuleDeclaration module) {
        out.openBlock("namespace " + MODULE_NAMESPACE + module.getName());
        SpecificationBlock spec = module.getSpecification();
        if (spec != null) {
            out.line("/// <summary>");
            out.line("/// " + xml(spec.getIntent()));
            out.line("/// </summary>");
        }
        out.openBlock("public static class " + module.getName());
        boolean first = true;
        for (FunctionDeclaration fn : module.getFunctions()) {
            if (!first) out.blankLine();
            first = false;
            fn.accept(this, null);
        }
        out.closeBlock("}");
        out.closeBlock("}");
    }

    @Override
    protected void emitFunction(FunctionDeclaration fn) {
        emitDocumentation(fn);
        String access = currentModule == null || isVisibleInModule(fn) ? "public" : "private";
        List<String> params = new ArrayList<String>();
        for (Parameter p : fn.getParameters()) {
            params.add(type(p.getType()) + " " + name(p.getName()));
        }
        out.openBlock(access + " static " + returnType(fn.getReturnType()) + " " + name(fn.getName())
                + "(" + join(params) + ")");
        emitFunctionBody(fn);
        out.closeBlock("}");
    }

    private boolean isVisibleInModule(FunctionDeclaration fn) {
        ModuleDeclaration module = program.findModule(currentModule);
        return module == null || module.isVisible(fn.getName());
    }

    private void emitDocumentation(FunctionDeclaration fn) {
        List<String> summary = summaryLines(fn);
        if (!summary.isEmpty()) {
            out.line("/// <summary>");
            for (String l : summary) {
                out.line(l.isEmpty() ? "///" : "/// " + xml(l));
            }
            out.line("/// </summary>");
        }
        for (Parameter p : fn.getParameters()) {
            out.line("/// <param name=\"" + p.getName() + "\">Parameter of type " + xml(p.getType().toString()) + "</param>");
        }
        if (!fn.getReturnType().isUnit()) {
            out.line("/// <returns>Returns " + xml(fn.getReturnType().toString()) + "</returns>");
        }
    }

    private static String xml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    @Override
    protected void emitPropagationCheck(String temp) {
        out.line("if (" + resultIsError(temp) + ")");
        out.indent();
        out.line("return " + propagateError(temp) + ";");
        out.dedent();
    }

    // ============ 类型 ============

    @Override
    protected String type(TypeRef type) {
        if (type.isResult()) {
            return "Result<" + type(type.getOkType()) + ", " + type(type.getErrorType()) + ">";
        }
        if (type.isOption()) {
            return "Option<" + type(type.getElementType()) + ">";
        }
        if (type.isList()) {
            return "List<" + type(type.getElementType()) + ">";
        }
        // 小数字面量按 double 处理，float 不能隐式接收
        if ("float".equals(type.getName())) {
            return "double";
        }
        return type.getName();
    }

    private String returnType(TypeRef type) {
        return type.isUnit() ? "void" : type(type);
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
        return "_ = " + value + ";";
    }

    @Override
    protected String abort(String message) {
        return "throw new InvalidOperationException(" + TargetStrings.quote(message) + ");";
    }

    @Override
    protected String trackEffects(FunctionDeclaration fn, List<Effect> effects) {
        StringBuilder sb = new StringBuilder("CadenzaRuntime.TrackEffects(");
        sb.append(TargetStrings.quote(fn.getName()));
        for (Effect effect : effects) {
            sb.append(", ").append(TargetStrings.quote(effect.getDisplayName()));
        }
        return sb.append(");").toString();
    }

    // ============ Result / Option ============

    @Override
    protected String resultIsOk(String target) {
        return target + ".IsSuccess";
    }

    @Override
    protected String resultIsError(String target) {
        return target + ".IsError";
    }

    @Override
    protected String resultValue(String target) {
        return target + ".Value";
    }

    @Override
    protected String resultError(String target) {
        return target + ".Error";
    }

    @Override
    protected String propagateError(String target) {
        TypeRef returnType = currentFunction != null ? currentFunction.getReturnType() : null;
        if (returnType == null || !returnType.isResult()) {
            return target;
        }
        return "Result.Error<" + type(returnType.getOkType()) + ", " + type(returnType.getErrorType()) + ">("
                + resultError(target) + ")";
    }

    @Override
    protected String okValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return "Result.Ok<" + type(expected.getOkType()) + ", " + type(expected.getErrorType()) + ">(" + value + ")";
        }
        return "Result.Ok(" + value + ")";
    }

    @Override
    protected String errorValue(String value, TypeRef expected) {
        if (expected != null && expected.isResult()) {
            return "Result.Error<" + type(expected.getOkType()) + ", " + type(expected.getErrorType()) + ">(" + value + ")";
        }
        return "Result.Error(" + value + ")";
    }

    @Override
    protected String optionHasValue(String target) {
        return target + ".HasValue";
    }

    @Override
    protected String optionValue(String target) {
        return target + ".Value";
    }

    @Override
    protected String someValue(String value, TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return "Option.Some<" + type(expected.getElementType()) + ">(" + value + ")";
        }
        return "Option.Some(" + value + ")";
    }

    @Override
    protected String noneValue(TypeRef expected) {
        if (expected != null && expected.isOption()) {
            return "Option.Empty<" + type(expected.getElementType()) + ">()";
        }
        return "Option.None";
    }

    // ============ 表达式钩子 ============

    @Override
    protected String stringLiteral(String value) {
        return TargetStrings.quote(value);
    }

    @Override
    protected String interpolation(StringInterpolation node) {
        StringBuilder sb = new StringBuilder("$\"");
        for (Expression part : node.getParts()) {
            if (part instanceof StringLiteral) {
                sb.append(TargetStrings.escapeCSharpInterpolated(((StringLiteral) part).getValue()));
            } else {
                sb.append('{').append(hole(part)).append('}');
            }
        }
        return sb.append('"').toString();
    }

    private String hole(Expression part) {
        String text = expr(part);
        if (part instanceof Identifier || part instanceof CallExpression || part instanceof MethodCallExpression
                || part instanceof MemberAccessExpression || part instanceof IndexExpression
                || part instanceof NumberLiteral) {
            return text;
        }
        // 三元与格式说明符共用 ':'，其余复合表达式一律加括号
        return "(" + text + ")";
    }

    @Override
    protected String listLiteral(List<String> elements) {
        TypeRef expected = expectedType();
        if (elements.isEmpty()) {
            String element = expected != null && expected.isList() ? type(expected.getElementType()) : "object";
            return "new List<" + element + ">()";
        }
        return "new[] { " + join(elements) + " }.ToList()";
    }

    @Override
    protected String matchExpression(MatchExpression node, String scrutinee) {
        String fallback = "throw new InvalidOperationException("
                + TargetStrings.quote("Non-exhaustive match at line " + node.getLocation().getLine()) + ")";
        if (node.isResultMatch()) {
            return receiverOf(node, scrutinee) + ".Match(" + lambda(node, MatchPattern.Kind.OK, fallback) + ", "
                    + lambda(node, MatchPattern.Kind.ERROR, fallback) + ")";
        }
        if (node.isOptionMatch()) {
            MatchCase none = caseFor(node, MatchPattern.Kind.NONE);
            return receiverOf(node, scrutinee) + ".Match(" + lambda(node, MatchPattern.Kind.SOME, fallback)
                    + ", () => " + (none != null ? expr(none.getValueExpression()) : fallback) + ")";
        }
        StringBuilder sb = new StringBuilder("(").append(scrutinee).append(" switch { ");
        boolean wildcard = false;
        for (MatchCase c : node.getCases()) {
            if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD) {
                sb.append("_ => ").append(expr(c.getValueExpression())).append(", ");
                wildcard = true;
                break;
            }
            sb.append(literal(c.getPattern().getLiteral())).append(" => ")
                    .append(expr(c.getValueExpression())).append(", ");
        }
        if (!wildcard) {
            sb.append("_ => ").append(fallback).append(", ");
        }
        return sb.append("})").toString();
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
            return "_ => " + fallback;
        }
        String param = c.getBindingName() != null ? name(c.getBindingName()) : "_";
        return param + " => " + expr(c.getValueExpression());
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String escapeReserved(String identifier) {
        return "@" + identifier;
    }

    @Override
    protected String moduleFunction(String moduleName, String functionName) {
        // 模块名可能与 System 中的类型同名（如 Math），一律用全局限定名
        return "global::" + MODULE_NAMESPACE + moduleName + "." + moduleName + "." + name(functionName);
    }

    @Override
    protected String topLevelFunction(String functionName) {
        return "global::" + PROGRAM_CLASS + "." + name(functionName);
    }
}
