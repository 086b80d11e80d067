package com.cadenza.targets.javascript;

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
 * JavaScript 源码输出：顶层函数声明，模块为返回导出对象的立即执行函数
 */
final class JavaScriptEmitter extends SourceEmitter {
    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
            "implements", "import", "in", "instanceof", "interface", "let", "new", "null", "package",
            "private", "protected", "public", "return", "static", "super", "switch", "this", "throw",
            "true", "try", "typeof", "var", "void", "while", "with", "yield", "arguments", "eval",
            "undefined", "NaN", "Infinity", "Result", "Option", "Cadenza", "module", "require", "exports"
    ));

    private final boolean esModule;

    JavaScriptEmitter(AnalyzedProgram analyzed, TargetConfiguration config, TargetCapabilities capabilities,
                      boolean esModule) {
        super(analyzed, config, TargetPlatform.JAVASCRIPT, capabilities);
        this.esModule = esModule;
    }

    // ============ 程序结构 ============

    @Override
    protected void emitProgram() {
        out.line("// Generated by the Cadenza compiler from " + program.getFileName());
        if (esModule) {
            out.line("import { Result, Option, Cadenza } from './" + JavaScriptGenerator.RUNTIME_FILE + "';");
        } else {
            out.line("'use strict';");
            out.blankLine();
            out.line("const { Result, Option, Cadenza } = require('./" + JavaScriptGenerator.RUNTIME_FILE + "');");
        }

        List<String> exported = new ArrayList<String>();
        for (FunctionDeclaration fn : program.getFunctions()) {
            out.blankLine();
            fn.accept(this, null);
            exported.add(name(fn.getName()));
        }
        for (ModuleDeclaration module : program.getModules()) {
            out.blankLine();
            module.accept(this, null);
            exported.add(module.getName());
        }

        out.blankLine();
        ResolvedCall entry = entryPoint();
        if (esModule) {
            if (!exported.isEmpty()) {
                out.line("export { " + join(exported) + " };");
            }
            if (entry != null) {
                out.blankLine();
                out.line(entryCall(entry) + ";");
            }
        } else {
            out.line("module.exports = { " + join(exported) + " };");
            if (entry != null) {
                out.blankLine();
                out.openBlock("if (typeof require !== 'undefined' && require.main === module)");
                out.line(entryCall(entry) + ";");
                out.closeBlock("}");
            }
        }
    }

    private String entryCall(ResolvedCall entry) {
        return (entry.getModuleName() == null
                ? name(entry.getFunctionName())
                : moduleFunction(entry.getModuleName(), entry.getFunctionName())) + "()";
    }

    @Override
    protected void emitModule(ModuleDeclaration module) {
        SpecificationBlock spec = module.getSpecification();
        if (spec != null) {
            out.line("/** " + spec.getIntent().replace("*/", "* /") + " */");
        }
        out.openBlock("const " + module.getName() + " = (() =>");
        List<String> visible = new ArrayList<String>();
        boolean first = true;
        for (FunctionDeclaration fn : module.getFunctions()) {
            if (!first) out.blankLine();
            first = false;
            fn.accept(this, null);
            if (module.isVisible(fn.getName())) {
                visible.add(name(fn.getName()));
            }
        }
        out.blankLine();
        out.line("return Object.freeze({ " + join(visible) + " });");
        out.closeBlock("})();");
    }

    @Override
    protected void emitFunction(FunctionDeclaration fn) {
        emitJsDoc(fn);
        List<String> params = new ArrayList<String>();
        for (Parameter p : fn.getParameters()) {
            params.add(name(p.getName()));
        }
        out.openBlock("function " + name(fn.getName()) + "(" + join(params) + ")");
        emitFunctionBody(fn);
        out.closeBlock("}");
    }

    private void emitJsDoc(FunctionDeclaration fn) {
        List<String> lines = summaryLines(fn);
        for (Parameter p : fn.getParameters()) {
            lines.add("@param {" + type(p.getType()) + "} " + p.getName());
        }
        if (!fn.getReturnType().isUnit()) {
            lines.add("@returns {" + type(fn.getReturnType()) + "}");
        }
        if (lines.isEmpty()) return;
        out.line("/**");
        for (String l : lines) {
            out.line(l.isEmpty() ? " *" : " * " + l.replace("*/", "* /"));
        }
        out.line(" */");
    }

    // ============ 类型（仅用于 JSDoc） ============

    @Override
    protected String type(TypeRef type) {
        String name = type.getName();
        if ("int".equals(name) || "float".equals(name) || "double".equals(name)) return "number";
        if ("bool".equals(name)) return "boolean";
        if (type.isUnit()) return "void";
        if (type.isResult()) {
            return "Result<" + type(type.getOkType()) + ", " + type(type.getErrorType()) + ">";
        }
        if (type.isOption()) {
            return "Option<" + type(type.getElementType()) + ">";
        }
        if (type.isList()) {
            return "Array<" + type(type.getElementType()) + ">";
        }
        return name;
    }

    // ============ 语句钩子 ============

    @Override
    protected void emitLocal(String name, TypeRef type, String value) {
        out.line("const " + name + " = " + value + ";");
    }

    @Override
    protected void emitDeclaration(String name, TypeRef type, SourceLocation location) {
        out.line("let " + name + ";");
    }

    @Override
    protected String abort(String message) {
        return "throw new Error(" + TargetStrings.quote(message) + ");";
    }

    @Override
    protected String trackEffects(FunctionDeclaration fn, List<Effect> effects) {
        StringBuilder sb = new StringBuilder("Cadenza.trackEffects(");
        sb.append(TargetStrings.quote(fn.getName()));
        for (Effect effect : effects) {
            sb.append(", ").append(TargetStrings.quote(effect.getDisplayName()));
        }
        return sb.append(");").toString();
    }

    // ============ Result / Option ============

    @Override
    protected String resultIsOk(String target) {
        return target + ".isOk";
    }

    @Override
    protected String resultIsError(String target) {
        return target + ".isError";
    }

    @Override
    protected String resultValue(String target) {
        return target + ".value";
    }

    @Override
    protected String resultError(String target) {
        return target + ".error";
    }

    @Override
    protected String propagateError(String target) {
        return target;
    }

    @Override
    protected String okValue(String value, TypeRef expected) {
        return "Result.ok(" + value + ")";
    }

    @Override
    protected String errorValue(String value, TypeRef expected) {
        return "Result.error(" + value + ")";
    }

    @Override
    protected String optionHasValue(String target) {
        return target + ".isSome";
    }

    @Override
    protected String optionIsEmpty(String target) {
        return target + ".isNone";
    }

    @Override
    protected String optionValue(String target) {
        return target + ".value";
    }

    @Override
    protected String someValue(String value, TypeRef expected) {
        return "Option.some(" + value + ")";
    }

    @Override
    protected String noneValue(TypeRef expected) {
        return "Option.none()";
    }

    // ============ 表达式钩子 ============

    @Override
    protected String binary(BinaryExpression.BinaryOp op, String left, String right, BinaryExpression node) {
        switch (op) {
            case EQ:
                return left + " === " + right;
            case NE:
                return left + " !== " + right;
            default:
                return super.binary(op, left, right, node);
        }
    }

    @Override
    protected String literalEquals(String target, String literal, Object rawValue) {
        return target + " === " + literal;
    }

    @Override
    protected String stringLiteral(String value) {
        return TargetStrings.quote(value);
    }

    @Override
    protected String interpolation(StringInterpolation node) {
        StringBuilder sb = new StringBuilder("`");
        for (Expression part : node.getParts()) {
            if (part instanceof StringLiteral) {
                sb.append(TargetStrings.escapeTemplateLiteral(((StringLiteral) part).getValue()));
            } else {
                sb.append("${").append(expr(part)).append('}');
            }
        }
        return sb.append('`').toString();
    }

    @Override
    protected String listLiteral(List<String> elements) {
        return "[" + join(elements) + "]";
    }

    @Override
    protected String matchExpression(MatchExpression node, String scrutinee) {
        String fallback = "Cadenza.panic("
                + TargetStrings.quote("Non-exhaustive match at line " + node.getLocation().getLine()) + ")";
        String receiver = node.getScrutinee() instanceof Identifier || node.getScrutinee() instanceof CallExpression
                || node.getScrutinee() instanceof MethodCallExpression ? scrutinee : "(" + scrutinee + ")";
        if (node.isResultMatch()) {
            return receiver + ".match(" + lambda(node, MatchPattern.Kind.OK, fallback) + ", "
                    + lambda(node, MatchPattern.Kind.ERROR, fallback) + ")";
        }
        if (node.isOptionMatch()) {
            MatchCase none = caseFor(node, MatchPattern.Kind.NONE);
            return receiver + ".match(" + lambda(node, MatchPattern.Kind.SOME, fallback)
                    + ", () => " + (none != null ? expr(none.getValueExpression()) : fallback) + ")";
        }
        // 被匹配值只求值一次：作为箭头函数参数传入
        String temp = tempName("v", 0);
        StringBuilder sb = new StringBuilder("((").append(temp).append(") => ");
        String tail = fallback;
        for (MatchCase c : node.getCases()) {
            if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD) {
                tail = expr(c.getValueExpression());
                break;
            }
            sb.append(temp).append(" === ").append(literal(c.getPattern().getLiteral())).append(" ? ")
                    .append(expr(c.getValueExpression())).append(" : ");
        }
        return sb.append(tail).append(")(").append(scrutinee).append(")").toString();
    }

    private String lambda(MatchExpression node, MatchPattern.Kind kind, String fallback) {
        MatchCase c = caseFor(node, kind);
        if (c == null) {
            return "() => " + fallback;
        }
        String param = c.getBindingName() != null ? name(c.getBindingName()) : "_";
        return param + " => " + expr(c.getValueExpression());
    }

    @Override
    protected Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    protected String moduleFunction(String moduleName, String functionName) {
        return moduleName + "." + name(functionName);
    }
}
