package com.cadenza.targets.wasm;

import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.compiler.analysis.ResolvedCall;
import com.cadenza.compiler.ast.*;
import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.ast.expr.*;
import com.cadenza.compiler.ast.stmt.*;
import com.cadenza.targets.GenerationException;
import com.cadenza.targets.TargetCapabilities;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetPlatform;
import com.cadenza.targets.support.CodeWriter;
import com.cadenza.targets.support.TargetStrings;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * WebAssembly 文本格式（WAT）输出
 * <p>值类型只有 i32 与 f64：int/bool/string 为 i32（字符串是数据段指针，指向 4 字节长度 + UTF-8 字节），
 * 小数为 f64；Result 与 Option 展开为两个值（标记 i32，1 表示 Ok/Some）加载荷，两个分支的载荷类型必须一致。
 * 无法表达的构造输出 ";; cadenza:" 注释并以 unreachable 代替。</p>
 */
final class WasmEmitter implements StatementVisitor<Void, Void>, ExpressionVisitor<String, Void> {
    private static final Logger LOG = Logger.getLogger(WasmEmitter.class.getName());

    static final String I32 = "i32";
    static final String F64 = "f64";
    private static final int DATA_BASE = 16;
    private static final TypeRef INT = TypeRef.simple("int");
    private static final TypeRef BOOL = TypeRef.simple("bool");
    private static final TypeRef DOUBLE = TypeRef.simple("double");
    private static final TypeRef STRING = TypeRef.simple("string");

    private enum ArmMode { RETURN, DISCARD }

    private final AnalyzedProgram analyzed;
    private final Program program;
    private final TargetConfiguration config;
    private final TargetCapabilities capabilities;
    private final String indent;

    private final Map<String, Integer> strings = new LinkedHashMap<String, Integer>();
    private int dataEnd = DATA_BASE;
    private boolean usesTracking;
    private boolean usesPanic;

    // 当前函数的状态
    private FunctionDeclaration currentFunction;
    private String currentModule;
    private CodeWriter body;
    private Map<String, String> locals;
    private Map<String, TypeRef> scope;
    private Map<ErrorPropagation, String> hoisted;
    private List<String> pendingComments;
    private int tempCounter;

    WasmEmitter(AnalyzedProgram analyzed, TargetConfiguration config, TargetCapabilities capabilities) {
        this.analyzed = analyzed;
        this.program = analyzed.getProgram();
        this.config = config;
        this.capabilities = capabilities;
        this.indent = config.getIndentString();
    }

    /**
     * 生成完整模块文本
     */
    String emit() {
        List<String> functions = new ArrayList<String>();
        for (FunctionDeclaration fn : program.getFunctions()) {
            functions.add(function(fn, null));
        }
        for (ModuleDeclaration module : program.getModules()) {
            for (FunctionDeclaration fn : module.getFunctions()) {
                functions.add(function(fn, module));
            }
        }

        CodeWriter out = new CodeWriter(indent);
        out.line(";; Generated by the Cadenza compiler from " + program.getFileName());
        out.line("(module");
        out.indent();
        if (usesTracking) {
            out.line("(import \"cadenza\" \"track_effect\" (func $cadenza_track_effect (param i32 i32)))");
        }
        if (usesPanic) {
            out.line("(import \"cadenza\" \"panic\" (func $cadenza_panic (param i32)))");
        }
        out.line("(memory (export \"memory\") " + config.getOption("wasm.memoryPages", "1") + ")");
        for (String fn : functions) {
            out.blankLine();
            out.lines(fn.endsWith("\n") ? fn.substring(0, fn.length() - 1) : fn);
        }
        if (!strings.isEmpty()) {
            out.blankLine();
            for (Map.Entry<String, Integer> e : strings.entrySet()) {
                out.line("(data (i32.const " + e.getValue() + ") \"" + lengthPrefix(e.getKey())
                        + TargetStrings.escapeWat(e.getKey()) + "\")");
            }
        }
        out.dedent();
        out.line(")");
        return out.getOutput();
    }

    boolean hasMain() {
        for (FunctionDeclaration fn : program.getFunctions()) {
            if ("main".equals(fn.getName()) && fn.getParameters().isEmpty()) return true;
        }
        return false;
    }

    // ============ 函数 ============

    private String function(FunctionDeclaration fn, ModuleDeclaration module) {
        String name = symbol(module != null ? module.getName() : null, fn.getName());
        List<String> results = valueTypes(fn.getReturnType());
        boolean supported = results != null;
        for (Parameter p : fn.getParameters()) {
            List<String> types = valueTypes(p.getType());
            if (types == null || types.isEmpty()) {
                supported = false;
                break;
            }
        }
        if (!supported) {
            return placeholder("function '" + fn.getName() + "' with signature "
                    + signatureText(fn)) + "\n";
        }

        currentFunction = fn;
        currentModule = module != null ? module.getName() : null;
        body = new CodeWriter(indent);
        body.indent();
        locals = new LinkedHashMap<String, String>();
        scope = new HashMap<String, TypeRef>();
        hoisted = new IdentityHashMap<ErrorPropagation, String>();
        pendingComments = new ArrayList<String>();
        tempCounter = 0;

        StringBuilder header = new StringBuilder("(func ").append(name);
        boolean exported = module == null || module.isVisible(fn.getName());
        if (exported) {
            header.append(" (export \"").append(module != null ? module.getName() + "." : "").append(fn.getName()).append("\")");
        }
        for (Parameter p : fn.getParameters()) {
            scope.put(p.getName(), p.getType());
            List<String> types = valueTypes(p.getType());
            if (types.size() == 1) {
                header.append(" (param $").append(p.getName()).append(' ').append(types.get(0)).append(')');
            } else {
                header.append(" (param $").append(p.getName()).append(".tag i32)");
                header.append(" (param $").append(p.getName()).append(".value ").append(types.get(1)).append(')');
            }
        }
        if (!results.isEmpty()) {
            header.append(" (result ").append(join(results, " ")).append(')');
        }

        try {
            emitEffectPrologue(fn);
            for (Statement stmt : fn.getBody()) {
                stmt.accept(this, null);
            }
            if (!results.isEmpty()) {
                // 所有路径都已显式 return，函数末尾不可达
                body.line("(unreachable)");
            }

            CodeWriter out = new CodeWriter(indent);
            for (String l : documentation(fn)) {
                out.line(";; " + l);
            }
            out.line(header.toString());
            out.indent();
            for (Map.Entry<String, String> local : locals.entrySet()) {
                out.line("(local $" + local.getKey() + " " + local.getValue() + ")");
            }
            out.dedent();
            return out.getOutput() + body.getOutput() + ")\n";
        } finally {
            currentFunction = null;
            currentModule = null;
        }
    }

    private String signatureText(FunctionDeclaration fn) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < fn.getParameters().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(fn.getParameters().get(i).getType());
        }
        return sb.append(") -> ").append(fn.getReturnType()).toString();
    }

    private List<String> documentation(FunctionDeclaration fn) {
        List<String> lines = new ArrayList<String>();
        SpecificationBlock spec = fn.getSpecification();
        if (spec != null) {
            lines.add(spec.getIntent());
        }
        if (fn.isPure()) {
            lines.add("Pure function - no side effects");
        } else if (fn.hasEffects()) {
            lines.add("Effects: " + Effect.join(fn.getEffects()));
        }
        return lines;
    }

    private void emitEffectPrologue(FunctionDeclaration fn) {
        for (Effect effect : fn.getEffects()) {
            if (!capabilities.supportsEffect(effect)) {
                body.line(placeholder("effect " + effect.getDisplayName()));
            } else if (config.isEnableRuntimeChecks()) {
                usesTracking = true;
                body.line("(call $cadenza_track_effect (i32.const " + intern(fn.getName()) + ") (i32.const "
                        + intern(effect.getDisplayName()) + "))");
            }
        }
    }

    // ============ 类型 ============

    /**
     * Cadenza 类型对应的 WASM 值序列
     *
     * @return 无法表达时返回 null
     */
    static List<String> valueTypes(TypeRef type) {
        if (type.isUnit()) {
            return Collections.emptyList();
        }
        String single = scalar(type);
        if (single != null) {
            return Collections.singletonList(single);
        }
        if (type.isResult()) {
            String ok = scalar(type.getOkType());
            String error = scalar(type.getErrorType());
            if (ok != null && ok.equals(error)) {
                return listOf(I32, ok);
            }
            return null;
        }
        if (type.isOption()) {
            String element = scalar(type.getElementType());
            return element != null ? listOf(I32, element) : null;
        }
        return null;
    }

    private static String scalar(TypeRef type) {
        String name = type.getName();
        if (!type.getArguments().isEmpty()) return null;
        if ("int".equals(name) || "bool".equals(name) || "string".equals(name)) return I32;
        if ("float".equals(name) || "double".equals(name)) return F64;
        return null;
    }

    private static List<String> listOf(String a, String b) {
        List<String> list = new ArrayList<String>();
        list.add(a);
        list.add(b);
        return list;
    }

    private static boolean isPair(TypeRef type) {
        return type != null && (type.isResult() || type.isOption());
    }

    /**
     * 推断表达式的 Cadenza 类型，只用于选择指令
     */
    private TypeRef typeOf(Expression e) {
        if (e instanceof NumberLiteral) {
            return ((NumberLiteral) e).isInteger() ? INT : DOUBLE;
        }
        if (e instanceof BooleanLiteral) return BOOL;
        if (e instanceof StringLiteral || e instanceof StringInterpolation) return STRING;
        if (e instanceof Identifier) {
            TypeRef t = scope.get(((Identifier) e).getName());
            return t != null ? t : INT;
        }
        if (e instanceof BinaryExpression) {
            BinaryExpression b = (BinaryExpression) e;
            if (b.getOperator().isComparison() || b.getOperator().isLogical()) return BOOL;
            TypeRef left = typeOf(b.getLeft());
            TypeRef right = typeOf(b.getRight());
            if (F64.equals(scalar(left)) || F64.equals(scalar(right))) return DOUBLE;
            return left;
        }
        if (e instanceof UnaryExpression) {
            UnaryExpression u = (UnaryExpression) e;
            return u.getOperator() == UnaryExpression.UnaryOp.NOT ? BOOL : typeOf(u.getOperand());
        }
        if (e instanceof CallExpression) {
            ResolvedCall resolved = analyzed.resolve((CallExpression) e);
            return resolved.getDeclaration() != null ? resolved.getDeclaration().getReturnType() : INT;
        }
        if (e instanceof ErrorPropagation) {
            TypeRef inner = typeOf(((ErrorPropagation) e).getExpression());
            return inner.isResult() ? inner.getOkType() : INT;
        }
        if (e instanceof TernaryExpression) {
            return typeOf(((TernaryExpression) e).getThenExpr());
        }
        if (e instanceof ResultExpression || e instanceof OptionExpression) {
            return currentFunction.getReturnType();
        }
        if (e instanceof MatchExpression) {
            MatchExpression m = (MatchExpression) e;
            MatchCase first = m.getCases().get(0);
            bindScope(first, typeOf(m.getScrutinee()));
            return first.isBlockBody() ? INT : typeOf(first.getValueExpression());
        }
        return INT;
    }

    // ============ 字符串数据段 ============

    private int intern(String value) {
        Integer address = strings.get(value);
        if (address != null) {
            return address;
        }
        int at = dataEnd;
        strings.put(value, at);
        int size = 4 + value.getBytes(StandardCharsets.UTF_8).length;
        dataEnd = (at + size + 3) & ~3;
        return at;
    }

    private static String lengthPrefix(String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            sb.append('\\').append(String.format("%02x", (length >>> (8 * i)) & 0xff));
        }
        return sb.toString();
    }

    // ============ 占位与局部变量 ============

    private String placeholder(String construct) {
        LOG.fine("WebAssembly 不支持 " + construct + "，输出占位注释");
        return ";; cadenza: " + construct + " not supported on " + TargetPlatform.WEBASSEMBLY.getDisplayName();
    }

    /** 表达式内的不支持构造：注释在语句前输出，值位置为 unreachable */
    private String unsupported(String construct) {
        pendingComments.add(placeholder(construct));
        return "(unreachable)";
    }

    private void line(String text) {
        for (String comment : pendingComments) {
            body.line(comment);
        }
        pendingComments.clear();
        body.line(text);
    }

    private String declare(String name, String type) {
        if (!locals.containsKey(name)) {
            locals.put(name, type);
        }
        return "$" + name;
    }

    /** 声明变量：成对类型拆成 .tag / .value 两个局部变量 */
    private void declareVariable(String name, TypeRef type) {
        scope.put(name, type);
        List<String> types = valueTypes(type);
        if (types == null || types.isEmpty()) return;
        if (types.size() == 1) {
            declare(name, types.get(0));
        } else {
            declare(name + ".tag", I32);
            declare(name + ".value", types.get(1));
        }
    }

    /** 把栈上的值存入变量（成对类型先弹出载荷） */
    private void storeFromStack(String name, TypeRef type) {
        List<String> types = valueTypes(type);
        if (types != null && types.size() == 2) {
            line("(local.set $" + name + ".value)");
            line("(local.set $" + name + ".tag)");
        } else {
            line("(local.set $" + name + ")");
        }
    }

    private String symbol(String module, String function) {
        return "$" + (module != null ? module + "." : "") + function;
    }

    // ============ 语句 ============

    @Override
    public Void visitFunction(FunctionDeclaration node, Void ctx) {
        return null;
    }

    @Override
    public Void visitModule(ModuleDeclaration node, Void ctx) {
        return null;
    }

    @Override
    public Void visitImport(ImportStatement node, Void ctx) {
        return null;
    }

    @Override
    public Void visitExport(ExportStatement node, Void ctx) {
        return null;
    }

    @Override
    public Void visitLet(LetStatement node, Void ctx) {
        Expression init = node.getInitializer();
        if (init instanceof MatchExpression && hasBlockArm((MatchExpression) init)) {
            line(placeholder("match with block arms as a let initializer"));
            return null;
        }
        TypeRef type = node.getType() != null ? node.getType() : typeOf(init);
        if (valueTypes(type) == null) {
            line(placeholder("variable '" + node.getName() + "' of type " + type));
            return null;
        }
        hoist(init);
        String value = expr(init, type);
        declareVariable(node.getName(), type);
        line(value);
        storeFromStack(node.getName(), type);
        return null;
    }

    @Override
    public Void visitIf(IfStatement node, Void ctx) {
        hoist(node.getCondition());
        line("(if " + expr(node.getCondition()));
        body.indent();
        block("then", node.getThenBody());
        if (node.hasElse()) {
            block("else", node.getElseBody());
        }
        body.dedent();
        body.line(")");
        return null;
    }

    private void block(String keyword, List<Statement> statements) {
        body.line("(" + keyword);
        body.indent();
        for (Statement stmt : statements) {
            stmt.accept(this, null);
        }
        body.dedent();
        body.line(")");
    }

    @Override
    public Void visitGuard(GuardStatement node, Void ctx) {
        hoist(node.getCondition());
        line("(if (i32.eqz " + expr(node.getCondition()) + ")");
        body.indent();
        block("then", node.getElseBody());
        body.dedent();
        body.line(")");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement node, Void ctx) {
        if (!node.hasValue()) {
            line("(return)");
            return null;
        }
        Expression value = node.getValue();
        if (currentFunction.getReturnType().isUnit()) {
            discard(value);
            line("(return)");
            return null;
        }
        if (value instanceof MatchExpression) {
            statementMatch((MatchExpression) value, ArmMode.RETURN);
            return null;
        }
        hoist(value);
        line("(return " + expr(value, currentFunction.getReturnType()) + ")");
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node, Void ctx) {
        discard(node.getExpression());
        return null;
    }

    private void discard(Expression e) {
        if (e instanceof MatchExpression) {
            statementMatch((MatchExpression) e, ArmMode.DISCARD);
            return;
        }
        hoist(e);
        if (e instanceof ErrorPropagation) {
            return;
        }
        if (!(e instanceof CallExpression) && !(e instanceof MethodCallExpression)) {
            // 无副作用的值直接丢弃
            return;
        }
        List<String> types = valueTypes(typeOf(e));
        String text = expr(e);
        if (types == null || types.isEmpty() || "(unreachable)".equals(text)) {
            line(text);
        } else if (types.size() == 1) {
            line("(drop " + text + ")");
        } else {
            line(text);
            line("(drop)");
            line("(drop)");
        }
    }

    /**
     * 语句位置的 match：被匹配值存入临时变量，分支为嵌套的 if/else
     */
    private void statementMatch(MatchExpression match, ArmMode mode) {
        hoist(match.getScrutinee());
        TypeRef type = typeOf(match.getScrutinee());
        if (valueTypes(type) == null || valueTypes(type).isEmpty()) {
            line(placeholder("match on " + type));
            return;
        }
        String temp = "__m" + (++tempCounter);
        declareVariable(temp, type);
        line(expr(match.getScrutinee()));
        storeFromStack(temp, type);
        armChain(match, match.getCases(), 0, temp, type, mode);
    }

    private void armChain(MatchExpression match, List<MatchCase> cases, int index, String temp, TypeRef type,
                          ArmMode mode) {
        if (index >= cases.size()) {
            panic(match);
            return;
        }
        MatchCase c = cases.get(index);
        boolean last = index == cases.size() - 1;
        boolean covered = !match.hasWildcard() && match.isExhaustive() && last;
        if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD || covered) {
            arm(c, temp, type, mode);
            return;
        }
        line("(if " + patternTest(c.getPattern(), temp, type));
        body.indent();
        body.line("(then");
        body.indent();
        arm(c, temp, type, mode);
        body.dedent();
        body.line(")");
        body.line("(else");
        body.indent();
        armChain(match, cases, index + 1, temp, type, mode);
        body.dedent();
        body.line(")");
        body.dedent();
        body.line(")");
    }

    private void arm(MatchCase c, String temp, TypeRef type, ArmMode mode) {
        bind(c, temp, type);
        List<Statement> statements = c.getBody();
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            boolean last = i == statements.size() - 1;
            if (last && stmt instanceof ExpressionStatement && mode == ArmMode.RETURN
                    && !currentFunction.getReturnType().isUnit()) {
                Expression value = ((ExpressionStatement) stmt).getExpression();
                if (value instanceof MatchExpression) {
                    statementMatch((MatchExpression) value, ArmMode.RETURN);
                } else {
                    hoist(value);
                    line("(return " + expr(value, currentFunction.getReturnType()) + ")");
                }
            } else {
                stmt.accept(this, null);
            }
        }
    }

    private void bind(MatchCase c, String temp, TypeRef type) {
        String binding = c.getBindingName();
        if (binding == null) return;
        TypeRef bound = bindScope(c, type);
        if (bound == null) return;
        declareVariable(binding, bound);
        line("(local.set $" + binding + " (local.get $" + temp + ".value))");
    }

    /** 把分支绑定名加入作用域，返回其类型 */
    private TypeRef bindScope(MatchCase c, TypeRef scrutineeType) {
        if (c.getBindingName() == null) return null;
        TypeRef bound;
        switch (c.getPattern().getKind()) {
            case OK:
                bound = scrutineeType.isResult() ? scrutineeType.getOkType() : INT;
                break;
            case ERROR:
                bound = scrutineeType.isResult() ? scrutineeType.getErrorType() : INT;
                break;
            case SOME:
                bound = scrutineeType.isOption() ? scrutineeType.getElementType() : INT;
                break;
            default:
                return null;
        }
        scope.put(c.getBindingName(), bound);
        return bound;
    }

    private String patternTest(MatchPattern pattern, String temp, TypeRef type) {
        switch (pattern.getKind()) {
            case OK:
            case SOME:
                return "(local.get $" + temp + ".tag)";
            case ERROR:
            case NONE:
                return "(i32.eqz (local.get $" + temp + ".tag))";
            case LITERAL:
                String t = scalar(type);
                return "(" + t + ".eq (local.get $" + temp + ") " + literal(pattern.getLiteral(), t) + ")";
            default:
                return "(i32.const 1)";
        }
    }

    private String literal(Object value, String type) {
        if (value instanceof String) {
            return "(i32.const " + intern((String) value) + ")";
        }
        if (value instanceof Boolean) {
            return "(i32.const " + (((Boolean) value) ? 1 : 0) + ")";
        }
        if (F64.equals(type)) {
            return "(f64.const " + ((Number) value).doubleValue() + ")";
        }
        return "(i32.const " + value + ")";
    }

    private void panic(MatchExpression match) {
        usesPanic = true;
        line("(call $cadenza_panic (i32.const " + intern("Non-exhaustive match at line " + match.getLocation().getLine()) + "))");
        line("(unreachable)");
    }

    private static boolean hasBlockArm(MatchExpression match) {
        for (MatchCase c : match.getCases()) {
            if (c.isBlockBody()) return true;
        }
        return false;
    }

    // ============ 错误传播 ============

    /**
     * 表达式中的 ? 按求值顺序提升为语句：调用结果存入临时变量，错误时原样返回
     */
    private void hoist(Expression expression) {
        final List<ErrorPropagation> found = new ArrayList<ErrorPropagation>();
        new AstScanner<Void>() {
            @Override
            public Void visitErrorPropagation(ErrorPropagation node, Void c) {
                super.visitErrorPropagation(node, c);
                found.add(node);
                return null;
            }

            @Override
            public Void visitMatch(MatchExpression node, Void c) {
                scan(node.getScrutinee(), c);
                return null;
            }

            @Override
            public Void visitTernary(TernaryExpression node, Void c) {
                scan(node.getCondition(), c);
                return null;
            }

            @Override
            public Void visitBinary(BinaryExpression node, Void c) {
                scan(node.getLeft(), c);
                if (!node.getOperator().isLogical()) {
                    scan(node.getRight(), c);
                }
                return null;
            }
        }.scan(expression, null);

        for (ErrorPropagation prop : found) {
            TypeRef type = typeOf(prop.getExpression());
            if (!type.isResult() || valueTypes(type) == null) {
                line(placeholder("error propagation on " + type));
                continue;
            }
            String temp = "__r" + (++tempCounter);
            declareVariable(temp, type);
            line(expr(prop.getExpression()));
            storeFromStack(temp, type);
            line("(if (i32.eqz (local.get $" + temp + ".tag))");
            body.indent();
            body.line("(then (return (local.get $" + temp + ".tag) (local.get $" + temp + ".value)))");
            body.dedent();
            body.line(")");
            hoisted.put(prop, temp);
        }
    }

    // ============ 表达式 ============

    private String expr(Expression e) {
        return e.accept(this, null);
    }

    /** 按期望类型渲染，整数到小数自动转换 */
    private String expr(Expression e, TypeRef expected) {
        String text = expr(e);
        if (F64.equals(scalar(expected)) && I32.equals(scalar(typeOf(e)))) {
            return "(f64.convert_i32_s " + text + ")";
        }
        return text;
    }

    @Override
    public String visitBinary(BinaryExpression node, Void ctx) {
        BinaryExpression.BinaryOp op = node.getOperator();
        if (op == BinaryExpression.BinaryOp.AND) {
            return "(if (result i32) " + expr(node.getLeft()) + " (then " + expr(node.getRight()) + ") (else (i32.const 0)))";
        }
        if (op == BinaryExpression.BinaryOp.OR) {
            return "(if (result i32) " + expr(node.getLeft()) + " (then (i32.const 1)) (else " + expr(node.getRight()) + "))";
        }
        TypeRef left = typeOf(node.getLeft());
        TypeRef right = typeOf(node.getRight());
        if (STRING.equals(left) && op == BinaryExpression.BinaryOp.ADD) {
            return unsupported("string concatenation");
        }
        boolean real = F64.equals(scalar(left)) || F64.equals(scalar(right));
        String prefix = real ? F64 : I32;
        String a = real ? expr(node.getLeft(), DOUBLE) : expr(node.getLeft());
        String b = real ? expr(node.getRight(), DOUBLE) : expr(node.getRight());
        String instruction;
        switch (op) {
            case ADD: instruction = "add"; break;
            case SUB: instruction = "sub"; break;
            case MUL: instruction = "mul"; break;
            case DIV: instruction = real ? "div" : "div_s"; break;
            case MOD:
                if (real) {
                    return unsupported("floating point remainder");
                }
                instruction = "rem_s";
                break;
            case EQ: instruction = "eq"; break;
            case NE: instruction = "ne"; break;
            case LT: instruction = real ? "lt" : "lt_s"; break;
            case LE: instruction = real ? "le" : "le_s"; break;
            case GT: instruction = real ? "gt" : "gt_s"; break;
            case GE: instruction = real ? "ge" : "ge_s"; break;
            default:
                return unsupported("operator " + op.toSourceString());
        }
        return "(" + prefix + "." + instruction + " " + a + " " + b + ")";
    }

    @Override
    public String visitUnary(UnaryExpression node, Void ctx) {
        String operand = expr(node.getOperand());
        if (node.getOperator() == UnaryExpression.UnaryOp.NOT) {
            return "(i32.eqz " + operand + ")";
        }
        if (F64.equals(scalar(typeOf(node.getOperand())))) {
            return "(f64.neg " + operand + ")";
        }
        return "(i32.sub (i32.const 0) " + operand + ")";
    }

    @Override
    public String visitCall(CallExpression node, Void ctx) {
        ResolvedCall resolved = analyzed.resolve(node);
        FunctionDeclaration target = resolved.getDeclaration();
        if (target == null) {
            return unsupported("external call '" + node.getName() + "'");
        }
        if (valueTypes(target.getReturnType()) == null) {
            return unsupported("call to '" + node.getName() + "'");
        }
        String module = resolved.getModuleName();
        StringBuilder sb = new StringBuilder("(call ").append(symbol(module, resolved.getFunctionName()));
        for (int i = 0; i < node.getArguments().size(); i++) {
            Expression arg = node.getArguments().get(i);
            TypeRef paramType = i < target.getParameters().size() ? target.getParameters().get(i).getType() : INT;
            sb.append(' ').append(expr(arg, paramType));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitMethodCall(MethodCallExpression node, Void ctx) {
        return unsupported("method call '" + node.getMethodName() + "'");
    }

    @Override
    public String visitMemberAccess(MemberAccessExpression node, Void ctx) {
        return unsupported("member access '" + node.getMember() + "'");
    }

    @Override
    public String visitIndex(IndexExpression node, Void ctx) {
        return unsupported("index access");
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        String name = node.getName();
        TypeRef type = scope.get(name);
        if (isPair(type)) {
            return "(local.get $" + name + ".tag) (local.get $" + name + ".value)";
        }
        return "(local.get $" + name + ")";
    }

    @Override
    public String visitNumber(NumberLiteral node, Void ctx) {
        return node.isInteger() ? "(i32.const " + node.getValue() + ")" : "(f64.const " + node.getValue() + ")";
    }

    @Override
    public String visitString(StringLiteral node, Void ctx) {
        return "(i32.const " + intern(node.getValue()) + ")";
    }

    @Override
    public String visitBoolean(BooleanLiteral node, Void ctx) {
        return node.getValue() ? "(i32.const 1)" : "(i32.const 0)";
    }

    @Override
    public String visitInterpolation(StringInterpolation node, Void ctx) {
        return unsupported("string interpolation");
    }

    @Override
    public String visitList(ListExpression node, Void ctx) {
        return unsupported("list literal");
    }

    @Override
    public String visitResult(ResultExpression node, Void ctx) {
        TypeRef expected = currentFunction.getReturnType();
        TypeRef payload = expected.isResult()
                ? (node.isOk() ? expected.getOkType() : expected.getErrorType()) : INT;
        return "(i32.const " + (node.isOk() ? 1 : 0) + ") " + expr(node.getValue(), payload);
    }

    @Override
    public String visitOption(OptionExpression node, Void ctx) {
        if (node.isSome()) {
            return "(i32.const 1) " + expr(node.getValue());
        }
        TypeRef expected = currentFunction.getReturnType();
        String element = expected.isOption() ? scalar(expected.getElementType()) : I32;
        return "(i32.const 0) (" + (element != null ? element : I32) + ".const 0)";
    }

    @Override
    public String visitErrorPropagation(ErrorPropagation node, Void ctx) {
        String temp = hoisted.get(node);
        if (temp == null) {
            throw new GenerationException(TargetPlatform.WEBASSEMBLY,
                    "Error propagation inside a conditional branch or match arm is not supported", node.getLocation());
        }
        return "(local.get $" + temp + ".value)";
    }

    /**
     * 表达式位置的 match：block 内先存被匹配值，再用带结果类型的 if 链选值
     */
    @Override
    public String visitMatch(MatchExpression node, Void ctx) {
        if (hasBlockArm(node)) {
            throw new GenerationException(TargetPlatform.WEBASSEMBLY,
                    "Match with block arms cannot be used inside an expression", node.getLocation());
        }
        TypeRef scrutineeType = typeOf(node.getScrutinee());
        List<String> types = valueTypes(scrutineeType);
        TypeRef resultType = typeOf(node);
        String result = scalar(resultType);
        if (types == null || types.isEmpty() || result == null) {
            return unsupported("match on " + scrutineeType);
        }
        String temp = "__m" + (++tempCounter);
        declareVariable(temp, scrutineeType);
        StringBuilder sb = new StringBuilder("(block (result ").append(result).append(") ")
                .append(expr(node.getScrutinee()));
        if (types.size() == 2) {
            sb.append(" (local.set $").append(temp).append(".value) (local.set $").append(temp).append(".tag)");
        } else {
            sb.append(" (local.set $").append(temp).append(")");
        }
        sb.append(' ').append(valueChain(node, node.getCases(), 0, temp, scrutineeType, result));
        return sb.append(')').toString();
    }

    private String valueChain(MatchExpression match, List<MatchCase> cases, int index, String temp,
                              TypeRef type, String result) {
        if (index >= cases.size()) {
            usesPanic = true;
            return "(call $cadenza_panic (i32.const " + intern("Non-exhaustive match at line "
                    + match.getLocation().getLine()) + ")) (unreachable)";
        }
        MatchCase c = cases.get(index);
        String value = armValue(c, temp, type);
        boolean covered = !match.hasWildcard() && match.isExhaustive() && index == cases.size() - 1;
        if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD || covered) {
            return value;
        }
        return "(if (result " + result + ") " + patternTest(c.getPattern(), temp, type)
                + " (then " + value + ") (else " + valueChain(match, cases, index + 1, temp, type, result) + "))";
    }

    private String armValue(MatchCase c, String temp, TypeRef type) {
        TypeRef bound = bindScope(c, type);
        String prefix = "";
        if (bound != null) {
            declareVariable(c.getBindingName(), bound);
            prefix = "(local.set $" + c.getBindingName() + " (local.get $" + temp + ".value)) ";
        }
        return prefix + expr(c.getValueExpression());
    }

    @Override
    public String visitTernary(TernaryExpression node, Void ctx) {
        String result = scalar(typeOf(node.getThenExpr()));
        if (result == null) {
            return unsupported("conditional expression of type " + typeOf(node.getThenExpr()));
        }
        return "(if (result " + result + ") " + expr(node.getCondition()) + " (then " + expr(node.getThenExpr())
                + ") (else " + expr(node.getElseExpr()) + "))";
    }

    private static String join(List<String> items, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(items.get(i));
        }
        return sb.toString();
    }
}
