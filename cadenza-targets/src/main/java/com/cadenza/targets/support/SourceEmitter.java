package com.cadenza.targets.support;

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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * C 系目标（C#、Java、JavaScript、C++）共用的源码生成骨架
 * <p>负责控制流降级：错误传播提升为临时变量加提前返回，语句位置的 match 降级为条件链；
 * 子类只提供目标语法。每次生成创建一个新实例，实例不可复用。</p>
 */
public abstract class SourceEmitter implements StatementVisitor<Void, Void>, ExpressionVisitor<String, Void> {
    private static final Logger LOG = Logger.getLogger(SourceEmitter.class.getName());

    /** 语句位置 match 的分支结果去向 */
    protected enum ArmMode {
        /** return match ... */
        RETURN,
        /** let x = match ...（含块分支） */
        ASSIGN,
        /** match 作为语句 */
        DISCARD
    }

    protected final AnalyzedProgram analyzed;
    protected final Program program;
    protected final TargetConfiguration config;
    protected final TargetPlatform platform;
    protected final TargetCapabilities capabilities;
    protected final CodeWriter out;

    private final Map<ErrorPropagation, String> hoisted = new IdentityHashMap<ErrorPropagation, String>();
    private int tempCounter;
    private TypeRef expectedType;

    /** 当前函数，程序级输出时为 null */
    protected FunctionDeclaration currentFunction;
    /** 当前模块名，顶层为 null */
    protected String currentModule;

    protected SourceEmitter(AnalyzedProgram analyzed, TargetConfiguration config,
                            TargetPlatform platform, TargetCapabilities capabilities) {
        this.analyzed = analyzed;
        this.program = analyzed.getProgram();
        this.config = config;
        this.platform = platform;
        this.capabilities = capabilities;
        this.out = new CodeWriter(config.getIndentString(), braceOnNewLine());
    }

    /**
     * 生成整个主源文件
     */
    public final String emit() {
        emitProgram();
        return out.getOutput();
    }

    protected abstract void emitProgram();

    /** 左花括号是否单独成行；在构造期间调用，不能依赖子类字段 */
    protected boolean braceOnNewLine() {
        return false;
    }

    protected abstract void emitFunction(FunctionDeclaration fn);

    protected abstract void emitModule(ModuleDeclaration module);

    // ============ 目标语法钩子 ============

    /** 类型映射 */
    protected abstract String type(TypeRef type);

    /** 声明并初始化局部变量；type 为 null 时由目标推断 */
    protected abstract void emitLocal(String name, TypeRef type, String value);

    /** 声明未初始化的局部变量，随后由条件链赋值 */
    protected abstract void emitDeclaration(String name, TypeRef type, SourceLocation location);

    protected abstract String resultIsOk(String target);

    protected abstract String resultIsError(String target);

    protected abstract String resultValue(String target);

    protected abstract String resultError(String target);

    /** 提前返回时交还给调用方的错误结果 */
    protected abstract String propagateError(String target);

    protected abstract String okValue(String value, TypeRef expected);

    protected abstract String errorValue(String value, TypeRef expected);

    protected abstract String optionHasValue(String target);

    protected abstract String optionValue(String target);

    protected abstract String someValue(String value, TypeRef expected);

    protected abstract String noneValue(TypeRef expected);

    protected abstract String stringLiteral(String value);

    protected abstract String interpolation(StringInterpolation node);

    protected abstract String listLiteral(List<String> elements);

    /** 表达式位置的 match，各分支均为单个表达式 */
    protected abstract String matchExpression(MatchExpression node, String scrutinee);

    /** 运行时中止语句，用于不穷尽 match 的兜底分支 */
    protected abstract String abort(String message);

    /** 进入函数时记录副作用的语句 */
    protected abstract String trackEffects(FunctionDeclaration fn, List<Effect> effects);

    /** 目标语言保留字 */
    protected abstract Set<String> reservedWords();

    /** 跨模块调用：模块名 + 函数名 */
    protected abstract String moduleFunction(String moduleName, String functionName);

    /** 从模块内部调用顶层函数 */
    protected String topLevelFunction(String functionName) {
        return name(functionName);
    }

    protected String escapeReserved(String identifier) {
        return identifier + "_";
    }

    protected String tempName(String base, int index) {
        return "__" + base + index;
    }

    protected String index(String target, String index) {
        return target + "[" + index + "]";
    }

    protected String memberAccess(String target, String member) {
        return target + "." + member;
    }

    protected String literalEquals(String target, String literal, Object rawValue) {
        return target + " == " + literal;
    }

    protected String optionIsEmpty(String target) {
        return "!" + optionHasValue(target);
    }

    protected String binary(BinaryExpression.BinaryOp op, String left, String right, BinaryExpression node) {
        return left + " " + op.toSourceString() + " " + right;
    }

    /** 丢弃值但保留求值的语句 */
    protected String discard(String value) {
        return value + ";";
    }

    protected String numberLiteral(NumberLiteral node) {
        return node.toSourceString();
    }

    /**
     * 目标不支持的构造留下可见注释
     */
    protected String placeholder(String construct) {
        LOG.fine(platform.getDisplayName() + " 不支持 " + construct + "，输出占位注释");
        return "/* cadenza: " + construct + " not supported on " + platform.getDisplayName() + " */";
    }

    // ============ 名称与文档 ============

    /** 源码标识符映射为目标标识符，避开保留字 */
    protected String name(String identifier) {
        return reservedWords().contains(identifier) ? escapeReserved(identifier) : identifier;
    }

    protected String temp(String base) {
        return tempName(base, ++tempCounter);
    }

    protected static String join(List<String> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(items.get(i));
        }
        return sb.toString();
    }

    /**
     * 函数说明文字：规约块意图、业务规则、期望结果、来源，以及纯度/副作用
     */
    protected List<String> summaryLines(FunctionDeclaration fn) {
        List<String> lines = new ArrayList<String>();
        SpecificationBlock spec = fn.getSpecification();
        if (spec != null) {
            lines.add(spec.getIntent());
            if (!spec.getRules().isEmpty()) {
                lines.add("");
                lines.add("Business Rules:");
                for (String rule : spec.getRules()) {
                    lines.add("- " + rule);
                }
            }
            if (!spec.getPostconditions().isEmpty()) {
                lines.add("");
                lines.add("Expected Outcomes:");
                for (String post : spec.getPostconditions()) {
                    lines.add("- " + post);
                }
            }
            if (spec.getSourceDoc() != null) {
                lines.add("");
                lines.add("Source: " + spec.getSourceDoc());
            }
        }
        String purity = purityLine(fn);
        if (purity != null) {
            if (!lines.isEmpty()) lines.add("");
            lines.add(purity);
        }
        return lines;
    }

    protected static String purityLine(FunctionDeclaration fn) {
        if (fn.isPure()) {
            return "Pure function - no side effects";
        }
        if (fn.hasEffects()) {
            return "Effects: " + Effect.join(fn.getEffects());
        }
        return null;
    }

    /**
     * 入口函数：无参的顶层 main，其次是模块里的无参 main
     *
     * @return 找不到返回 null
     */
    protected ResolvedCall entryPoint() {
        for (FunctionDeclaration fn : program.getFunctions()) {
            if ("main".equals(fn.getName()) && fn.getParameters().isEmpty()) {
                return new ResolvedCall(ResolvedCall.Kind.LOCAL, null, fn.getName(), fn);
            }
        }
        for (ModuleDeclaration module : program.getModules()) {
            FunctionDeclaration fn = module.findFunction("main");
            if (fn != null && fn.getParameters().isEmpty()) {
                return new ResolvedCall(ResolvedCall.Kind.MODULE, module.getName(), fn.getName(), fn);
            }
        }
        return null;
    }

    public boolean hasEntryPoint() {
        return entryPoint() != null;
    }

    // ============ 函数体 ============

    /**
     * 输出函数体：副作用序言加降级后的语句
     */
    protected void emitFunctionBody(FunctionDeclaration fn) {
        currentFunction = fn;
        expectedType = fn.getReturnType();
        tempCounter = 0;
        hoisted.clear();
        try {
            emitEffectPrologue(fn);
            emitStatements(fn.getBody());
        } finally {
            currentFunction = null;
            expectedType = null;
        }
    }

    protected void emitEffectPrologue(FunctionDeclaration fn) {
        List<Effect> tracked = new ArrayList<Effect>();
        for (Effect effect : fn.getEffects()) {
            if (capabilities.supportsEffect(effect)) {
                tracked.add(effect);
            } else if (capabilities.getSupportedEffects().contains(effect)) {
                out.line(placeholder("async effect " + effect.getDisplayName()));
            } else {
                out.line(placeholder("effect " + effect.getDisplayName()));
            }
        }
        if (!tracked.isEmpty() && config.isEnableRuntimeChecks()) {
            out.line(trackEffects(fn, tracked));
        }
    }

    protected void emitStatements(List<Statement> statements) {
        if (statements == null) return;
        for (Statement stmt : statements) {
            stmt.accept(this, null);
        }
    }

    protected String expr(Expression expression) {
        return expression.accept(this, null);
    }

    protected List<String> exprs(List<Expression> expressions) {
        List<String> result = new ArrayList<String>();
        for (Expression e : expressions) {
            result.add(expr(e));
        }
        return result;
    }

    /**
     * 渲染一个语句级表达式：其中的 ? 先按求值顺序提升到语句之前
     */
    protected String lower(Expression expression) {
        PropagationCollector collector = new PropagationCollector();
        collector.scan(expression, Boolean.FALSE);
        for (ErrorPropagation prop : collector.found) {
            String temp = temp("r");
            emitLocal(temp, null, expr(prop.getExpression()));
            emitPropagationCheck(temp);
            hoisted.put(prop, temp);
        }
        return expr(expression);
    }

    protected void emitPropagationCheck(String temp) {
        out.line("if (" + resultIsError(temp) + ") return " + propagateError(temp) + ";");
    }

    /** 当前期望的 Result/Option 类型，用于需要显式类型参数的目标 */
    protected TypeRef expectedType() {
        return expectedType;
    }

    // ============ 声明 ============

    @Override
    public Void visitFunction(FunctionDeclaration node, Void ctx) {
        emitFunction(node);
        return null;
    }

    @Override
    public Void visitModule(ModuleDeclaration node, Void ctx) {
        String saved = currentModule;
        currentModule = node.getName();
        try {
            emitModule(node);
        } finally {
            currentModule = saved;
        }
        return null;
    }

    @Override
    public Void visitImport(ImportStatement node, Void ctx) {
        // 调用已在分析阶段解析为限定名
        return null;
    }

    @Override
    public Void visitExport(ExportStatement node, Void ctx) {
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitLet(LetStatement node, Void ctx) {
        String target = name(node.getName());
        Expression init = node.getInitializer();
        TypeRef saved = expectedType;
        if (node.getType() != null && (node.getType().isResult() || node.getType().isOption() || node.getType().isList())) {
            expectedType = node.getType();
        }
        try {
            if (init instanceof ErrorPropagation) {
                // let x = f()? → 临时变量、错误分支、绑定值
                String temp = name(node.getName() + "_result");
                emitLocal(temp, null, lower(((ErrorPropagation) init).getExpression()));
                emitPropagationCheck(temp);
                emitLocal(target, node.getType(), resultValue(temp));
            } else if (init instanceof MatchExpression && hasBlockArm((MatchExpression) init)) {
                emitDeclaration(target, node.getType(), node.getLocation());
                emitStatementMatch((MatchExpression) init, ArmMode.ASSIGN, target);
            } else {
                emitLocal(target, node.getType(), lower(init));
            }
        } finally {
            expectedType = saved;
        }
        return null;
    }

    @Override
    public Void visitIf(IfStatement node, Void ctx) {
        out.openBlock("if (" + lower(node.getCondition()) + ")");
        emitStatements(node.getThenBody());
        emitElse(node);
        return null;
    }

    private void emitElse(IfStatement node) {
        if (!node.hasElse()) {
            out.closeBlock("}");
            return;
        }
        if (node.isElseIf()) {
            IfStatement next = (IfStatement) node.getElseBody().get(0);
            if (!containsPropagation(next.getCondition())) {
                out.continueBlock("else if (" + lower(next.getCondition()) + ")");
                emitStatements(next.getThenBody());
                emitElse(next);
                return;
            }
        }
        out.continueBlock("else");
        emitStatements(node.getElseBody());
        out.closeBlock("}");
    }

    @Override
    public Void visitGuard(GuardStatement node, Void ctx) {
        Expression condition = node.getCondition();
        String text = lower(condition);
        boolean simple = condition instanceof Identifier || condition instanceof CallExpression
                || condition instanceof MethodCallExpression || condition instanceof MemberAccessExpression
                || condition instanceof BooleanLiteral;
        out.openBlock("if (" + (simple ? "!" + text : "!(" + text + ")") + ")");
        emitStatements(node.getElseBody());
        out.closeBlock("}");
        return null;
    }

    @Override
    public Void visitReturn(ReturnStatement node, Void ctx) {
        if (!node.hasValue()) {
            out.line("return;");
        } else {
            emitReturnValue(node.getValue());
        }
        return null;
    }

    protected void emitReturnValue(Expression value) {
        if (currentFunction != null && currentFunction.getReturnType().isUnit()) {
            emitExpressionStatement(value);
            out.line("return;");
            return;
        }
        if (value instanceof MatchExpression) {
            emitStatementMatch((MatchExpression) value, ArmMode.RETURN, null);
            return;
        }
        out.line("return " + lower(value) + ";");
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node, Void ctx) {
        emitExpressionStatement(node.getExpression());
        return null;
    }

    private void emitExpressionStatement(Expression e) {
        if (e instanceof MatchExpression) {
            emitStatementMatch((MatchExpression) e, ArmMode.DISCARD, null);
            return;
        }
        String text = lower(e);
        if (e instanceof CallExpression || e instanceof MethodCallExpression) {
            out.line(text + ";");
        } else if (!(e instanceof ErrorPropagation) && containsCall(e)) {
            out.line(discard(text));
        }
        // 其余为无副作用的值，丢弃
    }

    // ============ match 降级 ============

    /**
     * 语句位置的 match：被匹配值求值一次存入临时变量，分支降级为 if / else if 链；
     * 不穷尽时追加运行时中止分支
     */
    protected void emitStatementMatch(MatchExpression match, ArmMode mode, String target) {
        String temp = temp("m");
        emitLocal(temp, null, lower(match.getScrutinee()));

        List<MatchCase> cases = match.getCases();
        boolean variantsCovered = !match.hasWildcard() && match.isExhaustive();
        boolean opened = false;
        boolean closed = false;
        for (int i = 0; i < cases.size(); i++) {
            MatchCase matchCase = cases.get(i);
            MatchPattern pattern = matchCase.getPattern();
            boolean last = i == cases.size() - 1;
            if (pattern.getKind() == MatchPattern.Kind.WILDCARD || (variantsCovered && last)) {
                if (opened) {
                    out.continueBlock("else");
                } else {
                    out.openBlock("");
                }
                emitArm(matchCase, temp, mode, target);
                out.closeBlock("}");
                closed = true;
                break;
            }
            String test = patternTest(temp, pattern);
            if (opened) {
                out.continueBlock("else if (" + test + ")");
            } else {
                out.openBlock("if (" + test + ")");
            }
            opened = true;
            emitArm(matchCase, temp, mode, target);
        }
        if (!closed) {
            out.continueBlock("else");
            out.line(abort("Non-exhaustive match at line " + match.getLocation().getLine()));
            out.closeBlock("}");
        }
    }

    private void emitArm(MatchCase matchCase, String temp, ArmMode mode, String target) {
        bindPattern(matchCase, temp);
        List<Statement> body = matchCase.getBody();
        if (body.isEmpty()) {
            if (mode == ArmMode.ASSIGN) {
                throw new GenerationException(platform, "Match arm must produce a value for '" + target + "'",
                        matchCase.getLocation());
            }
            return;
        }
        emitStatements(body.subList(0, body.size() - 1));
        Statement last = body.get(body.size() - 1);
        if (last instanceof ExpressionStatement) {
            Expression value = ((ExpressionStatement) last).getExpression();
            switch (mode) {
                case RETURN:
                    emitReturnValue(value);
                    break;
                case ASSIGN:
                    if (value instanceof MatchExpression && hasBlockArm((MatchExpression) value)) {
                        emitStatementMatch((MatchExpression) value, ArmMode.ASSIGN, target);
                    } else {
                        out.line(target + " = " + lower(value) + ";");
                    }
                    break;
                default:
                    emitExpressionStatement(value);
            }
            return;
        }
        if (mode == ArmMode.ASSIGN) {
            // 块分支末尾的 return v 给出该分支的值
            if (!(last instanceof ReturnStatement) || !((ReturnStatement) last).hasValue()) {
                throw new GenerationException(platform, "Match arm must end with a value for '" + target + "'",
                        matchCase.getLocation());
            }
            out.line(target + " = " + lower(((ReturnStatement) last).getValue()) + ";");
            return;
        }
        last.accept(this, null);
    }

    private void bindPattern(MatchCase matchCase, String temp) {
        String binding = matchCase.getBindingName();
        if (binding == null) return;
        switch (matchCase.getPattern().getKind()) {
            case OK:
                emitLocal(name(binding), null, resultValue(temp));
                break;
            case ERROR:
                emitLocal(name(binding), null, resultError(temp));
                break;
            case SOME:
                emitLocal(name(binding), null, optionValue(temp));
                break;
            default:
                break;
        }
    }

    protected String patternTest(String temp, MatchPattern pattern) {
        switch (pattern.getKind()) {
            case OK:
                return resultIsOk(temp);
            case ERROR:
                return resultIsError(temp);
            case SOME:
                return optionHasValue(temp);
            case NONE:
                return optionIsEmpty(temp);
            case LITERAL:
                return literalEquals(temp, literal(pattern.getLiteral()), pattern.getLiteral());
            default:
                return "true";
        }
    }

    /** 模式中的字面量 */
    protected String literal(Object value) {
        if (value instanceof String) {
            return stringLiteral((String) value);
        }
        return String.valueOf(value);
    }

    protected static boolean hasBlockArm(MatchExpression match) {
        for (MatchCase c : match.getCases()) {
            if (c.isBlockBody()) return true;
        }
        return false;
    }

    /**
     * 某个变体对应的分支：显式分支优先，其次通配符
     *
     * @return 都没有时返回 null
     */
    protected static MatchCase caseFor(MatchExpression match, MatchPattern.Kind kind) {
        MatchCase wildcard = null;
        for (MatchCase c : match.getCases()) {
            if (c.getPattern().getKind() == kind) return c;
            if (c.getPattern().getKind() == MatchPattern.Kind.WILDCARD && wildcard == null) wildcard = c;
        }
        return wildcard;
    }

    // ============ 表达式 ============

    @Override
    public String visitBinary(BinaryExpression node, Void ctx) {
        BinaryExpression.BinaryOp op = node.getOperator();
        String left = operand(node.getLeft(), op.getPrecedence(), false);
        String right = operand(node.getRight(), op.getPrecedence(), true);
        return binary(op, left, right, node);
    }

    private String operand(Expression e, int parentPrecedence, boolean rightSide) {
        String text = expr(e);
        if (e instanceof TernaryExpression) {
            return "(" + text + ")";
        }
        if (e instanceof BinaryExpression) {
            int p = ((BinaryExpression) e).getOperator().getPrecedence();
            if (p < parentPrecedence || (rightSide && p == parentPrecedence)) {
                return "(" + text + ")";
            }
        }
        return text;
    }

    @Override
    public String visitUnary(UnaryExpression node, Void ctx) {
        Expression operand = node.getOperand();
        String text = expr(operand);
        if (operand instanceof BinaryExpression || operand instanceof TernaryExpression
                || operand instanceof UnaryExpression) {
            text = "(" + text + ")";
        }
        return node.getOperator().toSourceString() + text;
    }

    @Override
    public String visitCall(CallExpression node, Void ctx) {
        return callee(node, analyzed.resolve(node)) + "(" + join(exprs(node.getArguments())) + ")";
    }

    protected String callee(CallExpression call, ResolvedCall resolved) {
        switch (resolved.getKind()) {
            case LOCAL:
            case MODULE:
            case IMPORTED:
                String module = resolved.getModuleName();
                if (module == null) {
                    return currentModule == null ? name(resolved.getFunctionName())
                            : topLevelFunction(resolved.getFunctionName());
                }
                if (module.equals(currentModule)) {
                    return name(resolved.getFunctionName());
                }
                return moduleFunction(module, resolved.getFunctionName());
            default:
                // 外部调用原样输出
                return call.getName();
        }
    }

    @Override
    public String visitMethodCall(MethodCallExpression node, Void ctx) {
        return receiver(node.getReceiver()) + "." + node.getMethodName() + "(" + join(exprs(node.getArguments())) + ")";
    }

    @Override
    public String visitMemberAccess(MemberAccessExpression node, Void ctx) {
        return memberAccess(receiver(node.getTarget()), node.getMember());
    }

    @Override
    public String visitIndex(IndexExpression node, Void ctx) {
        return index(receiver(node.getTarget()), expr(node.getIndex()));
    }

    private String receiver(Expression e) {
        String text = expr(e);
        if (e instanceof BinaryExpression || e instanceof UnaryExpression || e instanceof TernaryExpression) {
            return "(" + text + ")";
        }
        return text;
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return name(node.getName());
    }

    @Override
    public String visitNumber(NumberLiteral node, Void ctx) {
        return numberLiteral(node);
    }

    @Override
    public String visitString(StringLiteral node, Void ctx) {
        return stringLiteral(node.getValue());
    }

    @Override
    public String visitBoolean(BooleanLiteral node, Void ctx) {
        return node.getValue() ? "true" : "false";
    }

    @Override
    public String visitInterpolation(StringInterpolation node, Void ctx) {
        return interpolation(node);
    }

    @Override
    public String visitList(ListExpression node, Void ctx) {
        return listLiteral(exprs(node.getElements()));
    }

    @Override
    public String visitResult(ResultExpression node, Void ctx) {
        String value = expr(node.getValue());
        return node.isOk() ? okValue(value, expectedType) : errorValue(value, expectedType);
    }

    @Override
    public String visitOption(OptionExpression node, Void ctx) {
        return node.isSome() ? someValue(expr(node.getValue()), expectedType) : noneValue(expectedType);
    }

    @Override
    public String visitErrorPropagation(ErrorPropagation node, Void ctx) {
        String temp = hoisted.get(node);
        if (temp == null) {
            throw new GenerationException(platform, "Error propagation '?' is only supported inside a function body",
                    node.getLocation());
        }
        return resultValue(temp);
    }

    @Override
    public String visitMatch(MatchExpression node, Void ctx) {
        if (hasBlockArm(node)) {
            throw new GenerationException(platform,
                    "Match with block arms must be used as a statement, a return value or a let initializer",
                    node.getLocation());
        }
        return matchExpression(node, expr(node.getScrutinee()));
    }

    @Override
    public String visitTernary(TernaryExpression node, Void ctx) {
        String condition = expr(node.getCondition());
        if (node.getCondition() instanceof TernaryExpression) {
            condition = "(" + condition + ")";
        }
        return condition + " ? " + expr(node.getThenExpr()) + " : " + expr(node.getElseExpr());
    }

    // ============ 辅助遍历 ============

    /**
     * 按求值顺序（内层优先）收集 ?；条件分支、短路右操作数与 match 分支内的 ? 无法提升
     */
    private final class PropagationCollector extends AstScanner<Boolean> {
        final List<ErrorPropagation> found = new ArrayList<ErrorPropagation>();

        @Override
        public Void visitErrorPropagation(ErrorPropagation node, Boolean conditional) {
            if (conditional) {
                throw new GenerationException(platform, "Error propagation '?' cannot appear inside a conditional "
                        + "branch, a short-circuit operand or a match arm", node.getLocation());
            }
            super.visitErrorPropagation(node, conditional);
            found.add(node);
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpression node, Boolean conditional) {
            scan(node.getLeft(), conditional);
            scan(node.getRight(), conditional || node.getOperator().isLogical());
            return null;
        }

        @Override
        public Void visitTernary(TernaryExpression node, Boolean conditional) {
            scan(node.getCondition(), conditional);
            scan(node.getThenExpr(), Boolean.TRUE);
            scan(node.getElseExpr(), Boolean.TRUE);
            return null;
        }

        @Override
        public Void visitMatch(MatchExpression node, Boolean conditional) {
            scan(node.getScrutinee(), conditional);
            for (MatchCase c : node.getCases()) {
                scanStatements(c.getBody(), Boolean.TRUE);
            }
            return null;
        }
    }

    protected static boolean containsPropagation(Expression e) {
        final boolean[] found = {false};
        new AstScanner<Void>() {
            @Override
            public Void visitErrorPropagation(ErrorPropagation node, Void ctx) {
                found[0] = true;
                return null;
            }
        }.scan(e, null);
        return found[0];
    }

    protected static boolean containsCall(Expression e) {
        final boolean[] found = {false};
        new AstScanner<Void>() {
            @Override
            public Void visitCall(CallExpression node, Void ctx) {
                found[0] = true;
                return null;
            }

            @Override
            public Void visitMethodCall(MethodCallExpression node, Void ctx) {
                found[0] = true;
                return null;
            }
        }.scan(e, null);
        return found[0];
    }
}
