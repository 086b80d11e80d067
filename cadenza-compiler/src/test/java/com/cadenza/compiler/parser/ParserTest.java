package com.cadenza.compiler.parser;

import com.cadenza.compiler.ast.Effect;
import com.cadenza.compiler.ast.Expression;
import com.cadenza.compiler.ast.Statement;
import com.cadenza.compiler.ast.TypeRef;
import com.cadenza.compiler.ast.decl.*;
import com.cadenza.compiler.ast.expr.*;
import com.cadenza.compiler.ast.stmt.*;
import com.cadenza.compiler.lexer.LexException;
import com.cadenza.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source).tokenize(), "<test>").parse();
    }

    /** 解析单个函数 */
    private FunctionDeclaration parseFunction(String source) {
        Program program = parse(source);
        assertEquals(1, program.getStatements().size());
        return (FunctionDeclaration) program.getStatements().get(0);
    }

    /** 解析表达式：包在 return 语句里 */
    private Expression parseExpr(String expr) {
        FunctionDeclaration fn = parseFunction("function t() -> int { return " + expr + " }");
        return ((ReturnStatement) fn.getBody().get(0)).getValue();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ============ 函数声明 ============

    @Nested
    @DisplayName("函数声明")
    class FunctionDeclarationTests {

        @Test
        @DisplayName("参数与返回类型")
        void testSignature() {
            FunctionDeclaration fn = parseFunction("function add(a: int, b: int) -> int { return a + b }");
            assertEquals("add", fn.getName());
            assertEquals(2, fn.getParameters().size());
            assertEquals("b", fn.getParameters().get(1).getName());
            assertEquals(TypeRef.simple("int"), fn.getReturnType());
            assertFalse(fn.isPure());
            assertTrue(fn.getEffects().isEmpty());
        }

        @Test
        @DisplayName("省略返回类型为 Unit")
        void testUnitReturn() {
            FunctionDeclaration fn = parseFunction("function log() { }");
            assertTrue(fn.getReturnType().isUnit());
        }

        @Test
        @DisplayName("pure 函数")
        void testPure() {
            FunctionDeclaration fn = parseFunction("pure function sq(x: int) -> int { return x * x }");
            assertTrue(fn.isPure());
        }

        @Test
        @DisplayName("uses 子句保持声明顺序")
        void testEffects() {
            FunctionDeclaration fn = parseFunction(
                    "function save(u: string) uses [Database, Logging] -> Result<int, string> { return Ok(1) }");
            assertEquals(List.of(Effect.DATABASE, Effect.LOGGING), fn.getEffects());
            assertTrue(fn.getReturnType().isResult());
            assertEquals(TypeRef.simple("string"), fn.getReturnType().getErrorType());
        }

        @Test
        @DisplayName("uses 子句写在返回类型之后")
        void testEffectsAfterReturnType() {
            FunctionDeclaration fn = parseFunction("function f() -> int uses [IO] { return 1 }");
            assertEquals(List.of(Effect.IO), fn.getEffects());
        }

        @Test
        @DisplayName("pure 与 uses 同时出现是语法错误")
        void testPureWithEffects() {
            ParseException e = parseError("pure function f() uses [Database] -> int { return 1 }");
            assertTrue(e.getMessage().contains("Pure function 'f' cannot declare effects"));
        }

        @Test
        @DisplayName("未知副作用名")
        void testUnknownEffect() {
            ParseException e = parseError("function f() uses [Telepathy] -> int { return 1 }");
            assertTrue(e.getMessage().contains("Unknown effect 'Telepathy'"));
        }

        @Test
        @DisplayName("重复副作用")
        void testDuplicateEffect() {
            parseError("function f() uses [IO, IO] { }");
        }

        @Test
        @DisplayName("空副作用列表")
        void testEmptyEffects() {
            parseError("function f() uses [] { }");
        }

        @Test
        @DisplayName("缺少函数体")
        void testMissingBody() {
            ParseException e = parseError("function f() -> int");
            assertTrue(e.getMessage().contains("Missing body"));
        }

        @Test
        @DisplayName("缺少右花括号")
        void testMissingBrace() {
            parseError("function f() -> int { return 1 ");
        }

        @Test
        @DisplayName("Result 类型参数个数错误")
        void testResultArity() {
            ParseException e = parseError("function f() -> Result<int> { return Ok(1) }");
            assertTrue(e.getMessage().contains("exactly 2 type arguments"));
            parseError("function f() -> Result { return Ok(1) }");
        }

        @Test
        @DisplayName("Option / List 类型参数")
        void testOptionAndList() {
            FunctionDeclaration fn = parseFunction("function f(xs: List<int>) -> Option<string> { return None }");
            assertTrue(fn.getParameters().get(0).getType().isList());
            assertTrue(fn.getReturnType().isOption());
            parseError("function f(xs: List<int, int>) { }");
        }

        @Test
        @DisplayName("顶层只允许声明")
        void testTopLevelStatement() {
            ParseException e = parseError("let x = 1");
            assertTrue(e.getMessage().contains("Expected declaration"));
        }

        @Test
        @DisplayName("规约块附着在函数上")
        void testSpecification() {
            FunctionDeclaration fn = parseFunction("/*spec\n"
                    + "intent: \"Transfer funds\"\n"
                    + "rules:\n"
                    + "  - \"Amount must be positive\"\n"
                    + "  - Balance must cover amount\n"
                    + "postconditions:\n"
                    + "  - Funds moved\n"
                    + "source_doc: \"docs/transfer.md\"\n"
                    + "spec*/\n"
                    + "function transfer(amount: int) -> int { return amount }");
            SpecificationBlock spec = fn.getSpecification();
            assertNotNull(spec);
            assertEquals("Transfer funds", spec.getIntent());
            assertEquals(List.of("Amount must be positive", "Balance must cover amount"), spec.getRules());
            assertEquals(List.of("Funds moved"), spec.getPostconditions());
            assertEquals("docs/transfer.md", spec.getSourceDoc());
        }

        @Test
        @DisplayName("规约块缺少 intent")
        void testSpecificationWithoutIntent() {
            parseError("/*spec\nrules:\n - x\nspec*/ function f() { }");
        }

        @Test
        @DisplayName("规约块后没有声明")
        void testDanglingSpecification() {
            parseError("/*spec intent: x spec*/ import Math.*");
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("a + b * c > d && e || f")
        void testStandardPrecedence() {
            BinaryExpression or = (BinaryExpression) parseExpr("a + b * c > d && e || f");
            assertEquals(BinaryExpression.BinaryOp.OR, or.getOperator());
            assertTrue(or.getRight() instanceof Identifier);

            BinaryExpression and = (BinaryExpression) or.getLeft();
            assertEquals(BinaryExpression.BinaryOp.AND, and.getOperator());
            assertEquals("e", ((Identifier) and.getRight()).getName());

            BinaryExpression gt = (BinaryExpression) and.getLeft();
            assertEquals(BinaryExpression.BinaryOp.GT, gt.getOperator());

            BinaryExpression add = (BinaryExpression) gt.getLeft();
            assertEquals(BinaryExpression.BinaryOp.ADD, add.getOperator());
            BinaryExpression mul = (BinaryExpression) add.getRight();
            assertEquals(BinaryExpression.BinaryOp.MUL, mul.getOperator());
        }

        @Test
        @DisplayName("括号覆盖优先级")
        void testParentheses() {
            BinaryExpression mul = (BinaryExpression) parseExpr("(a + b) * c");
            assertEquals(BinaryExpression.BinaryOp.MUL, mul.getOperator());
            assertEquals(BinaryExpression.BinaryOp.ADD, ((BinaryExpression) mul.getLeft()).getOperator());
        }

        @Test
        @DisplayName("左结合")
        void testLeftAssociative() {
            BinaryExpression sub = (BinaryExpression) parseExpr("a - b - c");
            assertTrue(sub.getLeft() instanceof BinaryExpression);
            assertTrue(sub.getRight() instanceof Identifier);
        }

        @Test
        @DisplayName("相等低于关系")
        void testEqualityBelowRelational() {
            BinaryExpression eq = (BinaryExpression) parseExpr("a < b == c >= d");
            assertEquals(BinaryExpression.BinaryOp.EQ, eq.getOperator());
            assertEquals(BinaryExpression.BinaryOp.LT, ((BinaryExpression) eq.getLeft()).getOperator());
            assertEquals(BinaryExpression.BinaryOp.GE, ((BinaryExpression) eq.getRight()).getOperator());
        }

        @Test
        @DisplayName("一元运算符高于乘法")
        void testUnary() {
            BinaryExpression mul = (BinaryExpression) parseExpr("-a * !b");
            assertTrue(mul.getLeft() instanceof UnaryExpression);
            assertEquals(UnaryExpression.UnaryOp.NOT, ((UnaryExpression) mul.getRight()).getOperator());
        }

        @Test
        @DisplayName("三元低于 ||")
        void testTernary() {
            TernaryExpression ternary = (TernaryExpression) parseExpr("a || b ? 1 : 2");
            assertTrue(ternary.getCondition() instanceof BinaryExpression);
            assertEquals(1, ((NumberLiteral) ternary.getThenExpr()).getValue());
        }

        @Test
        @DisplayName("三元右结合")
        void testNestedTernary() {
            TernaryExpression ternary = (TernaryExpression) parseExpr("a ? 1 : b ? 2 : 3");
            assertTrue(ternary.getElseExpr() instanceof TernaryExpression);
        }
    }

    @Nested
    @DisplayName("后缀与字面量")
    class PostfixTests {

        @Test
        @DisplayName("错误传播 ?")
        void testErrorPropagation() {
            FunctionDeclaration fn = parseFunction(
                    "function f() -> Result<int, string> { let x = g()? return Ok(x * 2) }");
            LetStatement let = (LetStatement) fn.getBody().get(0);
            ErrorPropagation prop = (ErrorPropagation) let.getInitializer();
            assertEquals("g", ((CallExpression) prop.getExpression()).getName());
            assertTrue(fn.getBody().get(1) instanceof ReturnStatement);
        }

        @Test
        @DisplayName("? 后跟二元运算符仍是错误传播")
        void testPropagationInBinary() {
            BinaryExpression add = (BinaryExpression) parseExpr("g()? + 1");
            assertTrue(add.getLeft() instanceof ErrorPropagation);
        }

        @Test
        @DisplayName("? 后能组成三元时为三元")
        void testQuestionAsTernary() {
            assertTrue(parseExpr("ready ? a : b") instanceof TernaryExpression);
        }

        @Test
        @DisplayName("错误传播后接三元")
        void testPropagationThenTernary() {
            TernaryExpression ternary = (TernaryExpression) parseExpr("check()? ? 1 : 0");
            assertTrue(ternary.getCondition() instanceof ErrorPropagation);
        }

        @Test
        @DisplayName("三元分支里的错误传播")
        void testPropagationInsideTernaryBranch() {
            TernaryExpression ternary = (TernaryExpression) parseExpr("c ? f()? : 0");
            assertTrue(ternary.getThenExpr() instanceof ErrorPropagation);
        }

        @Test
        @DisplayName("深层嵌套的三元在线性时间量级内解析完成")
        void testDeeplyNestedTernary() {
            int depth = 60;
            StringBuilder expr = new StringBuilder();
            for (int i = 0; i < depth; i++) {
                expr.append("a ? ");
            }
            expr.append("1");
            for (int i = 0; i < depth; i++) {
                expr.append(" : 0");
            }
            Expression parsed = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> parseExpr(expr.toString()));

            int levels = 0;
            while (parsed instanceof TernaryExpression) {
                parsed = ((TernaryExpression) parsed).getThenExpr();
                levels++;
            }
            assertEquals(depth, levels);
            assertTrue(parsed instanceof NumberLiteral);
        }

        @Test
        @DisplayName("限定名调用折叠为单个 CallExpression")
        void testQualifiedCall() {
            CallExpression call = (CallExpression) parseExpr("Math.add(1, 2)");
            assertEquals("Math.add", call.getName());
            assertEquals("Math", call.getQualifier());
            assertEquals("add", call.getSimpleName());
            assertEquals(2, call.getArguments().size());
        }

        @Test
        @DisplayName("成员访问、方法调用与下标")
        void testMemberAccess() {
            assertTrue(parseExpr("user.name") instanceof MemberAccessExpression);
            IndexExpression index = (IndexExpression) parseExpr("xs[0]");
            assertEquals(0, ((NumberLiteral) index.getIndex()).getValue());
            MethodCallExpression call = (MethodCallExpression) parseExpr("xs[0].trim()");
            assertEquals("trim", call.getMethodName());
        }

        @Test
        @DisplayName("Result / Option / List 字面量")
        void testConstructors() {
            ResultExpression ok = (ResultExpression) parseExpr("Ok(1)");
            assertTrue(ok.isOk());
            ResultExpression err = (ResultExpression) parseExpr("Error(\"bad\")");
            assertEquals(ResultExpression.Variant.ERROR, err.getVariant());
            assertTrue(((OptionExpression) parseExpr("Some(1)")).isSome());
            assertFalse(((OptionExpression) parseExpr("None")).isSome());
            assertEquals(3, ((ListExpression) parseExpr("[1, 2, 3]")).getElements().size());
        }

        @Test
        @DisplayName("字符串插值重新解析嵌入表达式")
        void testInterpolation() {
            StringInterpolation interp = (StringInterpolation) parseExpr("$\"Sum: {a + b}, name: {user.name}\"");
            assertEquals(4, interp.getParts().size());
            assertEquals("Sum: ", ((StringLiteral) interp.getParts().get(0)).getValue());
            BinaryExpression sum = (BinaryExpression) interp.getParts().get(1);
            assertEquals(BinaryExpression.BinaryOp.ADD, sum.getOperator());
            assertEquals(1, sum.getLocation().getLine());
            assertTrue(interp.getParts().get(3) instanceof MemberAccessExpression);
        }

        @Test
        @DisplayName("插值中的非法表达式报错")
        void testBadInterpolation() {
            assertThrows(ParseException.class, () -> parseExpr("$\"{a +}\""));
            assertThrows(LexException.class, () -> parseExpr("$\"{a & b}\""));
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("let 带类型注解")
        void testTypedLet() {
            FunctionDeclaration fn = parseFunction("function f() { let x: int = 1; let y = x }");
            LetStatement x = (LetStatement) fn.getBody().get(0);
            assertEquals(TypeRef.simple("int"), x.getType());
            assertNull(((LetStatement) fn.getBody().get(1)).getType());
        }

        @Test
        @DisplayName("else if 链")
        void testElseIf() {
            FunctionDeclaration fn = parseFunction(
                    "function f(x: int) -> int { if x > 0 { return 1 } else if x < 0 { return -1 } else { return 0 } }");
            IfStatement ifStmt = (IfStatement) fn.getBody().get(0);
            assertTrue(ifStmt.isElseIf());
            IfStatement inner = (IfStatement) ifStmt.getElseBody().get(0);
            assertTrue(inner.hasElse());
        }

        @Test
        @DisplayName("guard 语句")
        void testGuard() {
            FunctionDeclaration fn = parseFunction("function f(x: int) -> Result<int, string> {"
                    + " guard x >= 0 else { return Error(\"neg\") } return Ok(x) }");
            GuardStatement guard = (GuardStatement) fn.getBody().get(0);
            assertEquals(BinaryExpression.BinaryOp.GE, ((BinaryExpression) guard.getCondition()).getOperator());
            assertEquals(1, guard.getElseBody().size());
        }

        @Test
        @DisplayName("guard 缺少 else")
        void testGuardWithoutElse() {
            parseError("function f(x: int) -> int { guard x > 0 { return 0 } return x }");
        }

        @Test
        @DisplayName("guard 的 else 块必须返回")
        void testGuardMustReturn() {
            ParseException e = parseError("function f(x: int) -> int { guard x > 0 else { log(x) } return x }");
            assertTrue(e.getMessage().contains("Guard else block"));
        }

        @Test
        @DisplayName("guard 的 else 块以全返回的 if 结束")
        void testGuardEndsWithIf() {
            parseFunction("function f(x: int) -> int { guard x > 0 else {"
                    + " if x == 0 { return 0 } else { return -1 } } return x }");
        }

        @Test
        @DisplayName("函数体内不允许嵌套函数")
        void testNestedFunction() {
            parseError("function f() { function g() { } }");
        }

        @Test
        @DisplayName("无值 return")
        void testBareReturn() {
            FunctionDeclaration fn = parseFunction("function f() { return }");
            assertFalse(((ReturnStatement) fn.getBody().get(0)).hasValue());
        }
    }

    @Nested
    @DisplayName("match")
    class MatchTests {

        private MatchExpression parseMatch(String body) {
            return (MatchExpression) parseExpr("match r { " + body + " }");
        }

        @Test
        @DisplayName("Ok / Error 分支")
        void testResultMatch() {
            MatchExpression match = parseMatch("Ok(v) -> v  Error(e) -> 0");
            assertEquals(2, match.getCases().size());
            MatchCase ok = match.getCases().get(0);
            assertEquals(MatchPattern.Kind.OK, ok.getPattern().getKind());
            assertEquals("v", ok.getBindingName());
            assertTrue(ok.getValueExpression() instanceof Identifier);
            assertTrue(match.isExhaustive());
        }

        @Test
        @DisplayName("块分支与逗号分隔")
        void testBlockArm() {
            MatchExpression match = parseMatch("Ok(v) -> { let y = v * 2 return y }, Error(_) -> 0,");
            MatchCase ok = match.getCases().get(0);
            assertTrue(ok.isBlockBody());
            assertEquals(2, ok.getBody().size());
            assertNull(match.getCases().get(1).getBindingName());
        }

        @Test
        @DisplayName("字面量与通配符")
        void testLiteralPatterns() {
            MatchExpression match = parseMatch("1 -> \"one\", -2 -> \"minus two\", \"x\" -> \"ex\", true -> \"t\", _ -> \"other\"");
            assertEquals(5, match.getCases().size());
            assertEquals(1, match.getCases().get(0).getPattern().getLiteral());
            assertEquals(-2, match.getCases().get(1).getPattern().getLiteral());
            assertEquals("x", match.getCases().get(2).getPattern().getLiteral());
            assertEquals(Boolean.TRUE, match.getCases().get(3).getPattern().getLiteral());
            assertTrue(match.hasWildcard());
        }

        @Test
        @DisplayName("Some / None")
        void testOptionMatch() {
            MatchExpression match = parseMatch("Some(x) -> x None -> 0");
            assertTrue(match.isOptionMatch());
            assertTrue(match.isExhaustive());
        }

        @Test
        @DisplayName("缺少 Error 分支不穷尽")
        void testNonExhaustive() {
            assertFalse(parseMatch("Ok(v) -> v").isExhaustive());
            assertFalse(parseMatch("1 -> 2").isExhaustive());
        }

        @Test
        @DisplayName("任意标识符不是合法模式")
        void testInvalidPattern() {
            assertThrows(ParseException.class, () -> parseMatch("Foo(x) -> 1"));
        }

        @Test
        @DisplayName("空 match")
        void testEmptyMatch() {
            assertThrows(ParseException.class, () -> parseExpr("match r { }"));
        }
    }

    // ============ 模块 ============

    @Nested
    @DisplayName("模块、导入与导出")
    class ModuleTests {

        @Test
        @DisplayName("模块与 export 列表")
        void testModuleExports() {
            Program program = parse("module Math {\n"
                    + "  function add(a: int, b: int) -> int { return a + b }\n"
                    + "  function helper() -> int { return 0 }\n"
                    + "  export { add }\n"
                    + "}");
            ModuleDeclaration module = program.getModules().get(0);
            assertEquals("Math", module.getName());
            assertEquals(2, module.getFunctions().size());
            assertTrue(module.isVisible("add"));
            assertFalse(module.isVisible("helper"));
        }

        @Test
        @DisplayName("export function 与 export a, b")
        void testExportForms() {
            Program program = parse("module M {\n"
                    + "  export function a() { }\n"
                    + "  function b() { }\n"
                    + "  function c() { }\n"
                    + "  export b, c\n"
                    + "}");
            ModuleDeclaration module = program.getModules().get(0);
            assertTrue(module.getFunctions().get(0).isExported());
            assertEquals(3, module.getExports().size());
        }

        @Test
        @DisplayName("没有 export 时全部可见")
        void testNoExports() {
            ModuleDeclaration module = parse("module M { function a() { } }").getModules().get(0);
            assertFalse(module.hasExportList());
            assertTrue(module.isVisible("a"));
        }

        @Test
        @DisplayName("导入形式")
        void testImports() {
            Program program = parse("import Math.{add, sub}\nimport Utils.*\nimport {fmt} from Text\nimport Logger");
            List<ImportStatement> imports = program.getImports();
            assertEquals(List.of("add", "sub"), imports.get(0).getSpecificNames());
            assertEquals("Math", imports.get(0).getModuleName());
            assertTrue(imports.get(1).isWildcard());
            assertEquals("Text", imports.get(2).getModuleName());
            assertEquals(List.of("fmt"), imports.get(2).getSpecificNames());
            assertFalse(imports.get(3).isSelective());
            assertFalse(imports.get(3).isWildcard());
        }

        @Test
        @DisplayName("模块不能嵌套")
        void testNestedModule() {
            parseError("module A { module B { } }");
        }

        @Test
        @DisplayName("副作用名可作模块名")
        void testEffectNamedModule() {
            Program program = parse("module Logging { function info(m: string) uses [IO] { } }");
            assertEquals("Logging", program.getModules().get(0).getName());
        }
    }

    @Test
    @DisplayName("语句顺序保持源码顺序")
    void testStatementOrder() {
        Program program = parse("import A.*\nfunction f() { }\nmodule M { }\nexport { f }");
        List<Statement> stmts = program.getStatements();
        assertTrue(stmts.get(0) instanceof ImportStatement);
        assertTrue(stmts.get(1) instanceof FunctionDeclaration);
        assertTrue(stmts.get(2) instanceof ModuleDeclaration);
        assertTrue(stmts.get(3) instanceof ExportStatement);
    }
}
