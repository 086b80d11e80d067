package com.cadenza.compiler.analysis;

import com.cadenza.compiler.Diagnostic;
import com.cadenza.compiler.FrontEnd;
import com.cadenza.compiler.ast.AstScanner;
import com.cadenza.compiler.ast.decl.Program;
import com.cadenza.compiler.ast.expr.CallExpression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SemanticAnalyzer 单元测试
 */
class SemanticAnalyzerTest {

    private AnalyzedProgram analyze(String source) {
        return FrontEnd.analyze(source, "<test>");
    }

    private SemanticException analyzeError(String source) {
        return assertThrows(SemanticException.class, () -> analyze(source));
    }

    /** 收集程序中所有调用节点（按遍历顺序） */
    private List<CallExpression> calls(Program program) {
        final List<CallExpression> result = new ArrayList<CallExpression>();
        new AstScanner<Void>() {
            @Override
            public Void visitCall(CallExpression node, Void ctx) {
                result.add(node);
                return super.visitCall(node, ctx);
            }
        }.scanStatements(program.getStatements(), null);
        return result;
    }

    private ResolvedCall resolveCall(AnalyzedProgram analyzed, String name) {
        for (CallExpression call : calls(analyzed.getProgram())) {
            if (call.getName().equals(name)) {
                return analyzed.resolve(call);
            }
        }
        fail("No call to " + name);
        return null;
    }

    private static final String MATH_MODULE = "module Math {\n"
            + "  function add(a: int, b: int) -> int { return a + b }\n"
            + "  function secret() -> int { return 42 }\n"
            + "  export { add }\n"
            + "}\n";

    // ============ 调用解析 ============

    @Nested
    @DisplayName("调用解析")
    class ResolutionTests {

        @Test
        @DisplayName("限定名调用解析到模块函数")
        void testQualifiedCall() {
            AnalyzedProgram analyzed = analyze(MATH_MODULE + "function main() -> int { return Math.add(1, 2) }");
            ResolvedCall call = resolveCall(analyzed, "Math.add");
            assertEquals(ResolvedCall.Kind.MODULE, call.getKind());
            assertEquals("Math", call.getModuleName());
            assertEquals("add", call.getFunctionName());
            assertNotNull(call.getDeclaration());
        }

        @Test
        @DisplayName("选择性导入后的简单名调用")
        void testImportedCall() {
            AnalyzedProgram analyzed = analyze(MATH_MODULE
                    + "import Math.{add}\n"
                    + "function main() -> int { return add(1, 2) }");
            ResolvedCall call = resolveCall(analyzed, "add");
            assertEquals(ResolvedCall.Kind.IMPORTED, call.getKind());
            assertEquals("Math", call.getModuleName());
        }

        @Test
        @DisplayName("通配导入只绑定导出的函数")
        void testWildcardImport() {
            AnalyzedProgram analyzed = analyze(MATH_MODULE
                    + "import Math.*\n"
                    + "function main() -> int { return add(1, secret()) }");
            assertEquals(ResolvedCall.Kind.IMPORTED, resolveCall(analyzed, "add").getKind());
            assertFalse(resolveCall(analyzed, "secret").isResolved());
        }

        @Test
        @DisplayName("模块内部调用优先解析到本模块")
        void testModuleLocalCall() {
            AnalyzedProgram analyzed = analyze("function helper() -> int { return 0 }\n"
                    + "module M {\n"
                    + "  function helper() -> int { return 1 }\n"
                    + "  function run() -> int { return helper() }\n"
                    + "}");
            ResolvedCall call = resolveCall(analyzed, "helper");
            assertEquals(ResolvedCall.Kind.LOCAL, call.getKind());
            assertEquals("M", call.getModuleName());
        }

        @Test
        @DisplayName("模块内可以调用自身未导出的函数")
        void testSelfQualifiedPrivateCall() {
            AnalyzedProgram analyzed = analyze("module Math {\n"
                    + "  function add(a: int, b: int) -> int { return Math.secret() }\n"
                    + "  function secret() -> int { return 42 }\n"
                    + "  export { add }\n"
                    + "}");
            assertEquals(ResolvedCall.Kind.MODULE, resolveCall(analyzed, "Math.secret").getKind());
        }

        @Test
        @DisplayName("顶层函数调用")
        void testTopLevelCall() {
            AnalyzedProgram analyzed = analyze("function two() -> int { return 2 }\n"
                    + "function main() -> int { return two() * 2 }");
            ResolvedCall call = resolveCall(analyzed, "two");
            assertEquals(ResolvedCall.Kind.LOCAL, call.getKind());
            assertNull(call.getModuleName());
        }

        @Test
        @DisplayName("未知名字保持未解析")
        void testUnresolved() {
            AnalyzedProgram analyzed = analyze("function main() { print(\"hi\") }");
            assertFalse(resolveCall(analyzed, "print").isResolved());
        }

        @Test
        @DisplayName("插值与 match 分支中的调用同样被解析")
        void testNestedCalls() {
            AnalyzedProgram analyzed = analyze("function two() -> int { return 2 }\n"
                    + "function main(r: Result<int, string>) -> string {\n"
                    + "  return match r { Ok(v) -> $\"{two()}\", Error(e) -> e }\n"
                    + "}");
            assertTrue(resolveCall(analyzed, "two").isResolved());
        }
    }

    // ============ 模块可见性 ============

    @Nested
    @DisplayName("模块可见性")
    class VisibilityTests {

        @Test
        @DisplayName("调用未导出函数")
        void testCallPrivateFunction() {
            SemanticException e = analyzeError(MATH_MODULE + "function main() -> int { return Math.secret() }");
            assertTrue(e.getMessage().contains("not exported"));
        }

        @Test
        @DisplayName("调用不存在的模块函数")
        void testCallMissingFunction() {
            SemanticException e = analyzeError(MATH_MODULE + "function main() -> int { return Math.mul(1, 2) }");
            assertTrue(e.getMessage().contains("has no function 'mul'"));
        }

        @Test
        @DisplayName("导入未导出的名字")
        void testImportPrivateName() {
            SemanticException e = analyzeError(MATH_MODULE + "import Math.{secret}");
            assertTrue(e.getMessage().contains("does not export 'secret'"));
        }

        @Test
        @DisplayName("导出不存在的函数")
        void testExportUnknown() {
            analyzeError("module M { function a() { } export { b } }");
        }

        @Test
        @DisplayName("重复模块与重复函数")
        void testDuplicates() {
            analyzeError("module M { }\nmodule M { }");
            analyzeError("function f() { }\nfunction f() { }");
            analyzeError("module M { function f() { } function f() { } }");
        }

        @Test
        @DisplayName("导入未知模块只产生警告")
        void testUnknownModuleImport() {
            AnalyzedProgram analyzed = analyze("import System.IO\nfunction main() { }");
            assertEquals(1, analyzed.getWarnings().size());
            assertEquals(Diagnostic.Severity.WARNING, analyzed.getWarnings().get(0).getSeverity());
            assertTrue(analyzed.getWarnings().get(0).getMessage().contains("System.IO"));
        }

        @Test
        @DisplayName("未知模块的限定调用不报错")
        void testExternalQualifiedCall() {
            AnalyzedProgram analyzed = analyze("function main() { Console.WriteLine(\"hi\") }");
            assertFalse(resolveCall(analyzed, "Console.WriteLine").isResolved());
        }
    }

    // ============ 错误传播 ============

    @Nested
    @DisplayName("错误传播")
    class PropagationTests {

        private static final String PARSE = "function parse(s: string) -> Result<int, string> { return Ok(1) }\n";

        @Test
        @DisplayName("合法的 ? 使用")
        void testValidPropagation() {
            AnalyzedProgram analyzed = analyze(PARSE
                    + "function double(s: string) -> Result<int, string> { let x = parse(s)? return Ok(x * 2) }");
            assertTrue(analyzed.getDiagnostics().isEmpty());
        }

        @Test
        @DisplayName("外层函数不返回 Result")
        void testEnclosingNotResult() {
            SemanticException e = analyzeError(PARSE + "function f(s: string) -> int { let x = parse(s)? return x }");
            assertTrue(e.getMessage().contains("requires function 'f' to return Result"));
        }

        @Test
        @DisplayName("被调用方不返回 Result")
        void testCalleeNotResult() {
            SemanticException e = analyzeError("function g() -> int { return 1 }\n"
                    + "function f() -> Result<int, string> { let x = g()? return Ok(x) }");
            assertTrue(e.getMessage().contains("not Result"));
        }

        @Test
        @DisplayName("错误类型不一致")
        void testErrorTypeMismatch() {
            SemanticException e = analyzeError(PARSE
                    + "function f(s: string) -> Result<int, int> { let x = parse(s)? return Ok(x) }");
            assertTrue(e.getMessage().contains("Incompatible error type"));
        }

        @Test
        @DisplayName("未解析调用上的 ? 不做类型检查")
        void testUnresolvedCallee() {
            analyze("function f() -> Result<int, string> { let x = external()? return Ok(x) }");
        }

        @Test
        @DisplayName("错误位置指向 ? 所在行")
        void testErrorLocation() {
            SemanticException e = analyzeError(PARSE
                    + "function f(s: string) -> int {\n"
                    + "  let x = parse(s)?\n"
                    + "  return x\n"
                    + "}");
            assertEquals(3, e.getLocation().getLine());
        }
    }

    // ============ 诊断 ============

    @Nested
    @DisplayName("警告与边界")
    class WarningTests {

        @Test
        @DisplayName("不穷尽的 match 产生警告")
        void testNonExhaustiveMatch() {
            AnalyzedProgram analyzed = analyze("function f(r: Result<int, string>) -> int {\n"
                    + "  return match r { Ok(v) -> v }\n"
                    + "}");
            List<Diagnostic> warnings = analyzed.getWarnings();
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).getMessage().contains("Non-exhaustive match"));
            assertEquals(2, warnings.get(0).getLine());
        }

        @Test
        @DisplayName("带通配符的 match 没有警告")
        void testWildcardMatch() {
            AnalyzedProgram analyzed = analyze("function f(n: int) -> string {\n"
                    + "  return match n { 1 -> \"one\", _ -> \"many\" }\n"
                    + "}");
            assertTrue(analyzed.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("不检查传递副作用：纯函数可以调用有副作用的函数")
        void testTransitiveEffectsNotChecked() {
            AnalyzedProgram analyzed = analyze("function save(x: int) uses [Database] -> int { return x }\n"
                    + "pure function wrapper(x: int) -> int { return save(x) }");
            assertTrue(analyzed.getDiagnostics().isEmpty());
            assertEquals(ResolvedCall.Kind.LOCAL, resolveCall(analyzed, "save").getKind());
        }
    }
}
