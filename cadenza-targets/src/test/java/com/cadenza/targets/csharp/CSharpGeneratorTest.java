package com.cadenza.targets.csharp;

import com.cadenza.compiler.FrontEnd;
import com.cadenza.targets.AuxiliaryFile;
import com.cadenza.targets.GenerationException;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetGenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("C# 后端")
class CSharpGeneratorTest {

    private final CSharpGenerator generator = new CSharpGenerator();

    private TargetGenerationResult generate(String source) {
        return generate(source, new TargetConfiguration());
    }

    private TargetGenerationResult generate(String source, TargetConfiguration config) {
        return generator.generate(FrontEnd.analyze(source, "test.cdz"), config);
    }

    private String code(String source) {
        return generate(source).getSourceText();
    }

    private static final String DIVIDE = "function divide(a: int, b: int) -> Result<int, string> {\n"
            + "  guard b != 0 else { return Error(\"division by zero\") }\n"
            + "  return Ok(a / b)\n"
            + "}\n";

    @Nested
    @DisplayName("控制流降级")
    class ControlFlowTests {

        @Test
        @DisplayName("guard 生成取反条件与提前返回")
        void testGuard() {
            String cs = code(DIVIDE);
            assertThat(cs).contains("public static Result<int, string> divide(int a, int b)");
            assertThat(cs).contains("if (!(b != 0))");
            assertThat(cs).contains("return Result.Error<int, string>(\"division by zero\");");
            assertThat(cs).contains("return Result.Ok<int, string>(a / b);");
            assertThat(cs.indexOf("if (!(b != 0))")).isLessThan(cs.indexOf("Result.Ok<int, string>(a / b)"));
        }

        @Test
        @DisplayName("? 展开为临时变量、错误检查和取值")
        void testErrorPropagation() {
            String cs = code(DIVIDE
                    + "function twice(a: int, b: int) -> Result<int, string> {\n"
                    + "  let x = divide(a, b)?\n"
                    + "  return Ok(x * 2)\n"
                    + "}\n");
            int temp = cs.indexOf("var x_result = divide(a, b);");
            int check = cs.indexOf("if (x_result.IsError)");
            int bind = cs.indexOf("var x = x_result.Value;");
            int ok = cs.indexOf("return Result.Ok<int, string>(x * 2);");
            assertThat(temp).isPositive();
            assertThat(check).isGreaterThan(temp);
            assertThat(bind).isGreaterThan(check);
            assertThat(ok).isGreaterThan(bind);
            assertThat(cs).contains("return Result.Error<int, string>(x_result.Error);");
        }

        @Test
        @DisplayName("表达式中的 ? 在语句之前提升")
        void testNestedPropagationHoisted() {
            String cs = code(DIVIDE
                    + "function sum(a: int) -> Result<int, string> {\n"
                    + "  return Ok(divide(a, 2)? + divide(a, 3)?)\n"
                    + "}\n");
            assertThat(cs).contains("var __r1 = divide(a, 2);");
            assertThat(cs).contains("var __r2 = divide(a, 3);");
            assertThat(cs).contains("return Result.Ok<int, string>(__r1.Value + __r2.Value);");
        }

        @Test
        @DisplayName("三元分支中的 ? 无法提升")
        void testPropagationInTernaryFails() {
            assertThatThrownBy(() -> code(DIVIDE
                    + "function pick(a: int, c: bool) -> Result<int, string> {\n"
                    + "  return Ok(c ? divide(a, 2)? : 0)\n"
                    + "}\n"))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("conditional");
        }

        @Test
        @DisplayName("else if 链保持 Allman 风格")
        void testElseIf() {
            String cs = code("function sign(x: int) -> int {\n"
                    + "  if x > 0 { return 1 } else if x < 0 { return -1 } else { return 0 }\n"
                    + "}\n");
            assertThat(cs).contains("if (x > 0)\n        {\n            return 1;\n        }\n"
                    + "        else if (x < 0)\n        {\n            return -1;\n        }\n"
                    + "        else\n        {\n            return 0;\n        }");
        }
    }

    @Nested
    @DisplayName("match")
    class MatchTests {

        @Test
        @DisplayName("return match 降级为成功判断的两个分支")
        void testResultMatchStatement() {
            String cs = code("function unwrap(r: Result<int, string>) -> int {\n"
                    + "  return match r { Ok(v) -> v  Error(e) -> 0 }\n"
                    + "}\n");
            assertThat(cs).contains("var __m1 = r;");
            assertThat(cs).contains("if (__m1.IsSuccess)");
            assertThat(cs).contains("var v = __m1.Value;");
            assertThat(cs).contains("return v;");
            assertThat(cs).contains("else\n");
            assertThat(cs).contains("var e = __m1.Error;");
            assertThat(cs).doesNotContain("Non-exhaustive");
        }

        @Test
        @DisplayName("表达式位置的 match 使用 Match 回调")
        void testResultMatchExpression() {
            String cs = code("function describe(r: Result<int, string>) -> string {\n"
                    + "  let text = match r { Ok(v) -> \"ok\"  Error(e) -> e }\n"
                    + "  return text\n"
                    + "}\n");
            assertThat(cs).contains("var text = r.Match(v => \"ok\", e => e);");
        }

        @Test
        @DisplayName("字面量 match 使用 switch 表达式，缺少通配符时抛出异常")
        void testLiteralSwitch() {
            String cs = code("function name(n: int) -> string {\n"
                    + "  let s = match n { 1 -> \"one\", 2 -> \"two\" }\n"
                    + "  return s\n"
                    + "}\n");
            assertThat(cs).contains("(n switch { 1 => \"one\", 2 => \"two\", _ => throw new InvalidOperationException(");
        }

        @Test
        @DisplayName("不穷尽的语句 match 追加中止分支")
        void testNonExhaustiveStatementMatch() {
            String cs = code("function first(r: Result<int, string>) -> int {\n"
                    + "  return match r { Ok(v) -> v }\n"
                    + "}\n");
            assertThat(cs).contains("throw new InvalidOperationException(\"Non-exhaustive match at line 2\");");
        }

        @Test
        @DisplayName("let 的块分支需要类型标注")
        void testBlockArmNeedsAnnotation() {
            String source = "function calc(r: Result<int, string>) -> int {\n"
                    + "  let x = match r { Ok(v) -> { let y = v * 2 return y }, Error(_) -> 0 }\n"
                    + "  return x\n"
                    + "}\n";
            assertThatThrownBy(() -> code(source))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("type annotation");

            String cs = code(source.replace("let x = match", "let x: int = match"));
            assertThat(cs).contains("int x;");
            assertThat(cs).contains("var y = v * 2;");
            assertThat(cs).contains("x = y;");
            assertThat(cs).contains("x = 0;");
        }
    }

    @Nested
    @DisplayName("程序结构")
    class StructureTests {

        @Test
        @DisplayName("模块映射为命名空间内的静态类，调用全局限定")
        void testModules() {
            String cs = code("module Math {\n"
                    + "  function add(a: int, b: int) -> int { return a + b }\n"
                    + "  function helper() -> int { return 1 }\n"
                    + "  export { add }\n"
                    + "}\n"
                    + "function main() uses [IO] { let s = Math.add(1, 2) }\n");
            assertThat(cs).contains("namespace Cadenza.Modules.Math");
            assertThat(cs).contains("public static class Math");
            assertThat(cs).contains("public static int add(int a, int b)");
            assertThat(cs).contains("private static int helper()");
            assertThat(cs).contains("var s = global::Cadenza.Modules.Math.Math.add(1, 2);");
            assertThat(cs).startsWith("// <auto-generated>");
            assertThat(cs).contains("CadenzaProgram.main();");
        }

        @Test
        @DisplayName("文档注释包含规约块与副作用")
        void testDocumentation() {
            String cs = code("/*spec\n"
                    + "intent: \"Stores a user\"\n"
                    + "rules:\n"
                    + "  - name must not be empty\n"
                    + "spec*/\n"
                    + "function save(name: string) uses [Database, Logging] -> Result<int, string> { return Ok(1) }\n");
            assertThat(cs).contains("/// Stores a user");
            assertThat(cs).contains("/// Business Rules:");
            assertThat(cs).contains("/// - name must not be empty");
            assertThat(cs).contains("/// Effects: Database, Logging");
            assertThat(cs).contains("/// <param name=\"name\">Parameter of type string</param>");
            assertThat(cs).contains("/// <returns>Returns Result&lt;int, string&gt;</returns>");
            assertThat(cs).contains("CadenzaRuntime.TrackEffects(\"save\", \"Database\", \"Logging\");");
        }

        @Test
        @DisplayName("关闭运行时检查后不生成副作用跟踪")
        void testRuntimeChecksDisabled() {
            TargetConfiguration config = new TargetConfiguration();
            config.setEnableRuntimeChecks(false);
            String cs = generate("function log(m: string) uses [Logging] { }", config).getSourceText();
            assertThat(cs).doesNotContain("TrackEffects");
        }

        @Test
        @DisplayName("保留字加 @ 前缀")
        void testReservedWords() {
            String cs = code("function f(object: int) -> int { return 1 }");
            assertThat(cs).contains("public static int f(int @object)");
        }

        @Test
        @DisplayName("字符串插值使用 $\"...\"")
        void testInterpolation() {
            String cs = code("function greet(name: string, n: int) -> string { return $\"Hi {name}, {n + 1}\" }");
            assertThat(cs).contains("return $\"Hi {name}, {(n + 1)}\";");
        }
    }

    @Nested
    @DisplayName("辅助文件")
    class AuxiliaryTests {

        @Test
        @DisplayName("有 main 时生成可执行项目")
        void testProjectFile() {
            TargetGenerationResult result = generate("function main() { }");
            AuxiliaryFile project = result.findAuxiliaryFile(CSharpGenerator.PROJECT_FILE);
            assertThat(project).isNotNull();
            assertThat(project.getKind()).isEqualTo(AuxiliaryFile.Kind.MANIFEST);
            assertThat(project.getContent()).contains("<OutputType>Exe</OutputType>");
            assertThat(project.getContent()).contains("<TargetFramework>net8.0</TargetFramework>");
            assertThat(result.getDependencies()).containsExactly("Microsoft.NETCore.App");
            assertThat(result.getBuildInstructions()).containsEntry("build", "dotnet build")
                    .containsEntry("run", "dotnet run");
        }

        @Test
        @DisplayName("没有 main 时生成类库，框架可配置")
        void testLibraryProject() {
            TargetConfiguration config = new TargetConfiguration().setOption("csharp.framework", "net6.0");
            AuxiliaryFile project = generate("function f() -> int { return 1 }", config)
                    .findAuxiliaryFile(CSharpGenerator.PROJECT_FILE);
            assertThat(project.getContent()).contains("<OutputType>Library</OutputType>");
            assertThat(project.getContent()).contains("<TargetFramework>net6.0</TargetFramework>");
        }

        @Test
        @DisplayName("运行时文件定义 Result 且两次生成完全相同")
        void testRuntimeIdempotent() {
            String source = DIVIDE + "function main() { let r = divide(4, 2) }";
            TargetGenerationResult first = generate(source);
            TargetGenerationResult second = generate(source);
            String runtime = first.findAuxiliaryFile(CSharpGenerator.RUNTIME_FILE).getContent();
            assertThat(runtime).contains("namespace Cadenza.Runtime");
            assertThat(runtime).contains("IsSuccess");
            assertThat(runtime).isEqualTo(second.findAuxiliaryFile(CSharpGenerator.RUNTIME_FILE).getContent());
            assertThat(first.getSourceText()).isEqualTo(second.getSourceText());
        }
    }
}
