package com.cadenza.targets.java;

import com.cadenza.compiler.FrontEnd;
import com.cadenza.targets.AuxiliaryFile;
import com.cadenza.targets.TargetConfiguration;
import com.cadenza.targets.TargetGenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("Java 后端")
class JavaGeneratorTest {

    private final JavaGenerator generator = new JavaGenerator();

    private TargetGenerationResult generate(String source) {
        return generator.generate(FrontEnd.analyze(source, "test.cdz"), new TargetConfiguration());
    }

    private static final String PROGRAM = "function check(n: int) -> Result<int, string> {\n"
            + "  guard n >= 0 else { return Error(\"neg\") }\n"
            + "  return Ok(n)\n"
            + "}\n"
            + "function g(fail: bool) -> Result<int, string> {\n"
            + "  if fail { return Error(\"boom\") }\n"
            + "  return Ok(21)\n"
            + "}\n"
            + "function f(fail: bool) -> Result<int, string> {\n"
            + "  let x = g(fail)?\n"
            + "  return Ok(x * 2)\n"
            + "}\n"
            + "function unwrap(r: Result<int, string>) -> int {\n"
            + "  return match r { Ok(v) -> v  Error(e) -> 0 }\n"
            + "}\n"
            + "function label(n: int) -> string {\n"
            + "  let s = match n { 1 -> \"one\", _ -> \"many\" }\n"
            + "  return $\"{n} is {s}\"\n"
            + "}\n"
            + "module Text {\n"
            + "  function shout(s: string) -> string { return $\"{s}!\" }\n"
            + "}\n";

    @Nested
    @DisplayName("源码结构")
    class SourceTests {

        @Test
        @DisplayName("单个 CadenzaProgram 类，模块为静态嵌套类")
        void testLayout() {
            String java = generate(PROGRAM).getSourceText();
            assertThat(java).contains("package cadenza.generated;");
            assertThat(java).contains("public final class CadenzaProgram {");
            assertThat(java).contains("public static Result<Integer, String> check(int n) {");
            assertThat(java).contains("if (!(n >= 0)) {");
            assertThat(java).contains("public static final class Text {");
            assertThat(java).contains("* @param n Parameter of type int");
            assertThat(java).contains("* @return Returns Result&lt;int, string&gt;");
        }

        @Test
        @DisplayName("包名可配置，运行命令随之变化")
        void testPackageOption() {
            TargetConfiguration config = new TargetConfiguration().setOption("java.package", "com.example.app");
            TargetGenerationResult result = generator.generate(FrontEnd.analyze("function main() { }", "t"), config);
            assertThat(result.getSourceText()).contains("package com.example.app;");
            assertThat(result.getSourceText()).contains("public static void main(String[] args) {");
            assertThat(result.getBuildInstructions())
                    .containsEntry("run", "java -cp target/classes com.example.app.CadenzaProgram");
            AuxiliaryFile runtime = result.findAuxiliaryFile(JavaGenerator.RUNTIME_FILE);
            assertThat(runtime.getContent()).contains("package com.example.app;");
        }

        @Test
        @DisplayName("不支持的副作用留下占位注释")
        void testUnsupportedEffectPlaceholder() {
            String java = generate("function pay(amount: int) uses [Payment, Logging] { }").getSourceText();
            assertThat(java).contains("/* cadenza: effect Payment not supported on Java */");
            assertThat(java).contains("CadenzaRuntime.trackEffects(\"pay\", \"Logging\");");
        }
    }

    @Nested
    @DisplayName("编译运行生成的代码")
    class RuntimeTests {

        @TempDir
        Path dir;

        private ClassLoader compile(TargetGenerationResult result) throws Exception {
            JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
            assumeTrue(compiler != null, "需要 JDK 编译器");

            Path sources = Files.createDirectories(dir.resolve("src"));
            Path classes = Files.createDirectories(dir.resolve("classes"));
            Path program = sources.resolve("CadenzaProgram.java");
            Path runtime = sources.resolve(JavaGenerator.RUNTIME_FILE);
            Files.write(program, result.getSourceText().getBytes(StandardCharsets.UTF_8));
            Files.write(runtime, result.findAuxiliaryFile(JavaGenerator.RUNTIME_FILE).getContent()
                    .getBytes(StandardCharsets.UTF_8));

            ByteArrayOutputStream errors = new ByteArrayOutputStream();
            int status = compiler.run(null, null, errors, "-d", classes.toString(), "-encoding", "UTF-8",
                    program.toString(), runtime.toString());
            assertThat(status).as(errors.toString("UTF-8")).isZero();
            return new URLClassLoader(new URL[]{classes.toUri().toURL()}, getClass().getClassLoader());
        }

        @Test
        @DisplayName("guard 只在条件不满足时返回错误")
        void testGuardBehaviour() throws Exception {
            Class<?> cls = compile(generate(PROGRAM)).loadClass("cadenza.generated.CadenzaProgram");
            Method check = cls.getMethod("check", int.class);
            assertThat(check.invoke(null, -1).toString()).isEqualTo("Error(neg)");
            assertThat(check.invoke(null, 0).toString()).isEqualTo("Ok(0)");
            assertThat(check.invoke(null, 5).toString()).isEqualTo("Ok(5)");
        }

        @Test
        @DisplayName("? 原样返回被调用方的错误")
        void testPropagationBehaviour() throws Exception {
            Class<?> cls = compile(generate(PROGRAM)).loadClass("cadenza.generated.CadenzaProgram");
            Method f = cls.getMethod("f", boolean.class);
            assertThat(f.invoke(null, true).toString()).isEqualTo("Error(boom)");
            assertThat(f.invoke(null, false).toString()).isEqualTo("Ok(42)");
        }

        @Test
        @DisplayName("match 与字符串插值")
        void testMatchAndInterpolation() throws Exception {
            Class<?> cls = compile(generate(PROGRAM)).loadClass("cadenza.generated.CadenzaProgram");
            Method f = cls.getMethod("f", boolean.class);
            Method unwrap = cls.getMethod("unwrap", f.getReturnType());
            assertThat(unwrap.invoke(null, f.invoke(null, false))).isEqualTo(42);
            assertThat(unwrap.invoke(null, f.invoke(null, true))).isEqualTo(0);

            Method label = cls.getMethod("label", int.class);
            assertThat(label.invoke(null, 1)).isEqualTo("1 is one");
            assertThat(label.invoke(null, 7)).isEqualTo("7 is many");

            Class<?> text = cls.getClassLoader().loadClass("cadenza.generated.CadenzaProgram$Text");
            assertThat(text.getMethod("shout", String.class).invoke(null, "hey")).isEqualTo("hey!");
        }
    }
}
