package com.cadenza.targets;

import com.cadenza.compiler.CadenzaException;
import com.cadenza.compiler.FrontEnd;
import com.cadenza.compiler.analysis.AnalyzedProgram;
import com.cadenza.targets.java.JavaGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MultiTargetCompiler 测试")
class MultiTargetCompilerTest {

    private static final String SOURCE = "function add(a: int, b: int) -> int { return a + b }\n"
            + "function main() { let x = add(1, 2) }\n";

    @TempDir
    Path out;

    @AfterEach
    void restoreRegistry() {
        TargetRegistry.reset();
    }

    private static AnalyzedProgram program() {
        return FrontEnd.analyze(SOURCE, "main.cdz");
    }

    private static String read(Path file) throws Exception {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    /** 总是失败的生成器 */
    static class FailingGenerator implements TargetGenerator {
        @Override
        public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
            throw new GenerationException(TargetPlatform.JAVA, "backend exploded");
        }

        @Override
        public String targetName() {
            return "Java";
        }

        @Override
        public List<String> supportedFeatures() {
            return Collections.emptyList();
        }

        @Override
        public TargetCapabilities capabilities() {
            return new JavaGenerator().capabilities();
        }
    }

    /** 长时间阻塞的生成器，被取消时返回 */
    static class SlowGenerator extends FailingGenerator {
        @Override
        public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new JavaGenerator().generate(program, config);
        }
    }

    /** 栈溢出的生成器 */
    static class OverflowGenerator extends FailingGenerator {
        @Override
        public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
            throw new StackOverflowError("deep AST");
        }
    }

    /** 忽略中断、跑满固定时长才返回的生成器 */
    static class StubbornGenerator extends FailingGenerator {
        final CountDownLatch finished = new CountDownLatch(1);

        @Override
        public TargetGenerationResult generate(AnalyzedProgram program, TargetConfiguration config) {
            long end = System.currentTimeMillis() + 1200;
            long remaining;
            while ((remaining = end - System.currentTimeMillis()) > 0) {
                try {
                    Thread.sleep(remaining);
                } catch (InterruptedException e) {
                    // 清掉中断标志，继续睡
                    Thread.interrupted();
                }
            }
            TargetGenerationResult result = new JavaGenerator().generate(program, config);
            finished.countDown();
            return result;
        }
    }

    @Nested
    @DisplayName("多目标")
    class MultiTargetTests {

        @Test
        @DisplayName("所有目标成功，各自写入子目录")
        void testAllTargets() throws Exception {
            MultiTargetResult result = new MultiTargetCompiler()
                    .compileToTargets(program(), EnumSet.allOf(TargetPlatform.class), out);

            assertThat(result.isOverallSuccess()).isTrue();
            assertThat(result.getTotalCount()).isEqualTo(5);
            for (TargetPlatform target : TargetPlatform.values()) {
                CompilationOutcome outcome = result.getOutcome(target);
                assertThat(outcome.isSuccess()).as(target.getDisplayName()).isTrue();
                assertThat(outcome.getOutputDirectory()).isEqualTo(out.resolve(target.getDirectoryName()));
                Path primary = out.resolve(target.getDirectoryName()).resolve(target.getPrimaryFileName());
                assertThat(outcome.getWrittenFiles().get(0)).isEqualTo(primary);
                assertThat(primary).exists();
                assertThat(read(primary)).isEqualTo(outcome.getGenerationResult().getSourceText());
                for (AuxiliaryFile file : outcome.getGenerationResult().getAuxiliaryFiles()) {
                    assertThat(out.resolve(target.getDirectoryName()).resolve(file.getName())).exists();
                }
            }
            assertThat(out.resolve("csharp").resolve("Program.csproj")).exists();
            assertThat(out.resolve("wasm").resolve("loader.js")).exists();
        }

        @Test
        @DisplayName("一个目标失败不影响其他目标")
        void testFailureIsolation() {
            TargetRegistry.register(TargetPlatform.JAVA, new FailingGenerator());
            MultiTargetResult result = new MultiTargetCompiler().compileToTargets(program(),
                    EnumSet.of(TargetPlatform.CSHARP, TargetPlatform.JAVA, TargetPlatform.JAVASCRIPT), out);

            assertThat(result.isOverallSuccess()).isFalse();
            assertThat(result.getSuccessCount()).isEqualTo(2);
            assertThat(result.getFailedTargets()).containsExactly(TargetPlatform.JAVA);
            assertThat(result.getSuccessfulTargets()).containsExactly(TargetPlatform.CSHARP, TargetPlatform.JAVASCRIPT);

            CompilationOutcome failed = result.getOutcome(TargetPlatform.JAVA);
            assertThat(failed.getErrorMessage()).contains("backend exploded");
            assertThat(failed.getError()).isInstanceOf(GenerationException.class);
            assertThat(failed.getWrittenFiles()).isEmpty();
            assertThat(out.resolve("javascript").resolve("program.js")).exists();
        }

        @Test
        @DisplayName("并行与串行结果一致")
        void testParallelMatchesSequential() throws Exception {
            Path parallelDir = out.resolve("parallel");
            Path sequentialDir = out.resolve("sequential");
            new MultiTargetCompiler(new CompilerOptions().setParallel(true))
                    .compileToTargets(program(), EnumSet.allOf(TargetPlatform.class), parallelDir);
            new MultiTargetCompiler(new CompilerOptions().setParallel(false))
                    .compileToTargets(program(), EnumSet.allOf(TargetPlatform.class), sequentialDir);

            for (TargetPlatform target : TargetPlatform.values()) {
                String name = target.getPrimaryFileName();
                assertThat(read(parallelDir.resolve(target.getDirectoryName()).resolve(name)))
                        .isEqualTo(read(sequentialDir.resolve(target.getDirectoryName()).resolve(name)));
            }
        }

        @Test
        @DisplayName("超时的目标记为失败，其余目标照常完成")
        void testTimeout() {
            TargetRegistry.register(TargetPlatform.JAVA, new SlowGenerator());
            CompilerOptions options = new CompilerOptions().setParallel(true).setTimeoutMillis(1000);
            MultiTargetResult result = new MultiTargetCompiler(options).compileToTargets(program(),
                    EnumSet.of(TargetPlatform.JAVA, TargetPlatform.JAVASCRIPT), out);

            CompilationOutcome slow = result.getOutcome(TargetPlatform.JAVA);
            assertThat(slow.isSuccess()).isFalse();
            assertThat(slow.getErrorMessage()).isEqualTo("Timed out after 1000ms");
            assertThat(result.getOutcome(TargetPlatform.JAVASCRIPT).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("串行模式下栈溢出只让该目标失败")
        void testSequentialErrorIsolation() {
            TargetRegistry.register(TargetPlatform.JAVA, new OverflowGenerator());
            MultiTargetResult result = new MultiTargetCompiler(new CompilerOptions().setParallel(false))
                    .compileToTargets(program(), EnumSet.of(TargetPlatform.JAVA, TargetPlatform.JAVASCRIPT), out);

            CompilationOutcome failed = result.getOutcome(TargetPlatform.JAVA);
            assertThat(failed.isSuccess()).isFalse();
            assertThat(failed.getError()).isInstanceOf(StackOverflowError.class);
            assertThat(failed.getErrorMessage()).isEqualTo("deep AST");
            assertThat(result.getOutcome(TargetPlatform.JAVASCRIPT).isSuccess()).isTrue();
            assertThat(out.resolve("javascript").resolve("program.js")).exists();
        }

        @Test
        @DisplayName("串行模式同样受超时约束")
        void testSequentialTimeout() {
            TargetRegistry.register(TargetPlatform.JAVA, new SlowGenerator());
            CompilerOptions options = new CompilerOptions().setParallel(false).setTimeoutMillis(300);
            long start = System.currentTimeMillis();
            MultiTargetResult result = new MultiTargetCompiler(options).compileToTargets(program(),
                    EnumSet.of(TargetPlatform.JAVA, TargetPlatform.JAVASCRIPT), out);

            assertThat(System.currentTimeMillis() - start).isLessThan(5000);
            assertThat(result.getOutcome(TargetPlatform.JAVA).getErrorMessage()).isEqualTo("Timed out after 300ms");
            assertThat(result.getOutcome(TargetPlatform.JAVASCRIPT).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("只有一个目标时并行模式也受超时约束")
        void testSingleTargetSetTimeout() {
            TargetRegistry.register(TargetPlatform.JAVA, new SlowGenerator());
            CompilerOptions options = new CompilerOptions().setParallel(true).setTimeoutMillis(300);
            MultiTargetResult result = new MultiTargetCompiler(options)
                    .compileToTargets(program(), EnumSet.of(TargetPlatform.JAVA), out);

            assertThat(result.isOverallSuccess()).isFalse();
            assertThat(result.getOutcome(TargetPlatform.JAVA).getErrorMessage()).isEqualTo("Timed out after 300ms");
        }

        @Test
        @DisplayName("超时后忽略中断的生成器不再写出文件")
        void testNoWriteAfterTimeout() throws Exception {
            StubbornGenerator stubborn = new StubbornGenerator();
            TargetRegistry.register(TargetPlatform.JAVA, stubborn);
            CompilerOptions options = new CompilerOptions().setParallel(true).setTimeoutMillis(200);
            MultiTargetResult result = new MultiTargetCompiler(options)
                    .compileToTargets(program(), EnumSet.of(TargetPlatform.JAVA, TargetPlatform.JAVASCRIPT), out);

            assertThat(result.getOutcome(TargetPlatform.JAVA).isSuccess()).isFalse();
            assertThat(stubborn.finished.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(300);
            assertThat(out.resolve("java")).doesNotExist();
            assertThat(out.resolve("javascript").resolve("program.js")).exists();
        }

        @Test
        @DisplayName("空目标集合视为成功")
        void testEmptyTargets() {
            MultiTargetResult result = new MultiTargetCompiler()
                    .compileToTargets(program(), EnumSet.noneOf(TargetPlatform.class), out);
            assertThat(result.isOverallSuccess()).isTrue();
            assertThat(result.getTotalCount()).isZero();
        }

        @Test
        @DisplayName("负数超时被拒绝")
        void testNegativeTimeout() {
            assertThatThrownBy(() -> new CompilerOptions().setTimeoutMillis(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("单目标")
    class SingleTargetTests {

        @Test
        @DisplayName("直接写入指定目录，不再创建子目录")
        void testCompileToTarget() {
            Path dir = out.resolve("js-out");
            CompilationOutcome outcome = new MultiTargetCompiler()
                    .compileToTarget(program(), TargetPlatform.JAVASCRIPT, dir);
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(dir.resolve("program.js")).exists();
            assertThat(dir.resolve("package.json")).exists();
            assertThat(dir.resolve("javascript")).doesNotExist();
        }

        @Test
        @DisplayName("单目标编译也受超时约束")
        void testCompileToTargetTimeout() {
            TargetRegistry.register(TargetPlatform.JAVA, new SlowGenerator());
            CompilationOutcome outcome = new MultiTargetCompiler(new CompilerOptions().setTimeoutMillis(300))
                    .compileToTarget(program(), TargetPlatform.JAVA, out.resolve("java-out"));
            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getErrorMessage()).isEqualTo("Timed out after 300ms");
        }
    }

    @Nested
    @DisplayName("CadenzaCompiler 入口")
    class FacadeTests {

        @Test
        @DisplayName("语法错误时抛出且不产生任何输出")
        void testParseErrorWritesNothing() {
            Path dir = out.resolve("broken");
            CadenzaCompiler compiler = new CadenzaCompiler();
            assertThatThrownBy(() -> compiler.compileAll("function ( {", dir))
                    .isInstanceOf(CadenzaException.class);
            assertThat(dir).doesNotExist();
        }

        @Test
        @DisplayName("源文件名出现在生成代码中")
        void testCompileFile() throws Exception {
            Path source = out.resolve("orders.cdz");
            Files.write(source, SOURCE.getBytes(StandardCharsets.UTF_8));
            MultiTargetResult result = new CadenzaCompiler(new CompilerOptions().setParallel(false))
                    .compileFile(source, EnumSet.of(TargetPlatform.JAVASCRIPT), out.resolve("build"));
            assertThat(result.isOverallSuccess()).isTrue();
            assertThat(read(out.resolve("build").resolve("javascript").resolve("program.js")))
                    .startsWith("// Generated by the Cadenza compiler from orders.cdz");
        }

        @Test
        @DisplayName("单目标编译")
        void testSingleTarget() {
            CompilationOutcome outcome = new CadenzaCompiler()
                    .compile(SOURCE, TargetPlatform.NATIVE, out.resolve("native"));
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getTarget()).isEqualTo(TargetPlatform.NATIVE);
            assertThat(out.resolve("native").resolve("CMakeLists.txt")).exists();
        }
    }
}
