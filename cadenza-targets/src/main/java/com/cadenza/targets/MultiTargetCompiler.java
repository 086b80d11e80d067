package com.cadenza.targets;

import com.cadenza.compiler.analysis.AnalyzedProgram;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 多目标编译编排器
 * <p>各后端读取同一个只读的分析结果，写入各自的子目录；一个目标失败不影响其他目标。</p>
 */
public class MultiTargetCompiler {
    private static final Logger LOG = Logger.getLogger(MultiTargetCompiler.class.getName());

    private final CompilerOptions options;

    public MultiTargetCompiler() {
        this(new CompilerOptions());
    }

    public MultiTargetCompiler(CompilerOptions options) {
        this.options = options != null ? options : new CompilerOptions();
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 为每个目标生成代码并写入 outputDir/&lt;目标目录&gt;/，等待全部完成后汇总
     */
    public MultiTargetResult compileToTargets(AnalyzedProgram program, Set<TargetPlatform> targets, Path outputDir) {
        Map<TargetPlatform, CompilationOutcome> results = new EnumMap<TargetPlatform, CompilationOutcome>(TargetPlatform.class);
        if (targets.isEmpty()) {
            return new MultiTargetResult(results);
        }
        LOG.fine("开始多目标编译: " + targets + " -> " + outputDir);
        long start = System.nanoTime();

        if (options.isParallel() && targets.size() > 1) {
            compileInPool(program, targets, outputDir, results);
        } else if (options.getTimeoutMillis() > 0) {
            // 串行也要受超时约束：每个目标独占一个线程，各自计时
            for (TargetPlatform target : targets) {
                Map<TargetPlatform, Path> single = new EnumMap<TargetPlatform, Path>(TargetPlatform.class);
                single.put(target, outputDir.resolve(target.getDirectoryName()));
                runInPool(program, single, 1, results);
            }
        } else {
            for (TargetPlatform target : targets) {
                results.put(target, compileOne(program, target, outputDir.resolve(target.getDirectoryName()),
                        new AtomicBoolean()));
            }
        }

        MultiTargetResult result = new MultiTargetResult(results);
        LOG.fine("多目标编译完成: " + result.getSuccessCount() + "/" + result.getTotalCount() + " 成功，耗时 "
                + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) + "ms");
        return result;
    }

    /**
     * 单目标：直接写入 outputPath
     */
    public CompilationOutcome compileToTarget(AnalyzedProgram program, TargetPlatform target, Path outputPath) {
        if (options.getTimeoutMillis() <= 0) {
            return compileOne(program, target, outputPath, new AtomicBoolean());
        }
        Map<TargetPlatform, Path> single = new EnumMap<TargetPlatform, Path>(TargetPlatform.class);
        single.put(target, outputPath);
        Map<TargetPlatform, CompilationOutcome> results = new EnumMap<TargetPlatform, CompilationOutcome>(TargetPlatform.class);
        runInPool(program, single, 1, results);
        return results.get(target);
    }

    private void compileInPool(AnalyzedProgram program, Set<TargetPlatform> targets, Path outputDir,
                               Map<TargetPlatform, CompilationOutcome> results) {
        Map<TargetPlatform, Path> dirs = new EnumMap<TargetPlatform, Path>(TargetPlatform.class);
        for (TargetPlatform target : targets) {
            dirs.put(target, outputDir.resolve(target.getDirectoryName()));
        }
        int threads = Math.min(targets.size(), Math.max(1, Runtime.getRuntime().availableProcessors()));
        runInPool(program, dirs, threads, results);
    }

    /**
     * 在守护线程池中运行，所有目标共享同一个截止时间
     */
    private void runInPool(final AnalyzedProgram program, Map<TargetPlatform, Path> dirs, int threads,
                           Map<TargetPlatform, CompilationOutcome> results) {
        final AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, new ThreadFactory() {
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "cadenza-target-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        Map<TargetPlatform, Future<CompilationOutcome>> futures = new LinkedHashMap<TargetPlatform, Future<CompilationOutcome>>();
        Map<TargetPlatform, AtomicBoolean> cancelled = new EnumMap<TargetPlatform, AtomicBoolean>(TargetPlatform.class);
        try {
            for (Map.Entry<TargetPlatform, Path> e : dirs.entrySet()) {
                final TargetPlatform target = e.getKey();
                final Path dir = e.getValue();
                final AtomicBoolean flag = new AtomicBoolean();
                cancelled.put(target, flag);
                futures.put(target, pool.submit(new Callable<CompilationOutcome>() {
                    @Override
                    public CompilationOutcome call() {
                        return compileOne(program, target, dir, flag);
                    }
                }));
            }
            long timeout = options.getTimeoutMillis();
            long deadline = System.currentTimeMillis() + timeout;
            for (Map.Entry<TargetPlatform, Future<CompilationOutcome>> e : futures.entrySet()) {
                TargetPlatform target = e.getKey();
                results.put(target, await(target, dirs.get(target), e.getValue(), cancelled.get(target),
                        timeout, deadline));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private CompilationOutcome await(TargetPlatform target, Path dir, Future<CompilationOutcome> future,
                                     AtomicBoolean cancelled, long timeout, long deadline) {
        try {
            if (timeout <= 0) {
                return future.get();
            }
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancelled.set(true);
            future.cancel(true);
            LOG.log(Level.WARNING, "目标 " + target.getDisplayName() + " 超时 (" + timeout + "ms)", e);
            return CompilationOutcome.failure(target, dir, "Timed out after " + timeout + "ms", e, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.log(Level.WARNING, "目标 " + target.getDisplayName() + " 执行失败", cause);
            return CompilationOutcome.failure(target, dir, cause.getMessage(), cause, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            future.cancel(true);
            LOG.log(Level.WARNING, "等待目标 " + target.getDisplayName() + " 时被中断", e);
            return CompilationOutcome.failure(target, dir, "Interrupted", e, 0);
        }
    }

    /**
     * 生成并写出一个目标；cancelled 置位后不再写任何文件
     */
    private CompilationOutcome compileOne(AnalyzedProgram program, TargetPlatform target, Path dir,
                                          AtomicBoolean cancelled) {
        long start = System.nanoTime();
        LOG.fine("开始生成 " + target.getDisplayName() + " -> " + dir);
        try {
            TargetGenerator generator = TargetRegistry.get(target);
            TargetGenerationResult generated = generator.generate(program, options.getConfiguration());
            if (isCancelled(cancelled)) {
                LOG.fine(target.getDisplayName() + " 已取消，丢弃生成结果");
                return CompilationOutcome.failure(target, dir, "Cancelled", null, elapsedSince(start));
            }
            List<Path> written = write(dir, target, generated, cancelled);
            long elapsed = elapsedSince(start);
            LOG.fine(target.getDisplayName() + " 生成完成: " + written.size() + " 个文件，耗时 " + elapsed + "ms");
            return CompilationOutcome.success(target, dir, written, generated, elapsed);
        } catch (Throwable e) {
            // 内存耗尽等虚拟机错误照常抛出；栈溢出只算这个目标失败
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw (VirtualMachineError) e;
            }
            LOG.log(Level.WARNING, "目标 " + target.getDisplayName() + " 生成失败: " + e.getMessage(), e);
            return CompilationOutcome.failure(target, dir, e.getMessage(), e, elapsedSince(start));
        }
    }

    private static boolean isCancelled(AtomicBoolean cancelled) {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    private static long elapsedSince(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    private static List<Path> write(Path dir, TargetPlatform target, TargetGenerationResult generated,
                                    AtomicBoolean cancelled) {
        List<Path> written = new ArrayList<Path>();
        try {
            Files.createDirectories(dir);
            Path primary = dir.resolve(target.getPrimaryFileName());
            Files.write(primary, generated.getSourceText().getBytes(StandardCharsets.UTF_8));
            written.add(primary);
            for (AuxiliaryFile file : generated.getAuxiliaryFiles()) {
                if (isCancelled(cancelled)) {
                    break;
                }
                Path path = dir.resolve(file.getName());
                Files.write(path, file.getContent().getBytes(StandardCharsets.UTF_8));
                written.add(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target.getDisplayName() + " output to " + dir, e);
        }
        return written;
    }
}
