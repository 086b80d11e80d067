package com.cadenza.targets;

import com.cadenza.compiler.ast.Effect;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 目标平台能力矩阵，副作用列表是封闭副作用词汇表的子集
 */
public final class TargetCapabilities {
    private final boolean async;
    private final boolean parallelism;
    private final boolean garbageCollection;
    private final boolean reflection;
    private final boolean exceptions;
    private final Set<Effect> supportedEffects;

    public TargetCapabilities(boolean async, boolean parallelism, boolean garbageCollection,
                              boolean reflection, boolean exceptions, Set<Effect> supportedEffects) {
        this.async = async;
        this.parallelism = parallelism;
        this.garbageCollection = garbageCollection;
        this.reflection = reflection;
        this.exceptions = exceptions;
        this.supportedEffects = supportedEffects.isEmpty()
                ? Collections.<Effect>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(supportedEffects));
    }

    public boolean supportsAsync() {
        return async;
    }

    public boolean supportsParallelism() {
        return parallelism;
    }

    public boolean supportsGarbageCollection() {
        return garbageCollection;
    }

    public boolean supportsReflection() {
        return reflection;
    }

    public boolean supportsExceptions() {
        return exceptions;
    }

    public Set<Effect> getSupportedEffects() {
        return supportedEffects;
    }

    /**
     * 副作用能否在该平台上表达：必须在支持列表中，异步类副作用还要求平台支持异步
     */
    public boolean supportsEffect(Effect effect) {
        if (!supportedEffects.contains(effect)) {
            return false;
        }
        return !effect.isAsync() || async;
    }

    @Override
    public String toString() {
        return "TargetCapabilities{async=" + async + ", parallelism=" + parallelism
                + ", gc=" + garbageCollection + ", reflection=" + reflection
                + ", exceptions=" + exceptions + ", effects=" + Effect.join(supportedEffects) + "}";
    }
}
