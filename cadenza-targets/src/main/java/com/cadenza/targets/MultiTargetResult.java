package com.cadenza.targets;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 多目标编译的汇总结果，按目标平台顺序排列
 */
public final class MultiTargetResult {
    private final Map<TargetPlatform, CompilationOutcome> results;

    public MultiTargetResult(Map<TargetPlatform, CompilationOutcome> results) {
        EnumMap<TargetPlatform, CompilationOutcome> copy = new EnumMap<TargetPlatform, CompilationOutcome>(TargetPlatform.class);
        copy.putAll(results);
        this.results = Collections.unmodifiableMap(copy);
    }

    public Map<TargetPlatform, CompilationOutcome> getResults() {
        return results;
    }

    /**
     * @return 未请求该目标时返回 null
     */
    public CompilationOutcome getOutcome(TargetPlatform target) {
        return results.get(target);
    }

    /** 所有请求的目标都成功（没有请求任何目标时也为 true） */
    public boolean isOverallSuccess() {
        return getSuccessCount() == getTotalCount();
    }

    public int getSuccessCount() {
        int count = 0;
        for (CompilationOutcome outcome : results.values()) {
            if (outcome.isSuccess()) count++;
        }
        return count;
    }

    public int getTotalCount() {
        return results.size();
    }

    public Set<TargetPlatform> getSuccessfulTargets() {
        Set<TargetPlatform> targets = EnumSet.noneOf(TargetPlatform.class);
        for (CompilationOutcome outcome : results.values()) {
            if (outcome.isSuccess()) targets.add(outcome.getTarget());
        }
        return targets;
    }

    public Set<TargetPlatform> getFailedTargets() {
        Set<TargetPlatform> targets = EnumSet.noneOf(TargetPlatform.class);
        for (CompilationOutcome outcome : results.values()) {
            if (!outcome.isSuccess()) targets.add(outcome.getTarget());
        }
        return targets;
    }

    @Override
    public String toString() {
        return "MultiTargetResult{" + getSuccessCount() + "/" + getTotalCount() + " succeeded, results=" + results.values() + "}";
    }
}
