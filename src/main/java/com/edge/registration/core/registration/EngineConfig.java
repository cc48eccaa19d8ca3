package com.edge.registration.core.registration;

import java.util.Objects;

/**
 * 配准引擎的验收策略
 * <p>
 * 结果必须同时满足 score >= minScore 且 inlierRatio >= minInlierRatio 才会被直接接受；
 * enableFallback 决定在没有结果过关时是否返回得分最高的候选
 */
public final class EngineConfig {
    public static final double DEFAULT_MIN_SCORE = 0.85;
    public static final double DEFAULT_MIN_INLIER_RATIO = 0.60;
    public static final boolean DEFAULT_ENABLE_FALLBACK = true;

    private static final EngineConfig DEFAULTS =
        new EngineConfig(DEFAULT_MIN_SCORE, DEFAULT_MIN_INLIER_RATIO, DEFAULT_ENABLE_FALLBACK);

    private final double minScore;
    private final double minInlierRatio;
    private final boolean enableFallback;

    public EngineConfig(double minScore, double minInlierRatio, boolean enableFallback) {
        if (!RegistrationResult.inUnitRange(minScore)) {
            throw new ValidationException("min_score must be in [0.0, 1.0], got " + minScore);
        }
        if (!RegistrationResult.inUnitRange(minInlierRatio)) {
            throw new ValidationException("min_inlier_ratio must be in [0.0, 1.0], got " + minInlierRatio);
        }
        this.minScore = minScore;
        this.minInlierRatio = minInlierRatio;
        this.enableFallback = enableFallback;
    }

    public static EngineConfig defaults() {
        return DEFAULTS;
    }

    public EngineConfig withMinScore(double minScore) {
        return new EngineConfig(minScore, minInlierRatio, enableFallback);
    }

    public EngineConfig withMinInlierRatio(double minInlierRatio) {
        return new EngineConfig(minScore, minInlierRatio, enableFallback);
    }

    public EngineConfig withEnableFallback(boolean enableFallback) {
        return new EngineConfig(minScore, minInlierRatio, enableFallback);
    }

    public double getMinScore() { return minScore; }

    public double getMinInlierRatio() { return minInlierRatio; }

    public boolean isEnableFallback() { return enableFallback; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EngineConfig)) return false;
        EngineConfig that = (EngineConfig) o;
        return Double.compare(that.minScore, minScore) == 0
            && Double.compare(that.minInlierRatio, minInlierRatio) == 0
            && enableFallback == that.enableFallback;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minScore, minInlierRatio, enableFallback);
    }

    @Override
    public String toString() {
        return String.format("EngineConfig[minScore=%.3f, minInlierRatio=%.3f, enableFallback=%s]",
            minScore, minInlierRatio, enableFallback);
    }
}
