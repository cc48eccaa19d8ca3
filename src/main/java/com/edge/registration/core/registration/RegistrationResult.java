package com.edge.registration.core.registration;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 单次算法配准结果
 * <p>
 * 不可变值对象：
 * - score: 整体对齐置信度 [0, 1]
 * - inlierRatio: 与估计变换一致的匹配占比 [0, 1]
 * - homography: 源图到参考图的 3x3 单应矩阵，引擎不解析，只透传
 * - matchesCount: 内点过滤前的原始匹配数
 * - metadata: 算法自定义数据，原样透传
 */
public final class RegistrationResult {
    private final double score;
    private final double inlierRatio;
    private final double[][] homography;
    private final int matchesCount;
    private final Map<String, Object> metadata;

    public RegistrationResult(double score, double inlierRatio, double[][] homography, int matchesCount) {
        this(score, inlierRatio, homography, matchesCount, null);
    }

    public RegistrationResult(double score,
                              double inlierRatio,
                              double[][] homography,
                              int matchesCount,
                              Map<String, Object> metadata) {
        if (!inUnitRange(score)) {
            throw new ValidationException("Score must be in [0.0, 1.0], got " + score);
        }
        if (!inUnitRange(inlierRatio)) {
            throw new ValidationException("Inlier ratio must be in [0.0, 1.0], got " + inlierRatio);
        }
        if (matchesCount < 0) {
            throw new ValidationException("Matches count must be >= 0, got " + matchesCount);
        }
        this.score = score;
        this.inlierRatio = inlierRatio;
        this.homography = copy(homography);
        this.matchesCount = matchesCount;
        this.metadata = metadata == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static boolean inUnitRange(double value) {
        // NaN 也视为越界
        return value >= 0.0 && value <= 1.0;
    }

    private static double[][] copy(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i] == null ? null : matrix[i].clone();
        }
        return copy;
    }

    public double getScore() { return score; }

    public double getInlierRatio() { return inlierRatio; }

    /**
     * 获取单应矩阵副本，可能为 null
     */
    public double[][] getHomography() { return copy(homography); }

    public int getMatchesCount() { return matchesCount; }

    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegistrationResult)) return false;
        RegistrationResult that = (RegistrationResult) o;
        return Double.compare(that.score, score) == 0
            && Double.compare(that.inlierRatio, inlierRatio) == 0
            && matchesCount == that.matchesCount
            && Arrays.deepEquals(homography, that.homography)
            && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(score, inlierRatio, matchesCount, metadata);
        return 31 * result + Arrays.deepHashCode(homography);
    }

    @Override
    public String toString() {
        return String.format("RegistrationResult[score=%.3f, inlierRatio=%.3f, matches=%d, metadata=%s]",
            score, inlierRatio, matchesCount, metadata);
    }
}
