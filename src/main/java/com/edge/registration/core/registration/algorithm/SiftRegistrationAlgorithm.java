package com.edge.registration.core.registration.algorithm;

import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.Feature2D;
import org.opencv.features2d.SIFT;

/**
 * SIFT 配准：精度高，速度较慢
 * <p>
 * SIFT 描述子为 CV_32F，使用 FLANN 匹配
 */
public class SiftRegistrationAlgorithm extends FeatureRegistrationAlgorithm {
    private static final int OCTAVE_LAYERS = 3;
    private static final double CONTRAST_THRESHOLD = 0.04;
    private static final double EDGE_THRESHOLD = 10;
    private static final double SIGMA = 1.6;

    // 0 表示保留全部特征
    private final int maxFeatures;

    public SiftRegistrationAlgorithm() {
        this(0);
    }

    public SiftRegistrationAlgorithm(int maxFeatures) {
        super();
        this.maxFeatures = maxFeatures;
    }

    public SiftRegistrationAlgorithm(int maxFeatures, double ratioThreshold, double ransacThreshold,
                                     int minMatchCount, int maxProcessWidth) {
        super(ratioThreshold, ransacThreshold, minMatchCount, maxProcessWidth);
        this.maxFeatures = maxFeatures;
    }

    @Override
    protected Feature2D createDetector() {
        return SIFT.create(Math.max(0, maxFeatures), OCTAVE_LAYERS, CONTRAST_THRESHOLD, EDGE_THRESHOLD, SIGMA);
    }

    @Override
    protected DescriptorMatcher createMatcher() {
        return DescriptorMatcher.create(DescriptorMatcher.FLANNBASED);
    }

    @Override
    public String getName() {
        return "SIFT";
    }

    public int getMaxFeatures() { return maxFeatures; }
}
