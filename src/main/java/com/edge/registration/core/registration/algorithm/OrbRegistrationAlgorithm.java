package com.edge.registration.core.registration.algorithm;

import org.opencv.core.Core;
import org.opencv.features2d.BFMatcher;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.Feature2D;
import org.opencv.features2d.ORB;

/**
 * ORB 配准：比 SIFT 快，精度略低
 * <p>
 * 二进制描述子，使用汉明距离暴力匹配
 */
public class OrbRegistrationAlgorithm extends FeatureRegistrationAlgorithm {
    public static final int DEFAULT_MAX_FEATURES = 500;

    private final int maxFeatures;

    public OrbRegistrationAlgorithm() {
        this(DEFAULT_MAX_FEATURES);
    }

    public OrbRegistrationAlgorithm(int maxFeatures) {
        super();
        this.maxFeatures = maxFeatures > 0 ? maxFeatures : DEFAULT_MAX_FEATURES;
    }

    public OrbRegistrationAlgorithm(int maxFeatures, double ratioThreshold, double ransacThreshold,
                                    int minMatchCount, int maxProcessWidth) {
        super(ratioThreshold, ransacThreshold, minMatchCount, maxProcessWidth);
        this.maxFeatures = maxFeatures > 0 ? maxFeatures : DEFAULT_MAX_FEATURES;
    }

    @Override
    protected Feature2D createDetector() {
        return ORB.create(maxFeatures);
    }

    @Override
    protected DescriptorMatcher createMatcher() {
        return BFMatcher.create(Core.NORM_HAMMING, false);
    }

    @Override
    public String getName() {
        return "ORB";
    }

    public int getMaxFeatures() { return maxFeatures; }
}
