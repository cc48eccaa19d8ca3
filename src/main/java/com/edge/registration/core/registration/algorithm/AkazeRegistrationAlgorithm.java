package com.edge.registration.core.registration.algorithm;

import org.opencv.core.Core;
import org.opencv.features2d.AKAZE;
import org.opencv.features2d.BFMatcher;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.Feature2D;

/**
 * AKAZE 配准：非线性尺度空间，对模糊和噪声较稳健
 */
public class AkazeRegistrationAlgorithm extends FeatureRegistrationAlgorithm {

    public AkazeRegistrationAlgorithm() {
        super();
    }

    public AkazeRegistrationAlgorithm(double ratioThreshold, double ransacThreshold,
                                      int minMatchCount, int maxProcessWidth) {
        super(ratioThreshold, ransacThreshold, minMatchCount, maxProcessWidth);
    }

    @Override
    protected Feature2D createDetector() {
        return AKAZE.create();
    }

    @Override
    protected DescriptorMatcher createMatcher() {
        // AKAZE 默认 MLDB 二进制描述子
        return BFMatcher.create(Core.NORM_HAMMING, false);
    }

    @Override
    public String getName() {
        return "AKAZE";
    }
}
