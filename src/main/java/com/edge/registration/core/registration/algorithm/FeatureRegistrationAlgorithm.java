package com.edge.registration.core.registration.algorithm;

import com.edge.registration.core.registration.RegistrationAlgorithm;
import com.edge.registration.core.registration.RegistrationResult;
import com.edge.registration.util.VisionTool;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.features2d.DescriptorMatcher;
import org.opencv.features2d.Feature2D;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于特征点的配准算法模板
 * <p>
 * 流程：灰度 -> 降采样 -> 特征提取 -> KNN 匹配 + Ratio Test -> RANSAC 单应矩阵 -> 评分。
 * 子类只需提供特征检测器和匹配器
 * <p>
 * 评分 = 0.7 * 内点率 + 0.3 * min(匹配数 / 100, 1)
 */
public abstract class FeatureRegistrationAlgorithm implements RegistrationAlgorithm<Mat> {
    private static final Logger logger = LoggerFactory.getLogger(FeatureRegistrationAlgorithm.class);

    public static final double DEFAULT_RATIO_THRESHOLD = 0.75;
    public static final double DEFAULT_RANSAC_THRESHOLD = 5.0;
    public static final int DEFAULT_MIN_MATCH_COUNT = 4;
    public static final int DEFAULT_MAX_PROCESS_WIDTH = 1280;

    // 单应矩阵至少需要 4 对点
    private static final int MIN_KEYPOINTS = 4;
    private static final double MATCH_COUNT_NORMALIZER = 100.0;
    private static final double INLIER_WEIGHT = 0.7;
    private static final double MATCH_WEIGHT = 0.3;

    private final double ratioThreshold;
    private final double ransacThreshold;
    private final int minMatchCount;
    // <= 0 表示不降采样
    private final int maxProcessWidth;

    // 懒加载，首次使用时初始化
    private Feature2D detector;
    private DescriptorMatcher matcher;

    protected FeatureRegistrationAlgorithm() {
        this(DEFAULT_RATIO_THRESHOLD, DEFAULT_RANSAC_THRESHOLD, DEFAULT_MIN_MATCH_COUNT, DEFAULT_MAX_PROCESS_WIDTH);
    }

    protected FeatureRegistrationAlgorithm(double ratioThreshold, double ransacThreshold,
                                           int minMatchCount, int maxProcessWidth) {
        if (ratioThreshold <= 0 || ratioThreshold > 1) {
            throw new IllegalArgumentException("Ratio threshold must be in (0, 1], got " + ratioThreshold);
        }
        if (ransacThreshold <= 0) {
            throw new IllegalArgumentException("RANSAC threshold must be positive, got " + ransacThreshold);
        }
        this.ratioThreshold = ratioThreshold;
        this.ransacThreshold = ransacThreshold;
        this.minMatchCount = Math.max(MIN_KEYPOINTS, minMatchCount);
        this.maxProcessWidth = maxProcessWidth;
    }

    /**
     * 创建特征检测器
     */
    protected abstract Feature2D createDetector();

    /**
     * 创建描述子匹配器
     */
    protected abstract DescriptorMatcher createMatcher();

    @Override
    public Optional<RegistrationResult> align(Mat source, Mat reference) {
        if (source == null || source.empty() || reference == null || reference.empty()) {
            logger.debug("{}: empty input image", getName());
            return Optional.empty();
        }

        Mat srcGray = null;
        Mat refGray = null;
        MatOfKeyPoint kpSrc = new MatOfKeyPoint();
        MatOfKeyPoint kpRef = new MatOfKeyPoint();
        Mat descSrc = new Mat();
        Mat descRef = new Mat();
        MatOfPoint2f srcPts = null;
        MatOfPoint2f refPts = null;
        Mat inlierMask = new Mat();
        Mat noMask = new Mat();
        Mat h = null;

        try {
            double srcScale = scaleFor(source);
            double refScale = scaleFor(reference);
            srcGray = prepare(source, srcScale);
            refGray = prepare(reference, refScale);

            if (detector == null) detector = createDetector();
            if (matcher == null) matcher = createMatcher();

            detector.detectAndCompute(srcGray, noMask, kpSrc, descSrc);
            detector.detectAndCompute(refGray, noMask, kpRef, descRef);

            int srcKeypoints = kpSrc.rows();
            int refKeypoints = kpRef.rows();
            if (descSrc.empty() || descRef.empty() || srcKeypoints < MIN_KEYPOINTS || refKeypoints < MIN_KEYPOINTS) {
                logger.debug("{}: not enough keypoints (src={}, ref={})", getName(), srcKeypoints, refKeypoints);
                return Optional.empty();
            }

            // KNN 匹配 + Ratio Test
            List<MatOfDMatch> knnMatches = new ArrayList<>();
            matcher.knnMatch(descSrc, descRef, knnMatches, 2);

            List<KeyPoint> kpSrcList = kpSrc.toList();
            List<KeyPoint> kpRefList = kpRef.toList();
            List<Point> srcList = new ArrayList<>();
            List<Point> refList = new ArrayList<>();
            for (MatOfDMatch pair : knnMatches) {
                DMatch[] dm = pair.toArray();
                if (dm.length >= 2 && dm[0].distance < ratioThreshold * dm[1].distance) {
                    srcList.add(kpSrcList.get(dm[0].queryIdx).pt);
                    refList.add(kpRefList.get(dm[0].trainIdx).pt);
                }
                pair.release();
            }

            int goodMatches = srcList.size();
            if (goodMatches < minMatchCount) {
                logger.debug("{}: not enough good matches ({} < {})", getName(), goodMatches, minMatchCount);
                return Optional.empty();
            }

            srcPts = new MatOfPoint2f();
            srcPts.fromList(srcList);
            refPts = new MatOfPoint2f();
            refPts.fromList(refList);
            h = Calib3d.findHomography(srcPts, refPts, Calib3d.RANSAC, ransacThreshold, inlierMask);

            if (h == null || h.empty()) {
                logger.debug("{}: no homography found", getName());
                return Optional.empty();
            }

            int inliers = Core.countNonZero(inlierMask);
            double inlierRatio = Math.min(1.0, (double) inliers / goodMatches);
            double matchScore = Math.min(goodMatches / MATCH_COUNT_NORMALIZER, 1.0);
            double score = Math.min(1.0, INLIER_WEIGHT * inlierRatio + MATCH_WEIGHT * matchScore);

            // 降采样坐标系 -> 原图坐标系: H = S_ref^-1 * H' * S_src
            double[][] homography = VisionTool.multiply(
                VisionTool.multiply(VisionTool.scaling(1.0 / refScale), VisionTool.toArray(h)),
                VisionTool.scaling(srcScale));

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("total_keypoints_src", srcKeypoints);
            metadata.put("total_keypoints_ref", refKeypoints);
            metadata.put("inliers", inliers);
            metadata.put("detector", getName());

            return Optional.of(new RegistrationResult(score, inlierRatio, homography, goodMatches, metadata));

        } catch (CvException e) {
            logger.debug("{}: OpenCV rejected input: {}", getName(), e.getMessage());
            return Optional.empty();
        } finally {
            if (srcGray != null) srcGray.release();
            if (refGray != null) refGray.release();
            kpSrc.release();
            kpRef.release();
            descSrc.release();
            descRef.release();
            if (srcPts != null) srcPts.release();
            if (refPts != null) refPts.release();
            inlierMask.release();
            noMask.release();
            if (h != null) h.release();
        }
    }

    private double scaleFor(Mat image) {
        if (maxProcessWidth > 0 && image.cols() > maxProcessWidth) {
            return (double) maxProcessWidth / image.cols();
        }
        return 1.0;
    }

    private Mat prepare(Mat image, double scale) {
        Mat gray = VisionTool.toGray(image);
        if (scale >= 1.0) {
            return gray;
        }
        Mat resized = new Mat();
        // INTER_AREA 最适合缩小图像
        Imgproc.resize(gray, resized, new Size(), scale, scale, Imgproc.INTER_AREA);
        gray.release();
        return resized;
    }

    public double getRatioThreshold() { return ratioThreshold; }

    public double getRansacThreshold() { return ransacThreshold; }

    public int getMinMatchCount() { return minMatchCount; }

    public int getMaxProcessWidth() { return maxProcessWidth; }
}
