package com.edge.registration.util;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;

/**
 * OpenCV 辅助工具：Base64 编解码、单应矩阵与 Mat 互转、透视变换
 */
public class VisionTool {
    private static final Logger logger = LoggerFactory.getLogger(VisionTool.class);

    private VisionTool() {
    }

    // =========================================================
    // 1. 编解码
    // =========================================================

    /**
     * Base64 字符串解码为彩色 Mat
     *
     * @return 解码失败时返回 null
     */
    public static Mat base64ToMat(String base64) {
        return base64ToMat(base64, Imgcodecs.IMREAD_COLOR);
    }

    /**
     * Base64 字符串解码为 Mat，兼容 data:image/...;base64, 前缀
     *
     * @return 解码失败时返回 null
     */
    public static Mat base64ToMat(String base64, int flags) {
        if (base64 == null || base64.isEmpty()) return null;
        if (base64.contains(",")) base64 = base64.substring(base64.indexOf(',') + 1);

        byte[] data;
        try {
            data = Base64.getDecoder().decode(base64.trim());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid Base64 image data: {}", e.getMessage());
            return null;
        }

        MatOfByte mob = new MatOfByte(data);
        try {
            Mat mat = Imgcodecs.imdecode(mob, flags);
            if (mat == null || mat.empty()) {
                logger.warn("Failed to decode image ({} bytes)", data.length);
                return null;
            }
            return mat;
        } finally {
            mob.release();
        }
    }

    /**
     * Mat 编码为 JPEG Base64
     */
    public static String matToBase64(Mat mat, int jpegQuality) {
        MatOfByte buffer = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality);
        try {
            if (!Imgcodecs.imencode(".jpg", mat, buffer, params)) {
                throw new IllegalStateException("Failed to encode image as JPEG");
            }
            return Base64.getEncoder().encodeToString(buffer.toArray());
        } finally {
            buffer.release();
            params.release();
        }
    }

    // =========================================================
    // 2. 单应矩阵
    // =========================================================

    /**
     * 3x3 CV_64F Mat 转 double[3][3]
     */
    public static double[][] toArray(Mat homography) {
        if (homography == null || homography.empty()) return null;
        if (homography.rows() != 3 || homography.cols() != 3) {
            throw new IllegalArgumentException("Homography must be 3x3, got "
                + homography.rows() + "x" + homography.cols());
        }
        double[][] h = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                h[r][c] = homography.get(r, c)[0];
            }
        }
        return h;
    }

    /**
     * double[3][3] 转 3x3 CV_64F Mat（调用方负责释放）
     */
    public static Mat toMat(double[][] homography) {
        if (homography == null || homography.length != 3) {
            throw new IllegalArgumentException("Homography must be a 3x3 matrix");
        }
        Mat m = new Mat(3, 3, CvType.CV_64F);
        for (int r = 0; r < 3; r++) {
            if (homography[r] == null || homography[r].length != 3) {
                m.release();
                throw new IllegalArgumentException("Homography must be a 3x3 matrix");
            }
            m.put(r, 0, homography[r]);
        }
        return m;
    }

    /**
     * 3x3 矩阵乘法 a * b
     */
    public static double[][] multiply(double[][] a, double[][] b) {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                double sum = 0;
                for (int k = 0; k < 3; k++) {
                    sum += a[r][k] * b[k][c];
                }
                out[r][c] = sum;
            }
        }
        return out;
    }

    /**
     * 各向同性缩放矩阵
     */
    public static double[][] scaling(double scale) {
        return new double[][]{
            {scale, 0, 0},
            {0, scale, 0},
            {0, 0, 1}
        };
    }

    // =========================================================
    // 3. 变换
    // =========================================================

    /**
     * 用单应矩阵把源图变换到参考图坐标系
     *
     * @param source     源图（调用方负责释放）
     * @param homography 源 -> 参考 的 3x3 矩阵
     * @param size       输出尺寸（通常为参考图尺寸）
     * @return 变换后的图像（调用方负责释放）
     */
    public static Mat warpPerspective(Mat source, double[][] homography, Size size) {
        Mat h = toMat(homography);
        try {
            Mat warped = new Mat();
            Imgproc.warpPerspective(source, warped, h, size, Imgproc.INTER_LINEAR);
            return warped;
        } finally {
            h.release();
        }
    }

    /**
     * 转灰度；单通道图像返回副本
     */
    public static Mat toGray(Mat frame) {
        Mat g = new Mat();
        if (frame.channels() == 3) Imgproc.cvtColor(frame, g, Imgproc.COLOR_BGR2GRAY);
        else if (frame.channels() == 4) Imgproc.cvtColor(frame, g, Imgproc.COLOR_BGRA2GRAY);
        else frame.copyTo(g);
        return g;
    }
}
