package com.edge.registration.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库，必须在任何 OpenCV 调用之前执行
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static final String OPENCV_LIBRARY = "opencv_java470";

    // 只表示已尝试加载，失败时同样不再重试
    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库，重复调用无副作用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        boolean isNativeImage = System.getProperty("org.graalvm.nativeimage.imagecode") != null;

        if (!isNativeImage) {
            // JAR 模式下，使用 openpnp 的自动加载
            logger.info("Running in JAR mode, loading OpenCV via openpnp...");
            try {
                nu.pattern.OpenCV.loadShared();
                logger.info("OpenCV loaded successfully via openpnp (JAR mode)");
            } catch (Exception | UnsatisfiedLinkError e) {
                logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
            }
            loaded = true;
            return;
        }

        logger.info("Running in native-image mode, loading OpenCV from application directory...");
        loadOpenCVNative(System.getProperty("user.dir"));
        loaded = true;
    }

    /**
     * 加载 OpenCV native 库 (native-image 模式下手动加载)
     */
    private static void loadOpenCVNative(String appDir) {
        String libFileName = libraryFileName(System.getProperty("os.name").toLowerCase());

        // 首先尝试从应用目录及其父目录加载
        File dir = new File(appDir);
        for (File candidate : new File[]{new File(dir, libFileName), new File(dir.getParentFile(), libFileName)}) {
            if (candidate.exists()) {
                try {
                    System.load(candidate.getAbsolutePath());
                    logger.info("OpenCV loaded successfully from: {}", candidate.getAbsolutePath());
                    return;
                } catch (UnsatisfiedLinkError e) {
                    logger.warn("Failed to load OpenCV from {}: {}", candidate, e.getMessage());
                }
            }
        }

        // 回退到从系统库路径加载
        try {
            System.loadLibrary(OPENCV_LIBRARY);
            logger.info("OpenCV loaded successfully from system library path");
        } catch (UnsatisfiedLinkError e) {
            logger.warn("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path",
                libFileName);
        }
    }

    /**
     * openpnp 的 OpenCV 在 Windows 上没有 lib 前缀
     */
    static String libraryFileName(String osName) {
        if (osName.contains("win")) {
            return OPENCV_LIBRARY + ".dll";
        } else if (osName.contains("mac")) {
            return "lib" + OPENCV_LIBRARY + ".dylib";
        }
        return "lib" + OPENCV_LIBRARY + ".so";
    }
}
