package com.edge.registration.core.registration.algorithm;

import com.edge.registration.config.YamlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class RegistrationAlgorithmFactory {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationAlgorithmFactory.class);

    public static final List<String> SUPPORTED_TYPES = List.of("sift", "orb", "akaze");

    private RegistrationAlgorithmFactory() {
    }

    /**
     * 根据配置创建配准算法
     * @param config 算法配置
     *               - "sift": SIFT + FLANN
     *               - "orb": ORB + 汉明暴力匹配
     *               - "akaze": AKAZE + 汉明暴力匹配
     * @return 算法实例（检测器在首次配准时才创建）
     * @throws IllegalArgumentException 如果类型不支持
     */
    public static FeatureRegistrationAlgorithm create(YamlConfig.AlgorithmConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Algorithm config cannot be null");
        }
        if (config.getType() == null || config.getType().isBlank()) {
            throw new IllegalArgumentException("Algorithm type is required for " + config.getName());
        }

        String type = config.getType().trim().toLowerCase();
        FeatureRegistrationAlgorithm algorithm;
        switch (type) {
            case "sift":
                algorithm = new SiftRegistrationAlgorithm(config.getMaxFeatures(),
                    config.getRatioThreshold(), config.getRansacThreshold(),
                    config.getMinMatchCount(), config.getMaxProcessWidth());
                break;
            case "orb":
                algorithm = new OrbRegistrationAlgorithm(config.getMaxFeatures(),
                    config.getRatioThreshold(), config.getRansacThreshold(),
                    config.getMinMatchCount(), config.getMaxProcessWidth());
                break;
            case "akaze":
                algorithm = new AkazeRegistrationAlgorithm(
                    config.getRatioThreshold(), config.getRansacThreshold(),
                    config.getMinMatchCount(), config.getMaxProcessWidth());
                break;
            default:
                throw new IllegalArgumentException("Unsupported algorithm type: " + config.getType()
                    + ". Supported: " + SUPPORTED_TYPES);
        }

        logger.info("Created {} algorithm: ratio={}, ransac={}, minMatches={}, maxWidth={}",
            algorithm.getName(), algorithm.getRatioThreshold(), algorithm.getRansacThreshold(),
            algorithm.getMinMatchCount(), algorithm.getMaxProcessWidth());
        return algorithm;
    }
}
