package com.edge.registration.config;

import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.algorithm.FeatureRegistrationAlgorithm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-registration")
public class YamlConfig {
    private EngineSettings engine = new EngineSettings();
    // 列表顺序即算法评估顺序
    private List<AlgorithmConfig> algorithms = new ArrayList<>();
    private WarpConfig warp = new WarpConfig();

    @Data
    public static class EngineSettings {
        private double minScore = EngineConfig.DEFAULT_MIN_SCORE;
        private double minInlierRatio = EngineConfig.DEFAULT_MIN_INLIER_RATIO;
        private boolean enableFallback = EngineConfig.DEFAULT_ENABLE_FALLBACK;

        /**
         * 转换为引擎验收策略（越界时抛 ValidationException）
         */
        public EngineConfig toEngineConfig() {
            return new EngineConfig(minScore, minInlierRatio, enableFallback);
        }
    }

    @Data
    public static class AlgorithmConfig {
        private String name;                // 注册名，为空时使用类型名大写
        private String type;                // sift, orb, akaze
        private boolean enabled = true;
        private int maxFeatures = 0;        // 0 表示使用算法默认值
        private double ratioThreshold = FeatureRegistrationAlgorithm.DEFAULT_RATIO_THRESHOLD;
        private double ransacThreshold = FeatureRegistrationAlgorithm.DEFAULT_RANSAC_THRESHOLD;
        private int minMatchCount = FeatureRegistrationAlgorithm.DEFAULT_MIN_MATCH_COUNT;
        private int maxProcessWidth = FeatureRegistrationAlgorithm.DEFAULT_MAX_PROCESS_WIDTH;

        public String resolveName() {
            if (name != null && !name.isBlank()) {
                return name;
            }
            if (type == null) {
                throw new IllegalArgumentException("Algorithm name or type is required");
            }
            return type.trim().toUpperCase();
        }
    }

    @Data
    public static class WarpConfig {
        private int jpegQuality = 90;
    }
}
