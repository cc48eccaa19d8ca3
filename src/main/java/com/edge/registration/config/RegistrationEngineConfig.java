package com.edge.registration.config;

import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.ImageRegistrationEngine;
import com.edge.registration.core.registration.algorithm.RegistrationAlgorithmFactory;
import com.edge.registration.core.registration.RegistrationAlgorithm;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 配准引擎配置
 * <p>
 * 从 application.yml 读取验收策略和算法列表，按列表顺序注册到引擎
 */
@Configuration
public class RegistrationEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegistrationEngineConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public ImageRegistrationEngine<Mat> imageRegistrationEngine() {
        EngineConfig engineConfig = yamlConfig.getEngine() != null
            ? yamlConfig.getEngine().toEngineConfig()
            : EngineConfig.defaults();

        Map<String, RegistrationAlgorithm<Mat>> algorithms = new LinkedHashMap<>();
        if (yamlConfig.getAlgorithms() != null) {
            for (YamlConfig.AlgorithmConfig algorithmConfig : yamlConfig.getAlgorithms()) {
                if (!algorithmConfig.isEnabled()) {
                    logger.info("Algorithm {} disabled, skipping", algorithmConfig.resolveName());
                    continue;
                }
                algorithms.put(algorithmConfig.resolveName(), RegistrationAlgorithmFactory.create(algorithmConfig));
            }
        }

        if (algorithms.isEmpty()) {
            logger.warn("No registration algorithms configured - every registration will fail");
        }

        logger.info("ImageRegistrationEngine configured: algorithms={}, {}", algorithms.keySet(), engineConfig);
        return new ImageRegistrationEngine<>(algorithms, engineConfig);
    }
}
