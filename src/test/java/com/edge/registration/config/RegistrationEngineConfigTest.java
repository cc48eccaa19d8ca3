package com.edge.registration.config;

import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.ImageRegistrationEngine;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class RegistrationEngineConfigTest {

    private static YamlConfig.AlgorithmConfig algorithm(String name, String type, boolean enabled) {
        YamlConfig.AlgorithmConfig config = new YamlConfig.AlgorithmConfig();
        config.setName(name);
        config.setType(type);
        config.setEnabled(enabled);
        return config;
    }

    private static ImageRegistrationEngine<Mat> build(YamlConfig yamlConfig) {
        RegistrationEngineConfig engineConfig = new RegistrationEngineConfig();
        ReflectionTestUtils.setField(engineConfig, "yamlConfig", yamlConfig);
        return engineConfig.imageRegistrationEngine();
    }

    @Test
    void registersEnabledAlgorithmsInListOrder() {
        YamlConfig yamlConfig = new YamlConfig();
        yamlConfig.getAlgorithms().add(algorithm("SIFT", "sift", true));
        yamlConfig.getAlgorithms().add(algorithm(null, "orb", true));
        yamlConfig.getAlgorithms().add(algorithm("AKAZE", "akaze", false));
        yamlConfig.getEngine().setMinScore(0.9);

        ImageRegistrationEngine<Mat> engine = build(yamlConfig);

        assertThat(engine.getAlgorithmNames()).containsExactly("SIFT", "ORB");
        assertThat(engine.getConfig()).isEqualTo(new EngineConfig(0.9, 0.6, true));
    }

    @Test
    void emptyAlgorithmListIsAllowed() {
        ImageRegistrationEngine<Mat> engine = build(new YamlConfig());

        assertThat(engine.size()).isZero();
        assertThat(engine.getConfig()).isEqualTo(EngineConfig.defaults());
    }
}
