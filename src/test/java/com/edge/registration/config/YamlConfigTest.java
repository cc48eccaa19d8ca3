package com.edge.registration.config;

import com.edge.registration.core.registration.EngineConfig;
import com.edge.registration.core.registration.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigTest {

    @Test
    void nameFallsBackToUpperCasedType() {
        YamlConfig.AlgorithmConfig config = new YamlConfig.AlgorithmConfig();
        config.setType("orb");

        assertThat(config.resolveName()).isEqualTo("ORB");

        config.setName("ORB-fast");
        assertThat(config.resolveName()).isEqualTo("ORB-fast");
    }

    @Test
    void nameOrTypeIsRequired() {
        assertThatThrownBy(() -> new YamlConfig.AlgorithmConfig().resolveName())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void engineSettingsConvertToEngineConfig() {
        YamlConfig yamlConfig = new YamlConfig();
        assertThat(yamlConfig.getEngine().toEngineConfig()).isEqualTo(EngineConfig.defaults());

        yamlConfig.getEngine().setMinScore(0.7);
        yamlConfig.getEngine().setEnableFallback(false);
        assertThat(yamlConfig.getEngine().toEngineConfig()).isEqualTo(new EngineConfig(0.7, 0.6, false));

        yamlConfig.getEngine().setMinInlierRatio(1.2);
        assertThatThrownBy(() -> yamlConfig.getEngine().toEngineConfig()).isInstanceOf(ValidationException.class);
    }
}
