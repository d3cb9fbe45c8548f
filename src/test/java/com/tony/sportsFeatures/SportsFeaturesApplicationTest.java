package com.tony.sportsFeatures;

import com.tony.sportsFeatures.config.FeatureProperties;
import com.tony.sportsFeatures.service.FeaturePipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SportsFeaturesApplicationTest {

    @Autowired private FeatureProperties properties;
    @Autowired private FeaturePipelineService pipelineService;

    @Test
    void contextLoadsWithConfiguredDefaults() {
        assertThat(pipelineService).isNotNull();
        assertThat(properties.getGroupColumn()).isEqualTo("Team");
        assertThat(properties.getLagPeriods()).containsExactly(1, 3, 5);
        assertThat(properties.getTargetColumn()).isEqualTo("playoff_status");
    }
}
