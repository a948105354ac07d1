package com.evidencetrust.runtime;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.GovernanceConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToDeterministicReviewWithStandardWeights() {
        AppConfig config = new AppConfig();
        GovernanceConfig governance = config.toGovernanceConfig();
        GovernanceConfig defaults = GovernanceConfig.defaults();

        assertEquals("deterministic", config.getEnhancement().getEvaluator());
        assertTrue(config.getEnhancement().getRouting().isEmpty());
        assertEquals(defaults.weights(), governance.weights());
        assertEquals(defaults.thresholds(), governance.thresholds());
        assertEquals(defaults.evidence(), governance.evidence());
        assertEquals(defaults.bias(), governance.bias());
        assertEquals(defaults.adjustmentBounds(), governance.adjustmentBounds());
        assertEquals(defaults.findingRouter().routes(), governance.findingRouter().routes());
        assertEquals(defaults.enhancementTimeout(), governance.enhancementTimeout());
    }
}
