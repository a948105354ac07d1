package com.evidencetrust.governance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrustTier {
    SELF_ASSESSED("self-assessed"),
    AI_VERIFIED("ai-verified"),
    AUDITOR_VERIFIED("auditor-verified");

    private final String label;

    TrustTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static TrustTier forScore(int confidenceScore, GovernanceConfig.TrustThresholds thresholds) {
        if (confidenceScore >= thresholds.auditorVerified()) {
            return AUDITOR_VERIFIED;
        }
        if (confidenceScore >= thresholds.aiVerified()) {
            return AI_VERIFIED;
        }
        return SELF_ASSESSED;
    }
}
