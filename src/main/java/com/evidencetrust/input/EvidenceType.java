package com.evidencetrust.input;

import java.util.Locale;

/**
 * Kind of artifact backing a control, inferred from the tool that produced it.
 */
public enum EvidenceType {
    SCAN,
    TEST,
    CONFIG,
    ATTESTATION,
    DOCUMENT;

    public static EvidenceType forTool(String tool) {
        if (tool == null) {
            return DOCUMENT;
        }
        return switch (tool.trim().toLowerCase(Locale.ROOT)) {
            case "prowler", "securityhub", "inspec", "trivy", "gitlab", "ciso-assistant" -> SCAN;
            case "soc2", "iso27001" -> ATTESTATION;
            case "pentest" -> TEST;
            default -> DOCUMENT;
        };
    }

    /**
     * Document and attestation evidence only asserts that a control works; it does not show it.
     */
    public boolean weak() {
        return this == DOCUMENT || this == ATTESTATION;
    }
}
