package com.evidencetrust.input;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentSource {
    SOC2("soc2"),
    ISO27001("iso27001"),
    PROWLER("prowler"),
    SECURITY_HUB("securityhub"),
    PENTEST("pentest"),
    MANUAL("manual"),
    JSON("json"),
    CISO_ASSISTANT("ciso-assistant");

    private final String label;

    DocumentSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
