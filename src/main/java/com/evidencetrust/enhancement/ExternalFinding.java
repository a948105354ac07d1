package com.evidencetrust.enhancement;

/**
 * A finding as reported by an external evaluator, before severity and category are validated.
 */
public record ExternalFinding(String severity, String category, String description, String remediation) {
}
