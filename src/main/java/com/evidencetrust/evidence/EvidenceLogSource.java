package com.evidencetrust.evidence;

/**
 * Produces ordered evidence records for a named log. A missing log is reported through
 * {@link EvidenceLog#present()}, never by throwing.
 */
public interface EvidenceLogSource {
    EvidenceLog open(String name);
}
