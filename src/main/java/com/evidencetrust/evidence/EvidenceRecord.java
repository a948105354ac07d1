package com.evidencetrust.evidence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One link of a hash-chained evidence log. {@code hash} commits to every other field; the first
 * record of a log has a null {@code previousHash}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record EvidenceRecord(
        int sequence,
        String timestamp,
        String operation,
        JsonNode data,
        String previousHash,
        String hash) {

    public String dataText(String field) {
        if (data == null || !data.hasNonNull(field)) {
            return null;
        }
        return data.get(field).asText();
    }
}
