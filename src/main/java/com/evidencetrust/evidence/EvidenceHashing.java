package com.evidencetrust.evidence;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Content hash of an evidence record: SHA-256 over compact JSON with the keys sequence,
 * timestamp, operation, data, previousHash in that order.
 */
public final class EvidenceHashing {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EvidenceHashing() {
    }

    public static String contentHash(EvidenceRecord record) {
        ObjectNode canonical = MAPPER.createObjectNode();
        canonical.put("sequence", record.sequence());
        canonical.put("timestamp", record.timestamp());
        canonical.put("operation", record.operation());
        canonical.set("data", record.data() == null ? NullNode.getInstance() : record.data());
        canonical.put("previousHash", record.previousHash());
        try {
            return sha256Hex(MAPPER.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Evidence record could not be serialized", e);
        }
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
