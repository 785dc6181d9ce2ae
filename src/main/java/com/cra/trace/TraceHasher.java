package com.cra.trace;

import com.cra.protocol.CanonicalJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * {@code event_hash = hex(SHA-256(previous_event_hash ++ canonical body))}.
 */
public final class TraceHasher {

    private TraceHasher() {
    }

    public static String hash(TraceEvent event) {
        MessageDigest digest = sha256();
        String previous = event.previousEventHash() == null ? "" : event.previousEventHash();
        digest.update(previous.getBytes(StandardCharsets.UTF_8));
        digest.update(CanonicalJson.bytes(event.canonicalBody()));
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Hex SHA-256 of the canonical form of {@code value}; {@code null} hashes as JSON null. */
    public static String hashJson(JsonNode value) {
        JsonNode node = value == null ? NullNode.getInstance() : value;
        return HexFormat.of().formatHex(sha256().digest(CanonicalJson.bytes(node)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
