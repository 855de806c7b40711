package com.procrawl.listingsync.ingest.normalize;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over the key-sorted JSON form of a listing's fields.
 */
public final class ContentHasher {
    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private ContentHasher() {
    }

    public static String hash(Map<String, Object> fields) {
        String json;
        try {
            json = CANONICAL_JSON.writeValueAsString(fields == null ? Map.of() : new TreeMap<>(fields));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Listing fields are not serializable", e);
        }
        return sha256Hex(json);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
