package com.reflow.core.world;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 over sorted-key JSON of a {@link WorldState}. Equal content always hashes equal,
 * regardless of insertion order of records or record fields.
 */
public final class StateHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private StateHasher() {}

    public static String hash(WorldState state) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("audit_log", state.auditLog());
        document.put("inventory", state.inventory());
        document.put("records", state.records());
        try {
            byte[] canonical = CANONICAL.writeValueAsBytes(document);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("World state is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
