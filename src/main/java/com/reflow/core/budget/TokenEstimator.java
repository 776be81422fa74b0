package com.reflow.core.budget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

/**
 * Approximates token cost as a quarter of the JSON length of a payload, at least one token.
 */
@Component
public class TokenEstimator {

    private final ObjectMapper mapper = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    public int estimate(Object payload) {
        if (payload == null) {
            return 1;
        }
        try {
            return Math.max(1, mapper.writeValueAsString(payload).length() / 4);
        } catch (JsonProcessingException e) {
            return Math.max(1, String.valueOf(payload).length() / 4);
        }
    }
}
