package com.reflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Success predicate of a task. Only {@value #RECORD_STATUS} is defined: the named record must
 * exist with the expected {@code status} field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SuccessCondition(
        @JsonProperty("type") String type,
        @JsonProperty("record_id") String recordId,
        @JsonProperty("expected_status") String expectedStatus
) {

    public static final String RECORD_STATUS = "record_status";

    public SuccessCondition {
        if (type == null || type.isBlank()) {
            type = RECORD_STATUS;
        }
    }

    public static SuccessCondition recordStatus(String recordId, String expectedStatus) {
        return new SuccessCondition(RECORD_STATUS, recordId, expectedStatus);
    }
}
