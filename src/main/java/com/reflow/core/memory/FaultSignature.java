package com.reflow.core.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reflow.core.model.StepContext;
import com.reflow.core.model.StepResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical description of a failure, used as the memory bank lookup key.
 *
 * @param toolName        failing tool
 * @param errorKind       error kind
 * @param stepName        failing step
 * @param keywords        top error keywords
 * @param stateHashPrefix first characters of the pre-call state hash
 */
public record FaultSignature(
        @JsonProperty("tool_name") String toolName,
        @JsonProperty("error_kind") String errorKind,
        @JsonProperty("step_name") String stepName,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("state_hash_prefix") String stateHashPrefix
) {

    static final int TOP_KEYWORDS = 5;
    static final int HASH_PREFIX_LENGTH = 10;

    public FaultSignature {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        stateHashPrefix = stateHashPrefix == null ? "" : stateHashPrefix;
        errorKind = errorKind == null ? "Unknown" : errorKind;
    }

    public static FaultSignature from(StepContext context, StepResult result) {
        String errorText = String.join(" ",
                result.errorMessage() == null ? "" : result.errorMessage(),
                result.error() == null || result.error().trace() == null ? "" : result.error().trace());
        String hash = context.preStateHash() == null ? "" : context.preStateHash();
        return new FaultSignature(
                context.toolName(),
                result.errorKind(),
                context.stepName(),
                KeywordExtractor.topKeywords(errorText, TOP_KEYWORDS),
                hash.substring(0, Math.min(HASH_PREFIX_LENGTH, hash.length())));
    }

    /** {@code tool|kind|step|hashPrefix|kw1,kw2,...} */
    @JsonIgnore
    public String key() {
        return toolName + "|" + errorKind + "|" + stepName + "|" + stateHashPrefix + "|" + String.join(",", keywords);
    }

    @JsonIgnore
    public Set<String> keywordSet() {
        return new HashSet<>(keywords);
    }
}
