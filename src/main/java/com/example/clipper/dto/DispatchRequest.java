package com.example.clipper.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DispatchRequest(String workflowId,
                              String ref,
                              String correlationToken,
                              Map<String, String> inputs) {

    public DispatchRequest {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(correlationToken, "correlationToken");
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    /**
     * Builds a request whose inputs carry the correlation token under {@code tokenKey}. A caller-supplied
     * value under the same key is overwritten.
     */
    public static DispatchRequest of(String workflowId,
                                     String ref,
                                     String correlationToken,
                                     String tokenKey,
                                     Map<String, String> params) {
        Map<String, String> inputs = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (key != null && value != null) {
                    inputs.put(key, value);
                }
            });
        }
        inputs.put(tokenKey, correlationToken);
        return new DispatchRequest(workflowId, ref, correlationToken, inputs);
    }
}
