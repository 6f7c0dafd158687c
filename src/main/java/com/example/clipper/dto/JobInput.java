package com.example.clipper.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller wants rendered: the source video plus any extra workflow inputs.
 */
public record JobInput(String url, Map<String, String> extraInputs) {

    /**
     * Entries with a null key or value are dropped: a workflow input cannot be null.
     */
    public JobInput {
        Map<String, String> inputs = new LinkedHashMap<>();
        if (extraInputs != null) {
            extraInputs.forEach((key, value) -> {
                if (key != null && value != null) {
                    inputs.put(key, value);
                }
            });
        }
        extraInputs = Map.copyOf(inputs);
    }

    public static JobInput of(String url) {
        return new JobInput(url, Map.of());
    }
}
