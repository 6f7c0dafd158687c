package com.example.clipper.dto.web;

import jakarta.validation.constraints.Size;

import java.util.Map;

public record RunRequest(@Size(max = 2048) String url,
                         Boolean watch,
                         Map<String, String> inputs) {

    public boolean watchOrDefault() {
        return watch == null || watch;
    }
}
