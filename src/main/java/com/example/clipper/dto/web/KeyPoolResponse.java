package com.example.clipper.dto.web;

public record KeyPoolResponse(String service, int count, boolean available) {
}
