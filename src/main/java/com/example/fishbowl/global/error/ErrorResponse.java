package com.example.fishbowl.global.error;

import java.util.Map;

import lombok.Builder;

@Builder
public record ErrorResponse(
        String code,
        ErrorType type,
        String message,
        Map<String, Object> details) {
}
