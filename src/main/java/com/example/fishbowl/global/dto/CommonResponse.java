package com.example.fishbowl.global.dto;

/**
 * 성공 응답 공통 포맷. 실패 응답은 GlobalExceptionHandler 의 ErrorResponse 를 사용한다.
 */
public record CommonResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(true, data, message);
    }
}
