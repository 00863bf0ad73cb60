package com.example.matrixgame.global.dto;

public record CommonResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(true, data, null);
    }

    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(true, data, message);
    }
}
