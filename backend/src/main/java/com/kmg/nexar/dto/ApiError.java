package com.kmg.nexar.dto;

public record ApiError(
        String code,
        String message
) {
}
