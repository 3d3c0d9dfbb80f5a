package com.kmg.nexar.dto;

public record EventMessage(
        String type,
        String jobId,
        String message,
        String timestamp,
        Object payload
) {
}
