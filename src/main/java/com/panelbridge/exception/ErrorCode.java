package com.panelbridge.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error categories surfaced by the runtime. The numeric status mirrors the closest HTTP status
 * so a presentation layer can map failures without inspecting exception types.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    AUTH_FAILED("AUTH_FAILED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    REMOTE_REJECTED("REMOTE_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 503);

    private final String code;
    private final int httpStatus;
}
