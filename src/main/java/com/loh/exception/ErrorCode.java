package com.loh.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE("INVALID_STATE", 409);

    private final String code;
    private final int httpStatus;
}
