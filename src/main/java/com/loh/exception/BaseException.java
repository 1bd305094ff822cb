package com.loh.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the domain exception hierarchy. Every failure the turn engine raises
 * on purpose carries an {@link ErrorCode} so callers can branch on the category
 * without parsing messages.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
