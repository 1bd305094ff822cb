package com.loh.exception;

import java.util.Map;

/**
 * Raised when caller-supplied input is malformed: a missing field, an unknown
 * player type, or a payload that does not match its order type.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
