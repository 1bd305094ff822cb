package com.loh.exception;

/**
 * Raised when an operation is valid in shape but not allowed in the current
 * lifecycle state, e.g. editing a draft that has already been deleted.
 */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
