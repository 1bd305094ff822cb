package com.loh.exception;

import java.util.Map;

/**
 * Raised when a standing-order template is rejected, typically because its
 * industry percentages add up to more than 100.
 */
public class InvalidStandingOrderException extends BaseException {

    public InvalidStandingOrderException(String starId, String reason) {
        super(
                ErrorCode.VALIDATION_ERROR,
                String.format("Invalid standing orders for star %s: %s", starId, reason),
                Map.of("starId", starId, "reason", reason));
    }
}
