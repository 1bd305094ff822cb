package com.loh.domain.payload;

/**
 * Typed body of an order submission. Which implementation applies is fixed by the
 * order's {@link com.loh.domain.enums.OrderType}; the payload column stores the JSON form.
 */
public sealed interface OrderPayload permits BuildPayload, MovePayload {

    String getSourceStarId();

    /** True when the order was generated from a star's standing-order template. */
    boolean isFromStandingOrder();
}
