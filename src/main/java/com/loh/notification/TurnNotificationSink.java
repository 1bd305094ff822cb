package com.loh.notification;

/**
 * Outbound channel for turn-advance notifications. Delivery is best effort; an
 * implementation must not let a delivery failure escape to the caller.
 */
public interface TurnNotificationSink {

    void turnAdvanced(TurnAdvanceNotification notification);
}
