package com.loh.resolution;

import com.loh.domain.enums.OrderType;
import com.loh.domain.enums.ResolutionPhase;
import lombok.Builder;
import lombok.Data;

/**
 * A final order that could not be applied. Its effects were rolled back; the rest of the
 * turn resolved normally.
 */
@Data
@Builder
public class OrderFailure {

    private String orderId;
    private String clientOrderId;
    private String playerId;
    private String sourceStarId;
    private OrderType orderType;
    private ResolutionPhase phase;
    private String message;
}
