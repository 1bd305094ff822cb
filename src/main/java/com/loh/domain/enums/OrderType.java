package com.loh.domain.enums;

import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import com.loh.domain.payload.OrderPayload;
import lombok.Getter;

/**
 * Kind of order a player (or a standing-order template) submits for a turn.
 *
 * <p>Each type is bound to exactly one payload class. The {@code AUTO_*} variants are
 * produced by standing-order materialization and resolve identically to their manual
 * counterparts.
 */
@Getter
public enum OrderType {
    BUILD("build", BuildPayload.class),
    AUTO_BUILD("auto_build", BuildPayload.class),
    MOVE("move", MovePayload.class),
    AUTO_MOVE("auto_move", MovePayload.class);

    private final String code;
    private final Class<? extends OrderPayload> payloadType;

    OrderType(String code, Class<? extends OrderPayload> payloadType) {
        this.code = code;
        this.payloadType = payloadType;
    }
}
