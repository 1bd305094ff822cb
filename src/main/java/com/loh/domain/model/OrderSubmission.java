package com.loh.domain.model;

import com.loh.domain.enums.OrderType;
import com.loh.domain.payload.OrderPayload;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One revision of a player's order for a turn.
 *
 * <p>Rows are append-only. All revisions of the same logical order share a
 * {@code clientOrderId}; the highest revision is the order's current state. A row
 * with {@code deleted = true} is a tombstone, a row with {@code finalized = true}
 * is the order as committed when the player ended the turn.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderSubmission {

    private String id;
    private String gameId;
    private String turnId;
    private String playerId;
    private String clientOrderId;
    private int revision;
    private OrderType orderType;
    private OrderPayload payload;
    private boolean deleted;
    private boolean finalized;
    private LocalDateTime finalizedAt;
    private LocalDateTime createdAt;

    public String getSourceStarId() {
        return payload != null ? payload.getSourceStarId() : null;
    }
}
