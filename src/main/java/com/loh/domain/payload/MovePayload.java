package com.loh.domain.payload;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for MOVE and AUTO_MOVE orders. An empty ship selection means
 * every active ship the player has at the source star.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class MovePayload implements OrderPayload {

    private String sourceStarId;
    private String destinationStarId;

    @Builder.Default
    private List<String> selectedShipIds = new ArrayList<>();

    private boolean fromStandingOrder;

    public boolean selectsAllShips() {
        return selectedShipIds == null || selectedShipIds.isEmpty();
    }
}
