package com.loh.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Undirected link between two stars. Movement is only allowed along wormholes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Wormhole {

    private String starAId;
    private String starBId;

    /** The star at the other end, or null if this wormhole does not touch {@code starId}. */
    public String otherEnd(String starId) {
        if (starId == null) {
            return null;
        }
        if (starId.equals(starAId)) {
            return starBId;
        }
        return starId.equals(starBId) ? starAId : null;
    }
}
