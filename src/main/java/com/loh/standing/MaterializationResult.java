package com.loh.standing;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one standing-order materialization pass.
 */
@Data
@Builder
public class MaterializationResult {

    private int starsProcessed;
    private int ordersCreated;
    private int starsFailed;
}
