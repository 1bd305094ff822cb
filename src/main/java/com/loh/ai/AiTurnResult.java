package com.loh.ai;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AiTurnResult {

    private String playerId;
    private String playerName;
    private String aiName;
    private boolean success;
    private int ordersSubmitted;
    private String error;
}
