package com.loh.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message pushed to clients when a game moves to its next turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnAdvanceNotification {

    private String gameId;
    private String previousTurnId;
    private int previousTurnNumber;
    private String newTurnId;
    private int newTurnNumber;
}
