package com.loh.domain.model;

import com.loh.domain.enums.TurnEventKind;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Entry in a turn's event log. {@code playerId} is null for events every player may see.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnEvent {

    private String id;
    private String gameId;
    private String turnId;
    private int turnNumber;
    private String playerId;
    private int seq;
    private TurnEventKind kind;
    private Map<String, Object> details;
    private LocalDateTime createdAt;
}
