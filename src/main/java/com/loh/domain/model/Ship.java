package com.loh.domain.model;

import com.loh.domain.enums.ShipStatus;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ship {

    private String id;
    private String gameId;
    private String ownerPlayerId;
    private String locationStarId;
    private double hp;
    private double power;
    private ShipStatus status;
    private Map<String, Object> details;
    private LocalDateTime createdAt;
}
