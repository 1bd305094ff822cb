package com.loh.domain.model;

import com.loh.domain.enums.GameStatus;
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
public class Game {

    private String id;
    private String ownerId;
    private Long seed;
    private String mapSize;
    private Double densityMin;
    private Double densityMax;
    private String title;
    private String description;
    private GameStatus status;

    /** Free-form game parameters (victory conditions, house rules). */
    private Map<String, Object> params;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
