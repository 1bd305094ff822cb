package com.loh.domain.model;

import com.loh.domain.enums.TurnStatus;
import java.time.LocalDateTime;
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
public class Turn {

    private String id;
    private String gameId;
    private int number;
    private TurnStatus status;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
}
