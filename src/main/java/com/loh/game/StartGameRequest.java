package com.loh.game;

import com.loh.domain.model.GalaxyTopology;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartGameRequest {

    private String ownerId;
    private Long seed;
    private String mapSize;
    private Double densityMin;
    private Double densityMax;
    private String title;
    private String description;
    private Map<String, Object> params;

    /** Pre-generated star map. */
    @NotNull
    private GalaxyTopology topology;

    @NotEmpty
    @Valid
    private List<PlayerSetup> players;
}
