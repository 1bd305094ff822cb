package com.loh.game;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One seat requested when starting a game.
 *
 * <p>{@code type} is {@code "player"} or {@code "ai"}. AI seats default to the Randy strategy
 * unless {@code aiName} names another registered one. {@code homeStarId} is optional; seats
 * without one are spread evenly over the star list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerSetup {

    private String userId;

    @NotBlank
    @Size(max = 100)
    private String name;

    private String colorHex;
    private String countryName;
    private String type;
    private String aiName;
    private Map<String, Object> aiConfig;
    private String homeStarId;
}
