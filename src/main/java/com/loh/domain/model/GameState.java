package com.loh.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of everything an AI needs to plan a turn: the game, its topology,
 * star states, ships and players.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GameState {

    private Game game;
    private Turn turn;
    private GalaxyTopology topology;

    @Builder.Default
    private List<StarState> starStates = new ArrayList<>();

    @Builder.Default
    private List<Ship> ships = new ArrayList<>();

    @Builder.Default
    private List<Player> players = new ArrayList<>();
}
