package com.loh.game;

import com.loh.domain.model.Game;
import com.loh.domain.model.Player;
import com.loh.domain.model.Turn;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class GameSetupResult {

    private final Game game;
    private final Turn firstTurn;
    private final List<Player> players;
    private final int starCount;
    private final int wormholeCount;
}
