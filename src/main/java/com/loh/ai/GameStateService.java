package com.loh.ai;

import com.loh.domain.enums.ShipStatus;
import com.loh.domain.model.GameState;
import com.loh.domain.model.Turn;
import com.loh.exception.ResourceNotFoundException;
import com.loh.galaxy.GalaxyTopologyProvider;
import com.loh.mapper.GameMapper;
import com.loh.mapper.PlayerMapper;
import com.loh.mapper.ShipMapper;
import com.loh.mapper.StarStateMapper;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.ShipJpaRepository;
import com.loh.repository.jpa.StarStateJpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assembles a full {@link GameState} snapshot for AI planning.
 */
@Service
public class GameStateService {

    private final GameJpaRepository gameJpaRepository;
    private final PlayerJpaRepository playerJpaRepository;
    private final StarStateJpaRepository starStateJpaRepository;
    private final ShipJpaRepository shipJpaRepository;
    private final GalaxyTopologyProvider galaxyTopologyProvider;
    private final GameMapper gameMapper;
    private final PlayerMapper playerMapper;
    private final StarStateMapper starStateMapper;
    private final ShipMapper shipMapper;

    public GameStateService(
            GameJpaRepository gameJpaRepository,
            PlayerJpaRepository playerJpaRepository,
            StarStateJpaRepository starStateJpaRepository,
            ShipJpaRepository shipJpaRepository,
            GalaxyTopologyProvider galaxyTopologyProvider,
            GameMapper gameMapper,
            PlayerMapper playerMapper,
            StarStateMapper starStateMapper,
            ShipMapper shipMapper) {
        this.gameJpaRepository = gameJpaRepository;
        this.playerJpaRepository = playerJpaRepository;
        this.starStateJpaRepository = starStateJpaRepository;
        this.shipJpaRepository = shipJpaRepository;
        this.galaxyTopologyProvider = galaxyTopologyProvider;
        this.gameMapper = gameMapper;
        this.playerMapper = playerMapper;
        this.starStateMapper = starStateMapper;
        this.shipMapper = shipMapper;
    }

    @Transactional(readOnly = true)
    public GameState loadGameState(String gameId, Turn turn) {
        return GameState.builder()
                .game(gameJpaRepository
                        .findById(gameId)
                        .map(gameMapper::toDomain)
                        .orElseThrow(() -> new ResourceNotFoundException("Game", gameId)))
                .turn(turn)
                .topology(galaxyTopologyProvider.getTopology(gameId))
                .starStates(starStateMapper.toDomainList(starStateJpaRepository.findByGameId(gameId)))
                .ships(shipMapper.toDomainList(shipJpaRepository.findByGameIdAndStatus(gameId, ShipStatus.ACTIVE)))
                .players(playerMapper.toDomainList(playerJpaRepository.findByGameIdOrderByNameAsc(gameId)))
                .build();
    }
}
