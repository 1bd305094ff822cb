package com.loh.game;

import com.loh.ai.AiStrategyRegistry;
import com.loh.ai.randy.RandyAiStrategy;
import com.loh.domain.enums.GameStatus;
import com.loh.domain.enums.PlayerStatus;
import com.loh.domain.enums.PlayerType;
import com.loh.domain.enums.ShipStatus;
import com.loh.domain.enums.TurnEventKind;
import com.loh.domain.model.Economy;
import com.loh.domain.model.GalaxyTopology;
import com.loh.domain.model.Game;
import com.loh.domain.model.Player;
import com.loh.domain.model.Star;
import com.loh.domain.model.Turn;
import com.loh.domain.model.Wormhole;
import com.loh.entity.GameEntity;
import com.loh.entity.PlayerEntity;
import com.loh.entity.ShipEntity;
import com.loh.entity.StarEntity;
import com.loh.entity.StarStateEntity;
import com.loh.entity.WormholeEntity;
import com.loh.event.EventPublisherHelper;
import com.loh.eventlog.TurnEventService;
import com.loh.exception.ValidationException;
import com.loh.mapper.GameMapper;
import com.loh.mapper.JsonHelper;
import com.loh.mapper.PlayerMapper;
import com.loh.repository.jpa.GameJpaRepository;
import com.loh.repository.jpa.PlayerJpaRepository;
import com.loh.repository.jpa.ShipJpaRepository;
import com.loh.repository.jpa.StarJpaRepository;
import com.loh.repository.jpa.StarStateJpaRepository;
import com.loh.repository.jpa.WormholeJpaRepository;
import com.loh.turn.TurnLedger;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Creates a running game from a pre-generated star map and a list of seats.
 *
 * <p>Everything is written in one transaction: the game row, the static topology, one
 * player per seat, a star state for every star (home stars owned and seeded with the
 * starting economy), one starting ship per player, and turn 1 in OPEN state. The
 * {@link com.loh.event.GameStartedEvent} published at the end lets AI seats take turn 1.
 */
@Service
@Validated
@EnableConfigurationProperties(GameSetupConfig.class)
public class GameSetupService {

    private static final Logger log = LoggerFactory.getLogger(GameSetupService.class);

    private final GameJpaRepository gameJpaRepository;
    private final PlayerJpaRepository playerJpaRepository;
    private final StarJpaRepository starJpaRepository;
    private final WormholeJpaRepository wormholeJpaRepository;
    private final StarStateJpaRepository starStateJpaRepository;
    private final ShipJpaRepository shipJpaRepository;
    private final TurnLedger turnLedger;
    private final TurnEventService turnEventService;
    private final AiStrategyRegistry aiStrategyRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final GameMapper gameMapper;
    private final PlayerMapper playerMapper;
    private final GameSetupConfig gameSetupConfig;

    public GameSetupService(
            GameJpaRepository gameJpaRepository,
            PlayerJpaRepository playerJpaRepository,
            StarJpaRepository starJpaRepository,
            WormholeJpaRepository wormholeJpaRepository,
            StarStateJpaRepository starStateJpaRepository,
            ShipJpaRepository shipJpaRepository,
            TurnLedger turnLedger,
            TurnEventService turnEventService,
            AiStrategyRegistry aiStrategyRegistry,
            EventPublisherHelper eventPublisherHelper,
            GameMapper gameMapper,
            PlayerMapper playerMapper,
            GameSetupConfig gameSetupConfig) {
        this.gameJpaRepository = gameJpaRepository;
        this.playerJpaRepository = playerJpaRepository;
        this.starJpaRepository = starJpaRepository;
        this.wormholeJpaRepository = wormholeJpaRepository;
        this.starStateJpaRepository = starStateJpaRepository;
        this.shipJpaRepository = shipJpaRepository;
        this.turnLedger = turnLedger;
        this.turnEventService = turnEventService;
        this.aiStrategyRegistry = aiStrategyRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.gameMapper = gameMapper;
        this.playerMapper = playerMapper;
        this.gameSetupConfig = gameSetupConfig;
    }

    /**
     * Starts a new game.
     *
     * @throws ValidationException if the topology or the seats are inconsistent
     */
    @Transactional
    public GameSetupResult startGame(@Valid StartGameRequest request) {
        GalaxyTopology topology = request.getTopology();
        Set<String> starIds = validateTopology(topology);
        List<PlayerType> types = validatePlayers(request.getPlayers(), starIds);
        List<String> homeStars = assignHomeStars(request.getPlayers(), topology);

        LocalDateTime now = LocalDateTime.now();
        GameEntity gameEntity = GameEntity.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(request.getOwnerId())
                .seed(request.getSeed())
                .mapSize(request.getMapSize())
                .densityMin(request.getDensityMin())
                .densityMax(request.getDensityMax())
                .title(request.getTitle())
                .description(request.getDescription())
                .status(GameStatus.RUNNING)
                .params(JsonHelper.toJson(request.getParams() != null ? request.getParams() : Map.of()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        gameEntity = gameJpaRepository.save(gameEntity);
        String gameId = gameEntity.getId();

        saveTopology(gameId, topology);

        List<PlayerEntity> playerEntities = new ArrayList<>();
        Map<String, String> ownerByStar = new HashMap<>();
        for (int i = 0; i < request.getPlayers().size(); i++) {
            PlayerEntity player = savePlayer(gameId, request.getPlayers().get(i), types.get(i));
            playerEntities.add(player);
            ownerByStar.put(homeStars.get(i), player.getId());
        }

        saveStarStates(gameId, topology, ownerByStar, now);

        for (int i = 0; i < playerEntities.size(); i++) {
            saveStartingShip(gameId, playerEntities.get(i).getId(), homeStars.get(i), i, now);
        }

        Turn firstTurn = turnLedger.openTurn(gameId, 1);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("players", playerEntities.size());
        details.put("stars", topology.getStars().size());
        details.put("wormholes", topology.getWormholes().size());
        turnEventService.append(gameId, firstTurn, null, TurnEventKind.GAME_STARTED, details);

        log.info(
                "Game {} started with {} players on {} stars and {} wormholes",
                gameId,
                playerEntities.size(),
                topology.getStars().size(),
                topology.getWormholes().size());

        eventPublisherHelper.publishGameStarted(this, gameId, firstTurn);

        Game game = gameMapper.toDomain(gameEntity);
        List<Player> players = playerMapper.toDomainList(playerEntities);
        return GameSetupResult.builder()
                .game(game)
                .firstTurn(firstTurn)
                .players(players)
                .starCount(topology.getStars().size())
                .wormholeCount(topology.getWormholes().size())
                .build();
    }

    /**
     * Home star for each seat: the requested one, or for seat {@code i} of {@code n} the star
     * at index {@code i * stars / n} of the id-sorted star list, skipping stars already taken.
     */
    public static List<String> assignHomeStars(List<PlayerSetup> players, GalaxyTopology topology) {
        List<String> sortedIds = topology.getStars().stream()
                .map(Star::getId)
                .sorted()
                .toList();
        Set<String> taken = new HashSet<>();
        for (PlayerSetup player : players) {
            if (player.getHomeStarId() != null) {
                taken.add(player.getHomeStarId());
            }
        }

        List<String> homes = new ArrayList<>();
        int seats = players.size();
        for (int i = 0; i < seats; i++) {
            PlayerSetup player = players.get(i);
            if (player.getHomeStarId() != null) {
                homes.add(player.getHomeStarId());
                continue;
            }
            int index = (int) ((long) i * sortedIds.size() / seats);
            String home = null;
            for (int offset = 0; offset < sortedIds.size(); offset++) {
                String candidate = sortedIds.get((index + offset) % sortedIds.size());
                if (!taken.contains(candidate)) {
                    home = candidate;
                    break;
                }
            }
            if (home == null) {
                throw new ValidationException("Not enough stars for " + seats + " players");
            }
            taken.add(home);
            homes.add(home);
        }
        return homes;
    }

    private Set<String> validateTopology(GalaxyTopology topology) {
        if (topology.getStars() == null || topology.getStars().isEmpty()) {
            throw new ValidationException("Topology must contain at least one star");
        }
        Set<String> starIds = new HashSet<>();
        for (Star star : topology.getStars()) {
            if (star.getId() == null || star.getId().isBlank()) {
                throw new ValidationException("Every star needs an id");
            }
            if (!starIds.add(star.getId())) {
                throw new ValidationException("Duplicate star id: " + star.getId());
            }
        }
        if (topology.getWormholes() == null) {
            topology.setWormholes(new ArrayList<>());
        }
        for (Wormhole wormhole : topology.getWormholes()) {
            if (!starIds.contains(wormhole.getStarAId()) || !starIds.contains(wormhole.getStarBId())) {
                throw new ValidationException(
                        "Wormhole " + wormhole.getStarAId() + "-" + wormhole.getStarBId() + " references an unknown star");
            }
            if (wormhole.getStarAId().equals(wormhole.getStarBId())) {
                throw new ValidationException("Wormhole cannot connect star " + wormhole.getStarAId() + " to itself");
            }
        }
        return starIds;
    }

    private List<PlayerType> validatePlayers(List<PlayerSetup> players, Set<String> starIds) {
        if (players.size() > starIds.size()) {
            throw new ValidationException(
                    "Not enough stars for " + players.size() + " players (" + starIds.size() + " stars)");
        }
        List<PlayerType> types = new ArrayList<>();
        Set<String> names = new HashSet<>();
        Set<String> homes = new HashSet<>();
        for (PlayerSetup player : players) {
            if (!names.add(player.getName())) {
                throw new ValidationException("Duplicate player name: " + player.getName());
            }
            PlayerType type = PlayerType.fromCode(player.getType());
            if (type == PlayerType.AI && player.getAiName() != null && !aiStrategyRegistry.has(player.getAiName())) {
                throw new ValidationException("Unknown AI strategy: " + player.getAiName());
            }
            String home = player.getHomeStarId();
            if (home != null) {
                if (!starIds.contains(home)) {
                    throw new ValidationException("Home star " + home + " is not in the topology");
                }
                if (!homes.add(home)) {
                    throw new ValidationException("Home star " + home + " assigned to more than one player");
                }
            }
            types.add(type);
        }
        return types;
    }

    private void saveTopology(String gameId, GalaxyTopology topology) {
        List<StarEntity> stars = new ArrayList<>();
        for (Star star : topology.getStars()) {
            stars.add(StarEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gameId(gameId)
                    .starId(star.getId())
                    .name(star.getName())
                    .posX(star.getPosX())
                    .posY(star.getPosY())
                    .posZ(star.getPosZ())
                    .resource(star.getResource())
                    .build());
        }
        starJpaRepository.saveAll(stars);

        List<WormholeEntity> wormholes = new ArrayList<>();
        for (Wormhole wormhole : topology.getWormholes()) {
            String a = wormhole.getStarAId();
            String b = wormhole.getStarBId();
            boolean ordered = a.compareTo(b) < 0;
            wormholes.add(WormholeEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gameId(gameId)
                    .starAId(ordered ? a : b)
                    .starBId(ordered ? b : a)
                    .build());
        }
        wormholeJpaRepository.saveAll(wormholes);
    }

    private PlayerEntity savePlayer(String gameId, PlayerSetup setup, PlayerType type) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (type == PlayerType.AI) {
            meta.put(Player.META_MAIN_AI, setup.getAiName() != null ? setup.getAiName() : RandyAiStrategy.NAME);
            meta.put(Player.META_AI_CONFIG, setup.getAiConfig() != null ? setup.getAiConfig() : Map.of());
        }
        PlayerEntity entity = PlayerEntity.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .userId(setup.getUserId())
                .name(setup.getName())
                .colorHex(setup.getColorHex())
                .countryName(setup.getCountryName())
                .status(PlayerStatus.ACTIVE)
                .type(type)
                .meta(JsonHelper.toJson(meta))
                .build();
        return playerJpaRepository.save(entity);
    }

    private void saveStarStates(
            String gameId, GalaxyTopology topology, Map<String, String> ownerByStar, LocalDateTime now) {
        List<StarStateEntity> states = new ArrayList<>();
        for (Star star : topology.getStars()) {
            String owner = ownerByStar.get(star.getId());
            Economy economy = owner != null
                    ? Economy.builder()
                            .available(gameSetupConfig.getStartingAvailable())
                            .industry(gameSetupConfig.getStartingIndustry())
                            .technology(gameSetupConfig.getStartingTechnology())
                            .resource(star.getResource())
                            .build()
                    : Economy.builder().resource(star.getResource()).build();
            states.add(StarStateEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gameId(gameId)
                    .starId(star.getId())
                    .ownerPlayerId(owner)
                    .economy(JsonHelper.toJson(economy))
                    .damage(JsonHelper.toJson(Map.of()))
                    .details(JsonHelper.toJson(Map.of()))
                    .hasStandingOrders(false)
                    .updatedAt(now)
                    .build());
        }
        starStateJpaRepository.saveAll(states);
    }

    /** Seat {@code index} gets power reduced by its index, never below 1. */
    private void saveStartingShip(String gameId, String playerId, String starId, int index, LocalDateTime now) {
        ShipEntity ship = ShipEntity.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .ownerPlayerId(playerId)
                .locationStarId(starId)
                .hp(gameSetupConfig.getStartingShipHp())
                .power(Math.max(1, gameSetupConfig.getStartingShipPower() - index))
                .status(ShipStatus.ACTIVE)
                .createdAt(now)
                .build();
        shipJpaRepository.save(ship);
    }
}
