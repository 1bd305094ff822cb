package com.loh.order;

import com.loh.domain.enums.OrderType;
import com.loh.domain.enums.TurnStatus;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.payload.MovePayload;
import com.loh.domain.payload.OrderPayload;
import com.loh.entity.OrderSubmissionEntity;
import com.loh.exception.InvalidStateException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.exception.ValidationException;
import com.loh.mapper.OrderSubmissionMapper;
import com.loh.repository.jpa.OrderSubmissionJpaRepository;
import com.loh.repository.jpa.TurnJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only store of order revisions.
 *
 * <p>Orders are never updated in place. Each logical order is identified by a
 * {@code clientOrderId}; creating, editing and deleting it all insert a new revision, and the
 * highest revision is its current state. Ending a turn copies the latest non-deleted revision
 * of every order into a new "final" revision, which is what the resolution engine reads.
 *
 * <p>Invariant kept here: after {@link #finalizePlayerTurn} returns, the player has exactly one
 * final row per non-deleted clientOrderId for that turn and no stale final rows.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderSubmissionJpaRepository orderSubmissionJpaRepository;
    private final TurnJpaRepository turnJpaRepository;
    private final OrderSubmissionMapper orderSubmissionMapper;

    public OrderService(
            OrderSubmissionJpaRepository orderSubmissionJpaRepository,
            TurnJpaRepository turnJpaRepository,
            OrderSubmissionMapper orderSubmissionMapper) {
        this.orderSubmissionJpaRepository = orderSubmissionJpaRepository;
        this.turnJpaRepository = turnJpaRepository;
        this.orderSubmissionMapper = orderSubmissionMapper;
    }

    /**
     * Creates a new logical order with a fresh clientOrderId at revision 1.
     *
     * @throws ResourceNotFoundException if the turn does not exist or is not open
     * @throws ValidationException if the payload is missing fields or does not match the type
     */
    @Transactional
    public OrderSubmission createDraft(
            String gameId, String turnId, String playerId, OrderType orderType, OrderPayload payload) {
        requireOpenTurn(gameId, turnId);
        validatePayload(orderType, payload);

        OrderSubmissionEntity saved = insertRevision(
                gameId, turnId, playerId, UUID.randomUUID().toString(), 1, orderType, payload);

        log.debug(
                "Draft {} created: game={}, turn={}, player={}, type={}",
                saved.getClientOrderId(),
                gameId,
                turnId,
                playerId,
                orderType);
        return orderSubmissionMapper.toDomain(saved);
    }

    /**
     * Replaces the content of an existing order by inserting revision {@code latest + 1}.
     *
     * @throws ResourceNotFoundException if no revision of the order exists
     * @throws InvalidStateException if the order's latest revision is a deletion
     */
    @Transactional
    public OrderSubmission editDraft(
            String gameId,
            String turnId,
            String playerId,
            String clientOrderId,
            OrderType orderType,
            OrderPayload payload) {
        requireOpenTurn(gameId, turnId);
        validatePayload(orderType, payload);
        OrderSubmissionEntity latest = requireLiveRevision(gameId, turnId, playerId, clientOrderId);

        OrderSubmissionEntity saved = insertRevision(
                gameId, turnId, playerId, clientOrderId, latest.getRevision() + 1, orderType, payload);
        return orderSubmissionMapper.toDomain(saved);
    }

    /**
     * Tombstones an order. The deletion revision carries the previous type and payload forward
     * so the row stays self-describing.
     */
    @Transactional
    public OrderSubmission deleteDraft(String gameId, String turnId, String playerId, String clientOrderId) {
        requireOpenTurn(gameId, turnId);
        OrderSubmissionEntity latest = requireLiveRevision(gameId, turnId, playerId, clientOrderId);

        OrderSubmissionEntity tombstone = OrderSubmissionEntity.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .turnId(turnId)
                .playerId(playerId)
                .clientOrderId(clientOrderId)
                .revision(latest.getRevision() + 1)
                .orderType(latest.getOrderType())
                .sourceStarId(latest.getSourceStarId())
                .payload(latest.getPayload())
                .deleted(true)
                .finalized(false)
                .createdAt(LocalDateTime.now())
                .build();
        OrderSubmissionEntity saved = orderSubmissionJpaRepository.save(tombstone);
        log.debug("Draft {} deleted at revision {}", clientOrderId, saved.getRevision());
        return orderSubmissionMapper.toDomain(saved);
    }

    /**
     * Current drafts of a player: for every clientOrderId the highest revision, dropping
     * deletions and finalized rows. Newest first.
     */
    @Transactional(readOnly = true)
    public List<OrderSubmission> listLatestDrafts(String gameId, String turnId, String playerId) {
        List<OrderSubmissionEntity> rows =
                orderSubmissionJpaRepository.findByGameIdAndTurnIdAndPlayerId(gameId, turnId, playerId);
        return orderSubmissionMapper.toDomainList(currentDrafts(rows));
    }

    /**
     * Current drafts that originate at a star, optionally narrowed to one player and/or one type.
     */
    @Transactional(readOnly = true)
    public List<OrderSubmission> listDraftsForStar(
            String gameId, String turnId, String starId, String playerId, OrderType orderType) {
        List<OrderSubmissionEntity> rows =
                orderSubmissionJpaRepository.findByGameIdAndTurnIdAndSourceStarId(gameId, turnId, starId);
        List<OrderSubmissionEntity> drafts = currentDrafts(rows).stream()
                .filter(row -> playerId == null || playerId.equals(row.getPlayerId()))
                .filter(row -> orderType == null || orderType == row.getOrderType())
                .toList();
        return orderSubmissionMapper.toDomainList(drafts);
    }

    /**
     * Commits a player's drafts for the turn.
     *
     * <p>Clears any earlier final flags first, then inserts one final revision for each order
     * whose latest revision is not a deletion. Calling it again re-finalizes from the current
     * drafts, so it is safe to repeat.
     *
     * @return the final rows written, possibly empty
     * @throws ResourceNotFoundException if the turn does not exist or is not open
     */
    @Transactional
    public List<OrderSubmission> finalizePlayerTurn(String gameId, String turnId, String playerId) {
        requireOpenTurn(gameId, turnId);
        int cleared = orderSubmissionJpaRepository.clearFinalFlags(gameId, turnId, playerId);

        List<OrderSubmissionEntity> rows =
                orderSubmissionJpaRepository.findByGameIdAndTurnIdAndPlayerId(gameId, turnId, playerId);
        LocalDateTime finalizedAt = LocalDateTime.now();

        List<OrderSubmissionEntity> finals = new ArrayList<>();
        for (OrderSubmissionEntity latest : latestPerClientOrder(rows)) {
            if (latest.isDeleted()) {
                continue;
            }
            finals.add(OrderSubmissionEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .gameId(gameId)
                    .turnId(turnId)
                    .playerId(playerId)
                    .clientOrderId(latest.getClientOrderId())
                    .revision(latest.getRevision() + 1)
                    .orderType(latest.getOrderType())
                    .sourceStarId(latest.getSourceStarId())
                    .payload(latest.getPayload())
                    .deleted(false)
                    .finalized(true)
                    .finalizedAt(finalizedAt)
                    .createdAt(finalizedAt)
                    .build());
        }
        List<OrderSubmissionEntity> saved = orderSubmissionJpaRepository.saveAll(finals);

        log.info(
                "Finalized {} orders for player {} in game {} turn {} (cleared {} stale finals)",
                saved.size(),
                playerId,
                gameId,
                turnId,
                cleared);
        return orderSubmissionMapper.toDomainList(saved);
    }

    /**
     * All final orders of a turn in resolution order (by player, then clientOrderId),
     * optionally restricted to one player.
     */
    @Transactional(readOnly = true)
    public List<OrderSubmission> listFinalOrders(String gameId, String turnId, String playerId) {
        List<OrderSubmissionEntity> finals = orderSubmissionJpaRepository.findFinalOrders(gameId, turnId).stream()
                .filter(row -> playerId == null || playerId.equals(row.getPlayerId()))
                .toList();
        return orderSubmissionMapper.toDomainList(finals);
    }

    private OrderSubmissionEntity insertRevision(
            String gameId,
            String turnId,
            String playerId,
            String clientOrderId,
            int revision,
            OrderType orderType,
            OrderPayload payload) {
        OrderSubmission order = OrderSubmission.builder()
                .id(UUID.randomUUID().toString())
                .gameId(gameId)
                .turnId(turnId)
                .playerId(playerId)
                .clientOrderId(clientOrderId)
                .revision(revision)
                .orderType(orderType)
                .payload(payload)
                .deleted(false)
                .finalized(false)
                .createdAt(LocalDateTime.now())
                .build();
        return orderSubmissionJpaRepository.save(orderSubmissionMapper.toEntity(order));
    }

    private OrderSubmissionEntity requireLiveRevision(
            String gameId, String turnId, String playerId, String clientOrderId) {
        Optional<OrderSubmissionEntity> latest =
                orderSubmissionJpaRepository.findFirstByGameIdAndTurnIdAndPlayerIdAndClientOrderIdOrderByRevisionDesc(
                        gameId, turnId, playerId, clientOrderId);
        OrderSubmissionEntity entity =
                latest.orElseThrow(() -> new ResourceNotFoundException("Order", clientOrderId));
        if (entity.isDeleted()) {
            throw new InvalidStateException("Order " + clientOrderId + " has been deleted");
        }
        return entity;
    }

    private void requireOpenTurn(String gameId, String turnId) {
        turnJpaRepository
                .findById(turnId)
                .filter(turn -> turn.getGameId().equals(gameId) && turn.getStatus() == TurnStatus.OPEN)
                .orElseThrow(() -> new ResourceNotFoundException("Open turn", gameId + "/" + turnId));
    }

    private void validatePayload(OrderType orderType, OrderPayload payload) {
        if (orderType == null) {
            throw new ValidationException("Order type is required");
        }
        if (payload == null) {
            throw new ValidationException("Payload is required for " + orderType.getCode() + " orders");
        }
        if (!orderType.getPayloadType().isInstance(payload)) {
            throw new ValidationException(
                    "Payload does not match order type " + orderType.getCode(),
                    Map.of("expected", orderType.getPayloadType().getSimpleName()));
        }
        if (payload.getSourceStarId() == null || payload.getSourceStarId().isBlank()) {
            throw new ValidationException("sourceStarId is required");
        }
        if (payload instanceof MovePayload move
                && (move.getDestinationStarId() == null || move.getDestinationStarId().isBlank())) {
            throw new ValidationException("destinationStarId is required for " + orderType.getCode() + " orders");
        }
    }

    /** Latest revision of each clientOrderId that is neither deleted nor final, newest first. */
    static List<OrderSubmissionEntity> currentDrafts(List<OrderSubmissionEntity> rows) {
        return latestPerClientOrder(rows).stream()
                .filter(row -> !row.isDeleted() && !row.isFinalized())
                .sorted(Comparator.comparing(
                                OrderSubmissionEntity::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(OrderSubmissionEntity::getClientOrderId))
                .toList();
    }

    static List<OrderSubmissionEntity> latestPerClientOrder(List<OrderSubmissionEntity> rows) {
        Map<String, OrderSubmissionEntity> latest = rows.stream()
                .collect(Collectors.toMap(
                        OrderSubmissionEntity::getClientOrderId,
                        Function.identity(),
                        (a, b) -> a.getRevision() >= b.getRevision() ? a : b));
        return new ArrayList<>(latest.values());
    }
}
