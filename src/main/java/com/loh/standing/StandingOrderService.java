package com.loh.standing;

import com.loh.domain.model.StandingOrders;
import com.loh.domain.model.StarState;
import com.loh.entity.StarStateEntity;
import com.loh.exception.InvalidStandingOrderException;
import com.loh.exception.ResourceNotFoundException;
import com.loh.exception.ValidationException;
import com.loh.mapper.JsonHelper;
import com.loh.repository.jpa.StarStateJpaRepository;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes the standing-order template kept in a star's details bag.
 */
@Service
public class StandingOrderService {

    private static final Logger log = LoggerFactory.getLogger(StandingOrderService.class);

    private final StarStateJpaRepository starStateJpaRepository;

    public StandingOrderService(StarStateJpaRepository starStateJpaRepository) {
        this.starStateJpaRepository = starStateJpaRepository;
    }

    /**
     * Stores the template for a star, replacing any previous one.
     *
     * @throws InvalidStandingOrderException if a percentage is negative or the industry split exceeds 100
     * @throws ResourceNotFoundException if the star has no state in this game
     */
    @Transactional
    public StandingOrders setStandingOrders(String gameId, String starId, StandingOrders standingOrders) {
        if (standingOrders == null) {
            throw new ValidationException("Standing orders are required");
        }
        validate(starId, standingOrders);

        StarStateEntity starState = requireStarState(gameId, starId);
        Map<String, Object> details = JsonHelper.toMap(starState.getDetails());
        details.put(StarState.DETAILS_STANDING_ORDERS, JsonHelper.asMap(standingOrders));
        starState.setDetails(JsonHelper.toJson(details));
        starState.setHasStandingOrders(true);
        starState.setUpdatedAt(LocalDateTime.now());
        starStateJpaRepository.save(starState);

        log.info("Standing orders set for star {} in game {}", starId, gameId);
        return standingOrders;
    }

    @Transactional(readOnly = true)
    public Optional<StandingOrders> getStandingOrders(String gameId, String starId) {
        StarStateEntity starState = requireStarState(gameId, starId);
        return read(starState);
    }

    @Transactional
    public void clearStandingOrders(String gameId, String starId) {
        StarStateEntity starState = requireStarState(gameId, starId);
        Map<String, Object> details = JsonHelper.toMap(starState.getDetails());
        if (details.remove(StarState.DETAILS_STANDING_ORDERS) == null && !starState.isHasStandingOrders()) {
            return;
        }
        starState.setDetails(JsonHelper.toJson(details));
        starState.setHasStandingOrders(false);
        starState.setUpdatedAt(LocalDateTime.now());
        starStateJpaRepository.save(starState);
        log.info("Standing orders cleared for star {} in game {}", starId, gameId);
    }

    /** Parses the template out of a star-state row, if it has one. */
    static Optional<StandingOrders> read(StarStateEntity starState) {
        Object raw = JsonHelper.toMap(starState.getDetails()).get(StarState.DETAILS_STANDING_ORDERS);
        return Optional.ofNullable(JsonHelper.convert(raw, StandingOrders.class));
    }

    private void validate(String starId, StandingOrders standingOrders) {
        StandingOrders.Industry industry = standingOrders.getIndustry();
        if (industry != null) {
            checkPercent(starId, "expand", industry.getExpandPercent());
            checkPercent(starId, "research", industry.getResearchPercent());
            checkPercent(starId, "build", industry.getBuildPercent());
            if (industry.total() > 100) {
                throw new InvalidStandingOrderException(
                        starId, "industry percentages add up to " + industry.total() + ", maximum is 100");
            }
        }
        StandingOrders.Move move = standingOrders.getMove();
        if (move != null && (move.getDestinationStarId() == null || move.getDestinationStarId().isBlank())) {
            throw new InvalidStandingOrderException(starId, "move template needs a destination star");
        }
    }

    private void checkPercent(String starId, String field, Double value) {
        if (value != null && (value < 0 || value > 100)) {
            throw new InvalidStandingOrderException(starId, field + " must be between 0 and 100, got " + value);
        }
    }

    private StarStateEntity requireStarState(String gameId, String starId) {
        return starStateJpaRepository
                .findByGameIdAndStarId(gameId, starId)
                .orElseThrow(() -> new ResourceNotFoundException("Star state", gameId + "/" + starId));
    }
}
