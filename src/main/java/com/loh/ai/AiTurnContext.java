package com.loh.ai;

import com.loh.domain.enums.OrderType;
import com.loh.domain.model.GameState;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.model.Turn;
import com.loh.domain.payload.OrderPayload;
import com.loh.order.OrderService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * What an AI strategy sees and can do during one turn: a filtered view of the game and a
 * way to submit draft orders for its own seat in the open turn.
 */
@Getter
public class AiTurnContext {

    private final String gameId;
    private final String playerId;
    private final Turn turn;
    private final GameState state;
    @Getter(AccessLevel.NONE)
    private final OrderService orderService;

    private final List<OrderSubmission> submitted = new ArrayList<>();

    public AiTurnContext(String gameId, String playerId, Turn turn, GameState state, OrderService orderService) {
        this.gameId = gameId;
        this.playerId = playerId;
        this.turn = turn;
        this.state = state;
        this.orderService = orderService;
    }

    public OrderSubmission submit(OrderType orderType, OrderPayload payload) {
        OrderSubmission order = orderService.createDraft(gameId, turn.getId(), playerId, orderType, payload);
        submitted.add(order);
        return order;
    }

    public List<OrderSubmission> getSubmitted() {
        return Collections.unmodifiableList(submitted);
    }
}
