package com.loh.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.loh.domain.enums.OrderType;
import com.loh.domain.model.OrderSubmission;
import com.loh.domain.payload.BuildPayload;
import com.loh.domain.payload.MovePayload;
import com.loh.entity.OrderSubmissionEntity;
import com.loh.mapper.JsonHelper;
import com.loh.mapper.OrderSubmissionMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class OrderSubmissionMapperTest {

    private OrderSubmissionMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = Mappers.getMapper(OrderSubmissionMapper.class);
    }

    @Test
    @DisplayName("build payload is stored with the wire keys and read back by order type")
    void buildPayload() {
        OrderSubmission order = OrderSubmission.builder()
                .id("o1")
                .gameId("game-1")
                .turnId("turn-1")
                .playerId("p1")
                .clientOrderId("c1")
                .revision(2)
                .orderType(OrderType.AUTO_BUILD)
                .payload(BuildPayload.builder()
                        .sourceStarId("s1")
                        .buildPoints(6.0)
                        .expandPoints(4.0)
                        .fromStandingOrder(true)
                        .build())
                .build();

        OrderSubmissionEntity entity = mapper.toEntity(order);

        assertThat(entity.getSourceStarId()).isEqualTo("s1");
        Map<String, Object> json = JsonHelper.toMap(entity.getPayload());
        assertThat(json).containsEntry("build", 6.0).containsEntry("expand", 4.0).doesNotContainKey("research");

        OrderSubmission back = mapper.toDomain(entity);
        assertThat(back.getPayload()).isInstanceOf(BuildPayload.class);
        BuildPayload payload = (BuildPayload) back.getPayload();
        assertThat(payload.getBuildPoints()).isEqualTo(6.0);
        assertThat(payload.isFromStandingOrder()).isTrue();
        assertThat(back.getRevision()).isEqualTo(2);
    }

    @Test
    @DisplayName("move payload comes back as a MovePayload with its ship selection")
    void movePayload() {
        OrderSubmissionEntity entity = OrderSubmissionEntity.builder()
                .id("o2")
                .orderType(OrderType.MOVE)
                .payload("{\"sourceStarId\":\"s1\",\"destinationStarId\":\"s2\",\"selectedShipIds\":[\"a\",\"b\"]}")
                .build();

        OrderSubmission order = mapper.toDomain(entity);

        assertThat(order.getPayload()).isInstanceOf(MovePayload.class);
        MovePayload payload = (MovePayload) order.getPayload();
        assertThat(payload.getDestinationStarId()).isEqualTo("s2");
        assertThat(payload.getSelectedShipIds()).containsExactly("a", "b");
        assertThat(order.getSourceStarId()).isEqualTo("s1");
    }

    @Test
    @DisplayName("unknown JSON fields are ignored on read")
    void unknownFieldsIgnored() {
        OrderSubmissionEntity entity = OrderSubmissionEntity.builder()
                .orderType(OrderType.BUILD)
                .payload("{\"sourceStarId\":\"s1\",\"ships\":3,\"legacyFlag\":true}")
                .build();

        BuildPayload payload = (BuildPayload) mapper.toDomain(entity).getPayload();

        assertThat(payload.getShips()).isEqualTo(3);
    }

    @Test
    @DisplayName("lists map element by element")
    void list() {
        OrderSubmissionEntity entity = OrderSubmissionEntity.builder()
                .orderType(OrderType.MOVE)
                .payload("{\"sourceStarId\":\"s1\",\"destinationStarId\":\"s2\"}")
                .build();

        assertThat(mapper.toDomainList(List.of(entity, entity))).hasSize(2);
    }
}
