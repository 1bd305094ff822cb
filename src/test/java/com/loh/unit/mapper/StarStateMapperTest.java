package com.loh.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.loh.domain.model.Economy;
import com.loh.domain.model.StandingOrders;
import com.loh.domain.model.StarState;
import com.loh.entity.StarStateEntity;
import com.loh.mapper.JsonHelper;
import com.loh.mapper.StarStateMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class StarStateMapperTest {

    private final StarStateMapper mapper = Mappers.getMapper(StarStateMapper.class);

    @Test
    void missingEconomyReadsAsEmpty() {
        StarStateEntity entity = StarStateEntity.builder().id("ss1").gameId("g").starId("s1").build();

        StarState state = mapper.toDomain(entity);

        assertThat(state.getEconomy()).isNotNull();
        assertThat(state.getEconomy().getAvailable()).isZero();
        assertThat(state.getDetails()).isEmpty();
    }

    @Test
    void standingOrdersUseShortIndustryKeys() {
        StandingOrders template = StandingOrders.builder()
                .industry(StandingOrders.Industry.builder().buildPercent(60.0).expandPercent(40.0).build())
                .build();
        StarState state = StarState.builder()
                .id("ss1")
                .starId("s1")
                .economy(Economy.builder().available(5).technology(2).build())
                .details(Map.of(StarState.DETAILS_STANDING_ORDERS, JsonHelper.asMap(template)))
                .build();

        StarStateEntity entity = mapper.toEntity(state);

        assertThat(entity.getDetails()).contains("\"build\":60.0").contains("\"expand\":40.0");
        StarState back = mapper.toDomain(entity);
        StandingOrders parsed =
                JsonHelper.convert(back.getDetails().get(StarState.DETAILS_STANDING_ORDERS), StandingOrders.class);
        assertThat(parsed.getIndustry().total()).isEqualTo(100.0);
        assertThat(back.getEconomy().shipCost()).isEqualTo(2.0);
    }
}
