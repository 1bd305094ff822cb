package com.loh.mapper;

import com.loh.domain.model.Star;
import com.loh.domain.model.Wormhole;
import com.loh.entity.StarEntity;
import com.loh.entity.WormholeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the static topology tables. A star's domain id is the
 * game-scoped {@code star_id}, not the row's surrogate key.
 */
@Mapper
public interface GalaxyMapper {

    @Mapping(source = "starId", target = "id")
    Star toDomain(StarEntity entity);

    List<Star> toStarList(List<StarEntity> entities);

    Wormhole toDomain(WormholeEntity entity);

    List<Wormhole> toWormholeList(List<WormholeEntity> entities);
}
