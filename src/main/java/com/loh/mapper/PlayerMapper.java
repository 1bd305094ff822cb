package com.loh.mapper;

import com.loh.domain.model.Player;
import com.loh.entity.PlayerEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Player and PlayerEntity. The meta bag is a JSON object in the entity.
 */
@Mapper
public interface PlayerMapper {

    @Mapping(source = "meta", target = "meta", qualifiedByName = "metaToJson")
    PlayerEntity toEntity(Player player);

    @Mapping(source = "meta", target = "meta", qualifiedByName = "jsonToMeta")
    Player toDomain(PlayerEntity entity);

    List<Player> toDomainList(List<PlayerEntity> entities);

    @Named("metaToJson")
    default String metaToJson(Map<String, Object> meta) {
        return JsonHelper.toJson(meta);
    }

    @Named("jsonToMeta")
    default Map<String, Object> jsonToMeta(String json) {
        return JsonHelper.toMap(json);
    }
}
