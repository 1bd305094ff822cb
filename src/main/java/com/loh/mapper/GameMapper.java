package com.loh.mapper;

import com.loh.domain.model.Game;
import com.loh.entity.GameEntity;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface GameMapper {

    @Mapping(source = "params", target = "params", qualifiedByName = "mapToJson")
    GameEntity toEntity(Game game);

    @Mapping(source = "params", target = "params", qualifiedByName = "jsonToMap")
    Game toDomain(GameEntity entity);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> value) {
        return JsonHelper.toJson(value);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
