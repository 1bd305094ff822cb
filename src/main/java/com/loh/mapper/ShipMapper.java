package com.loh.mapper;

import com.loh.domain.model.Ship;
import com.loh.entity.ShipEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface ShipMapper {

    @Mapping(source = "details", target = "details", qualifiedByName = "detailsToJson")
    ShipEntity toEntity(Ship ship);

    @Mapping(source = "details", target = "details", qualifiedByName = "jsonToDetails")
    Ship toDomain(ShipEntity entity);

    List<Ship> toDomainList(List<ShipEntity> entities);

    @Named("detailsToJson")
    default String detailsToJson(Map<String, Object> details) {
        return JsonHelper.toJson(details);
    }

    @Named("jsonToDetails")
    default Map<String, Object> jsonToDetails(String json) {
        return JsonHelper.toMap(json);
    }
}
