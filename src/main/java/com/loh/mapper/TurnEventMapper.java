package com.loh.mapper;

import com.loh.domain.model.TurnEvent;
import com.loh.entity.TurnEventEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface TurnEventMapper {

    @Mapping(source = "details", target = "details", qualifiedByName = "detailsToJson")
    TurnEventEntity toEntity(TurnEvent event);

    @Mapping(source = "details", target = "details", qualifiedByName = "jsonToDetails")
    TurnEvent toDomain(TurnEventEntity entity);

    List<TurnEvent> toDomainList(List<TurnEventEntity> entities);

    @Named("detailsToJson")
    default String detailsToJson(Map<String, Object> details) {
        return JsonHelper.toJson(details);
    }

    @Named("jsonToDetails")
    default Map<String, Object> jsonToDetails(String json) {
        return JsonHelper.toMap(json);
    }
}
