package com.loh.mapper;

import com.loh.domain.model.Economy;
import com.loh.domain.model.StarState;
import com.loh.entity.StarStateEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between StarState and StarStateEntity. Economy, damage and details
 * are JSON text in the entity. The standing-order flag is maintained by the service
 * that writes the details bag, so it is not derived here.
 */
@Mapper
public interface StarStateMapper {

    @Mapping(source = "economy", target = "economy", qualifiedByName = "economyToJson")
    @Mapping(source = "damage", target = "damage", qualifiedByName = "bagToJson")
    @Mapping(source = "details", target = "details", qualifiedByName = "bagToJson")
    @Mapping(target = "hasStandingOrders", ignore = true)
    StarStateEntity toEntity(StarState starState);

    @Mapping(source = "economy", target = "economy", qualifiedByName = "jsonToEconomy")
    @Mapping(source = "damage", target = "damage", qualifiedByName = "jsonToBag")
    @Mapping(source = "details", target = "details", qualifiedByName = "jsonToBag")
    StarState toDomain(StarStateEntity entity);

    List<StarState> toDomainList(List<StarStateEntity> entities);

    @Named("economyToJson")
    default String economyToJson(Economy economy) {
        return JsonHelper.toJson(economy);
    }

    @Named("jsonToEconomy")
    default Economy jsonToEconomy(String json) {
        Economy economy = JsonHelper.fromJson(json, Economy.class);
        return economy != null ? economy : new Economy();
    }

    @Named("bagToJson")
    default String bagToJson(Map<String, Object> bag) {
        return JsonHelper.toJson(bag);
    }

    @Named("jsonToBag")
    default Map<String, Object> jsonToBag(String json) {
        return JsonHelper.toMap(json);
    }
}
