package com.loh.mapper;

import com.loh.domain.model.Turn;
import com.loh.entity.TurnEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TurnMapper {

    TurnEntity toEntity(Turn turn);

    Turn toDomain(TurnEntity entity);

    List<Turn> toDomainList(List<TurnEntity> entities);
}
