package com.loh.mapper;

import com.loh.domain.model.OrderSubmission;
import com.loh.domain.payload.OrderPayload;
import com.loh.entity.OrderSubmissionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between OrderSubmission and OrderSubmissionEntity.
 *
 * <p>The payload column is plain JSON without a type tag; the concrete payload class
 * is taken from the row's order type when reading it back.
 */
@Mapper
public interface OrderSubmissionMapper {

    @Mapping(source = "payload", target = "payload", qualifiedByName = "payloadToJson")
    OrderSubmissionEntity toEntity(OrderSubmission order);

    @Mapping(target = "payload", expression = "java(payloadFromJson(entity))")
    OrderSubmission toDomain(OrderSubmissionEntity entity);

    List<OrderSubmission> toDomainList(List<OrderSubmissionEntity> entities);

    @Named("payloadToJson")
    default String payloadToJson(OrderPayload payload) {
        return JsonHelper.toJson(payload);
    }

    @Named("payloadFromJson")
    default OrderPayload payloadFromJson(OrderSubmissionEntity entity) {
        if (entity.getOrderType() == null) {
            return null;
        }
        return JsonHelper.fromJson(entity.getPayload(), entity.getOrderType().getPayloadType());
    }
}
