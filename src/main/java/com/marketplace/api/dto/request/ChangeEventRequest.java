package com.marketplace.api.dto.request;

import com.marketplace.exception.BusinessException;
import com.marketplace.exception.ErrorCode;
import com.marketplace.realtime.ChangeOperation;
import com.marketplace.realtime.EntityType;
import com.marketplace.realtime.RawChangeEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Locale;
import java.util.Map;
import lombok.Data;

/**
 * Raw change event injected through the debug API. {@code entity} accepts the entity name
 * ({@code ORDER}) or the change-stream table name ({@code marketplace_orders}).
 */
@Data
public class ChangeEventRequest {

    @NotBlank
    private String entity;

    @NotNull
    private ChangeOperation operation;

    private Map<String, Object> before;

    private Map<String, Object> after;

    public RawChangeEvent toRawChangeEvent() {
        return RawChangeEvent.builder()
                .entity(resolveEntity())
                .operation(operation)
                .before(before)
                .after(after)
                .build();
    }

    private EntityType resolveEntity() {
        for (EntityType type : EntityType.values()) {
            if (type.name().equals(entity.toUpperCase(Locale.ROOT))) {
                return type;
            }
        }
        try {
            return EntityType.fromTable(entity);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(
                    ErrorCode.UNSUPPORTED_ENTITY, "Unknown entity: " + entity, Map.of("entity", entity));
        }
    }
}
