package com.customer.matching.cache;

import com.customer.matching.core.model.BusinessRecord;
import com.customer.matching.core.model.HasStableId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * How an entity identifies itself for caching: either by a stable id, or
 * anonymously by its full content.
 */
public interface EntityIdentity {

    /**
     * Entity with a stable identifier.
     */
    record Identified(String id) implements EntityIdentity {
        public Identified {
            Objects.requireNonNull(id, "id is required");
        }
    }

    /**
     * Entity without an identifier; identified by its content.
     */
    record Anonymous(Object payload) implements EntityIdentity {
    }

    /**
     * Classifies an entity. Records implementing {@link HasStableId} and raw maps
     * carrying one of the {@link BusinessRecord#ID_FIELDS} are identified.
     */
    static EntityIdentity of(Object entity) {
        if (entity instanceof HasStableId withId) {
            Optional<String> id = withId.stableId();
            if (id.isPresent()) {
                return new Identified(id.get());
            }
            Object payload = entity instanceof BusinessRecord record ? record.attributes() : entity;
            return new Anonymous(payload);
        }
        if (entity instanceof Map<?, ?> map) {
            for (String field : BusinessRecord.ID_FIELDS) {
                Object value = map.get(field);
                if (value != null && !String.valueOf(value).isBlank()) {
                    return new Identified(String.valueOf(value));
                }
            }
        }
        return new Anonymous(entity);
    }
}
