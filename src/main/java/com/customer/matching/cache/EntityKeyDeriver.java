package com.customer.matching.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives stable cache keys from customer and employee records.
 *
 * <ul>
 *   <li>{@code id:<id>} for entities with a stable id</li>
 *   <li>{@code json:<canonical json>} otherwise, object keys sorted at every level</li>
 *   <li>{@code str:<toString>} if serialization fails</li>
 * </ul>
 *
 * Key derivation is pure and never throws.
 */
public final class EntityKeyDeriver {
    private static final Logger log = LoggerFactory.getLogger(EntityKeyDeriver.class);

    public static final String PAIR_SEPARATOR = "||";

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    private EntityKeyDeriver() {
    }

    /**
     * Derives the cache key of a single entity.
     */
    public static String deriveKey(Object entity) {
        if (entity == null) {
            return "null";
        }
        EntityIdentity identity = EntityIdentity.of(entity);
        if (identity instanceof EntityIdentity.Identified identified) {
            return "id:" + identified.id();
        }
        Object payload = ((EntityIdentity.Anonymous) identity).payload();
        try {
            return "json:" + CANONICAL_MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Falling back to string key for {}: {}", entity.getClass().getSimpleName(), e.getMessage());
            return "str:" + safeToString(payload);
        }
    }

    private static String safeToString(Object payload) {
        try {
            return String.valueOf(payload);
        } catch (RuntimeException e) {
            return payload.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(payload));
        }
    }

    /**
     * Derives the pairwise key for a customer/employee pair.
     */
    public static String pairKey(Object customer, Object employee) {
        return deriveKey(customer) + PAIR_SEPARATOR + deriveKey(employee);
    }

    /**
     * Returns true if the pair key belongs to the given customer key.
     */
    public static boolean isCustomerOf(String pairKey, String customerKey) {
        return pairKey.startsWith(customerKey + PAIR_SEPARATOR);
    }

    /**
     * Returns true if the pair key belongs to the given employee key.
     */
    public static boolean isEmployeeOf(String pairKey, String employeeKey) {
        return pairKey.endsWith(PAIR_SEPARATOR + employeeKey);
    }
}
