package com.customer.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for the dashboard's customer and employee records.
 *
 * Records are immutable attribute maps exactly as the dashboard holds them,
 * so they can be shipped to the matching service unchanged. Equality is
 * structural over the attributes.
 */
public abstract class BusinessRecord implements HasStableId {

    /**
     * Identifier fields, checked in this order.
     */
    public static final List<String> ID_FIELDS = List.of(
            "id", "customer_id", "employee_id", "customerId", "employeeId");

    private final Map<String, Object> attributes;

    protected BusinessRecord(Map<String, ?> attributes) {
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    @JsonValue
    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object get(String field) {
        return attributes.get(field);
    }

    /**
     * Returns the field as a string, or null when absent.
     */
    public String getString(String field) {
        Object value = attributes.get(field);
        return value != null ? String.valueOf(value) : null;
    }

    public String getIndustry() {
        return getString("industry");
    }

    public String getRole() {
        return getString("role");
    }

    public String getDescription() {
        return getString("description");
    }

    @Override
    public Optional<String> stableId() {
        for (String field : ID_FIELDS) {
            Object value = attributes.get(field);
            if (value == null) {
                continue;
            }
            String id = String.valueOf(value);
            if (!id.isBlank()) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BusinessRecord that = (BusinessRecord) o;
        return attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), attributes);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }

    /**
     * Fluent builder shared by the concrete record types.
     */
    protected abstract static class AbstractBuilder<T extends BusinessRecord, B extends AbstractBuilder<T, B>> {
        protected final Map<String, Object> attributes = new LinkedHashMap<>();

        public B id(Object id) {
            return attribute("id", id);
        }

        public B industry(String industry) {
            return attribute("industry", industry);
        }

        public B role(String role) {
            return attribute("role", role);
        }

        public B description(String description) {
            return attribute("description", description);
        }

        public B attribute(String key, Object value) {
            Objects.requireNonNull(key, "key is required");
            attributes.put(key, value);
            return self();
        }

        protected abstract B self();

        public abstract T build();
    }
}
