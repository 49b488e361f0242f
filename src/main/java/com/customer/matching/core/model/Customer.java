package com.customer.matching.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Map;

/**
 * A customer (or lead) record from the CRM.
 */
public final class Customer extends BusinessRecord {

    private Customer(Map<String, ?> attributes) {
        super(attributes);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Customer of(Map<String, ?> attributes) {
        return new Customer(attributes);
    }

    public String getName() {
        String name = getString("customer_name");
        return name != null ? name : getString("name");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractBuilder<Customer, Builder> {

        public Builder name(String name) {
            return attribute("customer_name", name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Customer build() {
            return new Customer(attributes);
        }
    }
}
