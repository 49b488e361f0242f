package com.customer.matching.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Map;

/**
 * An employee profile that can be assigned to customers.
 */
public final class Employee extends BusinessRecord {

    private Employee(Map<String, ?> attributes) {
        super(attributes);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Employee of(Map<String, ?> attributes) {
        return new Employee(attributes);
    }

    public String getName() {
        return getString("name");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractBuilder<Employee, Builder> {

        public Builder name(String name) {
            return attribute("name", name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Employee build() {
            return new Employee(attributes);
        }
    }
}
