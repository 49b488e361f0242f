package com.customer.matching.core.model;

import java.util.Optional;

/**
 * Capability of a record that can name itself with a stable identifier.
 * Records exposing an id are cached by that id; others fall back to
 * their canonical serialized form.
 */
public interface HasStableId {

    /**
     * Returns the stable identifier, or empty if the record carries none.
     */
    Optional<String> stableId();
}
