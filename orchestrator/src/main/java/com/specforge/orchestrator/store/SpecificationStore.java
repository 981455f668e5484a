package com.specforge.orchestrator.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Lookup of finished specifications by reference.
 */
public interface SpecificationStore {

    /** Empty when the reference is unknown or does not hold a usable specification. */
    Optional<JsonNode> find(String specificationRef);
}
