package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.model.EntityType;

import java.util.List;

/**
 * Turns one page body into entities, in document order.
 */
@FunctionalInterface
public interface EntityParser {

    List<Entity> parse(String body, EntityType entityType);
}
