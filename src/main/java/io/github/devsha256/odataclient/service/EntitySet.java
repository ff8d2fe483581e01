package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.query.Query;

import java.util.Objects;

/**
 * A named collection of entities of one type exposed by a service.
 */
public class EntitySet {

    private final String name;
    private final ODataService service;
    private final EntityType entityType;
    private final EntityParser parser;
    private final int maxPageFetches;

    public EntitySet(String name, ODataService service, EntityType entityType, EntityParser parser, int maxPageFetches) {
        this.name = Objects.requireNonNull(name, "name");
        this.service = Objects.requireNonNull(service, "service");
        this.entityType = entityType == null ? EntityType.untyped(name) : entityType;
        this.parser = Objects.requireNonNull(parser, "parser");
        if (maxPageFetches < 0) {
            throw new IllegalArgumentException("maxPageFetches must not be negative: " + maxPageFetches);
        }
        this.maxPageFetches = maxPageFetches;
    }

    public Query query() {
        return new Query(this);
    }

    public String name() {
        return name;
    }

    public ODataService service() {
        return service;
    }

    public EntityType entityType() {
        return entityType;
    }

    public EntityParser parser() {
        return parser;
    }

    public int maxPageFetches() {
        return maxPageFetches;
    }

    public Entity newEntity() {
        return Entity.blank(entityType);
    }

    @Override
    public String toString() {
        return name + " (" + entityType.qualifiedName() + ")";
    }
}
