package io.github.devsha256.odataclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One record of an entity set. Values are kept in the order the server sent them.
 */
public class Entity {

    private final EntityType type;
    private final Map<String, Object> values;

    public Entity(EntityType type, Map<String, Object> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * A blank instance of the given type, every declared property set to null.
     * Used to resolve property names before any data is loaded.
     */
    public static Entity blank(EntityType type) {
        Map<String, Object> values = new LinkedHashMap<>();
        type.properties().forEach(property -> values.put(property.name(), null));
        return new Entity(type, values);
    }

    public EntityType getType() {
        return type;
    }

    public Optional<PropertyInfo> getProperty(String name) {
        return type.findProperty(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return type.name() + values;
    }
}
