package io.github.devsha256.odataclient.model;

import java.util.List;
import java.util.Optional;

/**
 * Schema of one entity type as declared by the service metadata.
 */
public record EntityType(String namespace, String name, List<PropertyInfo> properties) {

    public EntityType {
        properties = List.copyOf(properties);
    }

    /**
     * Looks up a declared property by its exact name.
     */
    public Optional<PropertyInfo> findProperty(String propertyName) {
        return properties.stream()
                .filter(property -> property.name().equals(propertyName))
                .findFirst();
    }

    public String qualifiedName() {
        return (namespace == null || namespace.isEmpty()) ? name : namespace + "." + name;
    }

    /**
     * Placeholder type used when the service declares nothing for an entity set.
     */
    public static EntityType untyped(String name) {
        return new EntityType("", name, List.of());
    }
}
