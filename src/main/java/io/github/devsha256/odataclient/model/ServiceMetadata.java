package io.github.devsha256.odataclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What a service declares in its {@code $metadata} document: the schema namespace
 * and the entity type behind each entity set.
 */
public record ServiceMetadata(String namespace, Map<String, EntityType> entitySets) {

    public ServiceMetadata {
        entitySets = Collections.unmodifiableMap(new LinkedHashMap<>(entitySets));
    }

    /**
     * Case-insensitive match first, then exact.
     */
    public Optional<String> matchEntitySet(String requested) {
        String trimmed = requested.trim();
        Optional<String> matched = entitySets.keySet().stream()
                .filter(k -> k.equalsIgnoreCase(trimmed))
                .findFirst();
        if (matched.isEmpty() && entitySets.containsKey(trimmed)) {
            matched = Optional.of(trimmed);
        }
        return matched;
    }
}
