package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.model.PropertyInfo;
import io.github.devsha256.odataclient.model.ServiceMetadata;
import io.github.devsha256.odataclient.xml.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses an EDMX {@code $metadata} document into the entity types behind each entity set.
 */
public class MetadataParser {

    public ServiceMetadata parse(String xml) {
        Document doc = XmlDocuments.parse(xml);

        String namespace = "";
        Map<String, EntityType> entityTypeByQualifiedName = new HashMap<>();
        for (Element schema : XmlDocuments.descendants(doc.getDocumentElement(), "Schema")) {
            String schemaNamespace = schema.getAttribute("Namespace");
            List<Element> entityTypes = XmlDocuments.children(schema, "EntityType");
            if (namespace.isEmpty() && !entityTypes.isEmpty()) {
                namespace = schemaNamespace;
            }
            for (Element et : entityTypes) {
                EntityType type = new EntityType(schemaNamespace, et.getAttribute("Name"), readProperties(et));
                entityTypeByQualifiedName.put(type.qualifiedName(), type);
            }
        }

        Map<String, EntityType> entitySets = new LinkedHashMap<>();
        for (Element container : XmlDocuments.descendants(doc.getDocumentElement(), "EntityContainer")) {
            for (Element es : XmlDocuments.children(container, "EntitySet")) {
                String esName = es.getAttribute("Name");
                String entityType = es.getAttribute("EntityType");

                EntityType type = entityTypeByQualifiedName.get(entityType);
                if (type == null) {
                    // some services qualify the type with an alias instead of the namespace
                    String[] parts = entityType.split("\\.");
                    String rawName = parts[parts.length - 1];
                    type = entityTypeByQualifiedName.values().stream()
                            .filter(candidate -> rawName.equals(candidate.name()))
                            .findFirst()
                            .orElse(EntityType.untyped(rawName));
                }
                entitySets.put(esName, type);
            }
        }
        return new ServiceMetadata(namespace, entitySets);
    }

    private List<PropertyInfo> readProperties(Element entityType) {
        List<PropertyInfo> properties = new ArrayList<>();
        for (Element prop : XmlDocuments.children(entityType, "Property")) {
            boolean nullable = !"false".equalsIgnoreCase(prop.getAttribute("Nullable"));
            properties.add(new PropertyInfo(
                    prop.getAttribute("Name"),
                    prop.getAttribute("Type"),
                    nullable,
                    maxLength(prop.getAttribute("MaxLength")).orElse(null)));
        }
        return properties;
    }

    private Optional<Integer> maxLength(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            // "Max" and other symbolic lengths
            return Optional.empty();
        }
    }
}
