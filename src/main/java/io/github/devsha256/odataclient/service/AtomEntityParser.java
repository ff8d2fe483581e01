package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.model.PropertyInfo;
import io.github.devsha256.odataclient.xml.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads entities from an Atom feed (or a single entry) as returned by OData v2/v3 services.
 * <p>
 * Property values come from {@code m:properties}, either inside {@code content} or, for
 * media link entries, directly under the entry. Values typed with {@code m:type} (or by the
 * entity type metadata) are converted; anything else stays a string.
 */
public class AtomEntityParser implements EntityParser {

    @Override
    public List<Entity> parse(String body, EntityType entityType) {
        Document doc = XmlDocuments.parse(body);
        Element root = doc.getDocumentElement();

        List<Element> entries = "entry".equals(root.getLocalName())
                ? List.of(root)
                : XmlDocuments.children(root, "entry");

        List<Entity> entities = new ArrayList<>(entries.size());
        for (Element entry : entries) {
            entities.add(new Entity(entityType, readProperties(entry, entityType)));
        }
        return entities;
    }

    private Map<String, Object> readProperties(Element entry, EntityType entityType) {
        Optional<Element> properties = XmlDocuments.children(entry, "content").stream()
                .flatMap(content -> XmlDocuments.children(content, "properties").stream())
                .findFirst()
                .or(() -> XmlDocuments.children(entry, "properties").stream().findFirst());

        Map<String, Object> values = new LinkedHashMap<>();
        properties.ifPresent(element -> {
            for (Element property : XmlDocuments.childElements(element)) {
                String name = property.getLocalName();
                String declaredType = entityType.findProperty(name).map(PropertyInfo::type).orElse(null);
                values.put(name, readValue(property, declaredType));
            }
        });
        return values;
    }

    private Object readValue(Element property, String declaredType) {
        if ("true".equals(XmlDocuments.attribute(property, "null").orElse(null))) {
            return null;
        }
        List<Element> nested = XmlDocuments.childElements(property);
        if (!nested.isEmpty()) {
            // complex type
            Map<String, Object> complex = new LinkedHashMap<>();
            for (Element child : nested) {
                complex.put(child.getLocalName(), readValue(child, null));
            }
            return complex;
        }
        String type = XmlDocuments.attribute(property, "type").orElse(declaredType);
        return convert(property.getTextContent(), type);
    }

    static Object convert(String text, String type) {
        if (type == null) {
            return text;
        }
        try {
            switch (type) {
                case "Edm.Byte":
                case "Edm.SByte":
                case "Edm.Int16":
                case "Edm.Int32":
                    return Integer.valueOf(text.trim());
                case "Edm.Int64":
                    return Long.valueOf(text.trim());
                case "Edm.Decimal":
                    return new BigDecimal(text.trim());
                case "Edm.Double":
                    return Double.valueOf(text.trim());
                case "Edm.Single":
                    return Float.valueOf(text.trim());
                case "Edm.Boolean":
                    return Boolean.valueOf(text.trim());
                default:
                    return text;
            }
        } catch (NumberFormatException e) {
            // leave malformed numbers as the server sent them
            return text;
        }
    }
}
