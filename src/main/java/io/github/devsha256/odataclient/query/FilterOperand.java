package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.model.PropertyInfo;

/**
 * Left-hand side of a comparison. Either a property the entity type declares,
 * or a bare name the schema does not know about; the latter is passed through
 * untouched and left for the server to accept or reject.
 */
public sealed interface FilterOperand permits FilterOperand.Resolved, FilterOperand.Raw {

    /**
     * The name written into the filter expression.
     */
    String render();

    record Resolved(PropertyInfo property) implements FilterOperand {
        @Override
        public String render() {
            return property.name();
        }
    }

    record Raw(String name) implements FilterOperand {
        @Override
        public String render() {
            return name;
        }
    }
}
