package io.github.devsha256.odataclient.query;

import java.util.Objects;

/**
 * One comparison of a {@code $filter} clause, rendered as {@code <property> <op> <value>}.
 * <p>
 * Instances are immutable: the comparator methods return a new criteria bound to the
 * same operand. The operator is not checked against the property type.
 */
public final class Criteria {

    private final FilterOperand operand;
    private final Operator operator;
    private final Object value;

    public Criteria(FilterOperand operand) {
        this(operand, null, null);
    }

    public Criteria(FilterOperand operand, Operator operator, Object value) {
        this.operand = Objects.requireNonNull(operand, "operand");
        this.operator = operator;
        this.value = value;
    }

    public Criteria eq(Object value) {
        return with(Operator.EQ, value);
    }

    public Criteria ne(Object value) {
        return with(Operator.NE, value);
    }

    public Criteria gt(Object value) {
        return with(Operator.GT, value);
    }

    public Criteria ge(Object value) {
        return with(Operator.GE, value);
    }

    public Criteria lt(Object value) {
        return with(Operator.LT, value);
    }

    public Criteria le(Object value) {
        return with(Operator.LE, value);
    }

    public Criteria with(Operator operator, Object value) {
        return new Criteria(operand, Objects.requireNonNull(operator, "operator"), value);
    }

    public FilterOperand getOperand() {
        return operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    public boolean isComplete() {
        return operator != null;
    }

    @Override
    public String toString() {
        if (operator == null) {
            throw new IllegalStateException("No comparison set for " + operand.render());
        }
        return operand.render() + " " + operator.token() + " " + literal(value);
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        // OData escapes a quote inside a string literal by doubling it
        return "'" + value.toString().replace("'", "''") + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Criteria other)) {
            return false;
        }
        return operand.equals(other.operand) && operator == other.operator && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, operator, value);
    }
}
