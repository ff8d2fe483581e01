package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.exception.ODataClientException;
import io.github.devsha256.odataclient.service.EntitySet;
import io.github.devsha256.odataclient.service.RawResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for a request against one {@link EntitySet}.
 * <p>
 * Normally obtained from {@link EntitySet#query()}. Every builder method mutates and
 * returns this instance. Rendering and execution work on a {@link CompiledQuery} snapshot,
 * so reusing a query after {@link #execute()} does not affect results already returned.
 *
 * <pre>
 * Query query = entitySet.query();
 * Result products = query
 *     .where(query.property("Name").eq("Bread"))
 *     .orderBy("Price desc")
 *     .limit(10)
 *     .execute();
 * </pre>
 */
public class Query {

    private static final Logger log = LoggerFactory.getLogger(Query.class);

    private final EntitySet entitySet;

    private final List<Criteria> filters = new ArrayList<>();
    private final List<String> select = new ArrayList<>();
    private final List<String> expand = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private int skip;
    private int top;
    private boolean inlineCount;
    private String searchTerm;

    public Query(EntitySet entitySet) {
        this.entitySet = Objects.requireNonNull(entitySet, "entitySet");
    }

    /**
     * Starts a criteria on the named property. Names unknown to the entity type are kept
     * as raw operands. Does not add anything to this query; pass the finished criteria
     * to {@link #where(Criteria)}.
     */
    public Criteria property(String propertyName) {
        FilterOperand operand = entitySet.newEntity().getProperty(propertyName)
                .<FilterOperand>map(FilterOperand.Resolved::new)
                .orElseGet(() -> new FilterOperand.Raw(propertyName));
        return new Criteria(operand);
    }

    /**
     * Adds a filter criteria. Multiple criteria are combined with {@code and}.
     */
    public Query where(Criteria criteria) {
        Objects.requireNonNull(criteria, "criteria");
        if (!criteria.isComplete()) {
            throw new IllegalArgumentException("Criteria on " + criteria.getOperand().render() + " has no comparison");
        }
        filters.add(criteria);
        return this;
    }

    /**
     * Properties to order by; a token may carry a direction, e.g. {@code "Name desc"}.
     */
    public Query orderBy(String... properties) {
        orderBy.addAll(Arrays.asList(properties));
        return this;
    }

    public Query expand(String... associations) {
        expand.addAll(Arrays.asList(associations));
        return this;
    }

    public Query select(String... properties) {
        select.addAll(Arrays.asList(properties));
        return this;
    }

    public Query skip(int value) {
        this.skip = requireNonNegative("skip", value);
        return this;
    }

    public Query skip(String value) {
        return skip(toInt("skip", value));
    }

    public Query limit(int value) {
        this.top = requireNonNegative("limit", value);
        return this;
    }

    public Query limit(String value) {
        return limit(toInt("limit", value));
    }

    public Query searchTerm(String value) {
        this.searchTerm = value;
        return this;
    }

    /**
     * Asks the server to report the total match count along with the page.
     */
    public Query includeCount() {
        this.inlineCount = true;
        return this;
    }

    public CompiledQuery compile() {
        return new CompiledQuery(entitySet.name(), filters, searchTerm, orderBy, expand, select,
                inlineCount, skip, top);
    }

    public Result execute() {
        CompiledQuery compiled = compile();
        String path = compiled.toString();
        log.debug("Executing query {}", path);
        RawResponse response = entitySet.service().execute(path, Map.of(), false);
        return new Result(entitySet, compiled, response);
    }

    /**
     * Number of entities matching the current criteria, as reported by {@code $count}.
     */
    public long count() {
        String path = compile().countPath();
        log.debug("Counting with {}", path);
        String body = entitySet.service().execute(path, Map.of(), false).body();
        try {
            return Long.parseLong(body == null ? "" : body.trim());
        } catch (NumberFormatException e) {
            throw new ODataClientException("Unexpected $count response for " + path + ": '" + body + "'", e);
        }
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    public EntitySet getEntitySet() {
        return entitySet;
    }

    @Override
    public String toString() {
        return compile().toString();
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    private static int toInt(String name, String value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }
}
