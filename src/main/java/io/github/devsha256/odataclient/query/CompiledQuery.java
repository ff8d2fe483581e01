package io.github.devsha256.odataclient.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a {@link Query}, taken when the query is rendered or executed.
 * Later changes to the builder never leak into a compiled query or the results made from it.
 * <p>
 * Fragments are emitted in a fixed order: filter, search term, orderby, expand, select,
 * inline count, skip, top. Empty categories contribute nothing.
 */
public record CompiledQuery(
        String entitySetName,
        List<Criteria> filters,
        String searchTerm,
        List<String> orderBy,
        List<String> expand,
        List<String> select,
        boolean inlineCount,
        int skip,
        int top) {

    public CompiledQuery {
        filters = List.copyOf(filters);
        orderBy = List.copyOf(orderBy);
        expand = List.copyOf(expand);
        select = List.copyOf(select);
    }

    /**
     * The {@code &}-joined query options, or empty when no option is set.
     */
    public Optional<String> criteria() {
        List<String> fragments = new ArrayList<>();
        filterCriteria().ifPresent(fragments::add);
        searchTermCriteria().ifPresent(fragments::add);
        listCriteria("orderby", orderBy).ifPresent(fragments::add);
        listCriteria("expand", expand).ifPresent(fragments::add);
        listCriteria("select", select).ifPresent(fragments::add);
        if (inlineCount) {
            fragments.add("$inlinecount=allpages");
        }
        pagingCriteria("skip", skip).ifPresent(fragments::add);
        pagingCriteria("top", top).ifPresent(fragments::add);
        return fragments.isEmpty() ? Optional.empty() : Optional.of(String.join("&", fragments));
    }

    /**
     * Path of the {@code $count} request for the same criteria.
     */
    public String countPath() {
        String path = entitySetName + "/$count";
        return criteria().map(c -> path + "?" + c).orElse(path);
    }

    @Override
    public String toString() {
        return criteria().map(c -> entitySetName + "?" + c).orElse(entitySetName);
    }

    private Optional<String> filterCriteria() {
        if (filters.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("$filter=" + filters.stream()
                .map(Criteria::toString)
                .collect(Collectors.joining(" and ")));
    }

    private Optional<String> searchTermCriteria() {
        if (searchTerm == null || searchTerm.isBlank()) {
            return Optional.empty();
        }
        return Optional.of("searchTerm='" + searchTerm + "'&includePrerelease=false");
    }

    private static Optional<String> listCriteria(String name, List<String> tokens) {
        return tokens.isEmpty() ? Optional.empty() : Optional.of("$" + name + "=" + String.join(",", tokens));
    }

    private static Optional<String> pagingCriteria(String name, int value) {
        return value == 0 ? Optional.empty() : Optional.of("$" + name + "=" + value);
    }
}
