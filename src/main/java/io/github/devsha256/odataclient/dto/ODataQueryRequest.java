package io.github.devsha256.odataclient.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * Structured query payload. Everything but the connection and entity set is optional.
 */
public record ODataQueryRequest(
        String url, // blank: the configured default service
        String username,
        String password,
        @NotBlank String entitySet,
        List<@Valid FilterRequest> filters,
        List<String> orderBy,
        List<String> expand,
        List<String> select,
        @PositiveOrZero Integer skip,
        @PositiveOrZero Integer top,
        String searchTerm,
        boolean inlineCount
) {

    public ODataConnection connection() {
        return new ODataConnection(url, username, password);
    }
}
