package io.github.devsha256.odataclient.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * One comparison of a query payload, e.g. {"property": "Price", "operator": "gt", "value": 10}.
 */
public record FilterRequest(
        @NotBlank String property,
        @NotBlank String operator,
        Object value
) { }
