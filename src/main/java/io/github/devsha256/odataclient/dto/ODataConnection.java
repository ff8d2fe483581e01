package io.github.devsha256.odataclient.dto;

/**
 * Connection details of an OData service: base URL and Basic Authentication credentials.
 */
public record ODataConnection(String url, String username, String password) { }
