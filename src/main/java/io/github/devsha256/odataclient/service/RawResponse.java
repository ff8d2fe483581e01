package io.github.devsha256.odataclient.service;

/**
 * A successful response as returned by the service: status and textual body.
 */
public record RawResponse(int statusCode, String body) { }
