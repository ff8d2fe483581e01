package io.github.devsha256.odataclient.dto;

/**
 * Metadata request DTO. `entitySet` is optional; when provided, the service
 * returns metadata only for that entity set.
 */
public record ODataMetadataRequest(
        String url, // blank: the configured default service
        String username,
        String password,
        String entitySet // optional
) {

    public ODataConnection connection() {
        return new ODataConnection(url, username, password);
    }
}
