package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.exception.EntityNotFoundException;
import io.github.devsha256.odataclient.model.EntityType;
import io.github.devsha256.odataclient.model.ServiceMetadata;

import java.util.Map;

/**
 * A remote OData service that queries are executed against.
 */
public interface ODataService {

    /**
     * Base URL of the service, without a trailing query.
     */
    String serviceUrl();

    /**
     * Runs a GET request and returns the successful response.
     *
     * @param path    path and query relative to {@link #serviceUrl()}, or a full URL when {@code rawUrl} is set
     * @param options extra request headers
     * @param rawUrl  whether {@code path} was handed out by the server and must be sent unchanged
     * @throws io.github.devsha256.odataclient.exception.ODataRequestException when the request fails
     */
    RawResponse execute(String path, Map<String, String> options, boolean rawUrl);

    ServiceMetadata metadata();

    /**
     * Upper bound on continuation pages followed by one result iteration.
     */
    int maxPageFetches();

    default String namespace() {
        return metadata().namespace();
    }

    /**
     * The entity set with the given name, matched case-insensitively.
     *
     * @throws EntityNotFoundException if the service declares no such entity set
     */
    default EntitySet entitySet(String name) {
        ServiceMetadata metadata = metadata();
        String matched = metadata.matchEntitySet(name)
                .orElseThrow(() -> new EntityNotFoundException("EntitySet '" + name.trim() + "' not found in service metadata"));
        EntityType type = metadata.entitySets().get(matched);
        return new EntitySet(matched, this, type, new AtomEntityParser(), maxPageFetches());
    }
}
