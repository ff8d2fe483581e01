package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.ODataProperties;
import io.github.devsha256.odataclient.dto.FilterRequest;
import io.github.devsha256.odataclient.dto.ODataConnection;
import io.github.devsha256.odataclient.dto.ODataMetadataRequest;
import io.github.devsha256.odataclient.dto.ODataQueryRequest;
import io.github.devsha256.odataclient.exception.EntityNotFoundException;
import io.github.devsha256.odataclient.model.Entity;
import io.github.devsha256.odataclient.model.PropertyInfo;
import io.github.devsha256.odataclient.model.ServiceMetadata;
import io.github.devsha256.odataclient.query.Operator;
import io.github.devsha256.odataclient.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service that handles metadata, query and count requests. Opened services are kept
 * in the {@link ServiceRegistry} and reused across requests with the same URL and credentials.
 */
@Service
public class ODataGatewayService {

    private static final Logger log = LoggerFactory.getLogger(ODataGatewayService.class);

    private final ODataProperties properties;
    private final ServiceRegistry registry;

    public ODataGatewayService(ODataProperties properties, ServiceRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    /**
     * Returns the service registered for this connection (URL and credentials),
     * or connects and registers it.
     * A connection without URL falls back to the configured default service.
     */
    public ODataService open(ODataConnection requested) {
        ODataConnection connection = withDefaults(requested);
        return registry.lookup(connection).orElseGet(() -> {
            ODataService service = connect(connection);
            // loads $metadata, so a failing service never gets registered
            log.info("Opened OData service {} ({})", service.serviceUrl(), service.namespace());
            registry.register(connection, service);
            return service;
        });
    }

    ODataService connect(ODataConnection connection) {
        return HttpODataService.connect(connection, properties);
    }

    private ODataConnection withDefaults(ODataConnection connection) {
        if (connection.url() != null && !connection.url().isBlank()) {
            return connection;
        }
        if (properties.getServiceUrl() == null || properties.getServiceUrl().isBlank()) {
            throw new IllegalArgumentException("Service URL is required.");
        }
        return new ODataConnection(properties.getServiceUrl(), properties.getUsername(), properties.getPassword());
    }

    /**
     * Map of entity set name to its properties. If the request names an entity set,
     * returns only that one.
     *
     * @throws EntityNotFoundException if an entitySet filter is provided but not found
     */
    public Map<String, List<PropertyInfo>> fetchMetadata(ODataMetadataRequest req) {
        ServiceMetadata metadata = open(req.connection()).metadata();

        if (req.entitySet() == null || req.entitySet().isBlank()) {
            Map<String, List<PropertyInfo>> all = new LinkedHashMap<>();
            metadata.entitySets().forEach((name, type) -> all.put(name, type.properties()));
            return all;
        }

        String key = metadata.matchEntitySet(req.entitySet())
                .orElseThrow(() -> new EntityNotFoundException("EntitySet '" + req.entitySet().trim() + "' not found in service metadata"));
        return Collections.singletonMap(key, metadata.entitySets().get(key).properties());
    }

    /**
     * Runs the query and collects every entity of every page.
     */
    public List<Map<String, Object>> queryEntitySet(ODataQueryRequest req) {
        Query query = buildQuery(open(req.connection()).entitySet(req.entitySet()), req);
        return query.execute().stream()
                .map(Entity::asMap)
                .toList();
    }

    public long countEntitySet(ODataQueryRequest req) {
        return buildQuery(open(req.connection()).entitySet(req.entitySet()), req).count();
    }

    /**
     * Translates the request payload into builder calls.
     */
    public Query buildQuery(EntitySet entitySet, ODataQueryRequest req) {
        Query query = entitySet.query();
        if (req.filters() != null) {
            for (FilterRequest filter : req.filters()) {
                query.where(query.property(filter.property()).with(Operator.fromToken(filter.operator()), filter.value()));
            }
        }
        if (req.orderBy() != null) {
            query.orderBy(req.orderBy().toArray(String[]::new));
        }
        if (req.expand() != null) {
            query.expand(req.expand().toArray(String[]::new));
        }
        if (req.select() != null) {
            query.select(req.select().toArray(String[]::new));
        }
        if (req.skip() != null) {
            query.skip(req.skip());
        }
        if (req.top() != null) {
            query.limit(req.top());
        }
        if (req.searchTerm() != null) {
            query.searchTerm(req.searchTerm());
        }
        if (req.inlineCount()) {
            query.includeCount();
        }
        return query;
    }
}
