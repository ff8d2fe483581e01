package io.github.devsha256.odataclient.service;

import com.sap.cloud.sdk.cloudplatform.connectivity.DefaultHttpDestination;
import com.sap.cloud.sdk.cloudplatform.connectivity.HttpClientAccessor;
import com.sap.cloud.sdk.cloudplatform.connectivity.HttpDestination;
import io.github.devsha256.odataclient.ODataProperties;
import io.github.devsha256.odataclient.dto.ODataConnection;
import io.github.devsha256.odataclient.exception.ODataClientException;
import io.github.devsha256.odataclient.exception.ODataRequestException;
import io.github.devsha256.odataclient.model.ServiceMetadata;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ODataService} over Apache HttpClient, using an SAP Cloud SDK HTTP destination
 * with Basic Authentication.
 * <p>
 * Metadata is fetched once, on first use.
 */
public class HttpODataService implements ODataService {

    private static final Logger log = LoggerFactory.getLogger(HttpODataService.class);

    static final String ATOM_ACCEPT = "application/atom+xml,application/xml;q=0.9,text/plain;q=0.8";

    private final String serviceUrl;
    private final HttpClient client;
    private final Map<String, String> defaultHeaders;
    private final int maxPageFetches;
    private final MetadataParser metadataParser = new MetadataParser();

    private ServiceMetadata metadata;

    public HttpODataService(String serviceUrl, HttpClient client, Map<String, String> defaultHeaders, int maxPageFetches) {
        this.serviceUrl = normalizeBaseUrl(serviceUrl);
        this.client = client;
        this.defaultHeaders = Map.copyOf(defaultHeaders);
        this.maxPageFetches = maxPageFetches;
    }

    /**
     * Creates a service for the given connection. With {@code insecure-trust-all} a trust-all
     * client is used and the credentials are sent as a header; otherwise the SDK client
     * for the destination handles authentication.
     */
    public static HttpODataService connect(ODataConnection connection, ODataProperties properties) {
        if (connection.url() == null || connection.url().isBlank()) {
            throw new IllegalArgumentException("Service URL is required.");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        HttpClient client;
        if (properties.isInsecureTrustAll()) {
            client = TrustAllHttpClients.create();
            headers.put("Authorization", basicAuth(connection.username(), connection.password()));
        } else {
            client = HttpClientAccessor.getHttpClient(buildDestination(connection));
        }
        return new HttpODataService(connection.url(), client, headers, properties.getMaxPageFetches());
    }

    @Override
    public String serviceUrl() {
        return serviceUrl;
    }

    @Override
    public int maxPageFetches() {
        return maxPageFetches;
    }

    @Override
    public synchronized ServiceMetadata metadata() {
        if (metadata == null) {
            RawResponse response = execute("$metadata", Map.of("Accept", "application/xml"), false);
            metadata = metadataParser.parse(response.body());
            log.info("Loaded metadata of {}: namespace '{}', {} entity sets",
                    serviceUrl, metadata.namespace(), metadata.entitySets().size());
        }
        return metadata;
    }

    @Override
    public RawResponse execute(String path, Map<String, String> options, boolean rawUrl) {
        URI target = resolve(path, rawUrl);
        HttpGet get = new HttpGet(target);
        get.setHeader("Accept", ATOM_ACCEPT);
        defaultHeaders.forEach(get::setHeader);
        options.forEach(get::setHeader);

        log.debug("GET {}", target);
        try {
            return client.execute(get, response -> {
                int status = response.getStatusLine().getStatusCode();
                String body = response.getEntity() == null
                        ? ""
                        : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (status >= 400) {
                    log.warn("GET {} failed with HTTP {}", target, status);
                    throw new ODataRequestException("Request failed with HTTP " + status + ": " + target, status);
                }
                return new RawResponse(status, body);
            });
        } catch (IOException e) {
            log.warn("GET {} failed: {}", target, e.getMessage());
            throw new ODataRequestException("Request to " + target + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Full request URI for a path. Paths built by the client get their spaces and quotes
     * encoded; server-issued links are only resolved, never re-encoded.
     */
    URI resolve(String path, boolean rawUrl) {
        if (rawUrl && (path.startsWith("http://") || path.startsWith("https://"))) {
            return URI.create(path);
        }
        String relative = path.startsWith("/") ? path.substring(1) : path;
        String base = serviceUrl.endsWith("/") ? serviceUrl : serviceUrl + "/";
        try {
            return URI.create(base + (rawUrl ? relative : encode(relative)));
        } catch (IllegalArgumentException e) {
            throw new ODataClientException("Invalid request path '" + path + "'", e);
        }
    }

    /**
     * Percent-encodes a client-built path. Inside a quoted literal the query delimiters
     * {@code & = ?} are data and get encoded too; a doubled quote stays inside the literal.
     */
    static String encode(String path) {
        StringBuilder sb = new StringBuilder(path.length());
        boolean inLiteral = false;
        for (char c : path.toCharArray()) {
            switch (c) {
                case ' ' -> sb.append("%20");
                case '\'' -> {
                    inLiteral = !inLiteral;
                    sb.append("%27");
                }
                case '"' -> sb.append("%22");
                case '%' -> sb.append("%25");
                case '+' -> sb.append("%2B");
                case '#' -> sb.append("%23");
                case '<' -> sb.append("%3C");
                case '>' -> sb.append("%3E");
                case '&' -> sb.append(inLiteral ? "%26" : "&");
                case '=' -> sb.append(inLiteral ? "%3D" : "=");
                case '?' -> sb.append(inLiteral ? "%3F" : "?");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static HttpDestination buildDestination(ODataConnection connection) {
        try {
            return DefaultHttpDestination
                    .builder(URI.create(normalizeBaseUrl(connection.url())))
                    .basicCredentials(nullToEmpty(connection.username()), nullToEmpty(connection.password()))
                    .build();
        } catch (Exception e) {
            throw new ODataClientException("Failed to build destination: " + e.getMessage(), e);
        }
    }

    private static String basicAuth(String user, String pass) {
        String token = Base64.getEncoder()
                .encodeToString((nullToEmpty(user) + ":" + nullToEmpty(pass)).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    private static String normalizeBaseUrl(String url) {
        String trimmed = url == null ? "" : url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "HttpODataService[" + serviceUrl + "]";
    }
}
