package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.dto.ODataConnection;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opened services, indexed by the connection that opened them.
 * <p>
 * A service carries the credentials it was opened with, so the key is the URL together
 * with the username and a digest of the password: a connection with other credentials
 * never gets an already authenticated service back.
 */
@Component
public class ServiceRegistry {

    private final Map<String, ODataService> services = new ConcurrentHashMap<>();

    public void register(ODataConnection connection, ODataService service) {
        services.put(key(connection), service);
    }

    public Optional<ODataService> lookup(ODataConnection connection) {
        if (connection == null || connection.url() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(services.get(key(connection)));
    }

    public void flush() {
        services.clear();
    }

    /**
     * URL without trailing slash, username and the SHA-256 of the password.
     */
    static String key(ODataConnection connection) {
        String url = connection.url().trim();
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        String username = connection.username() == null ? "" : connection.username();
        String password = connection.password() == null ? "" : connection.password();
        return url + "\n" + username + "\n" + DigestUtils.sha256Hex(password);
    }
}
