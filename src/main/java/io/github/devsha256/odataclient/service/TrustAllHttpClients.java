package io.github.devsha256.odataclient.service;

import io.github.devsha256.odataclient.exception.ODataClientException;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.TrustStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.ssl.SSLContextBuilder;

import javax.net.ssl.SSLContext;

/**
 * Insecure "trust-all" TLS HttpClient. Dev-only, for services with self-signed certificates.
 */
final class TrustAllHttpClients {

    private TrustAllHttpClients() {
    }

    static CloseableHttpClient create() {
        try {
            TrustStrategy acceptingTrustStrategy = (cert, authType) -> true;
            SSLContext sslContext = SSLContextBuilder.create()
                    .loadTrustMaterial(null, acceptingTrustStrategy)
                    .build();

            return HttpClients.custom()
                    .setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                    .setSSLContext(sslContext)
                    .build();
        } catch (Exception e) {
            throw new ODataClientException("Failed to create trust-all HTTP client: " + e.getMessage(), e);
        }
    }
}
