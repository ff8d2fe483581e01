package io.github.devsha256.odataclient;

import io.github.devsha256.odataclient.query.Result;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Maps the OData client configuration from application.properties to a Java object.
 * Properties are prefixed with 'odata.client'.
 */
@Configuration
@ConfigurationProperties(prefix = "odata.client")
public class ODataProperties {

    // Default service, used when a request does not name one
    private String serviceUrl;
    private String username;
    private String password;

    // Continuation pages one result iteration may follow before giving up
    private int maxPageFetches = Result.DEFAULT_MAX_PAGE_FETCHES;

    // Dev-only: trust every TLS certificate and skip the SAP Cloud SDK client
    private boolean insecureTrustAll;

    public String getServiceUrl() { return serviceUrl; }
    public void setServiceUrl(String serviceUrl) { this.serviceUrl = serviceUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public int getMaxPageFetches() { return maxPageFetches; }
    public void setMaxPageFetches(int maxPageFetches) { this.maxPageFetches = maxPageFetches; }

    public boolean isInsecureTrustAll() { return insecureTrustAll; }
    public void setInsecureTrustAll(boolean insecureTrustAll) { this.insecureTrustAll = insecureTrustAll; }
}
