package io.github.devsha256.odataclient.query;

/**
 * Thrown when a result keeps advertising continuation links past the page fetch limit.
 * Indicates a server echoing the same or a cyclical link; iteration cannot resume.
 */
public class PaginationLimitExceededException extends IllegalStateException {

    private final int fetches;

    public PaginationLimitExceededException(int fetches, String pendingLink) {
        super("Possible infinite loop detected: " + fetches
                + " continuation pages fetched and the server still links to " + pendingLink);
        this.fetches = fetches;
    }

    public int getFetches() {
        return fetches;
    }
}
