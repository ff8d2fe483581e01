package io.github.devsha256.odataclient.query;

import io.github.devsha256.odataclient.xml.XmlDocuments;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Reads the {@code <link rel="next">} of a feed page and turns it into a path
 * relative to the service.
 * <p>
 * Known server quirk: a service queried over one scheme may advertise its continuation
 * links on the other ({@code http} versus {@code https}). {@link #normalize} strips the
 * service URL in both forms so the follow-up request stays on the caller's connection.
 */
public final class ContinuationLink {

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    private ContinuationLink() {
    }

    /**
     * The normalized continuation link of a page body, or empty on the last page.
     */
    public static Optional<String> of(String body, String serviceUrl) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        return href(XmlDocuments.parse(body)).map(href -> normalize(href, serviceUrl));
    }

    /**
     * Raw {@code href} of the feed's next link.
     */
    public static Optional<String> href(Document feed) {
        Element root = feed.getDocumentElement();
        if (root == null || !"feed".equals(root.getLocalName())) {
            return Optional.empty();
        }
        return XmlDocuments.children(root, "link").stream()
                .filter(link -> "next".equals(link.getAttribute("rel")))
                .findFirst()
                .flatMap(link -> XmlDocuments.attribute(link, "href"))
                .filter(href -> !href.isBlank());
    }

    /**
     * Removes the service URL from {@code href}, matching both its http and https forms.
     */
    public static String normalize(String href, String serviceUrl) {
        if (serviceUrl == null || serviceUrl.isBlank()) {
            return href;
        }
        String httpVersion = withScheme(serviceUrl, HTTP);
        String httpsVersion = withScheme(serviceUrl, HTTPS);
        return href.replace(httpVersion, "").replace(httpsVersion, "");
    }

    private static String withScheme(String url, String scheme) {
        if (url.startsWith(HTTPS)) {
            return scheme + url.substring(HTTPS.length());
        }
        if (url.startsWith(HTTP)) {
            return scheme + url.substring(HTTP.length());
        }
        return url;
    }
}
