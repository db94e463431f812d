package org.crynn.storage.cookie;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The parts of a request URL that cookie scoping looks at.
 */
public record RequestUrl(String scheme, String host, String path) {

    public static RequestUrl parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("request url is blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid request url: " + url, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Request url needs a scheme and a host: " + url);
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        return new RequestUrl(uri.getScheme().toLowerCase(Locale.ROOT), uri.getHost().toLowerCase(Locale.ROOT), path);
    }

    public boolean isSecure() {
        return "https".equals(scheme) || "wss".equals(scheme);
    }

    /**
     * Every stored domain that can apply to this host: the host itself (host-only cookies) and
     * the dotted form of the host and each parent domain.
     */
    List<String> candidateDomains() {
        List<String> out = new ArrayList<>();
        out.add(host);
        String d = host;
        while (!d.isEmpty()) {
            out.add("." + d);
            int dot = d.indexOf('.');
            if (dot < 0) break;
            d = d.substring(dot + 1);
        }
        return out;
    }
}
