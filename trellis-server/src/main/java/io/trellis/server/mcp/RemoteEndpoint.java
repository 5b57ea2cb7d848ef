package io.trellis.server.mcp;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// A remote server URL split into the base the SDK transports take and the
/// endpoint path they append to it.
///
/// The path of a configured URL is the endpoint; a URL without one gets the
/// transport's default (`/sse` or `/mcp`). Query strings stay on the endpoint.
///
/// ### Usage
/// {@snippet :
/// RemoteEndpoint endpoint = RemoteEndpoint.parse("https://tools.example.com/v1/mcp", "/mcp");
/// endpoint.baseUrl();  // "https://tools.example.com"
/// endpoint.endpoint(); // "/v1/mcp"
/// }
///
/// @param baseUrl scheme, host and non-default port, not null
/// @param endpoint path plus query, starting with `/`, not null
public record RemoteEndpoint(String baseUrl, String endpoint) {

    public RemoteEndpoint {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(endpoint, "endpoint must not be null");
    }

    /// Splits a configured server URL.
    ///
    /// @param url absolute `http` or `https` URL, not null
    /// @param defaultPath endpoint used when the URL has no path, not null
    /// @return split endpoint, never null
    /// @throws IllegalArgumentException if the URL is missing, malformed or not http(s)
    public static RemoteEndpoint parse(String url, String defaultPath) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("no url configured");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid url '" + url + "': " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("url must be absolute http(s): " + url);
        }

        String base = scheme.toLowerCase(Locale.ROOT) + "://" + uri.getHost();
        if (uri.getPort() != -1 && uri.getPort() != defaultPort(scheme)) {
            base += ":" + uri.getPort();
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            path = defaultPath;
        }
        String query = uri.getRawQuery();
        String endpoint = query != null && !query.isEmpty() ? path + "?" + query : path;
        return new RemoteEndpoint(base, endpoint);
    }

    /// Collects the headers sent with every request to a remote server.
    ///
    /// The configured `auth` token becomes an `Authorization` header with a
    /// `Bearer ` prefix unless it already carries one; it replaces a configured
    /// `Authorization` header.
    ///
    /// @param headers configured headers, not null
    /// @param auth token, may be null or blank
    /// @return headers in configuration order, never null
    public static Map<String, String> requestHeaders(Map<String, String> headers, String auth) {
        Map<String, String> result = new LinkedHashMap<>(headers);
        if (auth != null && !auth.isBlank()) {
            String token = auth.startsWith("Bearer ") ? auth : "Bearer " + auth;
            result.keySet().removeIf("Authorization"::equalsIgnoreCase);
            result.put("Authorization", token);
        }
        return result;
    }

    private static int defaultPort(String scheme) {
        return "https".equalsIgnoreCase(scheme) ? 443 : 80;
    }
}
