package com.coinbase.x402quote.server;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Framework-neutral view of an incoming request: headers (case-insensitive),
 * raw path and raw query string. Header values are untrusted.
 */
public final class RequestContext {
    private final Map<String, String> headers;
    private final String path;
    private final String query;

    public RequestContext(Map<String, String> headers, String path, String query) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.path = Objects.requireNonNull(path, "path");
        this.query = query == null || query.isEmpty() ? null : query;
    }

    /** Returns the header value or {@code null} when absent. */
    public String header(String name) {
        return headers.get(name);
    }

    public String path() {
        return path;
    }

    public String query() {
        return query;
    }

    /**
     * Canonical URL of the requested resource: scheme and authority of {@code baseUrl}
     * followed by this request's path and query.
     *
     * <p>Path and query are taken as received. Characters that {@link URI} does not accept
     * (such as {@code |}, spaces or non-ASCII text) are percent-encoded; existing
     * {@code %XX} escapes are kept as they are.
     */
    public URI resourceUrl(URI baseUrl) {
        StringBuilder url = new StringBuilder()
                .append(baseUrl.getScheme())
                .append("://")
                .append(baseUrl.getRawAuthority());
        if (!path.startsWith("/")) {
            url.append('/');
        }
        appendEscaped(url, path, false);
        if (query != null) {
            url.append('?');
            appendEscaped(url, query, true);
        }
        return URI.create(url.toString());
    }

    private static void appendEscaped(StringBuilder out, String raw, boolean query) {
        for (int i = 0; i < raw.length(); ) {
            int cp = raw.codePointAt(i);
            int next = i + Character.charCount(cp);
            if (cp == '%' && isHex(raw, i + 1) && isHex(raw, i + 2)) {
                out.append(raw, i, i + 3);
                next = i + 3;
            } else if (isAllowed(cp) || (query && cp == '?')) {
                out.append((char) cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    out.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
            }
            i = next;
        }
    }

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    // RFC 3986 unreserved, sub-delims, ':', '@' and '/'
    private static boolean isAllowed(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || "-._~!$&'()*+,;=:@/".indexOf(c) >= 0;
    }

    private static boolean isHex(String s, int index) {
        if (index >= s.length()) {
            return false;
        }
        char c = s.charAt(index);
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
