package com.coinbase.x402quote.server;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestContextTest {

    @Test
    void resourceUrlUsesBaseOriginWithRequestPathAndQuery() {
        RequestContext request = new RequestContext(Map.of(), "/files/report%20q3", "page=2&size=10");

        URI url = request.resourceUrl(URI.create("https://api.example.com:8443/ignored/prefix"));

        assertEquals("https://api.example.com:8443/files/report%20q3?page=2&size=10", url.toString());
    }

    @Test
    void charactersUriRejectsArePercentEncoded() {
        URI base = URI.create("https://localhost:3001/");

        assertEquals("https://localhost:3001/resource?a=1%7C2",
                new RequestContext(Map.of(), "/resource", "a=1|2").resourceUrl(base).toString());
        assertEquals("https://localhost:3001/my%20files/caf%C3%A9?q=%22x%22&r=%5B1%5D",
                new RequestContext(Map.of(), "/my files/caf\u00e9", "q=\"x\"&r=[1]").resourceUrl(base).toString());
    }

    @Test
    void strayPercentSignIsEncodedButEscapesAreKept() {
        RequestContext request = new RequestContext(Map.of(), "/a%2Fb", "discount=50%&next=%3F");

        assertEquals("https://localhost:3001/a%2Fb?discount=50%25&next=%3F",
                request.resourceUrl(URI.create("https://localhost:3001/")).toString());
    }

    @Test
    void emptyQueryIsDropped() {
        RequestContext request = new RequestContext(Map.of(), "/resource", "");

        assertEquals("http://localhost:3001/resource",
                request.resourceUrl(URI.create("http://localhost:3001/")).toString());
        assertNull(request.query());
    }

    @Test
    void headerLookupIgnoresCase() {
        RequestContext request = new RequestContext(Map.of("X-Quote-Id", "q1"), "/resource", null);

        assertEquals("q1", request.header("x-quote-id"));
        assertEquals("q1", request.header("X-QUOTE-ID"));
        assertNull(request.header("X-Client-Id"));
    }
}
