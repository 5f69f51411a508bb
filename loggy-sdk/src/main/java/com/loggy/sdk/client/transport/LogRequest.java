package com.loggy.sdk.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

public final class LogRequest {
    private final URI uri;
    private final String body;
    private final Map<String, String> headers;
    private final Duration timeout;

    public LogRequest(URI uri, String body, Map<String, String> headers, Duration timeout) {
        this.uri = uri;
        this.body = body;
        this.headers = headers;
        this.timeout = timeout;
    }

    public URI getUri() {
        return uri;
    }

    public String getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
