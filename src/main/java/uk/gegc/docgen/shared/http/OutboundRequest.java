package uk.gegc.docgen.shared.http;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;

/**
 * An HTTP request that can be replayed. The body is held in memory so every attempt sends the same bytes.
 */
public record OutboundRequest(
        HttpMethod method,
        URI uri,
        HttpHeaders headers,
        byte[] body
) {
    public OutboundRequest {
        if (method == null) {
            throw new IllegalArgumentException("Method cannot be null");
        }
        if (uri == null) {
            throw new IllegalArgumentException("URI cannot be null");
        }
        headers = headers == null ? new HttpHeaders() : HttpHeaders.readOnlyHttpHeaders(headers);
        body = body == null ? new byte[0] : body;
    }

    public static OutboundRequest post(URI uri, HttpHeaders headers, byte[] body) {
        return new OutboundRequest(HttpMethod.POST, uri, headers, body);
    }
}
