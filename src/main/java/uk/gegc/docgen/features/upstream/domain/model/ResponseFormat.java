package uk.gegc.docgen.features.upstream.domain.model;

/**
 * Structured-output hint, e.g. {@code {"type":"json_object"}}.
 */
public record ResponseFormat(String type) {

    public static ResponseFormat jsonObject() {
        return new ResponseFormat("json_object");
    }
}
