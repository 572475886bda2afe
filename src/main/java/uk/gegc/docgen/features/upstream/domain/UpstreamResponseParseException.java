package uk.gegc.docgen.features.upstream.domain;

/**
 * The provider answered but its body (or the model output inside it) could not be parsed.
 * The raw text is kept for diagnostics.
 */
public class UpstreamResponseParseException extends UpstreamException {

    private final String rawBody;

    public UpstreamResponseParseException(String message, String rawBody, Throwable cause) {
        super(UpstreamErrorKind.RESPONSE_UNPARSEABLE, message, null, cause);
        this.rawBody = rawBody;
    }

    public String getRawBody() {
        return rawBody;
    }
}
