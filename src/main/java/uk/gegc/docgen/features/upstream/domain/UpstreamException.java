package uk.gegc.docgen.features.upstream.domain;

/**
 * Base class for failures talking to the upstream LLM provider.
 * Used directly for non-2xx statuses that have no dedicated subtype.
 */
public class UpstreamException extends RuntimeException {

    private final UpstreamErrorKind kind;
    private final Integer status;

    public UpstreamException(String message, int status) {
        this(UpstreamErrorKind.GENERIC, message, status, null);
    }

    public UpstreamException(String message) {
        this(UpstreamErrorKind.GENERIC, message, null, null);
    }

    protected UpstreamException(UpstreamErrorKind kind, String message, Integer status, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public UpstreamErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP status returned by the provider, or {@code null} when no response was received.
     */
    public Integer getStatus() {
        return status;
    }
}
