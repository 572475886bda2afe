package uk.gegc.docgen.features.upstream.domain;

/**
 * Classification of upstream provider failures.
 */
public enum UpstreamErrorKind {
    UNAUTHORIZED(false),
    FORBIDDEN(false),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    UNAVAILABLE(true),
    RESPONSE_UNPARSEABLE(false),
    CANCELLED(false),
    GENERIC(false);

    private final boolean transientFailure;

    UpstreamErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether the transport retried this kind before it surfaced.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
