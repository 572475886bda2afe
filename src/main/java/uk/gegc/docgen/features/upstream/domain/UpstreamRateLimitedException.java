package uk.gegc.docgen.features.upstream.domain;

public class UpstreamRateLimitedException extends UpstreamException {

    private final long retryAfterSeconds;

    public UpstreamRateLimitedException(long retryAfterSeconds) {
        super(UpstreamErrorKind.RATE_LIMITED, "Rate limited: too many requests to the upstream provider", 429, null);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
