package uk.gegc.docgen.features.upstream.domain;

/**
 * No response could be obtained from the provider after the retry budget was spent.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(UpstreamErrorKind.UNAVAILABLE, message, null, cause);
    }
}
