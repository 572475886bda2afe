package uk.gegc.docgen.features.upstream.domain;

public class UpstreamCallCancelledException extends UpstreamException {

    public UpstreamCallCancelledException(String message, Throwable cause) {
        super(UpstreamErrorKind.CANCELLED, message, null, cause);
    }
}
