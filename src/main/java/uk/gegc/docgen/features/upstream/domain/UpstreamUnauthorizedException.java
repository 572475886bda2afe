package uk.gegc.docgen.features.upstream.domain;

public class UpstreamUnauthorizedException extends UpstreamException {

    public UpstreamUnauthorizedException() {
        super(UpstreamErrorKind.UNAUTHORIZED, "Unauthorized: check the upstream API key", 401, null);
    }
}
