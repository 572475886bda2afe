package uk.gegc.docgen.features.upstream.domain;

public class UpstreamForbiddenException extends UpstreamException {

    public UpstreamForbiddenException() {
        super(UpstreamErrorKind.FORBIDDEN, "Forbidden: the upstream credential may not access this resource", 403, null);
    }
}
