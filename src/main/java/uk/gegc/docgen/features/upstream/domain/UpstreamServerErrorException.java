package uk.gegc.docgen.features.upstream.domain;

public class UpstreamServerErrorException extends UpstreamException {

    public UpstreamServerErrorException(int status, String detail) {
        super(UpstreamErrorKind.SERVER_ERROR, "Upstream server error " + status
                + (detail == null || detail.isBlank() ? "" : ": " + detail), status, null);
    }
}
