package uk.gegc.docgen.features.export.domain;

/**
 * A renderer could not turn a bundle into files.
 */
public class ExportRenderingException extends RuntimeException {

    public ExportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
