package uk.gegc.docgen.features.export.domain;

public class InvalidExportBundleException extends RuntimeException {

    public InvalidExportBundleException(String message) {
        super(message);
    }
}
