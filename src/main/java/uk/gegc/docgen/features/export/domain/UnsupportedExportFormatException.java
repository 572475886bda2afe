package uk.gegc.docgen.features.export.domain;

public class UnsupportedExportFormatException extends RuntimeException {

    private final String format;

    public UnsupportedExportFormatException(String format) {
        super("Unsupported export format: '" + format + "'. Supported formats: pdf, archive (zip), markdown (md)");
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
