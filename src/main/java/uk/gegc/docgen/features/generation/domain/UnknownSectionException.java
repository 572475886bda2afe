package uk.gegc.docgen.features.generation.domain;

public class UnknownSectionException extends RuntimeException {

    private final String sectionId;

    public UnknownSectionException(String sectionId) {
        super("Unknown section or prompt id: '" + sectionId + "'");
        this.sectionId = sectionId;
    }

    public String getSectionId() {
        return sectionId;
    }
}
