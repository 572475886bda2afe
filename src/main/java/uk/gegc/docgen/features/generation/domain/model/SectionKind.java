package uk.gegc.docgen.features.generation.domain.model;

import uk.gegc.docgen.features.upstream.domain.model.ResponseFormat;

import java.util.Optional;

/**
 * Output shape expected from the upstream for a section.
 */
public enum SectionKind {

    /**
     * Addressable key/value markdown, requested as a JSON object and batched into one call.
     */
    STRUCTURED(ResponseFormat.jsonObject()),

    /**
     * Raw diagram markup with no surrounding structure, one call per section.
     */
    DIAGRAM(null);

    private final ResponseFormat responseFormat;

    SectionKind(ResponseFormat responseFormat) {
        this.responseFormat = responseFormat;
    }

    public Optional<ResponseFormat> responseFormat() {
        return Optional.ofNullable(responseFormat);
    }
}
