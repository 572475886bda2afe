package uk.gegc.docgen.features.export.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.docgen.features.export.domain.InvalidExportBundleException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExportBundle")
class ExportBundleTest {

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource({
            "summary_md, summary_md",
            "'../../etc/passwd', '.._.._etc_passwd'",
            "'data model', 'data_model'",
            "'a/b\\c', 'a_b_c'",
            "'..', 'section'",
            "'   ', 'section'"
    })
    @DisplayName("safeName keeps only filename-safe characters")
    void safeName(String key, String expected) {
        assertThat(ExportBundle.safeName(key)).isEqualTo(expected);
    }

    @Test
    @DisplayName("fromMap keeps request order and skips non-string values")
    void fromMapSkipsNonStrings() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("summary_md", "# Summary");
        raw.put("diagrams", List.of(Map.of("code", "graph TD")));
        raw.put("count", 3);
        raw.put("plan_md", "# Plan");

        ExportBundle bundle = ExportBundle.fromMap(raw);

        assertThat(bundle.sections()).extracting(ExportSection::name).containsExactly("summary_md", "plan_md");
        assertThat(bundle.sections().get(1).markdown()).isEqualTo("# Plan");
    }

    @Test
    @DisplayName("fromMap suffixes names that collide after sanitising")
    void fromMapDeduplicatesNames() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("a b", "1");
        raw.put("a/b", "2");
        raw.put("a_b", "3");

        ExportBundle bundle = ExportBundle.fromMap(raw);

        assertThat(bundle.sections()).extracting(ExportSection::name).containsExactly("a_b", "a_b-2", "a_b-3");
    }

    @Test
    @DisplayName("a bundle without markdown sections is invalid")
    void emptyBundle() {
        assertThatThrownBy(() -> ExportBundle.fromMap(Map.of()))
                .isInstanceOf(InvalidExportBundleException.class);
        assertThatThrownBy(() -> ExportBundle.fromMap(Map.of("diagrams", List.of())))
                .isInstanceOf(InvalidExportBundleException.class);
        assertThatThrownBy(() -> ExportBundle.fromMap(null))
                .isInstanceOf(InvalidExportBundleException.class);
    }
}
