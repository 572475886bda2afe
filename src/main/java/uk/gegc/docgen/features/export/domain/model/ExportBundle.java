package uk.gegc.docgen.features.export.domain.model;

import uk.gegc.docgen.features.export.domain.InvalidExportBundleException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Markdown sections to export, in request order, with names that are safe to use as filenames.
 */
public record ExportBundle(List<ExportSection> sections) {

    private static final String UNSAFE_CHARACTERS = "[^A-Za-z0-9._-]";
    private static final String FALLBACK_NAME = "section";

    public ExportBundle {
        if (sections == null || sections.isEmpty()) {
            throw new InvalidExportBundleException("Export bundle contains no markdown sections");
        }
        sections = List.copyOf(sections);
    }

    /**
     * Builds a bundle from a raw {@code section -> markdown} map. Entries whose value is not a string are skipped.
     */
    public static ExportBundle fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new InvalidExportBundleException("Export bundle is required");
        }
        List<ExportSection> sections = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (entry.getValue() instanceof String markdown) {
                sections.add(new ExportSection(uniqueName(safeName(entry.getKey()), usedNames), markdown));
            }
        }
        return new ExportBundle(sections);
    }

    static String safeName(String key) {
        String name = key == null ? "" : key.trim().replaceAll(UNSAFE_CHARACTERS, "_");
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
            return FALLBACK_NAME;
        }
        return name;
    }

    private static String uniqueName(String name, Set<String> usedNames) {
        String candidate = name;
        int suffix = 2;
        while (!usedNames.add(candidate)) {
            candidate = name + "-" + suffix++;
        }
        return candidate;
    }
}
