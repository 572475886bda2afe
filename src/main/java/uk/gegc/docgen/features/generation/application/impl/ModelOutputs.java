package uk.gegc.docgen.features.generation.application.impl;

import java.util.Locale;

/**
 * Cleanup applied to raw model output before it is used.
 */
final class ModelOutputs {

    private static final String FENCE = "```";
    private static final String SURROUNDING_NOISE = "`\"'";

    private ModelOutputs() {
    }

    /**
     * Removes a markdown code fence wrapped around the whole answer, keeping what is inside.
     */
    static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String text = content.strip();
        if (!text.startsWith(FENCE)) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        if (firstNewline < 0) {
            return text.substring(FENCE.length()).replace(FENCE, "").strip();
        }
        String body = text.substring(firstNewline + 1);
        if (body.stripTrailing().endsWith(FENCE)) {
            body = body.stripTrailing();
            body = body.substring(0, body.length() - FENCE.length());
        }
        return body.strip();
    }

    /**
     * Diagram source as the model returned it, minus surrounding whitespace, quotes, backticks
     * and a leading {@code mermaid} fence tag.
     */
    static String cleanDiagramSource(String content) {
        String code = trimNoise(content == null ? "" : content);
        String lower = code.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mermaid") && (code.length() == 7 || Character.isWhitespace(code.charAt(7)))) {
            code = trimNoise(code.substring(7));
        }
        return code;
    }

    private static String trimNoise(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isNoise(value.charAt(start))) {
            start++;
        }
        while (end > start && isNoise(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isNoise(char c) {
        return Character.isWhitespace(c) || SURROUNDING_NOISE.indexOf(c) >= 0;
    }
}
