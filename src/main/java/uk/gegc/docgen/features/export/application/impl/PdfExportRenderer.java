package uk.gegc.docgen.features.export.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import uk.gegc.docgen.features.export.application.ExportRenderer;
import uk.gegc.docgen.features.export.domain.ExportRenderingException;
import uk.gegc.docgen.features.export.domain.model.ExportBundle;
import uk.gegc.docgen.features.export.domain.model.ExportFile;
import uk.gegc.docgen.features.export.domain.model.ExportFormat;
import uk.gegc.docgen.features.export.domain.model.ExportSection;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders each markdown section into its own PDF.
 * Handles headings, bullets, fenced code and paragraphs; inline markup is flattened to plain text.
 */
@Component
@Slf4j
public class PdfExportRenderer implements ExportRenderer {

    private static final float MARGIN = 50f;
    private static final float PAGE_WIDTH = PDRectangle.LETTER.getWidth();
    private static final float MAX_TEXT_WIDTH = PAGE_WIDTH - (2 * MARGIN);
    private static final float TITLE_FONT_SIZE = 18f;
    private static final float HEADING_FONT_SIZE = 14f;
    private static final float SUBHEADING_FONT_SIZE = 12f;
    private static final float NORMAL_FONT_SIZE = 11f;
    private static final float CODE_FONT_SIZE = 9f;
    private static final float LINE_SPACING = 1.2f;
    private static final float PARAGRAPH_SPACING = 6f;
    private static final float BULLET_INDENT = 12f;
    private static final String CODE_FENCE = "```";

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.PDF;
    }

    @Override
    public List<ExportFile> render(ExportBundle bundle) {
        List<ExportFile> files = new ArrayList<>();
        for (ExportSection section : bundle.sections()) {
            byte[] bytes = renderSection(section);
            files.add(new ExportFile(section.name() + ".pdf", MediaType.APPLICATION_PDF_VALUE, bytes));
        }
        return files;
    }

    private byte[] renderSection(ExportSection section) {
        try (PDDocument document = new PDDocument()) {
            PDPageContext context = new PDPageContext(document);
            context.startNewPage();
            renderMarkdown(context, section.markdown());

            context.close();
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            document.save(baos);
            log.debug("Rendered section {} to PDF ({} pages)", section.name(), document.getNumberOfPages());
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ExportRenderingException("Failed to render PDF for section " + section.name(), e);
        }
    }

    private void renderMarkdown(PDPageContext context, String markdown) throws IOException {
        boolean inCode = false;
        for (String rawLine : markdown.replace("\r\n", "\n").split("\n", -1)) {
            String line = rawLine.replace("\t", "    ");
            String trimmed = line.strip();

            if (trimmed.startsWith(CODE_FENCE)) {
                inCode = !inCode;
                context.y -= PARAGRAPH_SPACING / 2;
                continue;
            }
            if (inCode) {
                context.writeWrappedText(line.stripTrailing(), PDType1Font.COURIER, CODE_FONT_SIZE, MARGIN + BULLET_INDENT, true);
                continue;
            }
            if (trimmed.isEmpty()) {
                context.y -= PARAGRAPH_SPACING;
                continue;
            }

            if (trimmed.startsWith("### ")) {
                context.ensureSpace(SUBHEADING_FONT_SIZE * 3);
                context.writeWrappedText(plain(trimmed.substring(4)), PDType1Font.HELVETICA_BOLD, SUBHEADING_FONT_SIZE, MARGIN, false);
                context.y -= PARAGRAPH_SPACING / 2;
            } else if (trimmed.startsWith("## ")) {
                context.ensureSpace(HEADING_FONT_SIZE * 3);
                context.y -= PARAGRAPH_SPACING;
                context.writeWrappedText(plain(trimmed.substring(3)), PDType1Font.HELVETICA_BOLD, HEADING_FONT_SIZE, MARGIN, false);
                context.y -= PARAGRAPH_SPACING / 2;
            } else if (trimmed.startsWith("# ")) {
                context.ensureSpace(TITLE_FONT_SIZE * 3);
                context.writeWrappedText(plain(trimmed.substring(2)), PDType1Font.HELVETICA_BOLD, TITLE_FONT_SIZE, MARGIN, false);
                context.y -= PARAGRAPH_SPACING;
            } else if (isBullet(trimmed)) {
                context.writeWrappedText("- " + plain(trimmed.substring(2)), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, MARGIN + BULLET_INDENT, false);
            } else {
                context.writeWrappedText(plain(trimmed), PDType1Font.HELVETICA, NORMAL_FONT_SIZE, MARGIN, false);
            }
        }
    }

    private static boolean isBullet(String line) {
        return line.startsWith("- ") || line.startsWith("* ") || line.startsWith("+ ");
    }

    private static String plain(String text) {
        return text.replace("**", "").replace("__", "").replace("`", "");
    }

    /**
     * Replaces characters the standard 14 fonts cannot encode, so one emoji does not fail the whole export.
     */
    static String encodable(String text, PDFont font) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            if (Character.isISOControl(cp)) {
                return;
            }
            try {
                font.encode(ch);
                sb.append(ch);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        });
        return sb.toString();
    }

    /**
     * Splits text into lines no wider than {@code maxWidth}. Prose wraps between words and splits words longer
     * than a line. Code ({@code preserveIndent}) wraps on raw characters, so inner spacing survives and every
     * continuation line repeats the leading indent.
     */
    static List<String> wrapLines(String text, PDFont font, float fontSize, float maxWidth,
                                  boolean preserveIndent) throws IOException {
        if (preserveIndent) {
            return wrapRaw(text, font, fontSize, maxWidth);
        }
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        for (String word : text.strip().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            String testLine = line.length() == 0 ? word : line + " " + word;
            if (width(testLine, font, fontSize) <= maxWidth) {
                line = new StringBuilder(testLine);
                continue;
            }
            if (line.length() > 0) {
                lines.add(line.toString());
            }
            line = new StringBuilder();
            for (char c : word.toCharArray()) {
                if (line.length() > 0 && width(line.toString() + c, font, fontSize) > maxWidth) {
                    lines.add(line.toString());
                    line = new StringBuilder();
                }
                line.append(c);
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static List<String> wrapRaw(String text, PDFont font, float fontSize, float maxWidth) throws IOException {
        int firstNonSpace = 0;
        while (firstNonSpace < text.length() && text.charAt(firstNonSpace) == ' ') {
            firstNonSpace++;
        }
        String indent = text.substring(0, firstNonSpace);
        String body = text.substring(firstNonSpace).stripTrailing();

        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder(indent);
        for (char c : body.toCharArray()) {
            if (line.length() > indent.length() && width(line.toString() + c, font, fontSize) > maxWidth) {
                lines.add(line.toString());
                line = new StringBuilder(indent);
                if (c == ' ') {
                    continue;
                }
            }
            line.append(c);
        }
        if (line.length() > indent.length()) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static float width(String text, PDFont font, float fontSize) throws IOException {
        return font.getStringWidth(text) / 1000 * fontSize;
    }

    private static class PDPageContext {
        private final PDDocument document;
        private PDPage currentPage;
        private PDPageContentStream contentStream;
        private float y;
        private final float pageHeight = PDRectangle.LETTER.getHeight();

        PDPageContext(PDDocument document) {
            this.document = document;
        }

        void startNewPage() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
            currentPage = new PDPage(PDRectangle.LETTER);
            document.addPage(currentPage);
            contentStream = new PDPageContentStream(document, currentPage);
            y = pageHeight - MARGIN;
        }

        void ensureSpace(float requiredSpace) throws IOException {
            if (currentPage == null || y < MARGIN + requiredSpace) {
                startNewPage();
            }
        }

        /**
         * Word-wraps text to the page width. Words longer than a line are split; code keeps its indentation.
         */
        void writeWrappedText(String text, PDFont font, float fontSize, float x, boolean preserveIndent) throws IOException {
            String safe = encodable(text, font);
            if (safe.isBlank()) {
                y -= fontSize * LINE_SPACING;
                return;
            }
            float maxWidth = PAGE_WIDTH - MARGIN - x;
            for (String line : wrapLines(safe, font, fontSize, maxWidth, preserveIndent)) {
                writeSingleLine(line, font, fontSize, x);
            }
        }

        private void writeSingleLine(String text, PDFont font, float fontSize, float x) throws IOException {
            ensureSpace(fontSize * LINE_SPACING);
            contentStream.beginText();
            contentStream.setFont(font, fontSize);
            contentStream.newLineAtOffset(x, y);
            contentStream.showText(text);
            contentStream.endText();
            y -= fontSize * LINE_SPACING;
        }

        void close() throws IOException {
            if (contentStream != null) {
                contentStream.close();
            }
        }
    }
}
