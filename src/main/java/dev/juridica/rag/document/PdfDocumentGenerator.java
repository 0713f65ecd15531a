package dev.juridica.rag.document;

import java.io.IOException;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Renders answers as A4 PDF files with PDFBox and the standard Helvetica
 * fonts. Characters the fonts cannot encode are replaced by {@code ?}.
 */
public class PdfDocumentGenerator implements DocumentGenerator {

    private static final float MARGIN = 56f;
    private static final float TITLE_SIZE = 16f;
    private static final float BODY_SIZE = 11f;
    private static final float LEADING = 1.4f;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.PDF;
    }

    @Override
    public void render(DocumentContent content, Path target) throws IOException {
        PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        try (PDDocument document = new PDDocument()) {
            Writer writer = new Writer(document);
            writer.paragraph(content.title(), bold, TITLE_SIZE);
            writer.paragraph("Generated on " + DATE.format(content.generatedAt()), regular, BODY_SIZE - 2);
            writer.blankLine(BODY_SIZE);
            writer.paragraph("Question", bold, BODY_SIZE);
            writer.paragraph(content.question(), regular, BODY_SIZE);
            writer.blankLine(BODY_SIZE);
            writer.paragraph("Answer", bold, BODY_SIZE);
            for (String paragraph : content.answer().split("\\n")) {
                writer.paragraph(paragraph, regular, BODY_SIZE);
            }
            if (!content.sources().isEmpty()) {
                writer.blankLine(BODY_SIZE);
                writer.paragraph("Sources", bold, BODY_SIZE);
                for (String source : content.sources()) {
                    writer.paragraph("- " + source, regular, BODY_SIZE);
                }
            }
            writer.close();
            document.save(target.toFile());
        }
    }

    static String encodable(PDFont font, String text) {
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            if (codePoint == '\t') {
                builder.append(' ');
                return;
            }
            try {
                font.encode(character);
                builder.append(character);
            } catch (IOException | IllegalArgumentException ex) {
                builder.append('?');
            }
        });
        return builder.toString();
    }

    /**
     * Writes wrapped lines top to bottom, opening pages as needed.
     */
    private static final class Writer {

        private final PDDocument document;
        private PDPageContentStream stream;
        private float y;

        Writer(PDDocument document) {
            this.document = document;
        }

        void paragraph(String text, PDFont font, float size) throws IOException {
            String safe = encodable(font, text == null ? "" : text);
            float width = PDRectangle.A4.getWidth() - 2 * MARGIN;
            for (String line : wrap(safe, font, size, width)) {
                line(line, font, size);
            }
        }

        void blankLine(float size) throws IOException {
            line("", null, size);
        }

        private void line(String text, PDFont font, float size) throws IOException {
            float height = size * LEADING;
            if (stream == null || y - height < MARGIN) {
                newPage();
            }
            y -= height;
            if (font != null && !text.isEmpty()) {
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN, y);
                stream.showText(text);
                stream.endText();
            }
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = page.getMediaBox().getHeight() - MARGIN;
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private static List<String> wrap(String text, PDFont font, float size, float width) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : text.split(" ")) {
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (current.length() > 0 && font.getStringWidth(candidate) / 1000 * size > width) {
                    lines.add(current.toString());
                    current = new StringBuilder(word);
                } else {
                    current = new StringBuilder(candidate);
                }
            }
            lines.add(current.toString());
            return lines;
        }
    }
}
