package com.example.finstatement.reader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import com.example.finstatement.exception.DocumentReadException;

class PdfPageTextReaderTest {

    private final PdfPageTextReader reader = new PdfPageTextReader();

    private static byte[] pdf(String... pageLines) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String line : pageLines) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(font, 12);
                    cs.newLineAtOffset(72, 700);
                    cs.showText(line);
                    cs.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void onePageOfTextPerPdfPage() throws IOException {
        List<String> pages = reader.read(pdf("Statement of Profit or Loss", "Statement of Financial Position"));

        assertThat(pages).hasSize(2);
        assertThat(pages.get(0)).contains("Statement of Profit or Loss").doesNotContain("Financial Position");
        assertThat(pages.get(1)).contains("Statement of Financial Position");
    }

    @Test
    void notAPdf() {
        byte[] junk = "plain text, not a PDF".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(junk))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageStartingWith("cannot read PDF");
    }
}
