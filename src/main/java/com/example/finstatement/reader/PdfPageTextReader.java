package com.example.finstatement.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.finstatement.exception.DocumentReadException;

/** Text of each PDF page, in page order. */
@Component
public class PdfPageTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfPageTextReader.class);

    public List<String> read(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<String> pages = new ArrayList<>();
            for (int p = 1; p <= document.getNumberOfPages(); p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(stripper.getText(document));
            }
            log.info("📄 PDF read: {} page(s)", pages.size());
            return pages;
        } catch (IOException e) {
            throw new DocumentReadException("cannot read PDF: " + e.getMessage(), e);
        }
    }
}
