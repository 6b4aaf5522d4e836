package com.example.statements.infrastructure.pdf;

import com.example.statements.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Infrastructure helper that turns the text layer of a PDF statement into plain lines.
 * Scanned statements without a text layer produce blank text; there is no OCR fallback.
 */
@Component
public class PdfBoxTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextReader.class);

    /**
     * Loads the PDF and extracts its text, one visual line per text line, pages in order.
     *
     * @param bytes    PDF bytes already loaded into memory
     * @param fileName name used in error messages
     * @return extracted text, never {@code null}
     * @throws PdfProcessingException when PDFBox cannot parse the document
     */
    public String readText(byte[] bytes, String fileName) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);
            String text = stripper.getText(document);
            log.debug("Read {} page(s) from {}", document.getNumberOfPages(), fileName);
            return text == null ? "" : text;
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the text of " + fileName, e);
        }
    }

    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setParagraphEnd("\n");
    }
}
