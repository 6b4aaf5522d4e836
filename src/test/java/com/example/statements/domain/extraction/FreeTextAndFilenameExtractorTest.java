package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for free-text sanitizing and filename reduction.
 */
class FreeTextAndFilenameExtractorTest {

    private final FreeTextExtractor freeTextExtractor = new FreeTextExtractor();
    private final FilenameExtractor filenameExtractor = new FilenameExtractor();

    @Test
    void sanitizeReplacesPunctuationRunsWithSingleSpace() {
        assertThat(freeTextExtractor.sanitize("Orig CO Name:Paypal,  Inc. #1234"))
                .isEqualTo("Orig CO Name Paypal Inc 1234");
    }

    @Test
    void sanitizeTrimsLeadingAndTrailingSymbols() {
        assertThat(freeTextExtractor.sanitize("** Wire fees waived. **")).isEqualTo("Wire fees waived");
    }

    @Test
    void nullTextIsAbsent() {
        assertThat(freeTextExtractor.extract(null).isAbsent()).isTrue();
    }

    @Test
    void filenameKeepsPartAfterLastSeparator() {
        assertThat(filenameExtractor.extract("/data/in/2023/statement.pdf").value()).isEqualTo("statement.pdf");
        assertThat(filenameExtractor.extract("C:\\scans\\jan.pdf").value()).isEqualTo("jan.pdf");
    }

    @Test
    void filenameMustEndInPdf() {
        ExtractedField<String> filename = filenameExtractor.extract("statement.txt");

        assertThat(filename.isRejected()).isTrue();
        assertThat(filenameExtractor.extract("  ").isAbsent()).isTrue();
        assertThat(filenameExtractor.extract("folder/").present()).isFalse();
    }
}
