package com.example.tenderintel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpecificationExtractorTest {

    private final SpecificationExtractor extractor = new SpecificationExtractor(5);

    @Test
    void extract_shouldKeepTechnicalLines_inDocumentOrder() {
        String text = "Scope of Supply\n"
                + "Material: ASTM A106 Grade B seamless\n"
                + "6\" pipe, schedule 40\n"
                + "Pressure rating Class 300\n"
                + "Gate valve, flanged ends\n"
                + "Delivery to site within 6 weeks\n"
                + "Ball valves x 20\n"
                + "Contact the buyer for questions\n"
                + "Flange face to EN 1092-1";

        assertThat(extractor.extract(text)).containsExactly(
                "Material: ASTM A106 Grade B seamless",
                "6\" pipe, schedule 40",
                "Pressure rating Class 300",
                "Gate valve, flanged ends",
                "Ball valves x 20",
                "Flange face to EN 1092-1");
    }

    @Test
    void extract_shouldDeduplicateByExactText_keepingFirstOccurrence() {
        String text = "  Stainless steel 316L  \r\n"
                + "Carbon steel A105\n"
                + "Stainless steel 316L\n"
                + "stainless steel 316L";

        assertThat(extractor.extract(text)).containsExactly(
                "Stainless steel 316L",
                "Carbon steel A105",
                "stainless steel 316L");
    }

    @Test
    void extract_shouldDropLinesNotLongerThanMinimum() {
        List<String> specs = extractor.extract("Size\nGrade\nsize 2\" NPS");

        assertThat(specs).containsExactly("size 2\" NPS");
    }

    @Test
    void extract_shouldMatchCueWordsAsWholeWords() {
        // "en" внутри "tender" и "attendance" не считается стандартом EN
        assertThat(extractor.extract("Tender opening attendance is optional")).isEmpty();
        assertThat(extractor.extract("All specifications attached")).containsExactly("All specifications attached");
    }

    @Test
    void extract_shouldReturnEmptyList_forBlankInput() {
        assertThat(extractor.extract("   \n\n")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
