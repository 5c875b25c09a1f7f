package com.example.tenderintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    private final ReportWriter reportWriter = new ReportWriter();

    @Test
    void toJson_shouldWriteIsoDatesAndLowercaseKeys() {
        ExtractedDocument document = ExtractedDocument.builder()
                .rawText("internal text")
                .materials(EnumSet.of(MaterialCategory.VALVES, MaterialCategory.FINNED_TUBES))
                .deadline(LocalDate.of(2026, 10, 21))
                .specifications(List.of("Gate valve class 300"))
                .tenderReference("RFQ-2026-077")
                .build();
        DeadlineDecision decision = DeadlineDecision.builder()
                .clientDeadline(LocalDate.of(2026, 10, 21))
                .supplierDeadline(LocalDate.of(2026, 10, 19))
                .status(DeadlineStatus.Status.DUE_TODAY)
                .urgency(Urgency.CRITICAL)
                .daysRemaining(0)
                .clientDaysRemaining(2)
                .businessDay(true)
                .followUpDate(LocalDate.of(2026, 10, 20))
                .build();

        ObjectNode json = reportWriter.toJson(new TenderAssessment("rfq.txt", document, decision, true));

        assertThat(json.get("source").asText()).isEqualTo("rfq.txt");
        assertThat(json.get("deadlineDetected").asBoolean()).isTrue();

        JsonNode doc = json.get("document");
        assertThat(doc.has("rawText")).isFalse();
        assertThat(doc.has("projectName")).isFalse();
        assertThat(doc.has("error")).isFalse();
        assertThat(doc.get("materials").size()).isEqualTo(2);
        assertThat(doc.get("materials").get(0).asText()).isEqualTo("valves");
        assertThat(doc.get("materials").get(1).asText()).isEqualTo("finned_tubes");
        assertThat(doc.get("deadline").asText()).isEqualTo("2026-10-21");
        assertThat(doc.get("tenderReference").asText()).isEqualTo("RFQ-2026-077");

        JsonNode dec = json.get("decision");
        assertThat(dec.get("supplierDeadline").asText()).isEqualTo("2026-10-19");
        assertThat(dec.get("status").asText()).isEqualTo("due_today");
        assertThat(dec.get("urgency").asText()).isEqualTo("critical");
        assertThat(dec.get("clientDaysRemaining").asLong()).isEqualTo(2);
        assertThat(dec.get("businessDay").asBoolean()).isTrue();
        assertThat(dec.get("bufferShortened").asBoolean()).isFalse();
        assertThat(dec.get("followUpDate").asText()).isEqualTo("2026-10-20");
    }

    @Test
    void toJson_shouldOmitDecision_forFailedDocument() {
        ObjectNode json = reportWriter.toJson(new TenderAssessment("scan.pdf",
                ExtractedDocument.failed("Error reading file: scan.pdf"), null, false));

        assertThat(json.has("decision")).isFalse();
        assertThat(json.has("deadlineDetected")).isFalse();
        assertThat(json.get("document").get("error").asText()).isEqualTo("Error reading file: scan.pdf");
        assertThat(json.get("document").get("materials").isEmpty()).isTrue();
        assertThat(json.get("document").has("deadline")).isFalse();
    }

    @Test
    void write_shouldProduceIndentedJson() throws Exception {
        String report = reportWriter.write(new TenderAssessment("scan.pdf",
                ExtractedDocument.failed("unreadable"), null, false));

        assertThat(report).contains("\"source\" : \"scan.pdf\"").contains("\n");
    }
}
