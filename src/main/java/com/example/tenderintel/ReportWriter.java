package com.example.tenderintel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON-отчет по обработанному документу для логов и аналитики.
 * Даты пишутся в ISO-формате (2026-12-15), перечисления - строчными ключами.
 */
public class ReportWriter {
    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson(TenderAssessment assessment) {
        ObjectNode root = mapper.createObjectNode();
        root.put("source", assessment.getSource());
        root.set("document", mapper.valueToTree(assessment.getDocument()));
        if (assessment.getDecision() != null) {
            root.put("deadlineDetected", assessment.isDeadlineDetected());
            root.set("decision", mapper.valueToTree(assessment.getDecision()));
        }
        return root;
    }

    public String write(TenderAssessment assessment) throws JsonProcessingException {
        return mapper.writeValueAsString(toJson(assessment));
    }
}
