package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;

/**
 * Общий сервис обработки тендерного текста: разбор документа и расчет срока для поставщиков.
 * Используется CLI и может вызываться из любого внешнего слоя (формы, трекер заказов).
 */
@Slf4j
public class TenderIntakeService {
    private final DocumentAnalyzer documentAnalyzer;
    private final DeadlinePolicy deadlinePolicy;

    public TenderIntakeService(DocumentAnalyzer documentAnalyzer, DeadlinePolicy deadlinePolicy) {
        this.documentAnalyzer = documentAnalyzer;
        this.deadlinePolicy = deadlinePolicy;
    }

    public TenderAssessment process(String source, String rawText) {
        return process(source, rawText, null);
    }

    /**
     * Разбирает текст и считает срок поставщика.
     * Если срок в тексте не найден, подставляется сегодняшний день, чтобы дальнейшая обработка не блокировалась.
     *
     * @param source имя источника для логов и отчета
     * @param rawText уже декодированный текст документа
     * @param complexityFactor коэффициент сложности или null для обычного запаса
     */
    public TenderAssessment process(String source, String rawText, Double complexityFactor) {
        log.info("Processing tender text from {}", source);
        ExtractedDocument document = documentAnalyzer.analyze(rawText);

        boolean deadlineDetected = document.getDeadline() != null;
        LocalDate clientDeadline = deadlineDetected ? document.getDeadline() : deadlinePolicy.today();
        if (!deadlineDetected) {
            log.warn("No deadline found in {}, using today {}", source, clientDeadline);
        }

        DeadlineDecision decision = complexityFactor != null
                ? deadlinePolicy.decide(clientDeadline, complexityFactor)
                : deadlinePolicy.decide(clientDeadline);

        log.info("Deadline calculation for {}: client {}, supplier {}, buffer {} days, status {}",
                source, decision.getClientDeadline(), decision.getSupplierDeadline(),
                deadlinePolicy.getBufferDays(), decision.getStatus());

        return new TenderAssessment(source, document, decision, deadlineDetected);
    }

    /**
     * Запись для документа, текст которого получить не удалось
     */
    public TenderAssessment failed(String source, String error) {
        log.error("Skipping {}: {}", source, error);
        return new TenderAssessment(source, ExtractedDocument.failed(error), null, false);
    }
}
