package com.example.tenderintel;

import lombok.Value;

/**
 * Итог обработки одного документа: извлеченные поля и решение по сроку.
 */
@Value
public class TenderAssessment {
    String source;
    ExtractedDocument document;
    DeadlineDecision decision;
    // false - срок в тексте не найден, вместо него взят сегодняшний день
    boolean deadlineDetected;
}
