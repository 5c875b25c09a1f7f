package com.example.tenderintel;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Срок клиента, рассчитанный срок для поставщиков и их статус.
 * status, urgency и daysRemaining считаются по сроку поставщика.
 */
@Value
@Builder
public class DeadlineDecision {
    LocalDate clientDeadline;
    LocalDate supplierDeadline;
    Urgency urgency;
    DeadlineStatus.Status status;
    long daysRemaining;
    long clientDaysRemaining;
    boolean businessDay;
    // true, если запас пришлось сократить, чтобы срок поставщика не оказался в прошлом
    boolean bufferShortened;
    // На следующий день после срока поставщика по заявке напоминают
    LocalDate followUpDate;
}
