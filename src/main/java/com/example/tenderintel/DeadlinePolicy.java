package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Расчет срока для поставщиков по сроку клиента.
 * <p>
 * Срок поставщика = срок клиента минус запас, но никогда не раньше сегодняшнего дня.
 * Если из-за этого запас сократился, это видно по статусу срока, а не скрывается.
 */
@Slf4j
public class DeadlinePolicy {
    private final Clock clock;
    private final int bufferDays;

    public DeadlinePolicy(Clock clock) {
        this(clock, Config.getBufferDays());
    }

    public DeadlinePolicy(Clock clock, int bufferDays) {
        this.clock = clock;
        this.bufferDays = requireBuffer(bufferDays);
    }

    public int getBufferDays() {
        return bufferDays;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate supplierDeadline(LocalDate clientDeadline) {
        return supplierDeadline(clientDeadline, bufferDays);
    }

    /**
     * @param clientDeadline срок клиента
     * @param bufferDays сколько дней вычесть, не меньше 0
     * @return срок поставщика, не раньше сегодняшнего дня
     */
    public LocalDate supplierDeadline(LocalDate clientDeadline, int bufferDays) {
        return supplierDeadline(clientDeadline, bufferDays, today());
    }

    private LocalDate supplierDeadline(LocalDate clientDeadline, int bufferDays, LocalDate today) {
        BusinessCalendar.requireDate(clientDeadline, "clientDeadline");
        LocalDate supplierDeadline = clientDeadline.minusDays(requireBuffer(bufferDays));
        if (supplierDeadline.isBefore(today)) {
            log.debug("Supplier deadline {} is in the past, using today {}", supplierDeadline, today);
            supplierDeadline = today;
        }
        return supplierDeadline;
    }

    /**
     * Вариант для строки с датой, например из формы или CSV.
     *
     * @throws IllegalArgumentException если строка не разбирается ни одним из форматов
     */
    public LocalDate supplierDeadline(String clientDeadline, int bufferDays) {
        LocalDate parsed = DateNormalizer.parseFreeString(clientDeadline);
        if (parsed == null) {
            throw new IllegalArgumentException("Not a recognizable date: '" + clientDeadline + "'");
        }
        return supplierDeadline(parsed, bufferDays);
    }

    /**
     * Срок поставщика с учетом сложности проекта и рабочих дней.
     * Запас умножается на коэффициент (минимум 1 день), выходной сдвигается на предыдущий
     * рабочий день, а если получилось прошлое - берется следующий рабочий день после сегодня.
     */
    public LocalDate optimalSupplierDeadline(LocalDate clientDeadline, double complexityFactor) {
        BusinessCalendar.requireDate(clientDeadline, "clientDeadline");
        if (Double.isNaN(complexityFactor) || Double.isInfinite(complexityFactor)) {
            throw new IllegalArgumentException("Complexity factor must be a finite number, got " + complexityFactor);
        }
        int adjustedBuffer = Math.max(1, (int) (bufferDays * complexityFactor));
        LocalDate supplierDeadline = clientDeadline.minusDays(adjustedBuffer);

        if (!BusinessCalendar.isBusinessDay(supplierDeadline)) {
            supplierDeadline = BusinessCalendar.previousBusinessDay(supplierDeadline);
        }

        LocalDate today = today();
        if (supplierDeadline.isBefore(today)) {
            supplierDeadline = BusinessCalendar.nextBusinessDay(today);
        }
        return supplierDeadline;
    }

    public DeadlineStatus deadlineStatus(LocalDate deadline) {
        return deadlineStatus(deadline, today());
    }

    public static DeadlineStatus deadlineStatus(LocalDate deadline, LocalDate today) {
        BusinessCalendar.requireDate(deadline, "deadline");
        BusinessCalendar.requireDate(today, "today");
        long daysRemaining = ChronoUnit.DAYS.between(today, deadline);

        DeadlineStatus.Status status;
        Urgency urgency;
        if (daysRemaining < 0) {
            status = DeadlineStatus.Status.OVERDUE;
            urgency = Urgency.CRITICAL;
        } else if (daysRemaining == 0) {
            status = DeadlineStatus.Status.DUE_TODAY;
            urgency = Urgency.CRITICAL;
        } else if (daysRemaining == 1) {
            status = DeadlineStatus.Status.DUE_SOON;
            urgency = Urgency.HIGH;
        } else if (daysRemaining <= 3) {
            status = DeadlineStatus.Status.APPROACHING;
            urgency = Urgency.MEDIUM;
        } else {
            status = DeadlineStatus.Status.ON_TRACK;
            urgency = Urgency.LOW;
        }
        return new DeadlineStatus(status, urgency, daysRemaining, BusinessCalendar.isBusinessDay(deadline), deadline);
    }

    /**
     * Полное решение по сроку клиента: срок поставщика, статус и дата напоминания.
     */
    public DeadlineDecision decide(LocalDate clientDeadline) {
        LocalDate today = today();
        return buildDecision(clientDeadline, supplierDeadline(clientDeadline, bufferDays, today), bufferDays, today);
    }

    /**
     * То же, но срок поставщика считается через {@link #optimalSupplierDeadline}.
     */
    public DeadlineDecision decide(LocalDate clientDeadline, double complexityFactor) {
        LocalDate supplierDeadline = optimalSupplierDeadline(clientDeadline, complexityFactor);
        int adjustedBuffer = Math.max(1, (int) (bufferDays * complexityFactor));
        return buildDecision(clientDeadline, supplierDeadline, adjustedBuffer, today());
    }

    private DeadlineDecision buildDecision(LocalDate clientDeadline, LocalDate supplierDeadline,
                                           int requestedBuffer, LocalDate today) {
        DeadlineStatus supplierStatus = deadlineStatus(supplierDeadline, today);
        boolean bufferShortened = ChronoUnit.DAYS.between(supplierDeadline, clientDeadline) < requestedBuffer;

        if (bufferShortened) {
            log.warn("Buffer for client deadline {} shortened: supplier deadline {} (requested {} days)",
                    clientDeadline, supplierDeadline, requestedBuffer);
        }

        return DeadlineDecision.builder()
                .clientDeadline(clientDeadline)
                .supplierDeadline(supplierDeadline)
                .status(supplierStatus.getStatus())
                .urgency(supplierStatus.getUrgency())
                .daysRemaining(supplierStatus.getDaysRemaining())
                .clientDaysRemaining(ChronoUnit.DAYS.between(today, clientDeadline))
                .businessDay(supplierStatus.isBusinessDay())
                .bufferShortened(bufferShortened)
                .followUpDate(supplierDeadline.plusDays(1))
                .build();
    }

    private static int requireBuffer(int bufferDays) {
        if (bufferDays < 0) {
            throw new IllegalArgumentException("Buffer days must not be negative, got " + bufferDays);
        }
        return bufferDays;
    }
}
