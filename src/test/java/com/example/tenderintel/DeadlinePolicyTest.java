package com.example.tenderintel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlinePolicyTest {

    // Понедельник, 19 октября 2026
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private final DeadlinePolicy policy = new DeadlinePolicy(CLOCK, 2);

    @Test
    void supplierDeadline_shouldSubtractBuffer() {
        assertThat(policy.supplierDeadline(LocalDate.of(2026, 11, 20))).isEqualTo(LocalDate.of(2026, 11, 18));
        assertThat(policy.supplierDeadline(LocalDate.of(2026, 11, 20), 5)).isEqualTo(LocalDate.of(2026, 11, 15));
        assertThat(policy.supplierDeadline(LocalDate.of(2026, 11, 20), 0)).isEqualTo(LocalDate.of(2026, 11, 20));
    }

    @Test
    void supplierDeadline_shouldNeverFallBeforeToday() {
        assertThat(policy.supplierDeadline(TODAY)).isEqualTo(TODAY);
        assertThat(policy.supplierDeadline(TODAY.plusDays(1))).isEqualTo(TODAY);
        assertThat(policy.supplierDeadline(LocalDate.of(2026, 10, 1))).isEqualTo(TODAY);
    }

    @Test
    void supplierDeadline_shouldKeepFullBuffer_whenClientDeadlineIsFarEnough() {
        for (int offset = -5; offset <= 40; offset++) {
            LocalDate client = TODAY.plusDays(offset);
            LocalDate supplier = policy.supplierDeadline(client);

            assertThat(supplier).isAfterOrEqualTo(TODAY);
            if (offset >= 2) {
                assertThat(ChronoUnit.DAYS.between(supplier, client)).isEqualTo(2);
            } else {
                assertThat(supplier).isEqualTo(TODAY);
            }
        }
    }

    @Test
    void supplierDeadline_shouldParseStringInput() {
        assertThat(policy.supplierDeadline("December 15, 2026", 2)).isEqualTo(LocalDate.of(2026, 12, 13));
        assertThat(policy.supplierDeadline("15/12/2026", 3)).isEqualTo(LocalDate.of(2026, 12, 12));
    }

    @Test
    void supplierDeadline_shouldRejectBadInput() {
        assertThatThrownBy(() -> policy.supplierDeadline("sometime soon", 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sometime soon");
        assertThatThrownBy(() -> policy.supplierDeadline(TODAY, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.supplierDeadline((LocalDate) null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeadlinePolicy(CLOCK, -3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "2026-10-18, OVERDUE,     CRITICAL, -1",
            "2026-10-19, DUE_TODAY,   CRITICAL, 0",
            "2026-10-20, DUE_SOON,    HIGH,     1",
            "2026-10-21, APPROACHING, MEDIUM,   2",
            "2026-10-22, APPROACHING, MEDIUM,   3",
            "2026-10-23, ON_TRACK,    LOW,      4"
    })
    void deadlineStatus_shouldClassifyByDaysRemaining(String deadline, DeadlineStatus.Status status,
                                                      Urgency urgency, long daysRemaining) {
        DeadlineStatus result = policy.deadlineStatus(LocalDate.parse(deadline));

        assertThat(result.getStatus()).isEqualTo(status);
        assertThat(result.getUrgency()).isEqualTo(urgency);
        assertThat(result.getDaysRemaining()).isEqualTo(daysRemaining);
        assertThat(result.getDeadline()).isEqualTo(LocalDate.parse(deadline));
    }

    @Test
    void deadlineStatus_shouldReportBusinessDay() {
        assertThat(policy.deadlineStatus(LocalDate.of(2026, 10, 23)).isBusinessDay()).isTrue();
        assertThat(policy.deadlineStatus(LocalDate.of(2026, 10, 24)).isBusinessDay()).isFalse();
    }

    @Test
    void optimalSupplierDeadline_shouldMoveWeekendToPreviousBusinessDay() {
        // 13 декабря 2026 - воскресенье
        assertThat(policy.optimalSupplierDeadline(LocalDate.of(2026, 12, 15), 1.0))
                .isEqualTo(LocalDate.of(2026, 12, 11));
    }

    @Test
    void optimalSupplierDeadline_shouldScaleBuffer_withMinimumOfOneDay() {
        assertThat(policy.optimalSupplierDeadline(LocalDate.of(2026, 12, 15), 2.6))
                .isEqualTo(LocalDate.of(2026, 12, 10));
        assertThat(policy.optimalSupplierDeadline(LocalDate.of(2026, 12, 15), 0.0))
                .isEqualTo(LocalDate.of(2026, 12, 14));
    }

    @Test
    void optimalSupplierDeadline_shouldUseNextBusinessDay_whenResultIsInThePast() {
        assertThat(policy.optimalSupplierDeadline(LocalDate.of(2026, 10, 20), 1.0))
                .isEqualTo(LocalDate.of(2026, 10, 20));
    }

    @Test
    void optimalSupplierDeadline_shouldRejectNonFiniteFactor() {
        assertThatThrownBy(() -> policy.optimalSupplierDeadline(LocalDate.of(2026, 12, 15), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.optimalSupplierDeadline(LocalDate.of(2026, 12, 15), Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decide_shouldCombineSupplierDeadlineAndStatus() {
        DeadlineDecision decision = policy.decide(LocalDate.of(2026, 11, 20));

        assertThat(decision.getClientDeadline()).isEqualTo(LocalDate.of(2026, 11, 20));
        assertThat(decision.getSupplierDeadline()).isEqualTo(LocalDate.of(2026, 11, 18));
        assertThat(decision.getStatus()).isEqualTo(DeadlineStatus.Status.ON_TRACK);
        assertThat(decision.getUrgency()).isEqualTo(Urgency.LOW);
        assertThat(decision.getDaysRemaining()).isEqualTo(30);
        assertThat(decision.getClientDaysRemaining()).isEqualTo(32);
        assertThat(decision.isBusinessDay()).isTrue();
        assertThat(decision.isBufferShortened()).isFalse();
        assertThat(decision.getFollowUpDate()).isEqualTo(LocalDate.of(2026, 11, 19));
    }

    @Test
    void decide_shouldFlagShortenedBuffer_whenClientDeadlineIsTooClose() {
        DeadlineDecision decision = policy.decide(TODAY.plusDays(1));

        assertThat(decision.getSupplierDeadline()).isEqualTo(TODAY);
        assertThat(decision.isBufferShortened()).isTrue();
        assertThat(decision.getStatus()).isEqualTo(DeadlineStatus.Status.DUE_TODAY);
        assertThat(decision.getUrgency()).isEqualTo(Urgency.CRITICAL);
        assertThat(decision.getFollowUpDate()).isEqualTo(TODAY.plusDays(1));
    }

    @Test
    void decide_withComplexity_shouldUseBusinessDayAdjustment() {
        DeadlineDecision decision = policy.decide(LocalDate.of(2026, 12, 15), 1.0);

        assertThat(decision.getSupplierDeadline()).isEqualTo(LocalDate.of(2026, 12, 11));
        assertThat(decision.getDaysRemaining()).isEqualTo(53);
        assertThat(decision.isBufferShortened()).isFalse();
        assertThat(decision.isBusinessDay()).isTrue();
    }
}
