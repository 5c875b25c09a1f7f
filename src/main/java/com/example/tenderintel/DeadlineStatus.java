package com.example.tenderintel;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Состояние срока относительно сегодняшнего дня
 */
@Value
public class DeadlineStatus {

    public enum Status {
        OVERDUE,
        DUE_TODAY,
        DUE_SOON,
        APPROACHING,
        ON_TRACK;

        @JsonValue
        public String getKey() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Status status;
    Urgency urgency;
    long daysRemaining;
    boolean businessDay;
    LocalDate deadline;
}
