package com.example.tenderintel;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Рабочие дни: понедельник - пятница. Праздники не учитываются.
 */
public final class BusinessCalendar {

    private BusinessCalendar() {
    }

    public static boolean isBusinessDay(LocalDate date) {
        requireDate(date, "date");
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * Ближайший рабочий день строго после указанной даты
     */
    public static LocalDate nextBusinessDay(LocalDate from) {
        LocalDate next = requireDate(from, "from").plusDays(1);
        while (!isBusinessDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /**
     * Ближайший рабочий день строго до указанной даты
     */
    public static LocalDate previousBusinessDay(LocalDate from) {
        LocalDate previous = requireDate(from, "from").minusDays(1);
        while (!isBusinessDay(previous)) {
            previous = previous.minusDays(1);
        }
        return previous;
    }

    /**
     * Количество рабочих дней между датами включительно, порядок аргументов не важен.
     */
    public static int businessDaysBetween(LocalDate a, LocalDate b) {
        LocalDate start = requireDate(a, "a");
        LocalDate end = requireDate(b, "b");
        if (start.isAfter(end)) {
            LocalDate tmp = start;
            start = end;
            end = tmp;
        }
        int businessDays = 0;
        for (LocalDate current = start; !current.isAfter(end); current = current.plusDays(1)) {
            if (isBusinessDay(current)) {
                businessDays++;
            }
        }
        return businessDays;
    }

    static LocalDate requireDate(LocalDate date, String name) {
        if (date == null) {
            throw new IllegalArgumentException("Expected a date for '" + name + "', got null");
        }
        return date;
    }
}
