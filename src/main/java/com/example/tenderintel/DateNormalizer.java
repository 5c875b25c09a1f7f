package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Приводит даты из текста к {@link LocalDate}.
 * Несуществующие даты (31 апреля, 29 февраля невисокосного года) отбрасываются, а не подгоняются.
 */
@Slf4j
public final class DateNormalizer {

    // Двузначный год: меньше 50 - 2000-е, иначе 1900-е
    static final int CENTURY_PIVOT = 50;

    // Порядок важен: день-месяц пробуется раньше месяц-день
    public static final List<String> FREE_STRING_PATTERNS = List.of(
            "uuuu-M-d", "d/M/uuuu", "M/d/uuuu", "d-M-uuuu", "M-d-uuuu",
            "d.M.uuuu", "M.d.uuuu", "uuuu/M/d",
            "MMMM d, uuuu", "MMM d, uuuu", "d MMMM uuuu", "d MMM uuuu",
            "MMMM d uuuu", "MMM d uuuu"
    );

    private static final Map<String, DateTimeFormatter> FORMATTERS = buildFormatters();

    private DateNormalizer() {
    }

    /**
     * Собирает дату из дня, месяца (номер или название) и года.
     *
     * @param day день месяца
     * @param month номер месяца 1-12 или название/сокращение ("Dec", "sept")
     * @param year четырехзначный или двузначный год
     * @return дата или null, если такой даты нет в календаре
     */
    public static LocalDate normalize(String day, String month, String year) {
        if (day == null || month == null || year == null) {
            return null;
        }
        Integer monthNumber = resolveMonth(month);
        if (monthNumber == null) {
            return null;
        }
        try {
            String yearText = year.trim();
            int yearNumber = Integer.parseInt(yearText);
            if (yearText.length() <= 2) {
                yearNumber = expandTwoDigitYear(yearNumber);
            }
            return normalize(Integer.parseInt(day.trim()), monthNumber, yearNumber);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static LocalDate normalize(int day, int month, int year) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            if (Config.getParserVerbose()) {
                log.debug("Rejected invalid date {}-{}-{}: {}", year, month, day, e.getMessage());
            }
            return null;
        }
    }

    public static LocalDate normalize(DateCandidate candidate) {
        return normalize(candidate.getDay(), candidate.getMonth(), candidate.getYear());
    }

    public static int expandTwoDigitYear(int year) {
        return year < CENTURY_PIVOT ? 2000 + year : 1900 + year;
    }

    /**
     * Номер месяца по числу или английскому названию, иначе null
     */
    public static Integer resolveMonth(String month) {
        String value = month.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty()) {
            return null;
        }
        if (Character.isDigit(value.charAt(0))) {
            try {
                int number = Integer.parseInt(value);
                return number >= 1 && number <= 12 ? number : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return PatternLibrary.MONTHS.get(value);
    }

    /**
     * Разбирает строку с датой, перебирая {@link #FREE_STRING_PATTERNS} по порядку.
     *
     * @return первая успешно разобранная дата или null
     */
    public static LocalDate parseFreeString(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        for (Map.Entry<String, DateTimeFormatter> entry : FORMATTERS.entrySet()) {
            try {
                return LocalDate.parse(value, entry.getValue());
            } catch (DateTimeParseException e) {
                // пробуем следующий формат
            }
        }
        log.debug("No date format matched: '{}'", value);
        return null;
    }

    public static String format(LocalDate date, String pattern) {
        DateTimeFormatter formatter = FORMATTERS.get(pattern);
        if (formatter == null) {
            throw new IllegalArgumentException("Unsupported date pattern: " + pattern);
        }
        return formatter.format(date);
    }

    private static Map<String, DateTimeFormatter> buildFormatters() {
        Map<String, DateTimeFormatter> formatters = new LinkedHashMap<>();
        for (String pattern : FREE_STRING_PATTERNS) {
            formatters.put(pattern, new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT));
        }
        return Collections.unmodifiableMap(formatters);
    }
}
