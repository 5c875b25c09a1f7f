package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ищет срок подачи заявок в тексте тендера.
 * <p>
 * Сначала просматриваются окна вокруг фраз вроде "deadline" или "submit by"
 * (в порядке приоритета фраз, внутри фразы - по порядку в документе),
 * и берется первая корректная дата окна. Если ничего не нашлось, весь текст
 * сканируется целиком, и принимается только дата строго позже сегодняшней.
 */
@Slf4j
public class DeadlineExtractor {
    private final Clock clock;
    private final int windowBefore;
    private final int windowAfter;

    public DeadlineExtractor(Clock clock) {
        this(clock, Config.getContextWindowBefore(), Config.getContextWindowAfter());
    }

    public DeadlineExtractor(Clock clock, int windowBefore, int windowAfter) {
        this.clock = clock;
        this.windowBefore = windowBefore;
        this.windowAfter = windowAfter;
    }

    public LocalDate extract(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        LocalDate anchored = findNearContext(text);
        if (anchored != null) {
            return anchored;
        }
        return findFutureDate(text);
    }

    /**
     * Первый этап: дата рядом с фразой о сроке
     */
    LocalDate findNearContext(String text) {
        for (Pattern context : PatternLibrary.DEADLINE_CONTEXTS) {
            Matcher matcher = context.matcher(text);
            while (matcher.find()) {
                int start = Math.max(0, matcher.start() - windowBefore);
                int end = Math.min(text.length(), matcher.end() + windowAfter);
                for (DateCandidate candidate : findCandidates(text, start, end)) {
                    LocalDate date = DateNormalizer.normalize(candidate);
                    if (date != null) {
                        log.debug("Deadline {} found near '{}'", date, matcher.group().trim());
                        return date;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Второй этап: первая дата в тексте, которая еще не наступила
     */
    LocalDate findFutureDate(String text) {
        LocalDate today = LocalDate.now(clock);
        for (DateCandidate candidate : findCandidates(text)) {
            LocalDate date = DateNormalizer.normalize(candidate);
            if (date != null && date.isAfter(today)) {
                log.debug("Deadline {} taken from free-text scan", date);
                return date;
            }
        }
        return null;
    }

    /**
     * Все совпадения всех форматов дат, по позиции в тексте.
     * При одинаковой позиции раньше идет формат с более высоким приоритетом.
     */
    static List<DateCandidate> findCandidates(String text) {
        return findCandidates(text, 0, text.length());
    }

    /**
     * То же для окна [start, end). Дата должна целиком лежать в окне, но границы цифр
     * проверяются по всему тексту, поэтому обрезанная краем окна дата не распознается.
     * Позиции кандидатов считаются от начала всего текста.
     */
    static List<DateCandidate> findCandidates(String text, int start, int end) {
        List<DateCandidate> candidates = new ArrayList<>();
        for (Map.Entry<PatternLibrary.DateGrammar, Pattern> grammar : PatternLibrary.DATE_GRAMMARS.entrySet()) {
            Matcher matcher = grammar.getValue().matcher(text)
                    .region(start, end)
                    .useTransparentBounds(true);
            while (matcher.find()) {
                candidates.add(new DateCandidate(
                        matcher.group("day"),
                        matcher.group("month"),
                        matcher.group("year"),
                        matcher.start(),
                        matcher.end(),
                        grammar.getKey()));
            }
        }
        candidates.sort(Comparator.comparingInt(DateCandidate::getStart)
                .thenComparing(DateCandidate::getGrammar));
        return candidates;
    }
}
