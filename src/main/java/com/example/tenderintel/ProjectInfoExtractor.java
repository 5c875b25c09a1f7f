package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class ProjectInfoExtractor {
    private static final int MIN_NAME_LENGTH = 3;
    private static final int MIN_REFERENCE_LENGTH = 2;

    private final int maxNameLength;

    public ProjectInfoExtractor() {
        this(Config.getProjectNameMaxLength());
    }

    public ProjectInfoExtractor(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    public ProjectInfo extract(String text) {
        if (text == null || text.isBlank()) {
            return new ProjectInfo(null, null);
        }
        return new ProjectInfo(extractProjectName(text), extractTenderReference(text));
    }

    String extractProjectName(String text) {
        for (Pattern pattern : PatternLibrary.PROJECT_NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String projectName = matcher.group(1).strip();
                if (projectName.length() > MIN_NAME_LENGTH && projectName.length() < maxNameLength) {
                    log.debug("Extracted project name: {}", projectName);
                    return toTitleCase(projectName);
                }
            }
        }
        return null;
    }

    String extractTenderReference(String text) {
        for (Pattern pattern : PatternLibrary.TENDER_REFERENCE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            int from = 0;
            // Короткий код или слово без цифр отбрасывается, поиск продолжается со следующего символа
            while (from < text.length() && matcher.find(from)) {
                String ref = matcher.group(1).strip().toUpperCase(Locale.ROOT);
                if (ref.length() > MIN_REFERENCE_LENGTH && containsDigit(ref)) {
                    log.debug("Extracted tender reference: {}", ref);
                    return ref;
                }
                from = matcher.start() + 1;
            }
        }
        return null;
    }

    private static boolean containsDigit(String value) {
        return value.chars().anyMatch(Character::isDigit);
    }

    /**
     * Первая буква каждого слова заглавная, остальные строчные.
     * Словом считается любая последовательность букв ("o'neil" -> "O'Neil").
     */
    static String toTitleCase(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString();
    }
}
