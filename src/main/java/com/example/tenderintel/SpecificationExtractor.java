package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Отбирает строки с техническими требованиями: размеры, стандарты, марки материалов.
 */
@Slf4j
public class SpecificationExtractor {
    private final int minLength;

    public SpecificationExtractor() {
        this(Config.getSpecificationMinLength());
    }

    public SpecificationExtractor(int minLength) {
        this.minLength = minLength;
    }

    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        // LinkedHashSet: дубликаты по точному тексту, порядок первого появления
        Set<String> specifications = new LinkedHashSet<>();
        for (String line : text.split("\\r?\\n")) {
            String cleanSpec = line.strip();
            if (cleanSpec.length() <= minLength) {
                continue;
            }
            if (isSpecification(cleanSpec)) {
                specifications.add(cleanSpec);
            }
        }
        if (Config.getParserVerbose()) {
            log.debug("Extracted {} specification lines", specifications.size());
        }
        return Collections.unmodifiableList(new ArrayList<>(specifications));
    }

    private boolean isSpecification(String line) {
        if (PatternLibrary.SPECIFICATION_CUE.matcher(line).find()) {
            return true;
        }
        for (Pattern pattern : PatternLibrary.TECHNICAL_PATTERNS) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }
}
