package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Определяет товарные группы по ключевым словам.
 * Достаточно одного упоминания, частота и позиция не учитываются.
 */
@Slf4j
public class MaterialExtractor {

    public Set<MaterialCategory> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySet();
        }
        String textLower = text.toLowerCase(Locale.ROOT);
        EnumSet<MaterialCategory> found = EnumSet.noneOf(MaterialCategory.class);

        for (Map.Entry<MaterialCategory, List<String>> entry : PatternLibrary.MATERIAL_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (textLower.contains(keyword)) {
                    if (Config.getParserVerbose()) {
                        log.debug("Material {} matched by '{}'", entry.getKey(), keyword);
                    }
                    found.add(entry.getKey());
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(found);
    }
}
