package com.example.tenderintel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Словари и регулярные выражения для разбора тендерной документации.
 * Все таблицы неизменяемые и создаются один раз при загрузке класса.
 */
public final class PatternLibrary {

    /**
     * Вид даты, который распознает соответствующее выражение
     */
    public enum DateGrammar {
        DAY_MONTH_YEAR,
        DAY_MONTH_SHORT_YEAR,
        YEAR_MONTH_DAY,
        MONTH_NAME_DAY_YEAR,
        DAY_MONTH_NAME_YEAR,
        MONTH_NAME_ORDINAL_DAY_YEAR
    }

    public static final Map<MaterialCategory, List<String>> MATERIAL_KEYWORDS = buildMaterialKeywords();

    // Порядок важен: раньше в списке - выше приоритет
    public static final List<Pattern> DEADLINE_CONTEXTS = List.of(
            Pattern.compile("deadline\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("due\\s*(?:by|on|date)?\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("submit\\s*(?:by|before|on)?\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("closing\\s*(?:date|time)?\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("no\\s*later\\s*than\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("final\\s*(?:date|deadline)\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("tender\\s*(?:deadline|due)\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("proposal\\s*(?:deadline|due)\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("quotation\\s*(?:deadline|due)\\s*:?\\s*", Pattern.CASE_INSENSITIVE)
    );

    // Именованные группы day, month, year
    public static final Map<DateGrammar, Pattern> DATE_GRAMMARS = buildDateGrammars();

    public static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("january", 1), Map.entry("jan", 1),
            Map.entry("february", 2), Map.entry("feb", 2),
            Map.entry("march", 3), Map.entry("mar", 3),
            Map.entry("april", 4), Map.entry("apr", 4),
            Map.entry("may", 5),
            Map.entry("june", 6), Map.entry("jun", 6),
            Map.entry("july", 7), Map.entry("jul", 7),
            Map.entry("august", 8), Map.entry("aug", 8),
            Map.entry("september", 9), Map.entry("sep", 9), Map.entry("sept", 9),
            Map.entry("october", 10), Map.entry("oct", 10),
            Map.entry("november", 11), Map.entry("nov", 11),
            Map.entry("december", 12), Map.entry("dec", 12)
    );

    public static final Pattern SPECIFICATION_CUE = Pattern.compile(
            "\\b(?:specification|spec|requirement|standard|grade|material|size|pressure|temperature"
                    + "|api|astm|asme|din|en|iso|class|rating)s?\\b",
            Pattern.CASE_INSENSITIVE);

    public static final List<Pattern> TECHNICAL_PATTERNS = List.of(
            Pattern.compile("\\d+[\"']\\s*(?:diameter|dia|pipe|tube)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:grade|class|schedule|rating)\\s*[a-z0-9]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:api|ansi|astm|asme|iso)\\s*[0-9a-z-]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+\\s*(?:mm|cm|in|inch|\"|')", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:carbon|stainless|alloy)\\s*steel", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:ball|gate|check|globe)\\s*valve", Pattern.CASE_INSENSITIVE)
    );

    public static final List<Pattern> PROJECT_NAME_PATTERNS = List.of(
            Pattern.compile("\\bproject\\s*:\\s*(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bproject\\s+name\\s*:?\\s*(.+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:title|name)\\s*:?\\s*(.+)", Pattern.CASE_INSENSITIVE)
    );

    // Регистр не важен; код без цифр ("documents") отбрасывается в ProjectInfoExtractor
    public static final List<Pattern> TENDER_REFERENCE_PATTERNS = List.of(
            Pattern.compile("\\b(?:tender|reference|ref)\\b\\s*(?:no\\.?|number|#)?\\s*[:#-]?\\s*([a-z0-9][a-z0-9/_-]*)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:rfq|rfp|tender)(?:\\s*[:#]\\s*|\\s+)([a-z0-9][a-z0-9-]*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b((?:rfq|rfp)-[a-z0-9][a-z0-9-]*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bref\\b\\s*:?\\s*([a-z0-9][a-z0-9-]*)", Pattern.CASE_INSENSITIVE)
    );

    private PatternLibrary() {
    }

    private static Map<MaterialCategory, List<String>> buildMaterialKeywords() {
        Map<MaterialCategory, List<String>> keywords = new EnumMap<>(MaterialCategory.class);
        keywords.put(MaterialCategory.PIPING, List.of("pipe", "piping", "pipeline", "tube", "tubing"));
        keywords.put(MaterialCategory.VALVES, List.of("valve", "valves", "ball valve", "gate valve", "check valve", "control valve"));
        keywords.put(MaterialCategory.FLANGES, List.of("flange", "flanges", "weld neck", "slip on", "blind flange"));
        keywords.put(MaterialCategory.FITTINGS, List.of("fitting", "fittings", "elbow", "tee", "reducer", "coupling"));
        keywords.put(MaterialCategory.BOLTS, List.of("bolt", "bolts", "stud", "fastener", "fasteners", "screw"));
        keywords.put(MaterialCategory.GASKETS, List.of("gasket", "gaskets", "sealing", "seal", "o-ring"));
        keywords.put(MaterialCategory.FINNED_TUBES, List.of("finned tube", "finned tubes", "fin tube", "heat exchanger tube"));
        return Collections.unmodifiableMap(keywords);
    }

    private static Map<DateGrammar, Pattern> buildDateGrammars() {
        Map<DateGrammar, Pattern> grammars = new EnumMap<>(DateGrammar.class);
        grammars.put(DateGrammar.DAY_MONTH_YEAR,
                Pattern.compile("(?<!\\d)(?<day>\\d{1,2})[/\\-.](?<month>\\d{1,2})[/\\-.](?<year>\\d{4})(?!\\d)"));
        grammars.put(DateGrammar.DAY_MONTH_SHORT_YEAR,
                Pattern.compile("(?<!\\d)(?<day>\\d{1,2})[/\\-.](?<month>\\d{1,2})[/\\-.](?<year>\\d{2})(?!\\d)"));
        grammars.put(DateGrammar.YEAR_MONTH_DAY,
                Pattern.compile("(?<!\\d)(?<year>\\d{4})[/\\-.](?<month>\\d{1,2})[/\\-.](?<day>\\d{1,2})(?!\\d)"));
        grammars.put(DateGrammar.MONTH_NAME_DAY_YEAR,
                Pattern.compile("\\b(?<month>[A-Za-z]+)\\.?\\s+(?<day>\\d{1,2}),?\\s+(?<year>\\d{4})(?!\\d)"));
        grammars.put(DateGrammar.DAY_MONTH_NAME_YEAR,
                Pattern.compile("(?<!\\d)(?<day>\\d{1,2})\\s+(?<month>[A-Za-z]+)\\.?,?\\s+(?<year>\\d{4})(?!\\d)"));
        grammars.put(DateGrammar.MONTH_NAME_ORDINAL_DAY_YEAR,
                Pattern.compile("\\b(?<month>[A-Za-z]+)\\.?\\s+(?<day>\\d{1,2})(?:st|nd|rd|th),?\\s+(?<year>\\d{4})(?!\\d)", Pattern.CASE_INSENSITIVE));
        return Collections.unmodifiableMap(grammars);
    }
}
