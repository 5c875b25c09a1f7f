package com.example.tenderintel;

import lombok.Value;

/**
 * Дата, найденная в тексте, до проверки по календарю.
 * Поля хранятся как в исходном тексте, месяц может быть числом или названием.
 */
@Value
public class DateCandidate {
    String day;
    String month;
    String year;
    int start;
    int end;
    PatternLibrary.DateGrammar grammar;
}
