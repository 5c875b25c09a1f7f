package com.example.tenderintel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Результат разбора одного текста тендера.
 * Все поля, кроме rawText, необязательны: отсутствие совпадения - это null или пустая коллекция.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractedDocument {
    // В JSON-отчет исходный текст не попадает
    @JsonIgnore
    String rawText;
    @Builder.Default
    Set<MaterialCategory> materials = Collections.emptySet();
    LocalDate deadline;
    @Builder.Default
    List<String> specifications = Collections.emptyList();
    String projectName;
    String tenderReference;
    // Заполняется только при ошибке получения текста, извлечение полей ошибок не дает
    String error;

    public static ExtractedDocument failed(String error) {
        return ExtractedDocument.builder()
                .rawText("")
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
