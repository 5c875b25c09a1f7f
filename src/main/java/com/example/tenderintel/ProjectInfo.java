package com.example.tenderintel;

import lombok.Value;

/**
 * Название проекта и номер тендера. Оба поля - подсказки и могут быть null.
 */
@Value
public class ProjectInfo {
    String projectName;
    String tenderReference;
}
