package com.example.changeguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Изменение схемы с результатом классификации и найденной строкой в исходном файле.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedChange {
    /**
     * Исходное изменение
     */
    private ChangeEvent event;

    /**
     * Номер строки в файле (начиная с 1)
     */
    private int lineNumber;

    /**
     * Является ли изменение ломающим для rolling-деплоя
     */
    private boolean breaking;

    /**
     * Описание риска
     */
    private String message;

    public ChangeKind getKind() {
        return event.getKind();
    }

    public String getFileName() {
        return event.getFileName();
    }
}
