package com.example.changeguard.dto;

import com.example.changeguard.model.ChangeKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ответ с результатами проверки.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResponse {
    /**
     * Статус выполнения
     */
    private CheckStatus status;

    /**
     * Сообщение (для ошибок)
     */
    private String message;

    private int totalChanges;

    private int breakingChanges;

    /**
     * Все распознанные изменения
     */
    private List<ChangeDto> changes;

    /**
     * Текстовый отчёт в том же виде, что и в CLI
     */
    private String report;

    public enum CheckStatus {
        COMPLETED,
        FAILED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChangeDto {
        private ChangeKind kind;
        private String tableName;
        private String columnName;
        private String fileName;
        private int lineNumber;
        private boolean breaking;
        private String message;
    }
}
