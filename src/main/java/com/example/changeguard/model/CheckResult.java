package com.example.changeguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Результат проверки набора changelog-файлов.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckResult {
    /**
     * Проверенные файлы в порядке передачи
     */
    @Builder.Default
    private List<String> changelogFiles = new ArrayList<>();

    /**
     * Время начала проверки
     */
    private LocalDateTime startedAt;

    /**
     * Время завершения проверки
     */
    private LocalDateTime completedAt;

    /**
     * Все распознанные изменения в порядке их следования
     */
    @Builder.Default
    private List<ClassifiedChange> changes = new ArrayList<>();

    public int getTotalChanges() {
        return changes != null ? changes.size() : 0;
    }

    /**
     * Только ломающие изменения, в исходном порядке.
     */
    public List<ClassifiedChange> getBreakingChanges() {
        return changes != null
                ? changes.stream().filter(ClassifiedChange::isBreaking).toList()
                : List.of();
    }

    public boolean hasBreakingChanges() {
        return !getBreakingChanges().isEmpty();
    }
}
