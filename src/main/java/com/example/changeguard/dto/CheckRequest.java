package com.example.changeguard.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Запрос на проверку changelog-файлов.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckRequest {
    /**
     * Пути к changelog-файлам (абсолютные или относительно checker.base-dir)
     */
    @NotEmpty(message = "At least one changelog file is required")
    private List<String> changelogFiles;
}
