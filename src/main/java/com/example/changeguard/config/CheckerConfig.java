package com.example.changeguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Основная конфигурация проверки.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "checker")
public class CheckerConfig {
    /**
     * Корневая директория, относительно которой разрешаются пути к changelog-файлам
     */
    private String baseDir = ".";

    /**
     * Завершать CLI с кодом 2, если найдены ломающие изменения
     */
    private boolean failOnBreaking = false;

    private ReportConfig report = new ReportConfig();

    public Path getBasePath() {
        return Path.of(baseDir).toAbsolutePath().normalize();
    }

    @Data
    public static class ReportConfig {
        /**
         * Файл для сохранения текстового отчёта (если не задан - только вывод в консоль)
         */
        private String path;
    }
}
