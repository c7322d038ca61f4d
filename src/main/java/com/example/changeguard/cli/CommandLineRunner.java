package com.example.changeguard.cli;

import com.example.changeguard.config.CheckerConfig;
import com.example.changeguard.model.CheckResult;
import com.example.changeguard.model.ClassifiedChange;
import com.example.changeguard.service.CheckService;
import com.example.changeguard.service.ReportGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * CLI интерфейс для запуска проверки из командной строки.
 *
 * Примеры использования:
 *
 * java -jar changelog-guard.jar --changelog=db/changelog/v1.xml --changelog=db/changelog/v2.xml
 *
 * java -jar changelog-guard.jar --changelog=v1.xml,v2.xml --output=./build/breaking-changes.txt --fail-on-breaking
 *
 * Коды завершения: 0 - проверка выполнена, 1 - ошибка,
 * 2 - найдены ломающие изменения (только с --fail-on-breaking).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_BREAKING_CHANGES = 2;

    private final CheckService checkService;
    private final ReportGenerator reportGenerator;
    private final CheckerConfig checkerConfig;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // Без --changelog приложение работает в режиме REST API
        if (!args.containsOption("changelog")) {
            log.info("Starting in REST API mode. Use --changelog=<file> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");
        System.exit(runCli(args, System.out));
    }

    int runCli(ApplicationArguments args, PrintStream out) {
        try {
            List<String> changelogFiles = getChangelogFiles(args);
            String output = getOption(args, "output", checkerConfig.getReport().getPath());
            boolean failOnBreaking = args.containsOption("fail-on-breaking") || checkerConfig.isFailOnBreaking();

            CheckResult result = checkService.check(changelogFiles);

            String report = reportGenerator.generate(result);
            out.print(report);

            if (output != null && !output.isBlank()) {
                saveReport(Path.of(output), report);
                out.println("Report saved to: " + Path.of(output).toAbsolutePath());
            }

            printSummary(result, out);

            if (failOnBreaking && result.hasBreakingChanges()) {
                return EXIT_BREAKING_CHANGES;
            }
            return EXIT_OK;
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /**
     * Файлы из всех --changelog, значения через запятую допускаются.
     */
    List<String> getChangelogFiles(ApplicationArguments args) {
        List<String> files = args.getOptionValues("changelog").stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Option --changelog requires at least one file");
        }
        return files;
    }

    private void saveReport(Path outputPath, String report) {
        try {
            Path parent = outputPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, report);
        } catch (IOException e) {
            log.error("Failed to save report", e);
            throw new RuntimeException("Failed to save report: " + e.getMessage(), e);
        }
    }

    private void printSummary(CheckResult result, PrintStream out) {
        List<ClassifiedChange> breaking = result.getBreakingChanges();
        out.println();
        out.println("Checked files:      " + String.join(", ", result.getChangelogFiles()));
        out.println("Schema changes:     " + result.getTotalChanges());
        out.println("Breaking changes:   " + breaking.size());
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name) && !args.getOptionValues(name).isEmpty()) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
