package com.example.changeguard.service;

import com.example.changeguard.metrics.CheckMetrics;
import com.example.changeguard.model.ChangeEvent;
import com.example.changeguard.model.CheckResult;
import com.example.changeguard.model.ClassifiedChange;
import com.example.changeguard.service.classification.BreakingChangeClassifier;
import com.example.changeguard.service.extraction.ChangeEventExtractor;
import com.example.changeguard.service.location.SourceLineLocator;
import com.example.changeguard.service.parsing.ChangelogParser;
import io.micrometer.core.instrument.Timer;
import liquibase.changelog.ChangeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Основной сервис проверки changelog-файлов.
 *
 * Классификация начинается только после извлечения изменений из всех файлов:
 * правило для NOT NULL зависит от полного набора изменений.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckService {

    private final ChangelogParser changelogParser;
    private final ChangeEventExtractor changeEventExtractor;
    private final BreakingChangeClassifier breakingChangeClassifier;
    private final SourceLineLocator sourceLineLocator;
    private final CheckMetrics checkMetrics;

    /**
     * Выполняет проверку набора changelog-файлов.
     *
     * @param changelogFiles пути к файлам в порядке применения
     * @return все распознанные изменения с классификацией и номерами строк
     */
    public CheckResult check(List<String> changelogFiles) {
        Timer.Sample totalSample = checkMetrics.startTimer();
        LocalDateTime startedAt = LocalDateTime.now();

        try {
            // 1. Разбор
            log.info("Step 1/4: Parsing {} changelog file(s)...", changelogFiles.size());
            Timer.Sample parseSample = checkMetrics.startTimer();
            List<ChangeSet> changeSets = changelogParser.parseAll(changelogFiles);
            checkMetrics.recordStepDuration(parseSample, "parse");

            // 2. Извлечение
            log.info("Step 2/4: Extracting schema changes...");
            Timer.Sample extractSample = checkMetrics.startTimer();
            List<ChangeEvent> events = List.copyOf(changeEventExtractor.extract(changeSets));
            checkMetrics.recordStepDuration(extractSample, "extract");

            // 3. Классификация по полному набору
            log.info("Step 3/4: Classifying {} changes...", events.size());
            Timer.Sample classifySample = checkMetrics.startTimer();
            // Равные события классифицируются одинаково, поэтому достаточно множества
            Set<ChangeEvent> breakingEvents = new HashSet<>(breakingChangeClassifier.classifyAll(events));
            checkMetrics.recordStepDuration(classifySample, "classify");

            // 4. Поиск строк
            log.info("Step 4/4: Locating changes in source files...");
            Timer.Sample locateSample = checkMetrics.startTimer();
            List<ClassifiedChange> changes = new ArrayList<>(events.size());
            for (ChangeEvent event : events) {
                changes.add(ClassifiedChange.builder()
                        .event(event)
                        .breaking(breakingEvents.contains(event))
                        .lineNumber(sourceLineLocator.locate(event))
                        .message(breakingChangeClassifier.message(event))
                        .build());
            }
            checkMetrics.recordStepDuration(locateSample, "locate");

            CheckResult result = CheckResult.builder()
                    .changelogFiles(List.copyOf(changelogFiles))
                    .startedAt(startedAt)
                    .completedAt(LocalDateTime.now())
                    .changes(changes)
                    .build();

            int breakingCount = result.getBreakingChanges().size();
            checkMetrics.recordCompleted(result.getTotalChanges(), breakingCount);
            log.info("Check completed: {} changes, {} breaking", result.getTotalChanges(), breakingCount);
            return result;

        } catch (RuntimeException e) {
            checkMetrics.recordFailed();
            throw e;
        } finally {
            checkMetrics.recordTotalDuration(totalSample);
        }
    }
}
