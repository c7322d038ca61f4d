package com.example.changeguard.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики проверки changelog-файлов.
 */
@Component
public class CheckMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final AtomicInteger lastChangesCount;
    private final AtomicInteger lastBreakingCount;

    public CheckMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("check.duration.total")
            .description("Total duration of changelog check")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("check.completed.total")
            .description("Total number of completed checks")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("check.failed.total")
            .description("Total number of failed checks")
            .register(meterRegistry);

        this.lastChangesCount = new AtomicInteger(0);
        Gauge.builder("check.changes.count", lastChangesCount, AtomicInteger::get)
            .description("Number of schema changes found in last check")
            .register(meterRegistry);

        this.lastBreakingCount = new AtomicInteger(0);
        Gauge.builder("check.breaking.count", lastBreakingCount, AtomicInteger::get)
            .description("Number of breaking changes found in last check")
            .register(meterRegistry);
    }

    /**
     * Создаёт Timer.Sample для измерения времени шага.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Записывает общее время проверки.
     */
    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения шага (parse, extract, classify, locate).
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("check.step.duration")
            .tag("step", stepName)
            .description("Duration of check step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    /**
     * Отмечает успешное завершение проверки и обновляет количество найденных изменений.
     */
    public void recordCompleted(int changesCount, int breakingCount) {
        lastChangesCount.set(changesCount);
        lastBreakingCount.set(breakingCount);
        completedTotal.increment();
    }

    /**
     * Отмечает неудачное завершение проверки.
     */
    public void recordFailed() {
        failedTotal.increment();
    }
}
