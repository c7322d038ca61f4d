package com.example.changeguard.service.classification;

import com.example.changeguard.model.ChangeEvent;
import com.example.changeguard.model.ChangeKind;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Определяет, может ли изменение сломать уже запущенные экземпляры сервиса
 * во время rolling-деплоя.
 */
@Service
public class BreakingChangeClassifier {

    private static final String DROP_MESSAGE =
            "Dropping the %s %s may cause running instances of the service to fail during the deployment. "
                    + "It will also make a rollback of this change non-trivial.";

    private static final String NOT_NULL_MESSAGE =
            "Adding a not-null constraint on column %s for table %s which already exists could break "
                    + "existing instances of the service while deploying and makes rolling back non-trivial.";

    private static final String NOT_BREAKING_MESSAGE = "Not a breaking change";

    /**
     * Классифицирует изменение в контексте всех изменений проверки.
     *
     * NOT NULL считается безопасным, только если таблица создаётся в этом же наборе
     * изменений. Порядок выполнения change-set'ов не учитывается, проверяется
     * лишь наличие {@link ChangeKind#TABLE_CREATED} с тем же именем таблицы.
     *
     * @param event     проверяемое изменение
     * @param allEvents все изменения из всех файлов
     * @return true, если изменение ломающее
     */
    public boolean isBreaking(ChangeEvent event, List<ChangeEvent> allEvents) {
        return switch (event.getKind()) {
            case TABLE_CREATED -> false;
            case TABLE_DROPPED, COLUMN_DROPPED -> true;
            case NOT_NULL_ADDED -> allEvents.stream()
                    .noneMatch(other -> other.getKind() == ChangeKind.TABLE_CREATED
                            && other.getTableName().equals(event.getTableName()));
        };
    }

    /**
     * Ломающие изменения в исходном порядке.
     */
    public List<ChangeEvent> classifyAll(List<ChangeEvent> allEvents) {
        return allEvents.stream()
                .filter(event -> isBreaking(event, allEvents))
                .toList();
    }

    /**
     * Описание риска для изменения.
     */
    public String message(ChangeEvent event) {
        return switch (event.getKind()) {
            case TABLE_CREATED -> NOT_BREAKING_MESSAGE;
            case TABLE_DROPPED -> String.format(DROP_MESSAGE, "table", event.getTableName());
            case COLUMN_DROPPED -> String.format(DROP_MESSAGE, "column", event.getQualifiedName());
            case NOT_NULL_ADDED -> String.format(NOT_NULL_MESSAGE, event.getColumnName(), event.getTableName());
        };
    }
}
