package com.example.changeguard.model;

import java.util.regex.Pattern;

/**
 * Вид структурного изменения схемы, распознаваемый анализатором.
 */
public enum ChangeKind {
    /**
     * Создание таблицы: {@code <createTable>}
     */
    TABLE_CREATED("createTable", false),

    /**
     * Удаление таблицы: {@code <dropTable>}
     */
    TABLE_DROPPED("dropTable", false),

    /**
     * Удаление колонки: {@code <dropColumn>}
     */
    COLUMN_DROPPED("dropColumn", true),

    /**
     * Добавление ограничения NOT NULL: {@code <addNotNullConstraint>}
     */
    NOT_NULL_ADDED("addNotNullConstraint", true);

    private final boolean columnScoped;
    private final Pattern tagPattern;

    ChangeKind(String tagName, boolean columnScoped) {
        this.columnScoped = columnScoped;
        // Группа 1 - текст атрибутов открывающего тега
        this.tagPattern = Pattern.compile("<" + tagName + "\\s+([^>]+)>");
    }

    /**
     * Относится ли изменение к конкретной колонке (а не ко всей таблице).
     */
    public boolean isColumnScoped() {
        return columnScoped;
    }

    public Pattern getTagPattern() {
        return tagPattern;
    }
}
