package com.example.changeguard.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Структурное изменение схемы, извлечённое из changelog-файла.
 *
 * Экземпляры неизменяемы и создаются только через фабричные методы,
 * которые гарантируют, что {@code columnName} задан ровно для видов
 * {@link ChangeKind#COLUMN_DROPPED} и {@link ChangeKind#NOT_NULL_ADDED}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChangeEvent {
    /**
     * Вид изменения
     */
    ChangeKind kind;

    /**
     * Имя таблицы
     */
    String tableName;

    /**
     * Имя колонки (null для изменений уровня таблицы)
     */
    String columnName;

    /**
     * Путь к файлу, в котором определён change-set
     */
    String fileName;

    public static ChangeEvent tableCreated(String tableName, String fileName) {
        return of(ChangeKind.TABLE_CREATED, tableName, null, fileName);
    }

    public static ChangeEvent tableDropped(String tableName, String fileName) {
        return of(ChangeKind.TABLE_DROPPED, tableName, null, fileName);
    }

    public static ChangeEvent columnDropped(String tableName, String columnName, String fileName) {
        return of(ChangeKind.COLUMN_DROPPED, tableName, columnName, fileName);
    }

    public static ChangeEvent notNullAdded(String tableName, String columnName, String fileName) {
        return of(ChangeKind.NOT_NULL_ADDED, tableName, columnName, fileName);
    }

    private static ChangeEvent of(ChangeKind kind, String tableName, String columnName, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name is required for " + kind);
        }
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name is required for " + kind + " in " + fileName);
        }
        if (kind.isColumnScoped() && (columnName == null || columnName.isBlank())) {
            throw new IllegalArgumentException("Column name is required for " + kind + " on table " + tableName);
        }
        return new ChangeEvent(kind, tableName, columnName, fileName);
    }

    /**
     * Полное имя объекта: {@code table} или {@code table.column}.
     */
    public String getQualifiedName() {
        return columnName != null ? tableName + "." + columnName : tableName;
    }

    @Override
    public String toString() {
        return kind + "(" + getQualifiedName() + ") in " + fileName;
    }
}
