package com.example.changeguard.service.extraction;

import com.example.changeguard.model.ChangeEvent;
import liquibase.change.Change;
import liquibase.change.ColumnConfig;
import liquibase.change.core.AddNotNullConstraintChange;
import liquibase.change.core.CreateTableChange;
import liquibase.change.core.DropColumnChange;
import liquibase.change.core.DropTableChange;
import liquibase.changelog.ChangeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Сервис для преобразования разобранных change-set'ов в {@link ChangeEvent}.
 */
@Slf4j
@Service
public class ChangeEventExtractor {

    /**
     * Извлекает изменения из всех change-set'ов, сохраняя порядок.
     * Изменения прочих типов (insert, addColumn, sql и т.д.) пропускаются.
     *
     * @param changeSets change-set'ы всех проверяемых файлов
     * @return список изменений
     */
    public List<ChangeEvent> extract(List<ChangeSet> changeSets) {
        List<ChangeEvent> events = new ArrayList<>();

        for (ChangeSet changeSet : changeSets) {
            String fileName = changeSet.getFilePath();
            log.debug("Processing change-set {}::{} from {}", changeSet.getId(), changeSet.getAuthor(), fileName);

            for (Change change : changeSet.getChanges()) {
                extractFromChange(change, fileName, events);
            }
        }

        log.info("Extracted {} schema changes from {} change-sets", events.size(), changeSets.size());
        return events;
    }

    private void extractFromChange(Change change, String fileName, List<ChangeEvent> events) {
        if (change instanceof CreateTableChange createTable) {
            if (hasTableName(createTable.getTableName(), change, fileName)) {
                events.add(ChangeEvent.tableCreated(createTable.getTableName(), fileName));
            }
        } else if (change instanceof DropTableChange dropTable) {
            if (hasTableName(dropTable.getTableName(), change, fileName)) {
                events.add(ChangeEvent.tableDropped(dropTable.getTableName(), fileName));
            }
        } else if (change instanceof DropColumnChange dropColumn) {
            if (hasTableName(dropColumn.getTableName(), change, fileName)) {
                for (String columnName : droppedColumns(dropColumn, fileName)) {
                    events.add(ChangeEvent.columnDropped(dropColumn.getTableName(), columnName, fileName));
                }
            }
        } else if (change instanceof AddNotNullConstraintChange addNotNull) {
            if (hasTableName(addNotNull.getTableName(), change, fileName)
                    && hasColumnName(addNotNull.getColumnName(), change, fileName)) {
                events.add(ChangeEvent.notNullAdded(addNotNull.getTableName(), addNotNull.getColumnName(), fileName));
            }
        }
    }

    /**
     * Колонки, удаляемые изменением: атрибут {@code columnName}
     * и вложенные элементы {@code <column name="..."/>}, без повторов.
     */
    private Set<String> droppedColumns(DropColumnChange dropColumn, String fileName) {
        Set<String> columns = new LinkedHashSet<>();
        if (dropColumn.getColumnName() != null && !dropColumn.getColumnName().isBlank()) {
            columns.add(dropColumn.getColumnName());
        }
        if (dropColumn.getColumns() != null) {
            for (ColumnConfig column : dropColumn.getColumns()) {
                if (column.getName() != null && !column.getName().isBlank()) {
                    columns.add(column.getName());
                }
            }
        }

        if (columns.isEmpty()) {
            log.warn("Skipping dropColumn on table {} in {}: no column name", dropColumn.getTableName(), fileName);
        }
        return columns;
    }

    private boolean hasTableName(String tableName, Change change, String fileName) {
        if (tableName == null || tableName.isBlank()) {
            log.warn("Skipping {} in {}: no table name", change.getClass().getSimpleName(), fileName);
            return false;
        }
        return true;
    }

    private boolean hasColumnName(String columnName, Change change, String fileName) {
        if (columnName == null || columnName.isBlank()) {
            log.warn("Skipping {} in {}: no column name", change.getClass().getSimpleName(), fileName);
            return false;
        }
        return true;
    }
}
