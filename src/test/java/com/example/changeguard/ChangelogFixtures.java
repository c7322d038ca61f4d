package com.example.changeguard;

/**
 * Changelog-файлы для тестов.
 */
public final class ChangelogFixtures {

    /**
     * Создаёт person и добавляет NOT NULL на person.username (безопасно),
     * затем меняет таблицу existing, которая в changelog не создаётся:
     * NOT NULL на строках 28 и 29, удаление колонки на строке 33.
     */
    public static final String EXAMPLE_CHANGELOG = """
            <?xml version="1.0" encoding="UTF-8"?>
            <databaseChangeLog
                    xmlns="http://www.liquibase.org/xml/ns/dbchangelog"
                    xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                    xsi:schemaLocation="http://www.liquibase.org/xml/ns/dbchangelog
                    http://www.liquibase.org/xml/ns/dbchangelog/dbchangelog-4.20.xsd">

                <changeSet id="1" author="dev">
                    <createTable tableName="person">
                        <column name="id" type="int">
                            <constraints primaryKey="true"/>
                        </column>
                        <column name="username" type="varchar(50)"/>
                    </createTable>
                </changeSet>

                <changeSet id="2" author="dev">
                    <addColumn tableName="person">
                        <column name="email" type="varchar(100)"/>
                    </addColumn>
                </changeSet>

                <changeSet id="3" author="dev">
                    <addNotNullConstraint tableName="person" columnName="username" columnDataType="varchar(50)"/>
                </changeSet>

                <changeSet id="4" author="dev">
                    <addNotNullConstraint tableName="existing" columnName="new_column" columnDataType="varchar(50)"/>
                    <addNotNullConstraint tableName="existing" columnName="existing_column" columnDataType="varchar(50)"/>
                </changeSet>

                <changeSet id="5" author="dev">
                    <dropColumn tableName="existing" columnName="delete_column"/>
                </changeSet>
            </databaseChangeLog>
            """;

    /**
     * Второй файл: удаляет таблицу legacy (строка 9) и создаёт таблицу existing.
     */
    public static final String SECOND_CHANGELOG = """
            <?xml version="1.0" encoding="UTF-8"?>
            <databaseChangeLog
                    xmlns="http://www.liquibase.org/xml/ns/dbchangelog"
                    xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                    xsi:schemaLocation="http://www.liquibase.org/xml/ns/dbchangelog
                    http://www.liquibase.org/xml/ns/dbchangelog/dbchangelog-4.20.xsd">

                <changeSet id="10" author="dev">
                    <dropTable tableName="legacy"/>
                </changeSet>

                <changeSet id="11" author="dev">
                    <createTable tableName="existing">
                        <column name="id" type="int"/>
                    </createTable>
                </changeSet>
            </databaseChangeLog>
            """;

    private ChangelogFixtures() {
    }
}
