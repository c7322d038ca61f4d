package com.example.changeguard.service.parsing;

import com.example.changeguard.config.CheckerConfig;
import com.example.changeguard.exception.ChangelogParseException;
import liquibase.changelog.ChangeLogParameters;
import liquibase.changelog.ChangeSet;
import liquibase.changelog.DatabaseChangeLog;
import liquibase.database.core.PostgresDatabase;
import liquibase.exception.ChangeLogParseException;
import liquibase.exception.UnexpectedLiquibaseException;
import liquibase.parser.core.xml.XMLChangeLogSAXParser;
import liquibase.resource.DirectoryResourceAccessor;
import liquibase.resource.ResourceAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Разбор XML changelog-файлов Liquibase в change-set'ы.
 *
 * База данных нужна парсеру только как параметр подстановки,
 * соединение с ней никогда не открывается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangelogParser {

    private final CheckerConfig checkerConfig;

    /**
     * Разбирает все файлы в порядке передачи.
     *
     * @param changelogFiles пути к файлам (абсолютные или относительно base-dir)
     * @return change-set'ы всех файлов в порядке следования
     * @throws ChangelogParseException если хотя бы один файл не удалось разобрать
     */
    public List<ChangeSet> parseAll(List<String> changelogFiles) {
        Path basePath = checkerConfig.getBasePath();
        ResourceAccessor resourceAccessor = createResourceAccessor(basePath);
        ChangeLogParameters parameters = new ChangeLogParameters(new PostgresDatabase());

        List<ChangeSet> changeSets = new ArrayList<>();
        for (String changelogFile : changelogFiles) {
            DatabaseChangeLog changeLog = parse(changelogFile, basePath, parameters, resourceAccessor);
            log.debug("Parsed {} change-sets from {}", changeLog.getChangeSets().size(), changelogFile);
            changeSets.addAll(changeLog.getChangeSets());
        }
        return changeSets;
    }

    private DatabaseChangeLog parse(String changelogFile,
                                    Path basePath,
                                    ChangeLogParameters parameters,
                                    ResourceAccessor resourceAccessor) {
        String location = toResourcePath(changelogFile, basePath);
        if (!Files.isRegularFile(basePath.resolve(location))) {
            throw new ChangelogParseException(changelogFile, "Changelog " + changelogFile + " does not exist");
        }

        try {
            return new XMLChangeLogSAXParser().parse(location, parameters, resourceAccessor);
        } catch (ChangeLogParseException | UnexpectedLiquibaseException e) {
            log.error("Failed to parse changelog {}", changelogFile, e);
            throw new ChangelogParseException(changelogFile,
                    "Failed to parse changelog " + changelogFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Приводит путь к виду, относительному base-dir, с прямыми слэшами.
     */
    String toResourcePath(String changelogFile, Path basePath) {
        Path absolute = basePath.resolve(changelogFile).normalize();
        if (!absolute.startsWith(basePath)) {
            throw new ChangelogParseException(changelogFile,
                    "Changelog " + changelogFile + " is outside of base directory " + basePath);
        }
        return basePath.relativize(absolute).toString().replace('\\', '/');
    }

    private ResourceAccessor createResourceAccessor(Path basePath) {
        try {
            return new DirectoryResourceAccessor(basePath);
        } catch (FileNotFoundException e) {
            throw new ChangelogParseException(basePath.toString(),
                    "Base directory " + basePath + " does not exist", e);
        }
    }
}
