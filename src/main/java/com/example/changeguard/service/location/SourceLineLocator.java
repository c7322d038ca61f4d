package com.example.changeguard.service.location;

import com.example.changeguard.config.CheckerConfig;
import com.example.changeguard.exception.ChangelogReadException;
import com.example.changeguard.model.ChangeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Поиск строки changelog-файла, в которой определено изменение.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceLineLocator {

    /**
     * Строка, возвращаемая, если тег изменения не найден
     */
    public static final int FALLBACK_LINE = 1;

    private final CheckerConfig checkerConfig;

    /**
     * Находит номер строки, с которой начинается тег изменения.
     *
     * Строки файла склеиваются без разделителя, по склеенному тексту ищется
     * первый тег нужного вида с подходящими атрибутами, затем смещение
     * начала совпадения переводится обратно в номер строки.
     *
     * @param event изменение
     * @return номер строки (начиная с 1), либо {@link #FALLBACK_LINE}, если тег не найден
     * @throws ChangelogReadException если файл не удалось прочитать
     */
    public int locate(ChangeEvent event) {
        List<String> lines = readLines(event.getFileName());
        String entireFile = String.join("", lines);

        Matcher matcher = event.getKind().getTagPattern().matcher(entireFile);
        while (matcher.find()) {
            if (matchesAttributes(event, matcher.group(1))) {
                return lineNumberAt(lines, matcher.start());
            }
        }

        log.warn("Could not locate {} in {}, reporting line {}", event, event.getFileName(), FALLBACK_LINE);
        return FALLBACK_LINE;
    }

    /**
     * Проверяет, что атрибуты тега относятся к таблице (и колонке) изменения.
     */
    boolean matchesAttributes(ChangeEvent event, String attributes) {
        if (!attributes.contains("tableName=\"" + event.getTableName() + "\"")) {
            return false;
        }
        return !event.getKind().isColumnScoped()
                || attributes.contains("columnName=\"" + event.getColumnName() + "\"");
    }

    /**
     * Переводит смещение в склеенном тексте в номер строки:
     * строка i занимает диапазон [начало, начало + длина).
     */
    int lineNumberAt(List<String> lines, int offset) {
        int lineStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            int lineEnd = lineStart + lines.get(i).length();
            if (offset >= lineStart && offset < lineEnd) {
                return i + 1;
            }
            lineStart = lineEnd;
        }
        return FALLBACK_LINE;
    }

    /**
     * Читает строки файла как UTF-8. Некорректные байты (например, в файлах
     * с encoding="ISO-8859-1") заменяются символом U+FFFD, теги остаются на месте.
     */
    private List<String> readLines(String fileName) {
        Path file = checkerConfig.getBasePath().resolve(fileName);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        } catch (IOException e) {
            log.error("Error reading changelog {}", file, e);
            throw new ChangelogReadException(fileName, e);
        }
    }
}
