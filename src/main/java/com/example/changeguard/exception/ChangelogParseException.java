package com.example.changeguard.exception;

/**
 * Changelog-файл не удалось разобрать. Проверка прерывается целиком.
 */
public class ChangelogParseException extends RuntimeException {

    private final String changelogFile;

    public ChangelogParseException(String changelogFile, String message) {
        super(message);
        this.changelogFile = changelogFile;
    }

    public ChangelogParseException(String changelogFile, String message, Throwable cause) {
        super(message, cause);
        this.changelogFile = changelogFile;
    }

    public String getChangelogFile() {
        return changelogFile;
    }
}
