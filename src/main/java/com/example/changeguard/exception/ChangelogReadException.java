package com.example.changeguard.exception;

import java.io.IOException;

/**
 * Файл, уже разобранный парсером, не удалось перечитать при поиске номера строки.
 */
public class ChangelogReadException extends RuntimeException {

    private final String changelogFile;

    public ChangelogReadException(String changelogFile, IOException cause) {
        super("Failed to read changelog " + changelogFile + ": " + cause.getMessage(), cause);
        this.changelogFile = changelogFile;
    }

    public String getChangelogFile() {
        return changelogFile;
    }
}
