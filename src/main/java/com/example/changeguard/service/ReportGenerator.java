package com.example.changeguard.service;

import com.example.changeguard.model.CheckResult;
import com.example.changeguard.model.ClassifiedChange;
import org.springframework.stereotype.Service;

/**
 * Формирует текстовый отчёт о ломающих изменениях.
 */
@Service
public class ReportGenerator {

    private static final String SEPARATOR = "------";

    /**
     * Блок на каждое ломающее изменение:
     * <pre>
     * ------
     * Breaking change in file &lt;file&gt; on line &lt;line&gt;.
     * &lt;message&gt;
     * ------
     * </pre>
     *
     * @param result результат проверки
     * @return отчёт (пустая строка, если ломающих изменений нет)
     */
    public String generate(CheckResult result) {
        StringBuilder report = new StringBuilder();
        for (ClassifiedChange change : result.getBreakingChanges()) {
            report.append(formatBlock(change)).append("\n");
        }
        return report.toString();
    }

    public String formatBlock(ClassifiedChange change) {
        return SEPARATOR + "\n"
                + "Breaking change in file " + change.getFileName()
                + " on line " + change.getLineNumber() + ".\n"
                + change.getMessage() + "\n"
                + SEPARATOR;
    }
}
