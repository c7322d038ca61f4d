package com.example.changeguard.service;

import com.example.changeguard.dto.CheckResponse;
import com.example.changeguard.model.CheckResult;
import com.example.changeguard.model.ClassifiedChange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Маппинг доменной модели в DTO.
 */
@Component
@RequiredArgsConstructor
public class CheckResultMapper {

    private final ReportGenerator reportGenerator;

    public CheckResponse toResponse(CheckResult result) {
        List<CheckResponse.ChangeDto> changes = result.getChanges().stream()
                .map(this::toDto)
                .toList();

        return CheckResponse.builder()
                .status(CheckResponse.CheckStatus.COMPLETED)
                .totalChanges(result.getTotalChanges())
                .breakingChanges(result.getBreakingChanges().size())
                .changes(changes)
                .report(reportGenerator.generate(result))
                .build();
    }

    public CheckResponse toFailure(String message) {
        return CheckResponse.builder()
                .status(CheckResponse.CheckStatus.FAILED)
                .message(message)
                .changes(List.of())
                .build();
    }

    private CheckResponse.ChangeDto toDto(ClassifiedChange change) {
        return CheckResponse.ChangeDto.builder()
                .kind(change.getKind())
                .tableName(change.getEvent().getTableName())
                .columnName(change.getEvent().getColumnName())
                .fileName(change.getFileName())
                .lineNumber(change.getLineNumber())
                .breaking(change.isBreaking())
                .message(change.getMessage())
                .build();
    }
}
