package com.example.changeguard.controller;

import com.example.changeguard.dto.CheckRequest;
import com.example.changeguard.dto.CheckResponse;
import com.example.changeguard.exception.ChangelogParseException;
import com.example.changeguard.exception.ChangelogReadException;
import com.example.changeguard.model.CheckResult;
import com.example.changeguard.service.CheckResultMapper;
import com.example.changeguard.service.CheckService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API контроллер для проверки changelog-файлов.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CheckController {

    private final CheckService checkService;
    private final CheckResultMapper checkResultMapper;

    /**
     * Проверяет changelog-файлы на ломающие изменения.
     *
     * POST /api/v1/check
     */
    @PostMapping("/check")
    public ResponseEntity<CheckResponse> check(@RequestBody @Valid CheckRequest request) {

        log.info("Checking changelogs: {}", request.getChangelogFiles());

        try {
            CheckResult result = checkService.check(request.getChangelogFiles());
            return ResponseEntity.ok(checkResultMapper.toResponse(result));
        } catch (ChangelogParseException e) {
            log.warn("Changelog {} could not be parsed: {}", e.getChangelogFile(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(checkResultMapper.toFailure(e.getMessage()));
        } catch (ChangelogReadException e) {
            log.error("Changelog {} could not be read", e.getChangelogFile(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(checkResultMapper.toFailure(e.getMessage()));
        }
    }

    /**
     * Health check эндпоинт.
     *
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
