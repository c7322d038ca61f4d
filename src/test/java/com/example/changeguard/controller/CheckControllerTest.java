package com.example.changeguard.controller;

import com.example.changeguard.dto.CheckRequest;
import com.example.changeguard.exception.ChangelogParseException;
import com.example.changeguard.exception.ChangelogReadException;
import com.example.changeguard.model.ChangeEvent;
import com.example.changeguard.model.CheckResult;
import com.example.changeguard.model.ClassifiedChange;
import com.example.changeguard.service.CheckResultMapper;
import com.example.changeguard.service.CheckService;
import com.example.changeguard.service.ReportGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CheckController.class)
@Import({CheckResultMapper.class, ReportGenerator.class})
class CheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CheckService checkService;

    @Test
    void shouldReturnClassifiedChanges() throws Exception {
        // Given
        CheckResult result = CheckResult.builder()
                .changelogFiles(List.of("db/changelog.xml"))
                .changes(List.of(
                        ClassifiedChange.builder()
                                .event(ChangeEvent.tableCreated("person", "db/changelog.xml"))
                                .lineNumber(9)
                                .breaking(false)
                                .message("Not a breaking change")
                                .build(),
                        ClassifiedChange.builder()
                                .event(ChangeEvent.columnDropped("existing", "delete_column", "db/changelog.xml"))
                                .lineNumber(33)
                                .breaking(true)
                                .message("Dropping the column existing.delete_column is risky.")
                                .build()))
                .build();
        when(checkService.check(List.of("db/changelog.xml"))).thenReturn(result);

        CheckRequest request = CheckRequest.builder()
                .changelogFiles(List.of("db/changelog.xml"))
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.totalChanges").value(2))
                .andExpect(jsonPath("$.breakingChanges").value(1))
                .andExpect(jsonPath("$.changes[0].kind").value("TABLE_CREATED"))
                .andExpect(jsonPath("$.changes[0].breaking").value(false))
                .andExpect(jsonPath("$.changes[1].kind").value("COLUMN_DROPPED"))
                .andExpect(jsonPath("$.changes[1].columnName").value("delete_column"))
                .andExpect(jsonPath("$.changes[1].lineNumber").value(33))
                .andExpect(jsonPath("$.report",
                        containsString("Breaking change in file db/changelog.xml on line 33.")));
    }

    @Test
    void shouldReturnBadRequestForEmptyFileList() throws Exception {
        // Given
        CheckRequest request = CheckRequest.builder()
                .changelogFiles(List.of())
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnUnprocessableEntityForParseFailure() throws Exception {
        // Given
        when(checkService.check(any()))
                .thenThrow(new ChangelogParseException("broken.xml", "Failed to parse changelog broken.xml"));

        CheckRequest request = CheckRequest.builder()
                .changelogFiles(List.of("broken.xml"))
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.message").value("Failed to parse changelog broken.xml"));
    }

    @Test
    void shouldReturnServerErrorWhenChangelogCannotBeReRead() throws Exception {
        // Given
        when(checkService.check(any()))
                .thenThrow(new ChangelogReadException("gone.xml", new IOException("No such file")));

        CheckRequest request = CheckRequest.builder()
                .changelogFiles(List.of("gone.xml"))
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.message").value("Failed to read changelog gone.xml: No such file"));
    }

    @Test
    void shouldReturnHealthStatus() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
