package com.Excel.Variance.controller;

import com.Excel.Variance.WorkbookFixtures;
import com.Excel.Variance.dto.SessionSummary;
import com.Excel.Variance.exception.SessionNotFoundException;
import com.Excel.Variance.exception.WorkbookLoadException;
import com.Excel.Variance.model.AnalysisSession;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.model.Workbook;
import com.Excel.Variance.service.AnalysisService;
import com.Excel.Variance.service.WorkbookService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionController Tests")
class SessionControllerTest {

    @Mock
    private AnalysisService analysisService;

    @Mock
    private WorkbookService workbookService;

    private SessionController controller;

    private final MockMultipartFile oldFile = new MockMultipartFile("oldModel", "old.xlsx", null, new byte[]{1});
    private final MockMultipartFile newFile = new MockMultipartFile("newModel", "new.xlsx", null, new byte[]{1});

    @BeforeEach
    void setUp() {
        controller = new SessionController(analysisService, workbookService);
    }

    @Test
    @DisplayName("Should open a session from two uploads")
    void shouldCreateSession() {
        // Given
        Workbook oldWorkbook = WorkbookFixtures.oldModel();
        Workbook newWorkbook = WorkbookFixtures.newModel();
        SessionSummary summary = new SessionSummary("s1", Instant.now(), "old.xlsx", "new.xlsx",
                List.of(WorkbookFixtures.INCOME), List.of(WorkbookFixtures.INCOME), Map.of(), Map.of());
        when(workbookService.loadWorkbook(oldFile)).thenReturn(oldWorkbook);
        when(workbookService.loadWorkbook(newFile)).thenReturn(newWorkbook);
        when(analysisService.createSession(oldWorkbook, newWorkbook))
                .thenReturn(new AnalysisSession("s1", oldWorkbook, newWorkbook));
        when(analysisService.describe("s1")).thenReturn(summary);

        // When
        ResponseEntity<Object> response = controller.createSession(oldFile, newFile);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody()).isSameAs(summary);
    }

    @Test
    @DisplayName("Should answer 400 when a workbook cannot be read")
    void shouldRejectUnreadableWorkbook() {
        when(workbookService.loadWorkbook(oldFile))
                .thenThrow(new WorkbookLoadException("Failed to load workbook 'old.xlsx'", null));

        ResponseEntity<Object> response = controller.createSession(oldFile, newFile);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).asInstanceOf(MAP).containsEntry("status", "error")
                .containsEntry("message", "Failed to load workbook 'old.xlsx'");
        verify(analysisService, never()).createSession(any(), any());
    }

    @Test
    @DisplayName("Should answer 404 for an unknown session")
    void shouldReturnNotFound() {
        when(analysisService.describe("nope")).thenThrow(new SessionNotFoundException("nope"));

        ResponseEntity<Object> response = controller.getSession("nope");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).asInstanceOf(MAP).containsEntry("error", "Session not found");
    }

    @Test
    @DisplayName("Should convert statement keys before selecting sheets")
    void shouldSelectSheets() {
        // Given
        SessionController.SheetSelectionRequest request = new SessionController.SheetSelectionRequest();
        request.setSheets(Map.of("income_statement", "P&L"));

        // When
        ResponseEntity<Object> response = controller.selectSheets("s1", request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(analysisService).selectSheets(eq("s1"), eq(Map.of(StatementType.INCOME_STATEMENT, "P&L")),
                eq(Map.of()), isNull());
    }

    @Test
    @DisplayName("Should answer 400 for an unknown statement type")
    void shouldRejectUnknownStatementType() {
        SessionController.SheetSelectionRequest request = new SessionController.SheetSelectionRequest();
        request.setSheets(Map.of("notes", "Notes"));

        ResponseEntity<Object> response = controller.selectSheets("s1", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).asInstanceOf(MAP).extractingByKey("message").asString().contains("notes");
        verify(analysisService, never()).selectSheets(any(), anyMap(), anyMap(), any());
    }

    @Test
    @DisplayName("Should answer 400 when the service rejects the selection")
    void shouldPropagateSelectionErrors() {
        SessionController.SheetSelectionRequest request = new SessionController.SheetSelectionRequest();
        doThrow(new IllegalArgumentException("At least one statement sheet must be selected"))
                .when(analysisService).selectSheets(eq("s1"), anyMap(), anyMap(), isNull());

        ResponseEntity<Object> response = controller.selectSheets("s1", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).asInstanceOf(MAP).containsEntry("error", "Invalid sheet selection");
    }

    @Test
    @DisplayName("Should delete existing sessions and 404 on missing ones")
    void shouldDeleteSession() {
        when(analysisService.deleteSession("s1")).thenReturn(true);
        when(analysisService.deleteSession("s2")).thenReturn(false);

        assertThat(controller.deleteSession("s1").getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(controller.deleteSession("s2").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
