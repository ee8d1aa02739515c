package com.Excel.Variance.controller;

import com.Excel.Variance.dto.PeriodTemplate;
import com.Excel.Variance.dto.SessionSummary;
import com.Excel.Variance.exception.SessionNotFoundException;
import com.Excel.Variance.exception.WorkbookLoadException;
import com.Excel.Variance.model.AnalysisSession;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.model.Workbook;
import com.Excel.Variance.service.AnalysisService;
import com.Excel.Variance.service.WorkbookService;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final AnalysisService analysisService;
    private final WorkbookService workbookService;

    public SessionController(AnalysisService analysisService, WorkbookService workbookService) {
        this.analysisService = analysisService;
        this.workbookService = workbookService;
    }

    /**
     * Upload the old and new model and open a session
     */
    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<Object> createSession(@RequestParam("oldModel") MultipartFile oldModel,
                                                @RequestParam("newModel") MultipartFile newModel) {
        logger.info("Received upload - old: '{}' ({} bytes), new: '{}' ({} bytes)",
                oldModel.getOriginalFilename(), oldModel.getSize(), newModel.getOriginalFilename(), newModel.getSize());

        try {
            Workbook oldWorkbook = workbookService.loadWorkbook(oldModel);
            Workbook newWorkbook = workbookService.loadWorkbook(newModel);

            AnalysisSession session = analysisService.createSession(oldWorkbook, newWorkbook);
            SessionSummary summary = analysisService.describe(session.getId());
            return ResponseEntity.status(HttpStatus.CREATED).body(summary);

        } catch (WorkbookLoadException e) {
            logger.warn("Upload rejected: {}", e.getMessage());
            return ErrorResponses.badRequest("Could not read workbook", e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error creating session", e);
            return ErrorResponses.serverError("Failed to create session", e);
        }
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Object> getSession(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(analysisService.describe(sessionId));
        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (Exception e) {
            logger.error("Failed to describe session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to get session", e);
        }
    }

    /**
     * Choose which sheet holds each statement, with optional period templates
     */
    @PostMapping("/{sessionId}/selection")
    public ResponseEntity<Object> selectSheets(@PathVariable String sessionId,
                                               @RequestBody SheetSelectionRequest request) {
        logger.info("Sheet selection for session {}: {}", sessionId, request.getSheets());

        try {
            Map<StatementType, String> sheets = toStatementMap(request.getSheets());
            Map<StatementType, String> newSheets = toStatementMap(request.getNewSheets());
            analysisService.selectSheets(sessionId, sheets, newSheets, request.getTemplates());

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("sessionId", sessionId);
            response.put("sheets", sheets);
            response.put("newSheets", newSheets);
            return ResponseEntity.ok(response);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid sheet selection", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to select sheets for session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to select sheets", e);
        }
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Object> deleteSession(@PathVariable String sessionId) {
        if (!analysisService.deleteSession(sessionId)) {
            return ErrorResponses.notFound(new SessionNotFoundException(sessionId));
        }
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Session deleted",
                "sessionId", sessionId
        ));
    }

    private static Map<StatementType, String> toStatementMap(Map<String, String> raw) {
        Map<StatementType, String> result = new EnumMap<>(StatementType.class);
        if (raw != null) {
            raw.forEach((type, sheet) -> {
                if (sheet == null || sheet.isBlank()) {
                    throw new IllegalArgumentException("Sheet name for '" + type + "' is empty");
                }
                result.put(StatementType.fromKey(type), sheet);
            });
        }
        return result;
    }

    @Data
    public static class SheetSelectionRequest {
        private Map<String, String> sheets;    // statement type -> sheet name, both models
        private Map<String, String> newSheets; // overrides for the new model
        private List<PeriodTemplate> templates;
    }
}
