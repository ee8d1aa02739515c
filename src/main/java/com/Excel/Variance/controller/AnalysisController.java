package com.Excel.Variance.controller;

import com.Excel.Variance.dto.ConsistencyCheck;
import com.Excel.Variance.dto.DrillDownOutcome;
import com.Excel.Variance.dto.DrillDownPreview;
import com.Excel.Variance.dto.PeriodAlignment;
import com.Excel.Variance.dto.StructureProbe;
import com.Excel.Variance.dto.VarianceReport;
import com.Excel.Variance.exception.SessionNotFoundException;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.service.AnalysisService;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/sessions/{sessionId}")
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * Detected periods and line items of every selected sheet
     */
    @GetMapping("/structure")
    public ResponseEntity<Object> getStructure(@PathVariable String sessionId) {
        logger.info("Structure requested for session {}", sessionId);
        try {
            List<StructureProbe> probes = analysisService.getStructure(sessionId);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("probes", probes);
            return ResponseEntity.ok(response);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid request", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to probe structure for session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to detect structure", e);
        }
    }

    @GetMapping("/periods")
    public ResponseEntity<Object> getPeriods(@PathVariable String sessionId) {
        try {
            Map<StatementType, PeriodAlignment> alignments = analysisService.getPeriodAlignment(sessionId);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("alignments", alignments);
            return ResponseEntity.ok(response);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid request", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to align periods for session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to align periods", e);
        }
    }

    /**
     * Whether the two models are comparable: statements, periods and line item names
     */
    @GetMapping("/consistency")
    public ResponseEntity<Object> getConsistency(@PathVariable String sessionId) {
        try {
            ConsistencyCheck consistency = analysisService.checkConsistency(sessionId);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("consistency", consistency);
            return ResponseEntity.ok(response);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid request", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to check consistency for session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to check consistency", e);
        }
    }

    /**
     * Variance of every matched line item for one period
     */
    @GetMapping("/variance")
    public ResponseEntity<Object> getVariance(@PathVariable String sessionId, @RequestParam String period) {
        logger.info("Variance requested for session {}, period '{}'", sessionId, period);
        try {
            List<VarianceReport> reports = analysisService.getVariance(sessionId, period);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("period", period);
            response.put("reports", reports);
            return ResponseEntity.ok(response);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid request", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to compute variance for session {}", sessionId, e);
            return ErrorResponses.serverError("Failed to compute variance", e);
        }
    }

    @PostMapping("/drill-down")
    public ResponseEntity<Object> drillDown(@PathVariable String sessionId, @RequestBody DrillDownRequest request) {
        logger.info("Drill-down requested for session {}: {} / '{}' / '{}'", sessionId,
                request.getStatementType(), request.getLineItemName(), request.getPeriod());

        try {
            if (request.getLineItemName() == null || request.getLineItemName().isBlank()) {
                return ErrorResponses.badRequest("Line item name is required", null);
            }
            if (request.getPeriod() == null || request.getPeriod().isBlank()) {
                return ErrorResponses.badRequest("Period is required", null);
            }
            StatementType type = StatementType.fromKey(request.getStatementType());

            DrillDownOutcome outcome = analysisService.drillDown(sessionId, type, request.getLineItemName(), request.getPeriod());
            return ResponseEntity.ok(outcome);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid drill-down request", e.getMessage());
        } catch (Exception e) {
            logger.error("Drill-down failed for session {}", sessionId, e);
            return ErrorResponses.serverError("Drill-down failed", e);
        }
    }

    @GetMapping("/drill-down-preview")
    public ResponseEntity<Object> preview(@PathVariable String sessionId,
                                          @RequestParam String statementType,
                                          @RequestParam String lineItemName,
                                          @RequestParam(required = false) String period) {
        try {
            DrillDownPreview preview = analysisService.preview(sessionId, StatementType.fromKey(statementType),
                    lineItemName, period);
            return ResponseEntity.ok(preview);

        } catch (SessionNotFoundException e) {
            return ErrorResponses.notFound(e);
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest("Invalid preview request", e.getMessage());
        } catch (Exception e) {
            logger.error("Drill-down preview failed for session {}", sessionId, e);
            return ErrorResponses.serverError("Drill-down preview failed", e);
        }
    }

    @Data
    public static class DrillDownRequest {
        private String statementType;
        private String lineItemName;
        private String period;
    }
}
