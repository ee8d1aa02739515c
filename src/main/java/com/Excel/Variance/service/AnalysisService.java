package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.AnalysisIssue;
import com.Excel.Variance.dto.ConsistencyCheck;
import com.Excel.Variance.dto.DrillDownOutcome;
import com.Excel.Variance.dto.DrillDownPreview;
import com.Excel.Variance.dto.FailureReason;
import com.Excel.Variance.dto.PeriodAlignment;
import com.Excel.Variance.dto.PeriodComparison;
import com.Excel.Variance.dto.PeriodTemplate;
import com.Excel.Variance.dto.SessionSummary;
import com.Excel.Variance.dto.StructureProbe;
import com.Excel.Variance.dto.VarianceReport;
import com.Excel.Variance.dto.VarianceResult;
import com.Excel.Variance.exception.SessionNotFoundException;
import com.Excel.Variance.exception.SheetNotFoundException;
import com.Excel.Variance.exception.VarianceAnalysisException;
import com.Excel.Variance.model.AnalysisSession;
import com.Excel.Variance.model.DrillDownKey;
import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.LineItemExtraction;
import com.Excel.Variance.model.MatchResult;
import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.model.ModelSide;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.PeriodHeader;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.SheetSelection;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.model.Workbook;
import com.Excel.Variance.repository.AnalysisSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the analysis engine. Runs the pipeline for a session on the worker pool and turns
 * every engine failure into an {@link AnalysisIssue} or a failed outcome; the only exceptions that leave
 * this class are {@link SessionNotFoundException}, {@link IllegalArgumentException} for bad input and
 * {@link IllegalStateException} when a worker dies unexpectedly.
 */
@Service
public class AnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisService.class);

    private final AnalysisSessionRepository sessionRepository;
    private final PeriodDetector periodDetector;
    private final PeriodTemplateService periodTemplateService;
    private final LineItemExtractor lineItemExtractor;
    private final LineItemMatcher lineItemMatcher;
    private final PeriodAligner periodAligner;
    private final VarianceEngine varianceEngine;
    private final SheetTypeSuggester sheetTypeSuggester;
    private final DrillDownPreviewService drillDownPreviewService;
    private final ConsistencyChecker consistencyChecker;
    private final ExecutorService analysisExecutor;
    private final VarianceProperties properties;

    public AnalysisService(AnalysisSessionRepository sessionRepository,
                           PeriodDetector periodDetector,
                           PeriodTemplateService periodTemplateService,
                           LineItemExtractor lineItemExtractor,
                           LineItemMatcher lineItemMatcher,
                           PeriodAligner periodAligner,
                           VarianceEngine varianceEngine,
                           SheetTypeSuggester sheetTypeSuggester,
                           DrillDownPreviewService drillDownPreviewService,
                           ConsistencyChecker consistencyChecker,
                           @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
                           VarianceProperties properties) {
        this.sessionRepository = sessionRepository;
        this.periodDetector = periodDetector;
        this.periodTemplateService = periodTemplateService;
        this.lineItemExtractor = lineItemExtractor;
        this.lineItemMatcher = lineItemMatcher;
        this.periodAligner = periodAligner;
        this.varianceEngine = varianceEngine;
        this.sheetTypeSuggester = sheetTypeSuggester;
        this.drillDownPreviewService = drillDownPreviewService;
        this.consistencyChecker = consistencyChecker;
        this.analysisExecutor = analysisExecutor;
        this.properties = properties;
    }

    // ---------------------------------------------------------------- sessions

    public AnalysisSession createSession(Workbook oldWorkbook, Workbook newWorkbook) {
        AnalysisSession session = new AnalysisSession(UUID.randomUUID().toString(), oldWorkbook, newWorkbook);
        sessionRepository.save(session);
        logger.info("Created session {} comparing '{}' with '{}'", session.getId(), oldWorkbook.getName(), newWorkbook.getName());
        return session;
    }

    public SessionSummary describe(String sessionId) {
        AnalysisSession session = getSession(sessionId);
        Workbook oldWorkbook = session.getOldWorkbook();
        Workbook newWorkbook = session.getNewWorkbook();
        return new SessionSummary(session.getId(), session.getCreatedAt(),
                oldWorkbook.getName(), newWorkbook.getName(),
                oldWorkbook.getSheetNames(), newWorkbook.getSheetNames(),
                sheetTypeSuggester.suggest(oldWorkbook), sheetTypeSuggester.suggest(newWorkbook));
    }

    /**
     * Set which sheet holds which statement. Clears everything derived from the previous selection.
     *
     * @throws IllegalArgumentException when nothing is selected or a template does not compile
     */
    public void selectSheets(String sessionId, Map<StatementType, String> sheets,
                             Map<StatementType, String> newSheets, List<PeriodTemplate> templates) {
        AnalysisSession session = getSession(sessionId);
        if ((sheets == null || sheets.isEmpty()) && (newSheets == null || newSheets.isEmpty())) {
            throw new IllegalArgumentException("At least one statement sheet must be selected");
        }
        // fail fast on bad templates rather than on every probe
        periodTemplateService.compileAll(templates);

        session.select(new SheetSelection(sheets, newSheets, templates));
        logger.info("Session {}: selected sheets {} (new overrides {}), {} templates", sessionId, sheets, newSheets,
                templates != null ? templates.size() : 0);
    }

    public boolean deleteSession(String sessionId) {
        boolean removed = sessionRepository.deleteById(sessionId);
        if (removed) {
            logger.info("Deleted session {}", sessionId);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${variance.session-cleanup-interval-ms:300000}")
    public void evictIdleSessions() {
        Instant cutoff = Instant.now().minus(properties.getSessionTimeout());
        List<String> removed = sessionRepository.removeIdleSince(cutoff);
        if (!removed.isEmpty()) {
            logger.debug("Evicted idle sessions {}", removed);
        }
    }

    // ---------------------------------------------------------------- structure

    /**
     * Probe every selected sheet of both models in parallel. Old side first, then statement type order.
     */
    public List<StructureProbe> getStructure(String sessionId) {
        AnalysisSession session = getSession(sessionId);
        SheetSelection selection = requireSelection(session);

        List<Future<StructureProbe>> futures = new ArrayList<>();
        for (ModelSide side : ModelSide.values()) {
            for (StatementType type : selection.getStatementTypes()) {
                futures.add(analysisExecutor.submit(() -> probe(session, side, type)));
            }
        }
        return awaitAll(futures, "structure probes");
    }

    public Map<StatementType, PeriodAlignment> getPeriodAlignment(String sessionId) {
        AnalysisSession session = getSession(sessionId);
        SheetSelection selection = requireSelection(session);

        Map<StatementType, PeriodAlignment> alignments = new EnumMap<>(StatementType.class);
        for (StatementType type : selection.getStatementTypes()) {
            StructureProbe oldProbe = probe(session, ModelSide.OLD, type);
            StructureProbe newProbe = probe(session, ModelSide.NEW, type);
            alignments.put(type, periodAligner.align(oldProbe.getPeriods(), newProbe.getPeriods()));
        }
        return alignments;
    }

    /**
     * Compatibility of the two models across every selected statement.
     */
    public ConsistencyCheck checkConsistency(String sessionId) {
        List<StructureProbe> probes = getStructure(sessionId);
        AnalysisSession session = getSession(sessionId);

        Map<StatementType, MatchResult> matches = new EnumMap<>(StatementType.class);
        for (StructureProbe probe : probes) {
            StatementType type = probe.getStatementType();
            if (probe.getSide() == ModelSide.OLD && probe.isSuccessful() && bothSucceeded(probes, type)) {
                matches.put(type, match(session, type));
            }
        }
        return consistencyChecker.check(probes, matches);
    }

    private static boolean bothSucceeded(List<StructureProbe> probes, StatementType type) {
        return probes.stream()
                .filter(p -> p.getStatementType() == type)
                .filter(StructureProbe::isSuccessful)
                .count() == ModelSide.values().length;
    }

    // ---------------------------------------------------------------- variance

    /**
     * One report per selected statement type, statements matched concurrently.
     */
    public List<VarianceReport> getVariance(String sessionId, String period) {
        if (period == null || period.isBlank()) {
            throw new IllegalArgumentException("A period must be selected");
        }
        AnalysisSession session = getSession(sessionId);
        SheetSelection selection = requireSelection(session);

        List<Future<VarianceReport>> futures = new ArrayList<>();
        for (StatementType type : selection.getStatementTypes()) {
            futures.add(analysisExecutor.submit(() -> buildReport(session, type, period)));
        }
        List<VarianceReport> reports = awaitAll(futures, "variance reports");
        logger.info("Session {}: variance for period '{}' across {} statements", sessionId, period, reports.size());
        return reports;
    }

    private VarianceReport buildReport(AnalysisSession session, StatementType type, String period) {
        StructureProbe oldProbe = probe(session, ModelSide.OLD, type);
        StructureProbe newProbe = probe(session, ModelSide.NEW, type);

        List<AnalysisIssue> issues = new ArrayList<>(oldProbe.getIssues());
        issues.addAll(newProbe.getIssues());

        if (!oldProbe.isSuccessful() || !newProbe.isSuccessful()) {
            StructureProbe failed = oldProbe.isSuccessful() ? newProbe : oldProbe;
            return VarianceReport.failed(type, period, issues, failed.getIssues().get(0).getMessage());
        }

        PeriodAlignment alignment = periodAligner.align(oldProbe.getPeriods(), newProbe.getPeriods());
        PeriodComparison comparison = alignment.resolve(period).orElse(null);
        if (comparison == null) {
            String message = String.format("Period '%s' not found on sheet '%s' or '%s'",
                    period, oldProbe.getSheetName(), newProbe.getSheetName());
            issues.add(AnalysisIssue.structural("PeriodNotFound", message, newProbe.getSheetName()));
            return VarianceReport.failed(type, period, issues, message);
        }

        MatchResult match = match(session, type);
        issues.addAll(match.getIssues());

        List<VarianceResult> variances = new ArrayList<>();
        for (MatchedPair pair : match.getPairs()) {
            variances.add(varianceEngine.computeVariance(pair, comparison.getOldLabel(), comparison.getNewLabel()));
        }

        return new VarianceReport(type, period, comparison.getOldLabel(), comparison.getNewLabel(),
                match.getPairs(), variances, issues, null);
    }

    // ---------------------------------------------------------------- drill-down

    /**
     * Drill into one line item. Graph building runs on the worker pool under the configured time limit.
     * Outcomes other than timeouts are cached until the sheet selection changes.
     */
    public DrillDownOutcome drillDown(String sessionId, StatementType type, String lineItemName, String period) {
        AnalysisSession session = getSession(sessionId);
        requireSelection(session);

        DrillDownKey key = new DrillDownKey(sessionId, type, lineItemName, period);
        DrillDownOutcome cached = session.getCache().getDrillDown(key);
        if (cached != null) {
            logger.debug("Drill-down cache hit for {}", key);
            return cached;
        }
        long generation = session.getCache().getGeneration();

        StructureProbe oldProbe = probe(session, ModelSide.OLD, type);
        StructureProbe newProbe = probe(session, ModelSide.NEW, type);
        if (!oldProbe.isSuccessful() || !newProbe.isSuccessful()) {
            StructureProbe failed = oldProbe.isSuccessful() ? newProbe : oldProbe;
            return DrillDownOutcome.failed(FailureReason.STRUCTURAL, failed.getIssues().get(0).getMessage())
                    .addIssues(failed.getIssues());
        }

        PeriodComparison comparison = periodAligner.align(oldProbe.getPeriods(), newProbe.getPeriods())
                .resolve(period).orElse(null);
        if (comparison == null || !comparison.isAligned()) {
            return DrillDownOutcome.failed(FailureReason.STRUCTURAL,
                    "Period '" + period + "' is not present in both models");
        }

        MatchResult match = match(session, type);
        MatchedPair pair = findPair(match.getPairs(), lineItemName);
        if (pair == null) {
            return DrillDownOutcome.failed(FailureReason.LINE_ITEM_NOT_FOUND,
                    "Line item '" + lineItemName + "' not found in the " + type.getKey() + " sheets");
        }

        Period oldPeriod = oldProbe.findPeriod(comparison.getOldLabel());
        Period newPeriod = newProbe.findPeriod(comparison.getNewLabel());
        DrillDownOutcome outcome = runDrillDown(session, pair, oldPeriod, newPeriod);

        if (outcome.getFailureReason() != FailureReason.TIMEOUT && outcome.getFailureReason() != FailureReason.INTERNAL_ERROR) {
            session.getCache().putDrillDown(key, outcome, generation);
        }
        return outcome;
    }

    private DrillDownOutcome runDrillDown(AnalysisSession session, MatchedPair pair, Period oldPeriod, Period newPeriod) {
        Duration timeout = properties.getDrillDownTimeout();
        Instant deadline = Instant.now().plus(timeout);
        String name = pair.getDisplayName();

        Future<DrillDownOutcome> future = analysisExecutor.submit(() -> varianceEngine.drillDown(pair,
                session.getOldWorkbook(), oldPeriod, session.getNewWorkbook(), newPeriod, deadline));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Drill-down for '{}' exceeded {} ms", name, timeout.toMillis());
            LineItem item = pair.getNewItem() != null ? pair.getNewItem() : pair.getOldItem();
            return DrillDownOutcome.failed(FailureReason.TIMEOUT,
                            "Drill-down for '" + name + "' exceeded the time limit of " + timeout.toMillis() + " ms")
                    .addIssue(AnalysisIssue.graph("GraphTimeout", "Dependency graph took too long to build",
                            item.getSheet(), item.getRow(), null));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return DrillDownOutcome.failed(FailureReason.TIMEOUT, "Drill-down for '" + name + "' was interrupted");
        } catch (ExecutionException e) {
            logger.error("Drill-down for '{}' failed", name, e.getCause());
            return DrillDownOutcome.failed(FailureReason.INTERNAL_ERROR,
                    "Drill-down for '" + name + "' failed: " + e.getCause().getMessage());
        }
    }

    public DrillDownPreview preview(String sessionId, StatementType type, String lineItemName, String period) {
        AnalysisSession session = getSession(sessionId);
        requireSelection(session);

        StructureProbe oldProbe = probe(session, ModelSide.OLD, type);
        StructureProbe newProbe = probe(session, ModelSide.NEW, type);
        MatchResult match = match(session, type);
        MatchedPair pair = findPair(match.getPairs(), lineItemName);
        if (pair == null) {
            throw new IllegalArgumentException("Line item '" + lineItemName + "' not found in the " + type.getKey() + " sheets");
        }

        LineItem item = pair.getNewItem() != null ? pair.getNewItem() : pair.getOldItem();
        String label = period;
        if (period != null) {
            PeriodComparison comparison = periodAligner.align(oldProbe.getPeriods(), newProbe.getPeriods())
                    .resolve(period).orElse(null);
            if (comparison != null) {
                label = item == pair.getNewItem() ? comparison.getNewLabel() : comparison.getOldLabel();
            }
        }
        return drillDownPreviewService.preview(item, label);
    }

    // ---------------------------------------------------------------- helpers

    private StructureProbe probe(AnalysisSession session, ModelSide side, StatementType type) {
        return session.getCache().getProbe(side, type, current -> computeProbe(session, current, side, type));
    }

    private MatchResult match(AnalysisSession session, StatementType type) {
        return session.getCache().getMatch(type, () -> lineItemMatcher.match(
                probe(session, ModelSide.OLD, type).getLineItems(),
                probe(session, ModelSide.NEW, type).getLineItems()));
    }

    private StructureProbe computeProbe(AnalysisSession session, SheetSelection selection, ModelSide side, StatementType type) {
        Workbook workbook = session.getWorkbook(side);
        String sheetName = selection.sheetFor(side, type);
        try {
            if (sheetName == null) {
                throw new SheetNotFoundException("No " + type.getKey() + " sheet selected for the "
                        + side.name().toLowerCase(Locale.ROOT) + " model");
            }
            Sheet sheet = workbook.findSheet(sheetName)
                    .orElseThrow(() -> new SheetNotFoundException(workbook.getName(), sheetName, workbook.getSheetNames()));

            PeriodHeader header = periodDetector.detect(sheet, periodTemplateService.compileAll(selection.getTemplates()));
            LineItemExtraction extraction = lineItemExtractor.extract(sheet, header, type);
            return new StructureProbe(side, type, sheetName, header.getHeaderRow(), header.getPeriods(),
                    extraction.getLineItems(), extraction.getIssues());
        } catch (VarianceAnalysisException e) {
            logger.warn("Structure probe failed for {} {} sheet '{}': {}", side, type.getKey(), sheetName, e.getMessage());
            return StructureProbe.failed(side, type, sheetName, AnalysisIssue.from(e));
        }
    }

    /**
     * Pair whose old name, then new name, equals {@code name}; falls back to a case-insensitive match.
     */
    private MatchedPair findPair(List<MatchedPair> pairs, String name) {
        if (name == null) {
            return null;
        }
        for (MatchedPair pair : pairs) {
            if (pair.getOldItem() != null && pair.getOldItem().getName().equals(name)) {
                return pair;
            }
        }
        for (MatchedPair pair : pairs) {
            if (pair.hasName(name)) {
                return pair;
            }
        }
        for (MatchedPair pair : pairs) {
            if (pair.getDisplayName().equalsIgnoreCase(name)) {
                return pair;
            }
        }
        return null;
    }

    private AnalysisSession getSession(String sessionId) {
        AnalysisSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        session.touch();
        return session;
    }

    private SheetSelection requireSelection(AnalysisSession session) {
        SheetSelection selection = session.getSelection();
        if (selection == null) {
            throw new IllegalArgumentException("No sheets selected for session " + session.getId());
        }
        return selection;
    }

    private <T> List<T> awaitAll(List<Future<T>> futures, String what) {
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while computing " + what, e);
            } catch (ExecutionException e) {
                logger.error("Failed to compute {}", what, e.getCause());
                throw new IllegalStateException("Failed to compute " + what + ": " + e.getCause().getMessage(), e.getCause());
            }
        }
        return results;
    }
}
