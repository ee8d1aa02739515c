package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.AnalysisIssue;
import com.Excel.Variance.dto.ComponentPresence;
import com.Excel.Variance.dto.DrillDownComponent;
import com.Excel.Variance.dto.DrillDownOutcome;
import com.Excel.Variance.dto.DrillDownResult;
import com.Excel.Variance.dto.DrillDownState;
import com.Excel.Variance.dto.FailureReason;
import com.Excel.Variance.dto.PercentageState;
import com.Excel.Variance.dto.VarianceResult;
import com.Excel.Variance.exception.CircularReferenceException;
import com.Excel.Variance.exception.GraphTimeoutException;
import com.Excel.Variance.formula.CellRef;
import com.Excel.Variance.graph.DependencyGraph;
import com.Excel.Variance.graph.DependencyGraphBuilder;
import com.Excel.Variance.graph.FormulaNode;
import com.Excel.Variance.graph.GraphFinding;
import com.Excel.Variance.graph.NodeKind;
import com.Excel.Variance.model.Cell;
import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.model.ModelSide;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.Workbook;
import com.Excel.Variance.util.CellValueUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Variance arithmetic for matched line items and drill-down attribution over dependency graphs.
 */
@Service
public class VarianceEngine {

    private static final Logger logger = LoggerFactory.getLogger(VarianceEngine.class);

    private final DependencyGraphBuilder graphBuilder;
    private final VarianceProperties properties;

    public VarianceEngine(DependencyGraphBuilder graphBuilder, VarianceProperties properties) {
        this.graphBuilder = graphBuilder;
        this.properties = properties;
    }

    /**
     * Variance of one pair between the aligned period labels of both sides.
     * Either label may be null when the period exists in one model only.
     */
    public VarianceResult computeVariance(MatchedPair pair, String oldLabel, String newLabel) {
        LineItem oldItem = pair.getOldItem();
        LineItem newItem = pair.getNewItem();

        Double oldValue = oldItem != null && oldLabel != null ? oldItem.getValue(oldLabel) : null;
        Double newValue = newItem != null && newLabel != null ? newItem.getValue(newLabel) : null;
        String name = pair.getDisplayName();
        String newName = newItem != null ? newItem.getName() : null;

        if (oldValue == null || newValue == null) {
            return new VarianceResult(name, newName, oldValue, newValue, null, null,
                    PercentageState.NOT_AVAILABLE, pair.getConfidence(), pair.getMatchKind(), false);
        }

        double absolute = newValue - oldValue;
        Double percentage = null;
        PercentageState state = PercentageState.UNDEFINED_ZERO_BASE;
        if (oldValue != 0.0) {
            percentage = absolute / Math.abs(oldValue) * 100.0;
            state = PercentageState.DEFINED;
        }

        boolean drillDown = oldItem.getFormula(oldLabel) != null || newItem.getFormula(newLabel) != null;
        return new VarianceResult(name, newName, oldValue, newValue, absolute, percentage, state,
                pair.getConfidence(), pair.getMatchKind(), drillDown);
    }

    /**
     * Attribute the variance of a matched pair to the operands of its formula.
     * Operands are paired by position; an operand with no counterpart is reported with its full
     * change and flagged OLD_ONLY or NEW_ONLY. Never throws for workbook content problems.
     *
     * @param deadline wall-clock limit for graph building, null for none
     */
    public DrillDownOutcome drillDown(MatchedPair pair, Workbook oldWorkbook, Period oldPeriod,
                                      Workbook newWorkbook, Period newPeriod, Instant deadline) {
        DrillDownOutcome outcome = new DrillDownOutcome();

        if (pair == null) {
            return outcome.fail(FailureReason.LINE_ITEM_NOT_FOUND, "Line item not found");
        }
        String name = pair.getDisplayName();
        if (!pair.getMatchKind().isMatched()) {
            String side = pair.getOldItem() != null ? "old" : "new";
            return outcome.fail(FailureReason.LINE_ITEM_NOT_FOUND,
                    "Line item '" + name + "' exists only in the " + side + " model");
        }
        if (oldPeriod == null || newPeriod == null) {
            return outcome.fail(FailureReason.STRUCTURAL,
                    "Selected period is not present in both models for line item '" + name + "'");
        }

        LineItem oldItem = pair.getOldItem();
        LineItem newItem = pair.getNewItem();
        Optional<Sheet> oldSheet = oldWorkbook.findSheet(oldItem.getSheet());
        Optional<Sheet> newSheet = newWorkbook.findSheet(newItem.getSheet());
        if (oldSheet.isEmpty() || newSheet.isEmpty()) {
            return outcome.fail(FailureReason.STRUCTURAL, "Sheet of line item '" + name + "' no longer exists");
        }

        CellRef oldRoot = CellRef.of(oldItem.getSheet(), oldPeriod.getColumnIndex(), oldItem.getRow());
        CellRef newRoot = CellRef.of(newItem.getSheet(), newPeriod.getColumnIndex(), newItem.getRow());
        Cell oldCell = oldSheet.get().getCell(oldRoot.getRow(), oldRoot.getCol());
        Cell newCell = newSheet.get().getCell(newRoot.getRow(), newRoot.getCol());
        boolean oldHasFormula = oldCell != null && oldCell.hasFormula();
        boolean newHasFormula = newCell != null && newCell.hasFormula();

        if (!oldHasFormula && !newHasFormula) {
            logger.debug("No drill-down for '{}': hardcoded in both models", name);
            return outcome.fail(FailureReason.NO_FORMULA,
                    "'" + name + "' holds a plain value in both models, no drill-down available");
        }

        outcome.transitionTo(DrillDownState.GRAPH_BUILDING);
        DependencyGraph oldGraph;
        DependencyGraph newGraph;
        try {
            oldGraph = graphBuilder.build(oldWorkbook, oldRoot, deadline);
            outcome.addIssues(toIssues(oldGraph, ModelSide.OLD));
            requireAcyclic(oldGraph);

            newGraph = graphBuilder.build(newWorkbook, newRoot, deadline);
            outcome.addIssues(toIssues(newGraph, ModelSide.NEW));
            requireAcyclic(newGraph);
        } catch (GraphTimeoutException e) {
            logger.warn("Drill-down for '{}' timed out: {}", name, e.getMessage());
            outcome.addIssue(AnalysisIssue.from(e));
            return outcome.fail(FailureReason.TIMEOUT, e.getMessage());
        } catch (CircularReferenceException e) {
            logger.warn("Drill-down for '{}' stopped: {}", name, e.getMessage());
            return outcome.fail(FailureReason.CIRCULAR_REFERENCE, e.getMessage());
        }

        for (DependencyGraph graph : List.of(oldGraph, newGraph)) {
            FormulaNode root = graph.getRoot();
            if (root.isOpaque()) {
                return outcome.fail(FailureReason.PARSE_ERROR,
                        "Formula of " + root.getKey() + " could not be broken down: " + root.getParseWarning());
            }
        }

        outcome.transitionTo(DrillDownState.COMPONENT_MATCHING);
        List<AnalysisIssue> dataIssues = new ArrayList<>();
        List<DrillDownComponent> components = pairComponents(oldGraph.getRoot(), oldWorkbook,
                newGraph.getRoot(), newWorkbook, dataIssues);

        Double sourceOld = rootValue(oldGraph.getRoot(), oldItem, oldPeriod, dataIssues);
        Double sourceNew = rootValue(newGraph.getRoot(), newItem, newPeriod, dataIssues);
        double totalVariance = zeroIfNull(sourceNew) - zeroIfNull(sourceOld);
        double totalExplained = 0.0;
        for (DrillDownComponent component : components) {
            totalExplained += component.getVarianceContribution();
        }

        outcome.addIssues(dataIssues);
        DrillDownResult result = new DrillDownResult(name,
                oldHasFormula ? oldCell.getFormula() : null,
                newHasFormula ? newCell.getFormula() : null,
                sourceOld, sourceNew, totalVariance, totalExplained, totalVariance - totalExplained, components);

        logger.info("Drill-down '{}': {} components, explained {} of {}", name, components.size(), totalExplained, totalVariance);
        return outcome.attribute(result);
    }

    private List<DrillDownComponent> pairComponents(FormulaNode oldRoot, Workbook oldWorkbook,
                                                    FormulaNode newRoot, Workbook newWorkbook,
                                                    List<AnalysisIssue> issues) {
        List<FormulaNode> oldOperands = oldRoot.getOperands();
        List<FormulaNode> newOperands = newRoot.getOperands();
        int count = Math.max(oldOperands.size(), newOperands.size());

        List<DrillDownComponent> components = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            FormulaNode oldNode = i < oldOperands.size() ? oldOperands.get(i) : null;
            FormulaNode newNode = i < newOperands.size() ? newOperands.get(i) : null;

            ComponentPresence presence = oldNode == null ? ComponentPresence.NEW_ONLY
                    : newNode == null ? ComponentPresence.OLD_ONLY
                    : ComponentPresence.BOTH;
            FormulaNode primary = newNode != null ? newNode : oldNode;
            Workbook primaryWorkbook = newNode != null ? newWorkbook : oldWorkbook;

            String name = componentName(primaryWorkbook, primary.getCellRef());
            Double oldValue = oldNode != null ? oldNode.getResolvedValue() : null;
            Double newValue = newNode != null ? newNode.getResolvedValue() : null;
            checkValue(oldNode, oldWorkbook, name, ModelSide.OLD, issues);
            checkValue(newNode, newWorkbook, name, ModelSide.NEW, issues);

            boolean hasFormula = (oldNode != null && oldNode.hasFormula()) || (newNode != null && newNode.hasFormula());
            components.add(new DrillDownComponent(name, primary.getKey(),
                    oldNode != null ? oldNode.getKey() : null,
                    newNode != null ? newNode.getKey() : null,
                    oldValue, newValue, zeroIfNull(newValue) - zeroIfNull(oldValue),
                    primary.isLeaf(), hasFormula, presence));
        }
        return components;
    }

    /**
     * Meaningful text in the label column of the referenced row, otherwise the address.
     */
    private String componentName(Workbook workbook, CellRef ref) {
        Optional<Sheet> sheet = workbook.findSheet(ref.getSheet());
        if (sheet.isPresent() && ref.getWorkbook() == null) {
            Object label = sheet.get().getRawValue(ref.getRow(), properties.getLabelColumn());
            if (CellValueUtils.isMeaningfulLabel(label)) {
                return (String) label;
            }
        }
        return ref.getKey();
    }

    private void checkValue(FormulaNode node, Workbook workbook, String name, ModelSide side,
                            List<AnalysisIssue> issues) {
        if (node == null || node.getResolvedValue() != null) {
            return;
        }
        if (node.getKind() == NodeKind.CONSTANT && isBlankCell(workbook, node.getCellRef())) {
            // empty input cell, zero by spreadsheet convention
            return;
        }
        CellRef ref = node.getCellRef();
        issues.add(AnalysisIssue.data(
                String.format("Component '%s' has no numeric value in the %s model; counted as 0", name, label(side)),
                ref.getSheet(), ref.getRow(), ref.getCol()));
    }

    private Double rootValue(FormulaNode root, LineItem item, Period period, List<AnalysisIssue> issues) {
        Double value = root.getResolvedValue();
        if (value == null) {
            value = item.getValue(period.getLabel());
        }
        if (value == null) {
            CellRef ref = root.getCellRef();
            issues.add(AnalysisIssue.data("Line item '" + item.getName() + "' has no numeric value in period '"
                    + period.getLabel() + "'; counted as 0", ref.getSheet(), ref.getRow(), ref.getCol()));
        }
        return value;
    }

    private void requireAcyclic(DependencyGraph graph) {
        for (GraphFinding finding : graph.getFindings()) {
            if (finding.getType() == GraphFinding.Type.CIRCULAR_REFERENCE) {
                throw new CircularReferenceException(finding.getSheet(), finding.getRow(), finding.getCol(), finding.getMessage());
            }
        }
    }

    private List<AnalysisIssue> toIssues(DependencyGraph graph, ModelSide side) {
        List<AnalysisIssue> issues = new ArrayList<>();
        for (GraphFinding finding : graph.getFindings()) {
            String message = finding.getMessage() + " (" + label(side) + " model)";
            switch (finding.getType()) {
                case CIRCULAR_REFERENCE:
                    issues.add(AnalysisIssue.graph("CircularReference", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                case DEPTH_TRUNCATED:
                    issues.add(AnalysisIssue.graph("DepthTruncated", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                case RANGE_TRUNCATED:
                    issues.add(AnalysisIssue.graph("RangeTruncated", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                case PARSE_WARNING:
                    issues.add(AnalysisIssue.formula("UnsupportedFormula", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                case EXTERNAL_REFERENCE:
                    issues.add(AnalysisIssue.formula("ExternalReference", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                case MISSING_SHEET:
                    issues.add(AnalysisIssue.formula("MissingSheet", message, finding.getSheet(), finding.getRow(), finding.getCol()));
                    break;
                default:
                    break;
            }
        }
        return issues;
    }

    private static boolean isBlankCell(Workbook workbook, CellRef ref) {
        Optional<Sheet> sheet = workbook.findSheet(ref.getSheet());
        if (sheet.isEmpty()) {
            return false;
        }
        Cell cell = sheet.get().getCell(ref.getRow(), ref.getCol());
        return cell == null || (!cell.hasFormula() && CellValueUtils.isBlank(cell.getRawValue()));
    }

    private static String label(ModelSide side) {
        return side == ModelSide.OLD ? "old" : "new";
    }

    private static double zeroIfNull(Double value) {
        return value != null ? value : 0.0;
    }
}
