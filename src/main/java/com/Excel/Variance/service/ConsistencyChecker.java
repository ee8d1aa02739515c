package com.Excel.Variance.service;

import com.Excel.Variance.dto.ConsistencyCheck;
import com.Excel.Variance.dto.PeriodAlignment;
import com.Excel.Variance.dto.StructureProbe;
import com.Excel.Variance.model.MatchKind;
import com.Excel.Variance.model.MatchResult;
import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.model.ModelSide;
import com.Excel.Variance.model.StatementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores whether an old and a new model can be compared line by line: same statements present,
 * at least one common period per statement, and how many line items found a partner.
 */
@Service
public class ConsistencyChecker {

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

    static final double STRUCTURE_WEIGHT = 0.4;
    static final double NAMING_WEIGHT = 0.3;
    static final double PERIOD_WEIGHT = 0.3;

    private final PeriodAligner periodAligner;

    public ConsistencyChecker(PeriodAligner periodAligner) {
        this.periodAligner = periodAligner;
    }

    /**
     * @param probes  structure probes of both models
     * @param matches line item matches of every statement probed successfully on both sides
     */
    public ConsistencyCheck check(List<StructureProbe> probes, Map<StatementType, MatchResult> matches) {
        Map<StatementType, StructureProbe> oldProbes = successfulBySide(probes, ModelSide.OLD);
        Map<StatementType, StructureProbe> newProbes = successfulBySide(probes, ModelSide.NEW);

        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<StatementType> compared = new ArrayList<>();
        for (StatementType type : StatementType.values()) {
            if (oldProbes.containsKey(type) && newProbes.containsKey(type)) {
                compared.add(type);
            }
        }

        boolean sameStatements = oldProbes.keySet().equals(newProbes.keySet());
        if (!sameStatements) {
            issues.add("Different financial statements found between models: old has " + keys(oldProbes.keySet())
                    + ", new has " + keys(newProbes.keySet()));
        }
        boolean structureMatch = sameStatements && !compared.isEmpty();

        boolean periodAlignmentPossible = !compared.isEmpty();
        for (StatementType type : compared) {
            PeriodAlignment alignment = periodAligner.align(oldProbes.get(type).getPeriods(), newProbes.get(type).getPeriods());
            if (alignment.getAligned().isEmpty()) {
                periodAlignmentPossible = false;
                warnings.add("No common periods found for " + type.getKey() + ", comparison will be limited");
            }
        }
        if (compared.isEmpty()) {
            warnings.add("No statement could be read from both models");
        }

        double namingConsistency = namingConsistency(compared, matches);

        double score = (structureMatch ? STRUCTURE_WEIGHT : 0.0)
                + NAMING_WEIGHT * namingConsistency
                + (periodAlignmentPossible ? PERIOD_WEIGHT : 0.0);

        logger.info("Consistency check: structureMatch={}, periods={}, naming={}, score={}",
                structureMatch, periodAlignmentPossible, namingConsistency, score);

        return new ConsistencyCheck(structureMatch, periodAlignmentPossible, namingConsistency, score, compared,
                issues, warnings, insights(structureMatch, periodAlignmentPossible, namingConsistency));
    }

    /**
     * Share of matched pairs, exact or fuzzy, among all pairs. 1.0 when there is nothing to compare.
     */
    double namingConsistency(List<StatementType> compared, Map<StatementType, MatchResult> matches) {
        int total = 0;
        int matched = 0;
        for (StatementType type : compared) {
            MatchResult result = matches.get(type);
            if (result == null) {
                continue;
            }
            for (MatchedPair pair : result.getPairs()) {
                total++;
                if (pair.getMatchKind() == MatchKind.EXACT || pair.getMatchKind() == MatchKind.FUZZY) {
                    matched++;
                }
            }
        }
        return total == 0 ? 1.0 : (double) matched / total;
    }

    private List<String> insights(boolean structureMatch, boolean periodAlignmentPossible, double naming) {
        List<String> insights = new ArrayList<>();
        if (structureMatch) {
            insights.add("Both models have consistent financial statement structure");
        }
        if (periodAlignmentPossible) {
            insights.add("Every compared statement shares at least one period");
        }
        String percent = String.format(Locale.ROOT, "%.1f%%", naming * 100.0);
        if (naming > 0.8) {
            insights.add("High naming consistency (" + percent + ") indicates reliable comparisons");
        } else if (naming > 0.5) {
            insights.add("Moderate naming consistency (" + percent + "), some manual review recommended");
        } else {
            insights.add("Low naming consistency (" + percent + "), significant differences detected");
        }
        return insights;
    }

    private static Map<StatementType, StructureProbe> successfulBySide(List<StructureProbe> probes, ModelSide side) {
        Map<StatementType, StructureProbe> result = new EnumMap<>(StatementType.class);
        for (StructureProbe probe : probes) {
            if (probe.getSide() == side && probe.isSuccessful()) {
                result.put(probe.getStatementType(), probe);
            }
        }
        return result;
    }

    private static String keys(Set<StatementType> types) {
        if (types.isEmpty()) {
            return "none";
        }
        return EnumSet.copyOf(types).stream().map(StatementType::getKey).collect(Collectors.joining(", "));
    }
}
