package com.Excel.Variance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the analysis engine, bound from the {@code variance.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "variance")
public class VarianceProperties {

    /** Rows scanned from the top of a sheet when looking for the period header */
    private int headerScanRows = 10;

    /** Period labels a row needs before it can be the header */
    private int minPeriodCells = 3;

    /** Column holding line item labels, 1 = A */
    private int labelColumn = 1;

    /** Consecutive empty rows that end line item extraction */
    private int emptyRowLimit = 10;

    private double fuzzyThreshold = 0.80;

    private int maxGraphDepth = 64;

    /** Cells taken from one range operand before the rest is dropped */
    private int maxRangeCells = 10_000;

    private Duration drillDownTimeout = Duration.ofSeconds(5);

    /** Worker pool size; 0 means one thread per available processor */
    private int workerThreads = 0;

    /** Bounds for bare four-digit year headers */
    private int minYear = 1900;
    private int maxYear = 2100;

    private Duration sessionTimeout = Duration.ofHours(1);

    /** How often idle sessions are swept, read by the scheduler */
    private long sessionCleanupIntervalMs = 300_000;

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
