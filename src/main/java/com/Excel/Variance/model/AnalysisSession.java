package com.Excel.Variance.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Two uploaded workbooks plus the current sheet selection and the results derived from it.
 * Workbooks never change; re-selecting sheets clears the cache.
 */
@Getter
public class AnalysisSession {

    private final String id;
    private final Workbook oldWorkbook;
    private final Workbook newWorkbook;
    private final Instant createdAt;
    private final AnalysisCache cache;

    private volatile Instant lastAccessed;

    public AnalysisSession(String id, Workbook oldWorkbook, Workbook newWorkbook) {
        this.id = id;
        this.oldWorkbook = oldWorkbook;
        this.newWorkbook = newWorkbook;
        this.createdAt = Instant.now();
        this.lastAccessed = createdAt;
        this.cache = new AnalysisCache(id);
    }

    public Workbook getWorkbook(ModelSide side) {
        return side == ModelSide.OLD ? oldWorkbook : newWorkbook;
    }

    public void select(SheetSelection selection) {
        cache.select(selection);
    }

    public SheetSelection getSelection() {
        return cache.getSelection();
    }

    public boolean hasSelection() {
        return getSelection() != null;
    }

    public void touch() {
        this.lastAccessed = Instant.now();
    }
}
