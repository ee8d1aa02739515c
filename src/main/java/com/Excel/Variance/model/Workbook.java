package com.Excel.Variance.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * In-memory workbook: sheets in file order with their raw values and formula strings.
 */
@Getter
public class Workbook {

    private final String name; // Workbook (file) name

    private final List<Sheet> sheets;

    public Workbook(String name, List<Sheet> sheets) {
        this.name = name;
        this.sheets = Collections.unmodifiableList(new ArrayList<>(sheets));
    }

    public Optional<Sheet> findSheet(String sheetName) {
        if (sheetName == null) {
            return Optional.empty();
        }
        return sheets.stream()
                .filter(s -> s.getName().equals(sheetName))
                .findFirst();
    }

    public List<String> getSheetNames() {
        List<String> names = new ArrayList<>();
        for (Sheet sheet : sheets) {
            names.add(sheet.getName());
        }
        return names;
    }
}
