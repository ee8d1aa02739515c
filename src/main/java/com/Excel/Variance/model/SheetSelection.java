package com.Excel.Variance.model;

import com.Excel.Variance.dto.PeriodTemplate;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Which sheet holds which statement. The new model uses the old model's sheet name unless overridden.
 */
@Value
public class SheetSelection {
    Map<StatementType, String> oldSheets;
    Map<StatementType, String> newSheets;
    List<PeriodTemplate> templates;

    public SheetSelection(Map<StatementType, String> oldSheets, Map<StatementType, String> newSheets,
                          List<PeriodTemplate> templates) {
        this.oldSheets = Collections.unmodifiableMap(copy(oldSheets));
        this.newSheets = Collections.unmodifiableMap(copy(newSheets));
        this.templates = templates != null ? List.copyOf(templates) : List.of();
    }

    public String sheetFor(ModelSide side, StatementType type) {
        if (side == ModelSide.NEW && newSheets.containsKey(type)) {
            return newSheets.get(type);
        }
        return oldSheets.get(type);
    }

    public List<StatementType> getStatementTypes() {
        EnumMap<StatementType, Boolean> types = new EnumMap<>(StatementType.class);
        oldSheets.keySet().forEach(type -> types.put(type, true));
        newSheets.keySet().forEach(type -> types.put(type, true));
        return List.copyOf(types.keySet());
    }

    private static Map<StatementType, String> copy(Map<StatementType, String> sheets) {
        EnumMap<StatementType, String> result = new EnumMap<>(StatementType.class);
        if (sheets != null) {
            result.putAll(sheets);
        }
        return result;
    }
}
