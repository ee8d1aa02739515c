package com.Excel.Variance.service;

import com.Excel.Variance.exception.WorkbookLoadException;
import com.Excel.Variance.model.Cell;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.Workbook;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads .xlsx files into the immutable {@link Workbook} model, keeping formula text and cached results.
 */
@Service
public class WorkbookService {
    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    public Workbook loadWorkbook(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new WorkbookLoadException("Uploaded file is empty", null);
        }
        try (InputStream in = file.getInputStream()) {
            return loadWorkbook(file.getOriginalFilename(), in);
        } catch (IOException e) {
            logger.error("Failed to read upload {}", file.getOriginalFilename(), e);
            throw new WorkbookLoadException("Failed to read uploaded file: " + e.getMessage(), e);
        }
    }

    public Workbook loadWorkbook(String name, InputStream in) {
        logger.info("Loading workbook '{}'", name);

        try (org.apache.poi.ss.usermodel.Workbook poiWorkbook = WorkbookFactory.create(in)) {
            return convert(name, poiWorkbook);
        } catch (EncryptedDocumentException e) {
            throw new WorkbookLoadException("Workbook '" + name + "' is password protected", e);
        } catch (IOException | RuntimeException e) {
            logger.error("Error loading workbook '{}': {}", name, e.getMessage(), e);
            throw new WorkbookLoadException("Failed to load workbook '" + name + "': " + e.getMessage(), e);
        }
    }

    /**
     * Copy every populated cell of a POI workbook into the model. Visible to tests working on in-memory workbooks.
     */
    public Workbook convert(String name, org.apache.poi.ss.usermodel.Workbook poiWorkbook) {
        List<Sheet> sheets = new ArrayList<>();
        for (org.apache.poi.ss.usermodel.Sheet poiSheet : poiWorkbook) {
            String sheetName = poiSheet.getSheetName();
            List<Cell> cells = new ArrayList<>();

            for (Row row : poiSheet) {
                for (org.apache.poi.ss.usermodel.Cell poiCell : row) {
                    Cell cell = toCell(sheetName, poiCell);
                    if (cell != null) {
                        cells.add(cell);
                    }
                }
            }

            sheets.add(new Sheet(sheetName, cells));
            logger.debug("Sheet '{}': {} populated cells", sheetName, cells.size());
        }

        Workbook workbook = new Workbook(name, sheets);
        logger.info("Loaded workbook '{}' with sheets {}", name, workbook.getSheetNames());
        return workbook;
    }

    private Cell toCell(String sheetName, org.apache.poi.ss.usermodel.Cell poiCell) {
        int row = poiCell.getRowIndex() + 1;
        int col = poiCell.getColumnIndex() + 1;

        if (poiCell.getCellType() == CellType.FORMULA) {
            Object cached = readValue(poiCell, poiCell.getCachedFormulaResultType());
            return Cell.formula(sheetName, row, col, poiCell.getCellFormula(), cached);
        }

        Object value = readValue(poiCell, poiCell.getCellType());
        if (value == null) {
            return null;
        }
        return Cell.value(sheetName, row, col, value);
    }

    private Object readValue(org.apache.poi.ss.usermodel.Cell poiCell, CellType type) {
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(poiCell)) {
                    // Dates only matter as header text
                    LocalDateTime date = poiCell.getLocalDateTimeCellValue();
                    return date != null ? date.format(DateTimeFormatter.ISO_LOCAL_DATE) : null;
                }
                return poiCell.getNumericCellValue();
            case STRING:
                String text = poiCell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case BOOLEAN:
                return poiCell.getBooleanCellValue();
            case ERROR:
                return org.apache.poi.ss.usermodel.FormulaError.forInt(poiCell.getErrorCellValue()).getString();
            default:
                return null;
        }
    }
}
