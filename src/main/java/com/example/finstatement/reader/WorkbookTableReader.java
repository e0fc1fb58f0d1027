package com.example.finstatement.reader;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.finstatement.exception.DocumentReadException;
import com.example.finstatement.model.SourceTable;

/**
 * Turns an .xlsx/.xls workbook into named tables. Numeric cells (and formulas that evaluate
 * to numbers) become {@link BigDecimal}; everything else becomes its displayed text; blank
 * cells are null. Row indexes follow the sheet, so empty rows stay in place.
 */
@Component
public class WorkbookTableReader {

    private static final Logger log = LoggerFactory.getLogger(WorkbookTableReader.class);

    public List<SourceTable> read(InputStream in) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            DataFormatter formatter = new DataFormatter();

            List<SourceTable> tables = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                tables.add(new SourceTable(sheet.getSheetName(), readRows(sheet, evaluator, formatter)));
            }
            log.info("📗 workbook read: {} sheet(s) {}", tables.size(), sheetNames(tables));
            return tables;
        } catch (IOException | EncryptedDocumentException e) {
            throw new DocumentReadException("cannot read workbook: " + e.getMessage(), e);
        }
    }

    private List<List<Object>> readRows(Sheet sheet, FormulaEvaluator evaluator, DataFormatter formatter) {
        List<List<Object>> rows = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() < 0) {
                rows.add(Collections.emptyList());
                continue;
            }
            List<Object> cells = new ArrayList<>();
            for (int c = 0; c < row.getLastCellNum(); c++) {
                cells.add(cellValue(row.getCell(c), evaluator, formatter));
            }
            rows.add(cells);
        }
        return rows;
    }

    Object cellValue(Cell cell, FormulaEvaluator evaluator, DataFormatter formatter) {
        if (cell == null) return null;

        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            try {
                type = evaluator.evaluateFormulaCell(cell);
            } catch (RuntimeException e) {
                // external references and unsupported functions: fall back to the cached result
                log.debug("formula {} not evaluated: {}", cell.getAddress(), e.getMessage());
                type = cell.getCachedFormulaResultType();
            }
        }

        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return formatter.formatCellValue(cell, evaluator);
                return BigDecimal.valueOf(cell.getNumericCellValue());
            case STRING:
                String s = cell.getStringCellValue();
                return s == null || s.isBlank() ? null : s;
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    private static List<String> sheetNames(List<SourceTable> tables) {
        List<String> names = new ArrayList<>();
        for (SourceTable t : tables) names.add(t.getName());
        return names;
    }
}
