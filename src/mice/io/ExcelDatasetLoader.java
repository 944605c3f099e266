/*
 *   This program is free software: you can redistribute it and/or modify
 *   it under the terms of the GNU General Public License as published by
 *   the Free Software Foundation, either version 3 of the License, or
 *   (at your option) any later version.
 *
 *   This program is distributed in the hope that it will be useful,
 *   but WITHOUT ANY WARRANTY; without even the implied warranty of
 *   MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *   GNU General Public License for more details.
 *
 *   You should have received a copy of the GNU General Public License
 *   along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

 /*
 *    ExcelDatasetLoader.java
 *
 */
package mice.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.Dataset;
import mice.session.DatasetLoader;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Loads a raw dataset from the first sheet of an Excel workbook (.xls or
 * .xlsx). The first row holds the column names, every following row is a
 * data row.
 * <p/>
 * Numeric cells give {@link Double} cells, text cells {@link String},
 * boolean cells {@link Boolean} and date formatted cells their ISO text.
 * Formula cells give their cached result. Blank and error cells, and rows
 * that are absent from the sheet, give {@link Dataset#MISSING}.
 */
public class ExcelDatasetLoader implements DatasetLoader {

    private static final Logger LOGGER = Logger.getLogger(ExcelDatasetLoader.class.getName());

    private final File m_file;

    public ExcelDatasetLoader(File file) {
        m_file = file;
    }

    /**
     * @param file - file to check
     * @return whether the file name carries an Excel extension
     */
    public static boolean isWorkbook(File file) {
        String name = file.getName().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xls");
    }

    @Override
    public Dataset load() throws IOException {

        if (!m_file.isFile()) {
            throw new IOException("No such file: " + m_file);
        }

        try (Workbook workbook = WorkbookFactory.create(m_file, null, true)) {
            Sheet sheet = workbook.getSheetAt(0);
            Dataset dataset = toDataset(sheet);
            LOGGER.log(Level.INFO, "Loaded sheet {0} of {1}: {2} rows, {3} columns",
                    new Object[]{sheet.getSheetName(), m_file, dataset.numRows(), dataset.numColumns()});
            return dataset;
        } catch (EncryptedDocumentException e) {
            throw new IOException("Cannot read encrypted workbook " + m_file, e);
        }
    }

    /**
     * Converts a sheet into a raw dataset. The number of columns is the
     * longest row of the sheet.
     *
     * @param sheet - sheet whose first row holds the column names
     * @return raw dataset
     * @throws IOException if the sheet has no rows or no columns
     */
    static Dataset toDataset(Sheet sheet) throws IOException {

        if (sheet.getPhysicalNumberOfRows() == 0) {
            throw new IOException("Sheet " + sheet.getSheetName() + " is empty");
        }

        int numColumns = 0;
        for (Row row : sheet) {
            numColumns = Math.max(numColumns, row.getLastCellNum());
        }
        if (numColumns <= 0) {
            throw new IOException("Sheet " + sheet.getSheetName() + " has no columns");
        }

        int headerRow = sheet.getFirstRowNum();
        List<String> names = columnNames(sheet.getRow(headerRow), numColumns);

        List<List<Object>> columns = new ArrayList<>(numColumns);
        for (int j = 0; j < numColumns; j++) {
            columns.add(new ArrayList<>());
        }
        for (int i = headerRow + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            for (int j = 0; j < numColumns; j++) {
                Cell cell = row == null ? null : row.getCell(j, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                columns.get(j).add(cellValue(cell));
            }
        }
        return new Dataset(names, columns);
    }

    /**
     * Reads the header row. Blank names become "Unnamed: j" and repeated
     * names get a ".1", ".2", ... suffix.
     */
    private static List<String> columnNames(Row header, int numColumns) {

        List<String> names = new ArrayList<>(numColumns);
        Set<String> used = new HashSet<>();
        for (int j = 0; j < numColumns; j++) {
            Object value = cellValue(header.getCell(j, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
            String name;
            if (Dataset.isMissing(value) || value.toString().trim().isEmpty()) {
                name = "Unnamed: " + j;
            } else if (value instanceof Double && (Double) value == Math.rint((Double) value)) {
                name = String.valueOf(((Double) value).longValue());
            } else {
                name = value.toString();
            }

            String unique = name;
            for (int n = 1; !used.add(unique); n++) {
                unique = name + "." + n;
            }
            names.add(unique);
        }
        return names;
    }

    /**
     * @param cell - cell to read, null when absent
     * @return the cell value, {@link Dataset#MISSING} for blank and error cells
     */
    static Object cellValue(Cell cell) {

        if (cell == null) {
            return Dataset.MISSING;
        }

        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return Dataset.MISSING;
        }
    }

}
