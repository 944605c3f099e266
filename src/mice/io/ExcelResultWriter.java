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
 *    ExcelResultWriter.java
 *
 */
package mice.io;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.Dataset;
import mice.core.MissingnessTable;
import mice.session.ResultWriter;
import mice.session.SessionResult;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Writes the tables of a session into one .xlsx workbook, one sheet per
 * table, in this order:
 * <ul>
 * <li>Missingness - variable, missing_n, missing_pct(%)</li>
 * <li>Data_Original - the sanitized original</li>
 * <li>Data_Imputed for a single chain, Data_Imputed_1 ... for several</li>
 * </ul>
 * Missing cells are left empty. The imputed sheets are only written when
 * something was imputed.
 */
public class ExcelResultWriter implements ResultWriter {

    public static final String MISSINGNESS_SHEET = "Missingness";

    public static final String ORIGINAL_SHEET = "Data_Original";

    public static final String IMPUTED_PREFIX = "Data_Imputed";

    private static final Logger LOGGER = Logger.getLogger(ExcelResultWriter.class.getName());

    private final File m_file;

    public ExcelResultWriter(File file) {
        m_file = file;
    }

    /**
     * @param file - output path
     * @return whether the path names an .xlsx workbook
     */
    public static boolean isWorkbook(File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(".xlsx");
    }

    @Override
    public void write(SessionResult result) throws IOException {

        File parent = m_file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Cannot create output directory " + parent);
        }

        try (Workbook workbook = new XSSFWorkbook()) {
            writeMissingness(workbook.createSheet(MISSINGNESS_SHEET), result.getMissingnessTable());
            writeDataset(workbook.createSheet(ORIGINAL_SHEET), result.getSanitizedOriginal());

            List<Dataset> completed = result.getCompletedDatasets();
            for (int c = 0; c < completed.size(); c++) {
                String name = completed.size() == 1 ? IMPUTED_PREFIX : IMPUTED_PREFIX + "_" + (c + 1);
                writeDataset(workbook.createSheet(name), completed.get(c));
            }

            try (OutputStream out = new FileOutputStream(m_file)) {
                workbook.write(out);
            }
        }
        LOGGER.log(Level.INFO, "Wrote {0}", m_file);
    }

    private static void writeMissingness(Sheet sheet, MissingnessTable table) {

        Row header = sheet.createRow(0);
        header.createCell(0).setCellValue(MissingnessTable.VARIABLE);
        header.createCell(1).setCellValue(MissingnessTable.MISSING_COUNT);
        header.createCell(2).setCellValue(MissingnessTable.MISSING_PCT);

        int r = 1;
        for (MissingnessTable.Entry entry : table.entries()) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(entry.getVariable());
            row.createCell(1).setCellValue(entry.getMissingCount());
            row.createCell(2).setCellValue(entry.getMissingPct());
        }
    }

    /**
     * Writes a header row with the column names followed by one row per
     * dataset row.
     */
    static void writeDataset(Sheet sheet, Dataset dataset) {

        Row header = sheet.createRow(0);
        for (int j = 0; j < dataset.numColumns(); j++) {
            header.createCell(j).setCellValue(dataset.columnName(j));
        }
        for (int i = 0; i < dataset.numRows(); i++) {
            Row row = sheet.createRow(i + 1);
            for (int j = 0; j < dataset.numColumns(); j++) {
                Object value = dataset.value(i, j);
                if (Dataset.isMissing(value)) {
                    continue;
                }
                Cell cell = row.createCell(j);
                if (value instanceof Number) {
                    cell.setCellValue(((Number) value).doubleValue());
                } else if (value instanceof Boolean) {
                    cell.setCellValue((Boolean) value);
                } else {
                    cell.setCellValue(value.toString());
                }
            }
        }
    }

}
