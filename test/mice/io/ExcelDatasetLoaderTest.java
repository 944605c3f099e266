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
 *    ExcelDatasetLoaderTest.java
 *
 */
package mice.io;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import mice.core.Dataset;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class ExcelDatasetLoaderTest {

    @TempDir
    Path tempDir;

    private static File save(Workbook workbook, File file) throws IOException {
        try (OutputStream out = new FileOutputStream(file)) {
            workbook.write(out);
        }
        workbook.close();
        return file;
    }

    /**
     * Header height, colour, ok; a short second row, a row absent from the
     * sheet and a row with a formula and a blank cell.
     */
    private static Workbook people(Workbook workbook) {
        Sheet sheet = workbook.createSheet("people");
        Row header = sheet.createRow(0);
        header.createCell(0).setCellValue("height");
        header.createCell(1).setCellValue("colour");
        header.createCell(2).setCellValue("ok");

        Row first = sheet.createRow(1);
        first.createCell(0).setCellValue(1.5);
        first.createCell(1).setCellValue("red");
        first.createCell(2).setCellValue(true);

        Row second = sheet.createRow(2);
        second.createCell(1).setCellValue("blue");

        Row fourth = sheet.createRow(4);
        fourth.createCell(0).setCellFormula("A2*2");
        fourth.createCell(1);
        fourth.createCell(2).setCellValue(false);

        workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("other");
        workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
        return workbook;
    }

    private static void assertPeople(Dataset dataset) {
        assertThat(dataset.columnNames()).containsExactly("height", "colour", "ok");
        assertThat(dataset.numRows()).isEqualTo(4);
        assertThat(dataset.column("height")).containsExactly(1.5, Dataset.MISSING, Dataset.MISSING, 3.0);
        assertThat(dataset.column("colour")).containsExactly("red", "blue", Dataset.MISSING, Dataset.MISSING);
        assertThat(dataset.column("ok")).containsExactly(true, Dataset.MISSING, Dataset.MISSING, false);
    }

    @Test
    void shouldLoadFirstSheetOfXlsx() throws Exception {
        File file = save(people(new XSSFWorkbook()), tempDir.resolve("people.xlsx").toFile());

        assertPeople(new ExcelDatasetLoader(file).load());
    }

    @Test
    void shouldLoadFirstSheetOfXls() throws Exception {
        File file = save(people(new HSSFWorkbook()), tempDir.resolve("people.xls").toFile());

        assertPeople(new ExcelDatasetLoader(file).load());
    }

    @Test
    void shouldBeReachableThroughWekaLoader() throws Exception {
        File file = save(people(new XSSFWorkbook()), tempDir.resolve("PEOPLE.XLSX").toFile());

        assertPeople(new WekaDatasetLoader(file).load());
    }

    @Test
    void shouldNameBlankAndRepeatedHeaders() throws Exception {
        Workbook workbook = new XSSFWorkbook();
        Row header = workbook.createSheet("s").createRow(0);
        header.createCell(0).setCellValue("a");
        header.createCell(2).setCellValue("a");
        header.createCell(3).setCellValue(2019);
        workbook.getSheetAt(0).createRow(1).createCell(4).setCellValue("wide");
        File file = save(workbook, tempDir.resolve("headers.xlsx").toFile());

        Dataset dataset = new ExcelDatasetLoader(file).load();

        assertThat(dataset.columnNames()).containsExactly("a", "Unnamed: 1", "a.1", "2019", "Unnamed: 4");
        assertThat(dataset.value(0, 4)).isEqualTo("wide");
    }

    @Test
    void shouldReadDateCellsAsIsoText() throws Exception {
        Workbook workbook = new XSSFWorkbook();
        CellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
        Sheet sheet = workbook.createSheet("dates");
        sheet.createRow(0).createCell(0).setCellValue("day");
        Cell cell = sheet.createRow(1).createCell(0);
        cell.setCellValue(LocalDateTime.of(2021, 3, 4, 0, 0));
        cell.setCellStyle(dateStyle);
        File file = save(workbook, tempDir.resolve("dates.xlsx").toFile());

        assertThat(new ExcelDatasetLoader(file).load().value(0, 0)).isEqualTo("2021-03-04T00:00");
    }

    @Test
    void shouldFailForEmptySheet() throws Exception {
        Workbook workbook = new XSSFWorkbook();
        workbook.createSheet("empty");
        File file = save(workbook, tempDir.resolve("empty.xlsx").toFile());

        assertThatThrownBy(() -> new ExcelDatasetLoader(file).load())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldRecogniseWorkbookExtensions() {
        assertThat(ExcelDatasetLoader.isWorkbook(new File("a.xls"))).isTrue();
        assertThat(ExcelDatasetLoader.isWorkbook(new File("b.XLSX"))).isTrue();
        assertThat(ExcelDatasetLoader.isWorkbook(new File("c.csv"))).isFalse();
    }

}
