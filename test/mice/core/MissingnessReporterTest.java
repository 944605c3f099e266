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
 *    MissingnessReporterTest.java
 *
 */
package mice.core;

import java.util.Collections;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MissingnessReporterTest {

    @Test
    void shouldReportCountsAndPercentagesSortedDescending() {
        Dataset dataset = TestDatasets.ageAndGrade();

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.entries()).containsExactly(
                new MissingnessTable.Entry("age", 2, 20.0),
                new MissingnessTable.Entry("grade", 1, 10.0));
        assertThat(table.numRows()).isEqualTo(10);
    }

    @Test
    void shouldKeepColumnOrderAmongTies() {
        Dataset dataset = Dataset.builder()
                .column("a", 1, 2, 3)
                .column("b", Dataset.MISSING, 2, 3)
                .column("c", 1, 2, 3)
                .column("d", 1, Dataset.MISSING, 3)
                .build();

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.entries()).extracting(MissingnessTable.Entry::getVariable)
                .containsExactly("b", "d", "a", "c");
    }

    @Test
    void shouldRoundToTwoDecimals() {
        Dataset dataset = Dataset.builder()
                .column("x", Dataset.MISSING, 1, 2)
                .column("y", Dataset.MISSING, Dataset.MISSING, 2)
                .build();

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.entry("x").getMissingPct()).isEqualTo(33.33);
        assertThat(table.entry("y").getMissingPct()).isEqualTo(66.67);
    }

    @Test
    void shouldSumToTotalMissingCells() {
        Dataset dataset = TestDatasets.people();

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.totalMissing()).isEqualTo(TestDatasets.countMissing(dataset));
        for (MissingnessTable.Entry entry : table.entries()) {
            double expected = MissingnessReporter.percentage(entry.getMissingCount(), dataset.numRows());
            assertThat(entry.getMissingPct()).isEqualTo(expected);
        }
    }

    @Test
    void shouldReportZerosWhenNothingIsMissing() {
        Dataset dataset = Dataset.builder().column("a", 1, 2).column("b", "x", "y").build();

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.entries()).hasSize(2);
        assertThat(table.entries()).allSatisfy(e -> assertThat(e.getMissingPct()).isZero());
        assertThat(table.totalMissing()).isZero();
    }

    @Test
    void shouldHandleDatasetWithoutRows() {
        Dataset dataset = new Dataset(Collections.singletonList("a"),
                Collections.singletonList(Collections.emptyList()));

        MissingnessTable table = MissingnessReporter.report(dataset);

        assertThat(table.entry("a").getMissingPct()).isZero();
    }

}
