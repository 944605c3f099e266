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
 *    DataSanitizerTest.java
 *
 */
package mice.core;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DataSanitizerTest {

    private final Dataset raw = Dataset.builder()
            .column("score", 1, "2.5", " 3 ", Double.POSITIVE_INFINITY, "abc", "", "1e2", "Infinity", "4d", true)
            .column("city", "Oslo", "  ", Double.NEGATIVE_INFINITY, "", "Rome", 7, Double.NaN, "\t", "Oslo", "Rome")
            .build();

    private final ColumnRoles roles = SchemaClassifier.classify(raw, Collections.singleton("score"));

    @Test
    void shouldCoerceContinuousColumnsToDoubles() {
        Dataset clean = DataSanitizer.sanitize(raw, roles);

        assertThat(clean.column("score")).containsExactly(
                1.0, 2.5, 3.0, Dataset.MISSING, Dataset.MISSING, Dataset.MISSING,
                100.0, Dataset.MISSING, Dataset.MISSING, 1.0);
    }

    @Test
    void shouldTurnBlankAndInfiniteCategoricalCellsIntoMissing() {
        Dataset clean = DataSanitizer.sanitize(raw, roles);

        assertThat(clean.column("city")).containsExactly(
                "Oslo", Dataset.MISSING, Dataset.MISSING, Dataset.MISSING, "Rome", 7,
                Dataset.MISSING, Dataset.MISSING, "Oslo", "Rome");
    }

    @Test
    void shouldNotModifyRawDataset() {
        DataSanitizer.sanitize(raw, roles);

        assertThat(raw.value(1, 0)).isEqualTo("2.5");
        assertThat(raw.value(3, 0)).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void shouldBeIdempotent() {
        Dataset once = DataSanitizer.sanitize(raw, roles);
        Dataset twice = DataSanitizer.sanitize(once, roles);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void shouldKeepShape() {
        Dataset clean = DataSanitizer.sanitize(raw, roles);

        assertThat(clean.columnNames()).isEqualTo(raw.columnNames());
        assertThat(clean.numRows()).isEqualTo(raw.numRows());
    }

    @Test
    void shouldTreatNonBreakingSpacesAsBlank() {
        assertThat(DataSanitizer.sanitizeCell("\u00a0", ColumnRole.CATEGORICAL)).isSameAs(Dataset.MISSING);
        assertThat(DataSanitizer.sanitizeCell(" \u00a0\u2007\t", ColumnRole.CATEGORICAL)).isSameAs(Dataset.MISSING);
        assertThat(DataSanitizer.sanitizeCell("\u00a0", ColumnRole.CONTINUOUS)).isSameAs(Dataset.MISSING);
        assertThat(DataSanitizer.sanitizeCell("\u00a0x", ColumnRole.CATEGORICAL)).isEqualTo("\u00a0x");
    }

    @Test
    void shouldSanitizeSingleCells() {
        assertThat(DataSanitizer.sanitizeCell(Float.NaN, ColumnRole.CATEGORICAL)).isSameAs(Dataset.MISSING);
        assertThat(DataSanitizer.sanitizeCell(" x ", ColumnRole.CATEGORICAL)).isEqualTo(" x ");
        assertThat(DataSanitizer.sanitizeCell("-0.5", ColumnRole.CONTINUOUS)).isEqualTo(-0.5);
        assertThat(DataSanitizer.sanitizeCell(Arrays.asList(1, 2), ColumnRole.CONTINUOUS)).isSameAs(Dataset.MISSING);
    }

}
