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
 *    MissingnessReporter.java
 *
 */
package mice.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the {@link MissingnessTable} of a dataset.
 */
public final class MissingnessReporter {

    private MissingnessReporter() {
    }

    /**
     * Counts missing cells per column. Percentages are taken against the
     * dataset's row count and rounded to two decimals. Entries are sorted by
     * percentage, highest first, keeping column order among ties.
     *
     * @param dataset - dataset to summarise
     * @return missingness table, one entry per column
     */
    public static MissingnessTable report(Dataset dataset) {

        int n = dataset.numRows();
        List<MissingnessTable.Entry> entries = new ArrayList<>(dataset.numColumns());
        for (int j = 0; j < dataset.numColumns(); j++) {
            int missing = dataset.missingCount(j);
            entries.add(new MissingnessTable.Entry(dataset.columnName(j), missing, percentage(missing, n)));
        }

        // List.sort is stable
        entries.sort(Collections.reverseOrder(Comparator.comparingDouble(MissingnessTable.Entry::getMissingPct)));

        return new MissingnessTable(entries, n);
    }

    /**
     * @return count / total * 100 rounded half-even to two decimals, 0 for an empty total
     */
    static double percentage(int count, int total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(count / (double) total * 100.0)
                .setScale(2, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

}
