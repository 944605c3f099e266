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
 *    ConvergenceTrace.java
 *
 */
package mice.core;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-iteration statistic of the imputed cells of each column. For numeric
 * columns this is the mean of the imputed values; for nominal columns it is
 * the share of imputed cells whose label changed during the pass. Values
 * settling down across iterations indicate the chain has stabilized.
 */
public class ConvergenceTrace implements Serializable {

    static final long serialVersionUID = 2291834780129338412L;

    private final Map<String, List<Double>> m_series = new LinkedHashMap<>();

    /**
     * Appends the statistic of one iteration for a column.
     *
     * @param column - column name
     * @param value - statistic for this iteration
     */
    public void record(String column, double value) {
        List<Double> series = m_series.get(column);
        if (series == null) {
            series = new ArrayList<>();
            m_series.put(column, series);
        }
        series.add(value);
    }

    /**
     * @return columns with a recorded series, in the order first recorded
     */
    public List<String> columns() {
        return new ArrayList<>(m_series.keySet());
    }

    /**
     * @param column - column name
     * @return one value per iteration, empty if the column was never modelled
     */
    public List<Double> series(String column) {
        List<Double> series = m_series.get(column);
        return series == null ? Collections.<Double>emptyList() : Collections.unmodifiableList(series);
    }

    @Override
    public String toString() {
        return m_series.toString();
    }

}
