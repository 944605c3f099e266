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
 *    ColumnComparison.java
 *
 */
package mice.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import mice.core.ColumnRole;
import mice.core.Dataset;

/**
 * Row-aligned before and after values of one imputed column, as handed to a
 * {@link DiagnosticsRenderer}. Index i of {@link #getBefore()} and
 * {@link #getAfter()} refers to the same row.
 */
public final class ColumnComparison {

    private final String m_column;

    private final ColumnRole m_role;

    private final int m_chainIndex;

    private final List<Object> m_before;

    private final List<Object> m_after;

    private final List<Integer> m_missingRows;

    public ColumnComparison(String column, ColumnRole role, int chainIndex, List<Object> before, List<Object> after) {
        if (before.size() != after.size()) {
            throw new IllegalArgumentException("Column '" + column + "' has " + before.size()
                    + " rows before imputation and " + after.size() + " after");
        }
        m_column = column;
        m_role = role;
        m_chainIndex = chainIndex;
        m_before = Collections.unmodifiableList(new ArrayList<>(before));
        m_after = Collections.unmodifiableList(new ArrayList<>(after));

        List<Integer> missingRows = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            if (Dataset.isMissing(before.get(i))) {
                missingRows.add(i);
            }
        }
        m_missingRows = Collections.unmodifiableList(missingRows);
    }

    public String getColumn() {
        return m_column;
    }

    public ColumnRole getRole() {
        return m_role;
    }

    public int getChainIndex() {
        return m_chainIndex;
    }

    /**
     * @return the sanitized column, missing cells included
     */
    public List<Object> getBefore() {
        return m_before;
    }

    /**
     * @return the completed column of the chain
     */
    public List<Object> getAfter() {
        return m_after;
    }

    /**
     * @return rows that were missing before imputation, ascending
     */
    public List<Integer> getMissingRows() {
        return m_missingRows;
    }

    /**
     * @return observed values before imputation
     */
    public List<Object> observedBefore() {
        List<Object> values = new ArrayList<>();
        for (Object value : m_before) {
            if (!Dataset.isMissing(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * @return imputed values, one per entry of {@link #getMissingRows()}
     */
    public List<Object> imputedAfter() {
        List<Object> values = new ArrayList<>(m_missingRows.size());
        for (Integer row : m_missingRows) {
            values.add(m_after.get(row));
        }
        return values;
    }

}
