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
 *    MissingnessTable.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only per-column summary of missing cells, sorted by missing
 * percentage, highest first.
 */
public final class MissingnessTable {

    /** Header names used when the table is written out */
    public static final String VARIABLE = "variable";
    public static final String MISSING_COUNT = "missing_n";
    public static final String MISSING_PCT = "missing_pct(%)";

    private final List<Entry> m_entries;

    private final int m_numRows;

    MissingnessTable(List<Entry> entries, int numRows) {
        m_entries = Collections.unmodifiableList(new ArrayList<>(entries));
        m_numRows = numRows;
    }

    public List<Entry> entries() {
        return m_entries;
    }

    /**
     * @return row count the percentages were computed against
     */
    public int numRows() {
        return m_numRows;
    }

    /**
     * @param variable - column name
     * @return entry for the column, or null if there is none
     */
    public Entry entry(String variable) {
        for (Entry e : m_entries) {
            if (e.getVariable().equals(variable)) {
                return e;
            }
        }
        return null;
    }

    public int totalMissing() {
        int total = 0;
        for (Entry e : m_entries) {
            total += e.getMissingCount();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MissingnessTable)) {
            return false;
        }
        MissingnessTable other = (MissingnessTable) o;
        return m_numRows == other.m_numRows && m_entries.equals(other.m_entries);
    }

    @Override
    public int hashCode() {
        return 31 * m_numRows + m_entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(VARIABLE).append('\t').append(MISSING_COUNT).append('\t').append(MISSING_PCT).append('\n');
        for (Entry e : m_entries) {
            sb.append(e.getVariable()).append('\t')
                    .append(e.getMissingCount()).append('\t')
                    .append(e.getMissingPct()).append('\n');
        }
        return sb.toString();
    }

    /**
     * One row of the table.
     */
    public static final class Entry {

        private final String m_variable;

        private final int m_missingCount;

        private final double m_missingPct;

        public Entry(String variable, int missingCount, double missingPct) {
            m_variable = variable;
            m_missingCount = missingCount;
            m_missingPct = missingPct;
        }

        public String getVariable() {
            return m_variable;
        }

        public int getMissingCount() {
            return m_missingCount;
        }

        public double getMissingPct() {
            return m_missingPct;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Entry)) {
                return false;
            }
            Entry other = (Entry) o;
            return m_variable.equals(other.m_variable)
                    && m_missingCount == other.m_missingCount
                    && Double.compare(m_missingPct, other.m_missingPct) == 0;
        }

        @Override
        public int hashCode() {
            return (m_variable.hashCode() * 31 + m_missingCount) * 31 + Double.hashCode(m_missingPct);
        }

        @Override
        public String toString() {
            return "{" + m_variable + ", " + m_missingCount + ", " + m_missingPct + "}";
        }

    }

}
