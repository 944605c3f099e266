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
 *    Dataset.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered, immutable table of named columns. Every column has the same
 * number of rows and every cell is either a value or {@link #MISSING}. A
 * {@code null} cell handed to the constructor is stored as {@link #MISSING}.
 *
 * @author mice
 */
public final class Dataset {

    /** Marker for a missing cell */
    public static final Missing MISSING = Missing.VALUE;

    /** Column names in their original order */
    private final List<String> m_names;

    /** Column values, parallel to m_names */
    private final List<List<Object>> m_columns;

    /** Column name to position */
    private final Map<String, Integer> m_index;

    /** Number of rows */
    private final int m_numRows;

    /**
     * Creates a dataset from parallel lists of names and columns.
     *
     * @param names - column names, must be unique
     * @param columns - column values, all of the same length
     * @throws DataValidityException if names repeat or column lengths differ
     */
    public Dataset(List<String> names, List<? extends List<?>> columns) {

        if (names.size() != columns.size()) {
            throw new DataValidityException("Got " + names.size() + " column names for "
                    + columns.size() + " columns", Collections.<String>emptyList());
        }

        Set<String> duplicates = new LinkedHashSet<>();
        m_index = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (m_index.put(names.get(i), i) != null) {
                duplicates.add(names.get(i));
            }
        }
        if (!duplicates.isEmpty()) {
            throw new DataValidityException("Column names are not unique", new ArrayList<>(duplicates));
        }

        int numRows = columns.isEmpty() ? 0 : columns.get(0).size();
        List<List<Object>> copied = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            List<?> column = columns.get(i);
            if (column.size() != numRows) {
                throw new DataValidityException("Column '" + names.get(i) + "' has " + column.size()
                        + " rows, expected " + numRows, Collections.singletonList(names.get(i)));
            }
            List<Object> values = new ArrayList<>(column.size());
            for (Object value : column) {
                values.add(value == null ? MISSING : value);
            }
            copied.add(Collections.unmodifiableList(values));
        }

        m_names = Collections.unmodifiableList(new ArrayList<>(names));
        m_columns = Collections.unmodifiableList(copied);
        m_numRows = numRows;
    }

    /**
     * @return a builder adding columns left to right
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tells whether a cell value is the missing marker.
     *
     * @param value - cell value
     * @return true if missing
     */
    public static boolean isMissing(Object value) {
        return value == null || value == MISSING;
    }

    public int numColumns() {
        return m_names.size();
    }

    public int numRows() {
        return m_numRows;
    }

    /**
     * @return true if there are no columns or no rows
     */
    public boolean isEmpty() {
        return m_names.isEmpty() || m_numRows == 0;
    }

    public List<String> columnNames() {
        return m_names;
    }

    public String columnName(int index) {
        return m_names.get(index);
    }

    /**
     * @param name - column name
     * @return position of the column, or -1 if there is no such column
     */
    public int columnIndex(String name) {
        Integer index = m_index.get(name);
        return index == null ? -1 : index;
    }

    public boolean hasColumn(String name) {
        return m_index.containsKey(name);
    }

    public List<Object> column(int index) {
        return m_columns.get(index);
    }

    public List<Object> column(String name) {
        int index = columnIndex(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column named '" + name + "'");
        }
        return m_columns.get(index);
    }

    public Object value(int row, int column) {
        return m_columns.get(column).get(row);
    }

    public boolean isMissing(int row, int column) {
        return isMissing(value(row, column));
    }

    /**
     * @param column - column position
     * @return number of missing cells in the column
     */
    public int missingCount(int column) {
        int count = 0;
        for (Object value : m_columns.get(column)) {
            if (isMissing(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return true if any cell in the dataset is missing
     */
    public boolean hasMissingValue() {
        for (int j = 0; j < numColumns(); j++) {
            if (missingCount(j) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return names of the columns holding at least one missing cell, in column order
     */
    public List<String> columnsWithMissing() {
        List<String> result = new ArrayList<>();
        for (int j = 0; j < numColumns(); j++) {
            if (missingCount(j) > 0) {
                result.add(m_names.get(j));
            }
        }
        return result;
    }

    /**
     * Returns a copy of this dataset with one column's values replaced.
     *
     * @param index - column position
     * @param values - new values, same row count
     * @return new dataset
     */
    public Dataset withColumn(int index, List<?> values) {
        List<List<?>> columns = new ArrayList<List<?>>(m_columns);
        columns.set(index, values);
        return new Dataset(m_names, columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        Dataset other = (Dataset) o;
        return m_names.equals(other.m_names) && m_columns.equals(other.m_columns);
    }

    @Override
    public int hashCode() {
        return 31 * m_names.hashCode() + m_columns.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", m_names)).append('\n');
        for (int i = 0; i < m_numRows; i++) {
            for (int j = 0; j < m_columns.size(); j++) {
                if (j != 0) {
                    sb.append(',');
                }
                sb.append(value(i, j));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Collects columns in order and builds a {@link Dataset}.
     */
    public static final class Builder {

        private final List<String> m_names = new ArrayList<>();

        private final List<List<Object>> m_columns = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, Object... values) {
            return column(name, Arrays.asList(values));
        }

        public Builder column(String name, List<?> values) {
            m_names.add(name);
            m_columns.add(new ArrayList<Object>(values));
            return this;
        }

        public Dataset build() {
            return new Dataset(m_names, m_columns);
        }

    }

}
