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
 *    DataValidityException.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a dataset cannot be imputed at all: it is empty, its column
 * names repeat, or a continuous column cannot be represented numerically.
 * Carries the names of the offending columns, if any.
 */
public class DataValidityException extends RuntimeException {

    static final long serialVersionUID = 4213820993741205512L;

    private final List<String> m_columns;

    public DataValidityException(String message, List<String> columns) {
        super(columns.isEmpty() ? message : message + ": " + String.join(", ", columns));
        m_columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * @return names of the columns that caused the failure, possibly empty
     */
    public List<String> getColumns() {
        return m_columns;
    }

}
