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
 *    ColumnRoles.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable role assignment for every column of a dataset, in column order.
 */
public final class ColumnRoles {

    private final Map<String, ColumnRole> m_roles;

    ColumnRoles(Map<String, ColumnRole> roles) {
        m_roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    /**
     * @param column - column name
     * @return role of the column
     * @throws IllegalArgumentException if the column has no role
     */
    public ColumnRole roleOf(String column) {
        ColumnRole role = m_roles.get(column);
        if (role == null) {
            throw new IllegalArgumentException("No role assigned to column '" + column + "'");
        }
        return role;
    }

    public boolean isContinuous(String column) {
        return roleOf(column) == ColumnRole.CONTINUOUS;
    }

    public List<String> continuousColumns() {
        return columnsWith(ColumnRole.CONTINUOUS);
    }

    public List<String> categoricalColumns() {
        return columnsWith(ColumnRole.CATEGORICAL);
    }

    public Map<String, ColumnRole> asMap() {
        return m_roles;
    }

    private List<String> columnsWith(ColumnRole role) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, ColumnRole> entry : m_roles.entrySet()) {
            if (entry.getValue() == role) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnRoles && m_roles.equals(((ColumnRoles) o).m_roles);
    }

    @Override
    public int hashCode() {
        return m_roles.hashCode();
    }

    @Override
    public String toString() {
        return m_roles.toString();
    }

}
