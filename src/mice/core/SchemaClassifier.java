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
 *    SchemaClassifier.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the columns of a dataset into continuous and categorical ones. The
 * caller names the continuous columns; every other column is categorical.
 */
public final class SchemaClassifier {

    private SchemaClassifier() {
    }

    /**
     * Assigns a role to every column.
     *
     * @param dataset - dataset whose columns are classified
     * @param continuousColumns - names of the columns to treat as continuous
     * @return role assignment in column order
     * @throws DataValidityException if a continuous column name does not exist
     */
    public static ColumnRoles classify(Dataset dataset, Collection<String> continuousColumns) {

        List<String> unknown = new ArrayList<>();
        for (String name : continuousColumns) {
            if (!dataset.hasColumn(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new DataValidityException("Continuous columns not found in dataset", unknown);
        }

        Map<String, ColumnRole> roles = new LinkedHashMap<>();
        for (String name : dataset.columnNames()) {
            roles.put(name, continuousColumns.contains(name) ? ColumnRole.CONTINUOUS : ColumnRole.CATEGORICAL);
        }
        return new ColumnRoles(roles);
    }

}
