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
 *    DataSanitizer.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a raw dataset into a well-typed working copy. Per cell, in order:
 * <ol>
 * <li>infinite and NaN numbers become missing,</li>
 * <li>blank strings, including ones made of non-breaking spaces, become missing,</li>
 * <li>in continuous columns anything that does not parse as a finite number
 * becomes missing and the rest is stored as a {@link Double}.</li>
 * </ol>
 * Unparseable cells never fail the run. The raw dataset is not modified.
 */
public final class DataSanitizer {

    private static final Logger LOGGER = Logger.getLogger(DataSanitizer.class.getName());

    private DataSanitizer() {
    }

    /**
     * @param raw - dataset as loaded
     * @param roles - role of every column of raw
     * @return sanitized dataset of the same shape
     */
    public static Dataset sanitize(Dataset raw, ColumnRoles roles) {

        List<List<Object>> columns = new ArrayList<>(raw.numColumns());
        for (int j = 0; j < raw.numColumns(); j++) {
            String name = raw.columnName(j);
            ColumnRole role = roles.roleOf(name);

            int coerced = 0;
            List<Object> values = new ArrayList<>(raw.numRows());
            for (Object value : raw.column(j)) {
                Object clean = sanitizeCell(value, role);
                if (clean == Dataset.MISSING && !Dataset.isMissing(value)) {
                    coerced++;
                }
                values.add(clean);
            }
            if (coerced > 0) {
                LOGGER.log(Level.FINE, "Column {0}: {1} cell(s) set to missing", new Object[]{name, coerced});
            }
            columns.add(values);
        }

        return new Dataset(raw.columnNames(), columns);
    }

    /**
     * Applies the sanitizing rules to a single cell.
     *
     * @param value - raw cell
     * @param role - role of the cell's column
     * @return clean value or {@link Dataset#MISSING}
     */
    public static Object sanitizeCell(Object value, ColumnRole role) {

        if (Dataset.isMissing(value)) {
            return Dataset.MISSING;
        }
        if (isNonFinite(value)) {
            return Dataset.MISSING;
        }
        if (value instanceof CharSequence && isBlank((CharSequence) value)) {
            return Dataset.MISSING;
        }

        if (role == ColumnRole.CONTINUOUS) {
            Double number = toNumber(value);
            return number == null ? Dataset.MISSING : number;
        }
        return value;
    }

    /**
     * @return true if every character is whitespace or a Unicode space, such as a non-breaking space
     */
    static boolean isBlank(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNonFinite(Object value) {
        if (value instanceof Double) {
            return !Double.isFinite((Double) value);
        }
        if (value instanceof Float) {
            return !Float.isFinite((Float) value);
        }
        return false;
    }

    /**
     * @return the value as a finite double, or null if it is not one
     */
    static Double toNumber(Object value) {

        double parsed;
        if (value instanceof Number) {
            parsed = ((Number) value).doubleValue();
        } else if (value instanceof Boolean) {
            parsed = (Boolean) value ? 1.0 : 0.0;
        } else {
            String text = value.toString().trim();
            // parseDouble also takes java literal suffixes such as 1d, Infinity and NaN
            if (text.isEmpty() || Character.isLetter(text.charAt(text.length() - 1))) {
                return null;
            }
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

}
