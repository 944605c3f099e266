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
 *    InstancesCodec.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

/**
 * Translates a sanitized {@link Dataset} into Weka {@link Instances} and a
 * completed copy back again. Continuous columns become numeric attributes,
 * categorical columns become nominal attributes with one label per distinct
 * observed value, in order of first appearance. Values are told apart with
 * {@code equals}, so {@code 1} and {@code "1"} are two labels; the Weka label
 * text is the value's string form, suffixed where two values print alike.
 * Decoding only replaces missing cells, so every observed cell comes back as
 * the very object it was.
 */
public class InstancesCodec {

    /** Label given to a categorical column that has no observed value */
    public static final String UNOBSERVED_LABEL = "unobserved";

    /** Relation name of the encoded instances */
    public static final String RELATION_NAME = "mice";

    private final Dataset m_dataset;

    /** Distinct observed values per nominal column in label order, null for numeric columns */
    private final List<List<Object>> m_labelValues;

    /** Label index of each distinct value, null for numeric columns */
    private final List<Map<Object, Integer>> m_labelIndex;

    /**
     * @param dataset - sanitized dataset
     * @param roles - role of every column
     * @throws DataValidityException if a continuous column holds a non-numeric cell
     */
    public InstancesCodec(Dataset dataset, ColumnRoles roles) {

        m_dataset = dataset;
        m_labelValues = new ArrayList<>(dataset.numColumns());
        m_labelIndex = new ArrayList<>(dataset.numColumns());

        List<String> nonNumeric = new ArrayList<>();
        for (int j = 0; j < dataset.numColumns(); j++) {
            String name = dataset.columnName(j);
            if (roles.isContinuous(name)) {
                for (Object value : dataset.column(j)) {
                    if (!Dataset.isMissing(value) && !(value instanceof Number)) {
                        nonNumeric.add(name);
                        break;
                    }
                }
                m_labelValues.add(null);
                m_labelIndex.add(null);
            } else {
                Map<Object, Integer> index = indexLabels(dataset.column(j));
                m_labelValues.add(Collections.unmodifiableList(new ArrayList<>(index.keySet())));
                m_labelIndex.add(index);
            }
        }
        if (!nonNumeric.isEmpty()) {
            throw new DataValidityException("Continuous columns hold non-numeric values", nonNumeric);
        }
    }

    private static Map<Object, Integer> indexLabels(List<Object> column) {
        Map<Object, Integer> index = new LinkedHashMap<>();
        for (Object value : column) {
            if (!Dataset.isMissing(value) && !index.containsKey(value)) {
                index.put(value, index.size());
            }
        }
        if (index.isEmpty()) {
            index.put(UNOBSERVED_LABEL, 0);
        }
        return index;
    }

    /**
     * @return Weka label texts for the values, unique within the column
     */
    private static List<String> labelTexts(List<Object> values) {
        List<String> labels = new ArrayList<>(values.size());
        Set<String> used = new HashSet<>();
        for (Object value : values) {
            String label = value.toString();
            for (int n = 2; !used.add(label); n++) {
                label = value + "_" + n;
            }
            labels.add(label);
        }
        return labels;
    }

    /**
     * @return the dataset as Weka instances, missing cells as Weka missing values, no class set
     */
    public Instances encode() {

        ArrayList<Attribute> attributes = new ArrayList<>(m_dataset.numColumns());
        for (int j = 0; j < m_dataset.numColumns(); j++) {
            List<Object> labelValues = m_labelValues.get(j);
            if (labelValues == null) {
                attributes.add(new Attribute(m_dataset.columnName(j)));
            } else {
                attributes.add(new Attribute(m_dataset.columnName(j), labelTexts(labelValues)));
            }
        }

        Instances data = new Instances(RELATION_NAME, attributes, m_dataset.numRows());
        for (int i = 0; i < m_dataset.numRows(); i++) {
            double[] values = new double[m_dataset.numColumns()];
            for (int j = 0; j < m_dataset.numColumns(); j++) {
                Object value = m_dataset.value(i, j);
                if (Dataset.isMissing(value)) {
                    values[j] = Utils.missingValue();
                } else if (m_labelIndex.get(j) == null) {
                    values[j] = ((Number) value).doubleValue();
                } else {
                    values[j] = m_labelIndex.get(j).get(value);
                }
            }
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    /**
     * Builds the completed dataset from imputed instances. Columns without
     * missing cells are taken over unchanged; in the others only the missing
     * cells are filled from the instances.
     *
     * @param completed - instances produced from {@link #encode()} with every missing value imputed
     * @return completed dataset, same column order and names
     * @throws ImputationException if the instances do not line up with the dataset or still hold missing values
     */
    public Dataset decode(Instances completed) {

        if (completed.numInstances() != m_dataset.numRows()
                || completed.numAttributes() != m_dataset.numColumns()) {
            throw new ImputationException("Imputed instances do not match the dataset shape");
        }

        List<List<Object>> columns = new ArrayList<>(m_dataset.numColumns());
        for (int j = 0; j < m_dataset.numColumns(); j++) {
            List<Object> original = m_dataset.column(j);
            if (m_dataset.missingCount(j) == 0) {
                columns.add(original);
                continue;
            }

            List<Object> values = new ArrayList<>(original);
            for (int i = 0; i < values.size(); i++) {
                if (!Dataset.isMissing(values.get(i))) {
                    continue;
                }
                Instance row = completed.instance(i);
                if (row.isMissing(j)) {
                    throw new ImputationException("Cell " + i + " of column '"
                            + m_dataset.columnName(j) + "' was not imputed");
                }
                values.set(i, decodeValue(j, row.value(j)));
            }
            columns.add(values);
        }

        return new Dataset(m_dataset.columnNames(), columns);
    }

    private Object decodeValue(int column, double value) {
        List<Object> labelValues = m_labelValues.get(column);
        if (labelValues == null) {
            return value;
        }
        return labelValues.get((int) value);
    }

}
