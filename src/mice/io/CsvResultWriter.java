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
 *    CsvResultWriter.java
 *
 */
package mice.io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.Dataset;
import mice.core.MissingnessTable;
import mice.session.ResultWriter;
import mice.session.SessionResult;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.Utils;
import weka.core.converters.CSVSaver;

/**
 * Writes the tables of a session into a directory as CSV files:
 * <ul>
 * <li>Missingness.csv - variable, missing_n, missing_pct(%)</li>
 * <li>Data_Original.csv - the sanitized original</li>
 * <li>Data_Imputed.csv for a single chain, Data_Imputed_1.csv ... for several</li>
 * </ul>
 * The imputed files are only written when something was imputed.
 */
public class CsvResultWriter implements ResultWriter {

    public static final String MISSINGNESS_FILE = "Missingness.csv";

    public static final String ORIGINAL_FILE = "Data_Original.csv";

    public static final String IMPUTED_PREFIX = "Data_Imputed";

    private static final Logger LOGGER = Logger.getLogger(CsvResultWriter.class.getName());

    private final File m_directory;

    public CsvResultWriter(File directory) {
        m_directory = directory;
    }

    @Override
    public void write(SessionResult result) throws IOException {

        if (!m_directory.isDirectory() && !m_directory.mkdirs()) {
            throw new IOException("Cannot create output directory " + m_directory);
        }

        save(missingnessInstances(result.getMissingnessTable()), MISSINGNESS_FILE);
        save(toInstances(result.getSanitizedOriginal(), "Data_Original"), ORIGINAL_FILE);

        List<Dataset> completed = result.getCompletedDatasets();
        for (int c = 0; c < completed.size(); c++) {
            String name = completed.size() == 1 ? IMPUTED_PREFIX : IMPUTED_PREFIX + "_" + (c + 1);
            save(toInstances(completed.get(c), name), name + ".csv");
        }
    }

    private void save(Instances data, String fileName) throws IOException {
        File file = new File(m_directory, fileName);
        CSVSaver saver = new CSVSaver();
        saver.setInstances(data);
        saver.setFile(file);
        saver.writeBatch();
        LOGGER.log(Level.INFO, "Wrote {0}", file);
    }

    /**
     * @return the table as instances with one string and two numeric attributes
     */
    static Instances missingnessInstances(MissingnessTable table) {

        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute(MissingnessTable.VARIABLE, (List<String>) null));
        attributes.add(new Attribute(MissingnessTable.MISSING_COUNT));
        attributes.add(new Attribute(MissingnessTable.MISSING_PCT));

        Instances data = new Instances("Missingness", attributes, table.entries().size());
        for (MissingnessTable.Entry entry : table.entries()) {
            double[] values = new double[3];
            values[0] = data.attribute(0).addStringValue(entry.getVariable());
            values[1] = entry.getMissingCount();
            values[2] = entry.getMissingPct();
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    /**
     * Converts a dataset for saving. A column whose cells are all numbers
     * becomes a numeric attribute, any other column a string attribute.
     *
     * @param dataset - dataset to convert
     * @param relation - relation name
     * @return instances in column order
     */
    static Instances toInstances(Dataset dataset, String relation) {

        boolean[] numeric = new boolean[dataset.numColumns()];
        ArrayList<Attribute> attributes = new ArrayList<>(dataset.numColumns());
        for (int j = 0; j < dataset.numColumns(); j++) {
            numeric[j] = true;
            for (Object value : dataset.column(j)) {
                if (!Dataset.isMissing(value) && !(value instanceof Number)) {
                    numeric[j] = false;
                    break;
                }
            }
            attributes.add(numeric[j]
                    ? new Attribute(dataset.columnName(j))
                    : new Attribute(dataset.columnName(j), (List<String>) null));
        }

        Instances data = new Instances(relation, attributes, dataset.numRows());
        for (int i = 0; i < dataset.numRows(); i++) {
            double[] values = new double[dataset.numColumns()];
            for (int j = 0; j < dataset.numColumns(); j++) {
                Object value = dataset.value(i, j);
                if (Dataset.isMissing(value)) {
                    values[j] = Utils.missingValue();
                } else if (numeric[j]) {
                    values[j] = ((Number) value).doubleValue();
                } else {
                    values[j] = data.attribute(j).addStringValue(value.toString());
                }
            }
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

}
