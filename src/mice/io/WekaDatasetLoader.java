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
 *    WekaDatasetLoader.java
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
import mice.session.DatasetLoader;
import weka.core.Attribute;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.converters.ConverterUtils.DataSource;

/**
 * Loads a raw dataset from any file Weka has a converter for (CSV, ARFF,
 * ...). Numeric attributes give {@link Double} cells, all other attributes
 * give {@link String} cells, missing values give {@link Dataset#MISSING}.
 * Excel workbooks are handed to {@link ExcelDatasetLoader}.
 */
public class WekaDatasetLoader implements DatasetLoader {

    private static final Logger LOGGER = Logger.getLogger(WekaDatasetLoader.class.getName());

    private final File m_file;

    public WekaDatasetLoader(File file) {
        m_file = file;
    }

    @Override
    public Dataset load() throws IOException {

        if (!m_file.isFile()) {
            throw new IOException("No such file: " + m_file);
        }
        if (ExcelDatasetLoader.isWorkbook(m_file)) {
            return new ExcelDatasetLoader(m_file).load();
        }

        Instances data;
        try {
            data = new DataSource(m_file.getPath()).getDataSet();
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to read " + m_file, e);
        }
        if (data == null) {
            throw new IOException("No converter could read " + m_file);
        }

        LOGGER.log(Level.INFO, "Loaded {0}: {1} rows, {2} columns",
                new Object[]{m_file, data.numInstances(), data.numAttributes()});
        return toDataset(data);
    }

    /**
     * Converts Weka instances into a raw dataset, attribute order preserved.
     *
     * @param data - instances to convert
     * @return raw dataset
     */
    public static Dataset toDataset(Instances data) {

        List<String> names = new ArrayList<>(data.numAttributes());
        List<List<Object>> columns = new ArrayList<>(data.numAttributes());
        for (int j = 0; j < data.numAttributes(); j++) {
            Attribute attribute = data.attribute(j);
            names.add(attribute.name());

            List<Object> values = new ArrayList<>(data.numInstances());
            for (int i = 0; i < data.numInstances(); i++) {
                Instance row = data.instance(i);
                if (row.isMissing(j)) {
                    values.add(Dataset.MISSING);
                } else if (attribute.isNumeric()) {
                    values.add(row.value(j));
                } else {
                    values.add(row.stringValue(j));
                }
            }
            columns.add(values);
        }
        return new Dataset(names, columns);
    }

}
