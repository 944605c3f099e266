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
 *    IterativeImputation.java
 *
 */
package mice.filters.unsupervised.attribute;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Randomizable;
import weka.filters.SimpleBatchFilter;
import weka.filters.UnsupervisedFilter;

/**
 * <!-- globalinfo-start -->
 * Parent class for imputation techniques that start from a complete working
 * copy of the dataset and refine the imputed cells column by column.
 * <p/>
 * <!-- globalinfo-end -->
 *
 * @author mice
 */
public abstract class IterativeImputation extends SimpleBatchFilter implements UnsupervisedFilter, Randomizable {

    static final long serialVersionUID = 6098832117240936655L;

    /** Dataset to be imputed */
    protected Instances m_dataset;

    /** m_missingMask[attribute][row] is true where the input value is missing */
    protected boolean[][] m_missingMask;

    /** Attributes with at least one missing value, in attribute order */
    protected List<Integer> m_attributesWithMissing;

    /** Seed for the initial draws and every model fitted */
    protected int m_Seed = 42;

    /**
     * Records which cells of m_dataset are missing. The mask never changes
     * afterwards, so models are always trained on originally observed rows.
     */
    protected void recordMissingMask() {

        m_missingMask = new boolean[m_dataset.numAttributes()][m_dataset.numInstances()];
        m_attributesWithMissing = new ArrayList<>();

        for (int j = 0; j < m_dataset.numAttributes(); j++) {
            boolean any = false;
            for (int i = 0; i < m_dataset.numInstances(); i++) {
                if (m_dataset.instance(i).isMissing(j)) {
                    m_missingMask[j][i] = true;
                    any = true;
                }
            }
            if (any) {
                m_attributesWithMissing.add(j);
            }
        } //end attr loop

    }

    /**
     * Copies m_dataset and fills each missing cell with a value drawn
     * uniformly, with replacement, from the observed values of its attribute.
     * An attribute without observed values is filled with 0 if numeric and
     * its first label if nominal.
     *
     * @param random - source of the draws
     * @return complete working copy
     * @throws Exception if a nominal attribute without observed values has no labels
     */
    protected Instances initialDraws(Random random) throws Exception {

        Instances working = new Instances(m_dataset);

        for (Integer j : m_attributesWithMissing) {

            double[] observed = observedValues(j);
            if (observed.length == 0 && working.attribute(j).isNominal()
                    && working.attribute(j).numValues() == 0) {
                throw new Exception("Attribute " + working.attribute(j).name()
                        + " has no observed values and no labels");
            }

            for (int i = 0; i < working.numInstances(); i++) {
                if (m_missingMask[j][i]) {
                    // 0 is the number zero or the first label
                    double value = observed.length == 0 ? 0 : observed[random.nextInt(observed.length)];
                    working.instance(i).setValue(j, value);
                }
            }

        } //end missing attr loop

        return working;
    }

    /**
     * @param attIndex - attribute index
     * @return observed values of the attribute in m_dataset, in row order
     */
    protected double[] observedValues(int attIndex) {
        double[] values = new double[m_dataset.numInstances()];
        int count = 0;
        for (int i = 0; i < m_dataset.numInstances(); i++) {
            if (!m_missingMask[attIndex][i]) {
                values[count++] = m_dataset.instance(i).value(attIndex);
            }
        }
        double[] result = new double[count];
        System.arraycopy(values, 0, result, 0, count);
        return result;
    }

    /**
     * Subset of the working copy where the attribute was originally observed,
     * with the attribute as class.
     *
     * @param working - current complete working copy
     * @param attIndex - target attribute
     * @return training rows
     */
    protected Instances observedRows(Instances working, int attIndex) {
        return rowsWhere(working, attIndex, false);
    }

    /**
     * Subset of the working copy where the attribute was originally missing,
     * with the attribute as class.
     *
     * @param working - current complete working copy
     * @param attIndex - target attribute
     * @return rows to impute, in row order
     */
    protected Instances missingRows(Instances working, int attIndex) {
        return rowsWhere(working, attIndex, true);
    }

    private Instances rowsWhere(Instances working, int attIndex, boolean missing) {
        Instances subset = new Instances(working, working.numInstances());
        for (int i = 0; i < working.numInstances(); i++) {
            if (m_missingMask[attIndex][i] == missing) {
                Instance row = working.instance(i);
                subset.add(row);
            }
        }
        subset.setClassIndex(attIndex);
        return subset;
    }

    /**
     * @param attIndex - attribute index
     * @return indices of the rows where the attribute was originally missing
     */
    protected int[] missingRowIndices(int attIndex) {
        int count = 0;
        for (boolean missing : m_missingMask[attIndex]) {
            if (missing) {
                count++;
            }
        }
        int[] rows = new int[count];
        int k = 0;
        for (int i = 0; i < m_missingMask[attIndex].length; i++) {
            if (m_missingMask[attIndex][i]) {
                rows[k++] = i;
            }
        }
        return rows;
    }

    @Override
    public void setSeed(int seed) {
        m_Seed = seed;
    }

    @Override
    public int getSeed() {
        return m_Seed;
    }

    /**
     * Returns the tip text for this property.
     *
     * @return tip text for this property suitable for displaying in the
     * explorer/experimenter gui
     */
    public String seedTipText() {
        return "Seed for the initial draws and for every model fitted during imputation.";
    }

    /**
     * Determines the output format based on the input format and returns this.
     *
     * @param inputFormat the input format to base the output format on
     * @return the output format
     */
    @Override
    protected Instances determineOutputFormat(Instances inputFormat) {
        return new Instances(inputFormat, 0);
    }

}
