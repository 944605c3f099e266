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
 *    ColumnPredictor.java
 *
 */
package mice.predictor;

import java.util.Random;
import mice.core.ColumnRole;
import weka.core.Instances;

/**
 * Fits a model of one column on the rows where it was observed and predicts
 * it for the rows where it was missing. The target column is the class
 * attribute of both instance sets; all other attributes are complete.
 */
public interface ColumnPredictor {

    /**
     * @param training - rows where the target was originally observed, class index set
     * @param targets - rows where the target was originally missing, same header
     * @param random - chain random, the only source of randomness
     * @return one imputed value per target row, in Weka's internal representation
     * (the number itself for numeric targets, the label index for nominal ones)
     * @throws Exception if the underlying classifier fails
     */
    double[] impute(Instances training, Instances targets, Random random) throws Exception;

    /**
     * @return the role of the columns this predictor handles
     */
    ColumnRole getRole();

}
