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
 *    Predictors.java
 *
 */
package mice.predictor;

import mice.core.ColumnRole;
import weka.classifiers.Classifier;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;

/**
 * Factory for {@link ColumnPredictor}s.
 */
public final class Predictors {

    /** Trees in the default forest */
    public static final int DEFAULT_NUM_TREES = 50;

    private Predictors() {
    }

    /**
     * @return a random forest, the default model for both roles
     */
    public static Classifier defaultClassifier() {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(DEFAULT_NUM_TREES);
        return forest;
    }

    public static ColumnPredictor forRole(ColumnRole role, Classifier template, int meanMatchCandidates) {
        switch (role) {
            case CONTINUOUS:
                return new RegressionPredictor(template, meanMatchCandidates);
            case CATEGORICAL:
                return new ClassificationPredictor(template, meanMatchCandidates);
            default:
                throw new IllegalArgumentException("Unknown role " + role);
        }
    }

    /**
     * @param target - attribute to impute, numeric or nominal
     * @return the role matching the attribute type
     */
    public static ColumnRole roleOf(Attribute target) {
        if (target.isNumeric()) {
            return ColumnRole.CONTINUOUS;
        }
        if (target.isNominal()) {
            return ColumnRole.CATEGORICAL;
        }
        throw new IllegalArgumentException("Attribute '" + target.name() + "' is neither numeric nor nominal");
    }

}
