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
 *    RegressionPredictorTest.java
 *
 */
package mice.predictor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import mice.core.ColumnRole;
import org.junit.jupiter.api.Test;
import weka.classifiers.trees.REPTree;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.Utils;

import static org.assertj.core.api.Assertions.*;

class RegressionPredictorTest {

    private static Instances linear(int rows) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute("x"));
        attributes.add(new Attribute("y"));
        Instances data = new Instances("linear", attributes, rows);
        for (int i = 0; i < rows; i++) {
            data.add(new DenseInstance(1.0, new double[]{i, 3.0 * i + (i % 4)}));
        }
        data.setClassIndex(1);
        return data;
    }

    private static Instances targets(double... xs) {
        Instances targets = new Instances(linear(0), xs.length);
        for (double x : xs) {
            targets.add(new DenseInstance(1.0, new double[]{x, Utils.missingValue()}));
        }
        return targets;
    }

    @Test
    void shouldReturnObservedValuesWhenMatchingMeans() throws Exception {
        Instances training = linear(30);
        Set<Double> observed = new HashSet<>();
        for (int i = 0; i < training.numInstances(); i++) {
            observed.add(training.instance(i).classValue());
        }

        double[] imputed = new RegressionPredictor(Predictors.defaultClassifier(), 5)
                .impute(training, targets(2.5, 10.5, 27.5), new Random(1));

        assertThat(imputed).hasSize(3);
        for (double value : imputed) {
            assertThat(observed).contains(value);
        }
    }

    @Test
    void shouldPickDonorsNearThePrediction() throws Exception {
        double[] imputed = new RegressionPredictor(new REPTree(), 3)
                .impute(linear(40), targets(5, 35), new Random(3));

        assertThat(imputed[0]).isLessThan(imputed[1]);
    }

    @Test
    void shouldReturnRawPredictionsWithoutCandidates() throws Exception {
        double[] imputed = new RegressionPredictor(Predictors.defaultClassifier(), 0)
                .impute(linear(30), targets(4.5), new Random(7));

        assertThat(imputed[0]).isBetween(0.0, 90.0);
    }

    @Test
    void shouldBeReproducibleForSameRandomState() throws Exception {
        RegressionPredictor predictor = new RegressionPredictor(Predictors.defaultClassifier(), 5);

        double[] first = predictor.impute(linear(30), targets(1, 12, 20), new Random(11));
        double[] second = predictor.impute(linear(30), targets(1, 12, 20), new Random(11));

        assertThat(second).containsExactly(first);
    }

    /** Donor order of a full sort of all rows by distance, ties by row. */
    private static int[] closestByFullSort(final double[] predictions, final double target, int count) {
        Integer[] rows = new Integer[predictions.length];
        for (int k = 0; k < rows.length; k++) {
            rows[k] = k;
        }
        Arrays.sort(rows, Comparator.comparingDouble(k -> Math.abs(predictions[k] - target)));
        int[] result = new int[count];
        for (int k = 0; k < count; k++) {
            result[k] = rows[k];
        }
        return result;
    }

    @Test
    void shouldChooseSameDonorsAsFullSort() {
        double[] predictions = {3.0, 1.0, 4.0, 1.0, 5.0, 9.0, 2.0, 6.0, 5.0, 3.0, 5.0, 8.0, 9.0, 7.0, 9.0, 3.0};
        int[] order = RegressionPredictor.sortByPrediction(predictions);
        double[] sorted = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            sorted[k] = predictions[order[k]];
        }

        for (double target : new double[]{-1.0, 0.5, 1.0, 2.5, 3.0, 4.5, 5.0, 6.5, 9.0, 12.0, Double.NaN}) {
            for (int count = 1; count <= predictions.length; count++) {
                assertThat(RegressionPredictor.nearestDonors(sorted, order, target, count))
                        .as("target %s, %d donors", target, count)
                        .containsExactly(closestByFullSort(predictions, target, count));
            }
        }
    }

    @Test
    void shouldOrderTrainingRowsByPrediction() {
        int[] order = RegressionPredictor.sortByPrediction(new double[]{2.0, 1.0, 2.0, 0.5});

        assertThat(order).containsExactly(3, 1, 0, 2);
    }

    @Test
    void shouldRejectNegativeCandidates() {
        assertThatThrownBy(() -> new RegressionPredictor(new REPTree(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDispatchOnRole() {
        assertThat(Predictors.forRole(ColumnRole.CONTINUOUS, new REPTree(), 5)).isInstanceOf(RegressionPredictor.class);
        assertThat(Predictors.forRole(ColumnRole.CATEGORICAL, new REPTree(), 5)).isInstanceOf(ClassificationPredictor.class);
        assertThat(Predictors.roleOf(new Attribute("n"))).isEqualTo(ColumnRole.CONTINUOUS);
    }

}
