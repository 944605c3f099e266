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
 *    RegressionPredictor.java
 *
 */
package mice.predictor;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import mice.core.ColumnRole;
import weka.classifiers.Classifier;
import weka.core.Instances;

/**
 * Imputes a numeric column with a regression model. With mean matching
 * enabled the imputed value is the observed value of a donor: one of the
 * training rows whose prediction lies closest to the prediction for the
 * missing row, picked uniformly at random. Training predictions are sorted
 * once per fit; each missing row then finds its donors by binary search.
 *
 * @author mice
 */
public class RegressionPredictor extends AbstractColumnPredictor {

    public RegressionPredictor(Classifier template, int meanMatchCandidates) {
        super(template, meanMatchCandidates);
    }

    @Override
    public double[] impute(Instances training, Instances targets, Random random) throws Exception {

        Classifier model = fit(training, random);

        double[] predictions = new double[targets.numInstances()];
        for (int i = 0; i < targets.numInstances(); i++) {
            predictions[i] = model.classifyInstance(targets.instance(i));
        }

        if (m_meanMatchCandidates == 0) {
            return predictions;
        }

        final double[] trainingPredictions = new double[training.numInstances()];
        for (int i = 0; i < training.numInstances(); i++) {
            trainingPredictions[i] = model.classifyInstance(training.instance(i));
        }

        int candidates = Math.min(m_meanMatchCandidates, training.numInstances());
        int[] order = sortByPrediction(trainingPredictions);
        double[] sorted = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            sorted[k] = trainingPredictions[order[k]];
        }

        double[] imputed = new double[predictions.length];
        for (int i = 0; i < predictions.length; i++) {
            int[] donors = nearestDonors(sorted, order, predictions[i], candidates);
            int donor = donors[random.nextInt(candidates)];
            imputed[i] = training.instance(donor).classValue();
        }
        return imputed;
    }

    /**
     * @param predictions - prediction per training row
     * @return training rows ordered by prediction, ties by row
     */
    static int[] sortByPrediction(final double[] predictions) {
        Integer[] boxed = new Integer[predictions.length];
        for (int k = 0; k < boxed.length; k++) {
            boxed[k] = k;
        }
        Arrays.sort(boxed, Comparator.comparingDouble(k -> predictions[k]));
        int[] order = new int[boxed.length];
        for (int k = 0; k < boxed.length; k++) {
            order[k] = boxed[k];
        }
        return order;
    }

    /**
     * Finds the training rows whose predictions lie closest to a target's
     * prediction, walking outwards from where the prediction falls in the
     * sorted training predictions.
     *
     * @param sorted - training predictions in ascending order
     * @param order - training row of each entry of sorted
     * @param prediction - prediction for the missing row
     * @param count - number of donors, at most sorted.length
     * @return donor rows, closest first, ties by row
     */
    static int[] nearestDonors(double[] sorted, int[] order, double prediction, int count) {

        int[] donors = new int[count];
        if (Double.isNaN(prediction)) {
            // every distance is NaN, so all rows tie
            int[] rows = order.clone();
            Arrays.sort(rows);
            System.arraycopy(rows, 0, donors, 0, count);
            return donors;
        }

        int right = lowerBound(sorted, prediction, sorted.length);

        // equal predictions on the left are taken in row order, so the walk
        // enters each run of equal values at its start
        int groupEnd = right - 1;
        int groupStart = groupEnd < 0 ? 0 : lowerBound(sorted, sorted[groupEnd], groupEnd + 1);
        int groupPos = groupStart;

        for (int c = 0; c < count; c++) {
            boolean takeLeft;
            if (right >= sorted.length) {
                takeLeft = true;
            } else if (groupEnd < 0) {
                takeLeft = false;
            } else {
                int cmp = Double.compare(Math.abs(sorted[groupEnd] - prediction),
                        Math.abs(sorted[right] - prediction));
                takeLeft = cmp < 0 || (cmp == 0 && order[groupPos] < order[right]);
            }

            if (takeLeft) {
                donors[c] = order[groupPos++];
                if (groupPos > groupEnd) {
                    groupEnd = groupStart - 1;
                    if (groupEnd >= 0) {
                        groupStart = lowerBound(sorted, sorted[groupEnd], groupEnd + 1);
                        groupPos = groupStart;
                    }
                }
            } else {
                donors[c] = order[right++];
            }
        }
        return donors;
    }

    /**
     * @return first index below end whose value is not less than key, or end
     */
    private static int lowerBound(double[] sorted, double key, int end) {
        int low = 0;
        int high = end;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (Double.compare(sorted[mid], key) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public ColumnRole getRole() {
        return ColumnRole.CONTINUOUS;
    }

}
