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
 *    ClassificationPredictor.java
 *
 */
package mice.predictor;

import java.util.Random;
import mice.core.ColumnRole;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.Utils;

/**
 * Imputes a nominal column with a classifier. With mean matching enabled the
 * label is drawn from the predicted class distribution, otherwise the most
 * probable label is taken. Only labels seen in the training rows can carry
 * probability, so the result is always an observed label.
 *
 * @author mice
 */
public class ClassificationPredictor extends AbstractColumnPredictor {

    public ClassificationPredictor(Classifier template, int meanMatchCandidates) {
        super(template, meanMatchCandidates);
    }

    @Override
    public double[] impute(Instances training, Instances targets, Random random) throws Exception {

        Classifier model = fit(training, random);
        int[] observedCounts = training.attributeStats(training.classIndex()).nominalCounts;

        double[] imputed = new double[targets.numInstances()];
        for (int i = 0; i < targets.numInstances(); i++) {
            double[] dist = model.distributionForInstance(targets.instance(i));
            for (int c = 0; c < dist.length; c++) {
                if (observedCounts[c] == 0) {
                    dist[c] = 0;
                }
            }

            if (Utils.sum(dist) <= 0) {
                // no usable distribution, fall back to the majority label
                imputed[i] = Utils.maxIndex(observedCounts);
            } else if (m_meanMatchCandidates == 0) {
                imputed[i] = Utils.maxIndex(dist);
            } else {
                imputed[i] = draw(dist, random);
            }
        }
        return imputed;
    }

    /**
     * @return index drawn with probability proportional to its weight
     */
    static int draw(double[] weights, Random random) {
        double threshold = random.nextDouble() * Utils.sum(weights);
        double cumulative = 0;
        int last = -1;
        for (int c = 0; c < weights.length; c++) {
            if (weights[c] <= 0) {
                continue;
            }
            cumulative += weights[c];
            last = c;
            if (threshold < cumulative) {
                return c;
            }
        }
        return last;
    }

    @Override
    public ColumnRole getRole() {
        return ColumnRole.CATEGORICAL;
    }

}
