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
 *    AbstractColumnPredictor.java
 *
 */
package mice.predictor;

import java.util.Random;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.Randomizable;

/**
 * Parent class for predictors backed by a Weka classifier. Each call fits a
 * fresh copy of the template so nothing leaks between columns, iterations or
 * chains.
 *
 * @author mice
 */
public abstract class AbstractColumnPredictor implements ColumnPredictor {

    /** Classifier configuration copied for every fit */
    protected final Classifier m_template;

    /**
     * Number of donor candidates. Zero means the raw model output is used.
     */
    protected final int m_meanMatchCandidates;

    protected AbstractColumnPredictor(Classifier template, int meanMatchCandidates) {
        if (meanMatchCandidates < 0) {
            throw new IllegalArgumentException("Mean match candidates must be >= 0");
        }
        m_template = template;
        m_meanMatchCandidates = meanMatchCandidates;
    }

    /**
     * Builds a copy of the template on the training rows. Randomizable
     * classifiers are seeded from the chain random.
     *
     * @param training - rows with the class observed
     * @param random - chain random
     * @return fitted classifier
     * @throws Exception if copying or training fails
     */
    protected Classifier fit(Instances training, Random random) throws Exception {
        Classifier classifier = AbstractClassifier.makeCopy(m_template);
        if (classifier instanceof Randomizable) {
            ((Randomizable) classifier).setSeed(random.nextInt());
        }
        classifier.buildClassifier(training);
        return classifier;
    }

}
