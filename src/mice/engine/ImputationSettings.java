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
 *    ImputationSettings.java
 *
 */
package mice.engine;

import java.util.Collections;
import mice.core.DataValidityException;
import mice.predictor.Predictors;
import weka.classifiers.Classifier;

/**
 * Tunable parameters of the chained-equations engine. Defaults reproduce the
 * behaviour of a single chain of three iterations with seed 42.
 */
public class ImputationSettings {

    public static final int DEFAULT_ITERATIONS = 3;

    public static final int DEFAULT_CHAINS = 1;

    public static final int DEFAULT_SEED = 42;

    public static final int DEFAULT_MEAN_MATCH_CANDIDATES = 5;

    private int m_iterations = DEFAULT_ITERATIONS;

    private int m_chains = DEFAULT_CHAINS;

    private int m_seed = DEFAULT_SEED;

    private int m_meanMatchCandidates = DEFAULT_MEAN_MATCH_CANDIDATES;

    private boolean m_parallelChains = false;

    private Classifier m_classifier = Predictors.defaultClassifier();

    public ImputationSettings() {
    }

    /**
     * @return a copy sharing the classifier template
     */
    public ImputationSettings copy() {
        ImputationSettings copy = new ImputationSettings();
        copy.m_iterations = m_iterations;
        copy.m_chains = m_chains;
        copy.m_seed = m_seed;
        copy.m_meanMatchCandidates = m_meanMatchCandidates;
        copy.m_parallelChains = m_parallelChains;
        copy.m_classifier = m_classifier;
        return copy;
    }

    public int getIterations() {
        return m_iterations;
    }

    public ImputationSettings setIterations(int iterations) {
        if (iterations < 1) {
            throw invalid("iterations must be >= 1, got " + iterations);
        }
        m_iterations = iterations;
        return this;
    }

    public int getChains() {
        return m_chains;
    }

    public ImputationSettings setChains(int chains) {
        if (chains < 1) {
            throw invalid("chains must be >= 1, got " + chains);
        }
        m_chains = chains;
        return this;
    }

    public int getSeed() {
        return m_seed;
    }

    /**
     * Chain i uses seed + i.
     */
    public ImputationSettings setSeed(int seed) {
        m_seed = seed;
        return this;
    }

    public int getMeanMatchCandidates() {
        return m_meanMatchCandidates;
    }

    public ImputationSettings setMeanMatchCandidates(int meanMatchCandidates) {
        if (meanMatchCandidates < 0) {
            throw invalid("mean match candidates must be >= 0, got " + meanMatchCandidates);
        }
        m_meanMatchCandidates = meanMatchCandidates;
        return this;
    }

    public boolean isParallelChains() {
        return m_parallelChains;
    }

    public ImputationSettings setParallelChains(boolean parallelChains) {
        m_parallelChains = parallelChains;
        return this;
    }

    public Classifier getClassifier() {
        return m_classifier;
    }

    public ImputationSettings setClassifier(Classifier classifier) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier must not be null");
        }
        m_classifier = classifier;
        return this;
    }

    private static DataValidityException invalid(String message) {
        return new DataValidityException("Invalid imputation settings, " + message, Collections.<String>emptyList());
    }

    @Override
    public String toString() {
        return "ImputationSettings{iterations=" + m_iterations
                + ", chains=" + m_chains
                + ", seed=" + m_seed
                + ", meanMatchCandidates=" + m_meanMatchCandidates
                + ", parallelChains=" + m_parallelChains
                + ", classifier=" + m_classifier.getClass().getName() + "}";
    }

}
