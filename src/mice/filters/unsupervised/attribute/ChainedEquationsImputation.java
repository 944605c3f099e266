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
 *    ChainedEquationsImputation.java
 *
 */
package mice.filters.unsupervised.attribute;

import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Vector;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.ColumnCondition;
import mice.core.ColumnRole;
import mice.core.ConvergenceTrace;
import mice.predictor.ColumnPredictor;
import mice.predictor.Predictors;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.core.Capabilities;
import weka.core.Instances;
import weka.core.Option;
import weka.core.OptionHandler;
import weka.core.TechnicalInformation;
import weka.core.TechnicalInformationHandler;
import weka.core.Utils;

/**
 * <!-- globalinfo-start -->
 * Class that implements multiple imputation by chained equations (MICE) for
 * one chain. Every missing value is first filled by a random draw from the
 * observed values of its attribute. Then, for a fixed number of iterations,
 * each attribute with missing values is modelled in turn from all other
 * attributes: the model is trained on the rows where the attribute was
 * originally observed and its predictions replace the values of the rows
 * where it was originally missing. Numeric attributes are imputed by
 * regression with predictive mean matching, nominal attributes by drawing
 * from the predicted class distribution.
 * <p/>
 * MICE specification from:
 * <p/>
 * van Buuren, S., and Groothuis-Oudshoorn, K. (2011): mice: Multivariate
 * Imputation by Chained Equations in R, Journal of Statistical Software,
 * Vol. 45, No. 3, pp. 1 - 67, DOI information: 10.18637/jss.v045.i03
 * <p/>
 * Changes:
 * <ul>
 * <li>An attribute whose observed rows hold a single distinct value gets
 * that value in every missing row, no model is fitted.</li>
 * <li>An attribute without any observed value keeps its initial fill: zero
 * for numeric attributes, the first label for nominal ones.</li>
 * </ul> <p/> <!-- globalinfo-end -->
 *
 * <!-- options-start -->
 * Valid options are:
 * <p/>
 *
 * <pre> -I
 * numIterations - Number of passes over the attributes with missing values (default 3)</pre>
 *
 * <pre> -S
 * seed - Random number seed (default 42)</pre>
 *
 * <pre> -K
 * meanMatchCandidates - Number of donor candidates for predictive mean matching, 0 uses the model output directly (default 5)</pre>
 *
 * <pre> -W
 * classifier - Full class name of the classifier used to model each attribute, options after -- (default weka.classifiers.trees.RandomForest)</pre>
 * <!-- options-end -->
 *
 * @author mice
 * @version 0.1
 */
public class ChainedEquationsImputation extends IterativeImputation implements TechnicalInformationHandler {

    static final long serialVersionUID = -3321768092214478120L;

    /** Number of passes over the attributes with missing values */
    private int m_numIterations = 3;

    /**
     * Donor candidates for predictive mean matching. Zero writes the model
     * output directly.
     */
    private int m_meanMatchCandidates = 5;

    /** Template of the model fitted for each attribute */
    private Classifier m_Classifier = Predictors.defaultClassifier();

    /** Attributes imputed without a model in the last run */
    private Map<String, ColumnCondition> m_fallbacks = new LinkedHashMap<>();

    /** Per-iteration statistics of the last run */
    private ConvergenceTrace m_trace = new ConvergenceTrace();

    /**
     * Main method for testing this class.
     *
     * @param argv should contain arguments to the filter: use -h for help
     */
    public static void main(String[] argv) {
        runFilter(new ChainedEquationsImputation(), argv);
    }

    /**
     * Runs one chain of chained equations on the given dataset.
     *
     * @param input - dataset to process
     * @return imputed dataset without missing values
     * @throws Exception if a model cannot be fitted
     */
    @Override
    protected Instances process(Instances input) throws Exception {

        m_dataset = input;
        m_fallbacks = new LinkedHashMap<>();
        m_trace = new ConvergenceTrace();
        recordMissingMask();

        /* Step 1: fill every missing value by a draw from its observed values */
        Random random = new Random(m_Seed);
        Instances working = initialDraws(random);

        /* Step 2: refine, one attribute at a time, left to right */
        for (int iteration = 1; iteration <= m_numIterations; iteration++) {

            for (Integer j : m_attributesWithMissing) {
                imputeAttribute(working, j, random);
            } //end attr loop

            Logger.getLogger(ChainedEquationsImputation.class.getName()).log(Level.FINE,
                    "Seed {0}: iteration {1} of {2} done", new Object[]{m_Seed, iteration, m_numIterations});

        } //end iteration loop

        /* Step 3: the working copy is the completed dataset */
        return working;

    }

    /**
     * Models one attribute on its originally observed rows and overwrites its
     * originally missing rows in the working copy.
     *
     * @param working - complete working copy, updated in place
     * @param attIndex - attribute to impute
     * @param random - chain random
     * @throws Exception if the model cannot be fitted
     */
    protected void imputeAttribute(Instances working, int attIndex, Random random) throws Exception {

        String name = working.attribute(attIndex).name();
        int[] rows = missingRowIndices(attIndex);
        Instances training = observedRows(working, attIndex);

        //nothing observed to learn from, keep the initial fill
        if (training.isEmpty()) {
            noteFallback(name, ColumnCondition.EMPTY_TRAINING_SET);
            return;
        }

        double[] before = new double[rows.length];
        for (int k = 0; k < rows.length; k++) {
            before[k] = working.instance(rows[k]).value(attIndex);
        }

        double[] imputed;
        if (training.attributeStats(attIndex).distinctCount < 2) {
            noteFallback(name, ColumnCondition.DEGENERATE);
            imputed = new double[rows.length];
            Arrays.fill(imputed, training.instance(0).value(attIndex));
        } else {
            Instances targets = missingRows(working, attIndex);
            ColumnPredictor predictor = Predictors.forRole(
                    Predictors.roleOf(working.attribute(attIndex)), m_Classifier, m_meanMatchCandidates);
            imputed = predictor.impute(training, targets, random);
        }

        for (int k = 0; k < rows.length; k++) {
            working.instance(rows[k]).setValue(attIndex, imputed[k]);
        }

        m_trace.record(name, statistic(working, attIndex, before, imputed));

    }

    /**
     * @return mean of the imputed values for numeric attributes, share of
     * changed labels for nominal ones
     */
    private static double statistic(Instances working, int attIndex, double[] before, double[] imputed) {
        if (imputed.length == 0) {
            return 0;
        }
        if (Predictors.roleOf(working.attribute(attIndex)) == ColumnRole.CONTINUOUS) {
            return Utils.mean(imputed);
        }
        int changed = 0;
        for (int k = 0; k < imputed.length; k++) {
            if (imputed[k] != before[k]) {
                changed++;
            }
        }
        return changed / (double) imputed.length;
    }

    private void noteFallback(String attribute, ColumnCondition condition) {
        if (!m_fallbacks.containsKey(attribute)) {
            Logger.getLogger(ChainedEquationsImputation.class.getName()).log(Level.FINE,
                    "Attribute {0} imputed without a model: {1}", new Object[]{attribute, condition});
        }
        m_fallbacks.put(attribute, condition);
    }

    /**
     * Returns the Capabilities of this filter.
     *
     * @return the capabilities of this object
     * @see Capabilities
     */
    @Override
    public Capabilities getCapabilities() {
        Capabilities result = super.getCapabilities();
        result.disableAll();

        // attributes
        result.enable(Capabilities.Capability.NUMERIC_ATTRIBUTES);
        result.enable(Capabilities.Capability.NOMINAL_ATTRIBUTES);
        result.enable(Capabilities.Capability.MISSING_VALUES);

        // class
        result.enable(Capabilities.Capability.NO_CLASS);

        return result;
    }

    /**
     * Returns attributes imputed without a model during the last run, with
     * the reason.
     *
     * @return attribute name to condition, in attribute order
     */
    public Map<String, ColumnCondition> getFallbacks() {
        return Collections.unmodifiableMap(m_fallbacks);
    }

    /**
     * Returns the per-iteration statistics of the last run.
     *
     * @return convergence trace
     */
    public ConvergenceTrace getConvergenceTrace() {
        return m_trace;
    }

    /**
     * Returns the number of iterations.
     *
     * @return number of passes over the attributes with missing values
     */
    public int getNumIterations() {
        return m_numIterations;
    }

    /**
     * Set the number of iterations.
     *
     * @param numIterations - number of passes, at least 1
     * @throws IllegalArgumentException if numIterations is less than 1
     */
    public void setNumIterations(int numIterations) {
        if (numIterations < 1) {
            throw new IllegalArgumentException("Number of iterations must be >= 1");
        }
        m_numIterations = numIterations;
    }

    /**
     * Returns the tip text for this property.
     *
     * @return tip text for this property suitable for displaying in the
     * explorer/experimenter gui
     */
    public String numIterationsTipText() {
        return "Number of passes over the attributes with missing values.";
    }

    /**
     * Returns the number of donor candidates for predictive mean matching.
     *
     * @return donor candidates, 0 if the model output is used directly
     */
    public int getMeanMatchCandidates() {
        return m_meanMatchCandidates;
    }

    /**
     * Set the number of donor candidates for predictive mean matching.
     *
     * @param meanMatchCandidates - donor candidates, 0 to use the model output directly
     * @throws IllegalArgumentException if meanMatchCandidates is negative
     */
    public void setMeanMatchCandidates(int meanMatchCandidates) {
        if (meanMatchCandidates < 0) {
            throw new IllegalArgumentException("Mean match candidates must be >= 0");
        }
        m_meanMatchCandidates = meanMatchCandidates;
    }

    /**
     * Returns the tip text for this property.
     *
     * @return tip text for this property suitable for displaying in the
     * explorer/experimenter gui
     */
    public String meanMatchCandidatesTipText() {
        return "Number of donor candidates for predictive mean matching of numeric attributes. "
                + "Nominal attributes draw from the class distribution when this is above 0. "
                + "0 uses the model output directly.";
    }

    /**
     * Returns the classifier used to model each attribute.
     *
     * @return classifier template
     */
    public Classifier getClassifier() {
        return m_Classifier;
    }

    /**
     * Set the classifier used to model each attribute. It must handle both
     * numeric and nominal classes for datasets that contain both.
     *
     * @param classifier - classifier template, copied for every fit
     */
    public void setClassifier(Classifier classifier) {
        m_Classifier = classifier;
    }

    /**
     * Returns the tip text for this property.
     *
     * @return tip text for this property suitable for displaying in the
     * explorer/experimenter gui
     */
    public String classifierTipText() {
        return "The classifier used to model each attribute with missing values.";
    }

    /**
     * Returns an enumeration describing the available options.
     *
     * @return an enumeration of all the available options.
     */
    @Override
    public Enumeration<Option> listOptions() {

        Vector<Option> result = new Vector<Option>();

        result.addElement(new Option("\tNumber of passes over the attributes with missing values.\n"
                + "\t(default 3)", "I", 1, "-I <num>"));

        result.addElement(new Option("\tRandom number seed.\n"
                + "\t(default 42)", "S", 1, "-S <num>"));

        result.addElement(new Option("\tDonor candidates for predictive mean matching, 0 uses the model output.\n"
                + "\t(default 5)", "K", 1, "-K <num>"));

        result.addElement(new Option("\tFull class name of the classifier, options after --.\n"
                + "\t(default weka.classifiers.trees.RandomForest)", "W", 1, "-W <classifier>"));

        result.addAll(Collections.list(super.listOptions()));

        return result.elements();
    }

    /**
     * Parses a given list of options.
     * <p/>
     *
     * <!-- options-start -->
     * Valid options are:
     * <p/>
     *
     * <pre> -I
     * numIterations - Number of passes over the attributes with missing values (default 3)</pre>
     *
     * <pre> -S
     * seed - Random number seed (default 42)</pre>
     *
     * <pre> -K
     * meanMatchCandidates - Donor candidates for predictive mean matching (default 5)</pre>
     *
     * <pre> -W
     * classifier - Full class name of the classifier, options after --</pre>
     * <!-- options-end -->
     *
     * @param options the list of options as an array of strings
     * @throws Exception if an option is not supported
     */
    @Override
    public void setOptions(String[] options) throws Exception {
        String optionString;

        // set # iterations
        optionString = Utils.getOption('I', options);
        if (optionString.length() != 0) {
            setNumIterations(Integer.parseInt(optionString));
        } else {
            setNumIterations(3);
        }

        // set seed
        optionString = Utils.getOption('S', options);
        if (optionString.length() != 0) {
            setSeed(Integer.parseInt(optionString));
        } else {
            setSeed(42);
        }

        // set mean match candidates
        optionString = Utils.getOption('K', options);
        if (optionString.length() != 0) {
            setMeanMatchCandidates(Integer.parseInt(optionString));
        } else {
            setMeanMatchCandidates(5);
        }

        // set classifier, its options follow --
        optionString = Utils.getOption('W', options);
        if (optionString.length() != 0) {
            setClassifier(AbstractClassifier.forName(optionString, Utils.partitionOptions(options)));
        } else {
            setClassifier(Predictors.defaultClassifier());
        }

        super.setOptions(options);
    }

    /**
     * Gets the current settings of ChainedEquationsImputation
     *
     * @return an array of strings suitable for passing to setOptions()
     */
    @Override
    public String[] getOptions() {

        Vector<String> result = new Vector<String>();

        result.add("-I");
        result.add("" + getNumIterations());

        result.add("-S");
        result.add("" + getSeed());

        result.add("-K");
        result.add("" + getMeanMatchCandidates());

        Collections.addAll(result, super.getOptions());

        result.add("-W");
        result.add(getClassifier().getClass().getName());
        if (getClassifier() instanceof OptionHandler) {
            String[] classifierOptions = ((OptionHandler) getClassifier()).getOptions();
            if (classifierOptions.length > 0) {
                result.add("--");
                Collections.addAll(result, classifierOptions);
            }
        }

        return result.toArray(new String[result.size()]);

    }

    /**
     * Returns an instance of a TechnicalInformation object, containing detailed
     * information about the technical background of this class, e.g., paper
     * reference or book this class is based on.
     *
     * @return the technical information about this class
     */
    @Override
    public TechnicalInformation getTechnicalInformation() {
        TechnicalInformation result;

        result = new TechnicalInformation(TechnicalInformation.Type.ARTICLE);
        result.setValue(TechnicalInformation.Field.AUTHOR, "van Buuren, S., & Groothuis-Oudshoorn, K.");
        result.setValue(TechnicalInformation.Field.YEAR, "2011");
        result.setValue(TechnicalInformation.Field.TITLE, "mice: Multivariate Imputation by Chained Equations in R");
        result.setValue(TechnicalInformation.Field.JOURNAL, "Journal of Statistical Software");
        result.setValue(TechnicalInformation.Field.VOLUME, "45");
        result.setValue(TechnicalInformation.Field.NUMBER, "3");
        result.setValue(TechnicalInformation.Field.PAGES, "1-67");
        result.setValue(TechnicalInformation.Field.URL, "https://doi.org/10.18637/jss.v045.i03");

        return result;

    }

    /**
     * Return a description suitable for displaying in the
     * explorer/experimenter.
     *
     * @return a description suitable for displaying in the
     * explorer/experimenter
     */
    @Override
    public String globalInfo() {

        return "Class that implements multiple imputation by chained equations "
                + "(MICE) for one chain. Missing values are first filled by random "
                + "draws from the observed values of their attribute. Then, for a "
                + "number of iterations, each attribute with missing values is "
                + "modelled from all other attributes on the rows where it was "
                + "observed, and the model's predictions replace the values where "
                + "it was missing. Numeric attributes use predictive mean matching, "
                + "nominal attributes draw from the predicted class distribution.\n"
                + "\n"
                + "Changes:\n"
                + "-An attribute whose observed rows hold a single distinct value gets "
                + "that value in every missing row.\n"
                + "-An attribute without observed values keeps its initial fill: zero "
                + "if numeric, the first label if nominal.\n\n"
                + "For more information see:\n" + getTechnicalInformation().toString();

    }

}
