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
 *    ChainedEquationsEngine.java
 *
 */
package mice.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.ColumnRoles;
import mice.core.DataValidityException;
import mice.core.Dataset;
import mice.core.ImputationException;
import mice.core.InstancesCodec;
import mice.filters.unsupervised.attribute.ChainedEquationsImputation;
import weka.classifiers.AbstractClassifier;
import weka.core.Instances;
import weka.filters.Filter;

/**
 * Produces completed datasets from a sanitized dataset by running
 * {@link ChainedEquationsImputation} once per chain. Chain i is seeded with
 * {@code seed + i} and works on its own copy of the data, so chains never
 * share mutable state and may run in parallel.
 *
 * @author mice
 */
public class ChainedEquationsEngine {

    private static final Logger LOGGER = Logger.getLogger(ChainedEquationsEngine.class.getName());

    private final ImputationSettings m_settings;

    public ChainedEquationsEngine(ImputationSettings settings) {
        m_settings = settings.copy();
    }

    public ChainedEquationsEngine() {
        this(new ImputationSettings());
    }

    /**
     * Imputes every chain.
     *
     * @param sanitized - sanitized dataset, not modified
     * @param roles - role of every column
     * @return one result per chain, in chain order
     * @throws DataValidityException if the dataset is empty or a continuous column is not numeric
     * @throws ImputationException if a model cannot be fitted
     */
    public List<ChainResult> impute(Dataset sanitized, ColumnRoles roles) {

        if (sanitized.isEmpty()) {
            throw new DataValidityException("Dataset has " + sanitized.numColumns() + " columns and "
                    + sanitized.numRows() + " rows, nothing to impute", Collections.<String>emptyList());
        }

        final InstancesCodec codec = new InstancesCodec(sanitized, roles);
        Instances encoded = codec.encode();

        LOGGER.log(Level.INFO, "Imputing columns {0} with {1}",
                new Object[]{sanitized.columnsWithMissing(), m_settings});

        List<Callable<ChainResult>> chains = new ArrayList<>(m_settings.getChains());
        for (int c = 0; c < m_settings.getChains(); c++) {
            final int chainIndex = c;
            final Instances data = new Instances(encoded);
            chains.add(new Callable<ChainResult>() {
                @Override
                public ChainResult call() throws Exception {
                    return runChain(codec, data, chainIndex);
                }
            });
        }

        if (m_settings.isParallelChains() && chains.size() > 1) {
            return runParallel(chains);
        }

        List<ChainResult> results = new ArrayList<>(chains.size());
        for (Callable<ChainResult> chain : chains) {
            try {
                results.add(chain.call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ImputationException("Chain " + results.size() + " failed", e);
            }
        }
        return results;
    }

    private List<ChainResult> runParallel(List<Callable<ChainResult>> chains) {

        int threads = Math.min(chains.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ChainResult>> futures = executor.invokeAll(chains);
            List<ChainResult> results = new ArrayList<>(futures.size());
            for (Future<ChainResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new ImputationException("Chain " + results.size() + " failed", e.getCause());
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImputationException("Interrupted while imputing chains", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Runs one chain on a private copy of the encoded data.
     *
     * @param codec - codec that encoded the data
     * @param data - encoded data owned by this chain
     * @param chainIndex - position of the chain
     * @return completed dataset and diagnostics of the chain
     * @throws Exception if the filter fails
     */
    ChainResult runChain(InstancesCodec codec, Instances data, int chainIndex) throws Exception {

        int seed = m_settings.getSeed() + chainIndex;

        ChainedEquationsImputation filter = new ChainedEquationsImputation();
        filter.setSeed(seed);
        filter.setNumIterations(m_settings.getIterations());
        filter.setMeanMatchCandidates(m_settings.getMeanMatchCandidates());
        filter.setClassifier(AbstractClassifier.makeCopy(m_settings.getClassifier()));
        filter.setInputFormat(data);

        Instances completed = Filter.useFilter(data, filter);

        LOGGER.log(Level.INFO, "Chain {0} (seed {1}) done", new Object[]{chainIndex, seed});
        if (!filter.getFallbacks().isEmpty()) {
            LOGGER.log(Level.INFO, "Chain {0} used fallbacks for {1}",
                    new Object[]{chainIndex, filter.getFallbacks()});
        }

        return new ChainResult(chainIndex, seed, codec.decode(completed),
                filter.getFallbacks(), filter.getConvergenceTrace());
    }

}
