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
 *    ImputationSession.java
 *
 */
package mice.session;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.ColumnRoles;
import mice.core.DataSanitizer;
import mice.core.DataValidityException;
import mice.core.Dataset;
import mice.core.MissingnessReporter;
import mice.core.MissingnessTable;
import mice.core.SchemaClassifier;
import mice.engine.ChainResult;
import mice.engine.ChainedEquationsEngine;
import mice.engine.ImputationSettings;

/**
 * One request/response cycle of imputation: sanitize the raw dataset,
 * report its missingness and, if anything is missing, run the engine. The
 * session keeps no state between runs and performs no I/O.
 *
 * @author mice
 */
public class ImputationSession {

    private static final Logger LOGGER = Logger.getLogger(ImputationSession.class.getName());

    private final ImputationSettings m_settings;

    public ImputationSession(ImputationSettings settings) {
        m_settings = settings.copy();
    }

    public ImputationSession() {
        this(new ImputationSettings());
    }

    /**
     * Runs with the configured number of chains.
     *
     * @see #run(Dataset, Collection, int)
     */
    public SessionResult run(Dataset raw, Collection<String> continuousColumns) {
        return run(raw, continuousColumns, m_settings.getChains());
    }

    /**
     * Imputes a raw dataset.
     *
     * @param raw - dataset as loaded
     * @param continuousColumns - columns to treat as continuous, all others are categorical
     * @param chains - number of completed datasets to produce
     * @return missingness table, sanitized original and completed datasets
     * @throws DataValidityException if the dataset is empty, a continuous column
     * does not exist or the chain count is below 1
     */
    public SessionResult run(Dataset raw, Collection<String> continuousColumns, int chains) {

        if (raw.isEmpty()) {
            throw new DataValidityException("Dataset has " + raw.numColumns() + " columns and "
                    + raw.numRows() + " rows, nothing to impute", Collections.<String>emptyList());
        }

        Set<String> continuous = Collections.unmodifiableSet(new LinkedHashSet<>(continuousColumns));
        ColumnRoles roles = SchemaClassifier.classify(raw, continuous);
        Dataset sanitized = DataSanitizer.sanitize(raw, roles);
        MissingnessTable missingness = MissingnessReporter.report(sanitized);

        if (!sanitized.hasMissingValue()) {
            LOGGER.log(Level.INFO, "No missing values in {0} columns, nothing to impute", sanitized.numColumns());
            return new SessionResult(missingness, sanitized, roles, Collections.<ChainResult>emptyList());
        }

        ImputationSettings settings = m_settings.copy().setChains(chains);
        List<ChainResult> results = new ChainedEquationsEngine(settings).impute(sanitized, roles);

        return new SessionResult(missingness, sanitized, roles, results);
    }

}
