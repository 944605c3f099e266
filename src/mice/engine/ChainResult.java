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
 *    ChainResult.java
 *
 */
package mice.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import mice.core.ColumnCondition;
import mice.core.ConvergenceTrace;
import mice.core.Dataset;

/**
 * Outcome of one chain: the completed dataset, the seed that produced it,
 * the columns imputed by a fallback and the convergence trace.
 */
public final class ChainResult {

    private final int m_chainIndex;

    private final int m_seed;

    private final Dataset m_completed;

    private final Map<String, ColumnCondition> m_fallbacks;

    private final ConvergenceTrace m_trace;

    public ChainResult(int chainIndex, int seed, Dataset completed,
            Map<String, ColumnCondition> fallbacks, ConvergenceTrace trace) {
        m_chainIndex = chainIndex;
        m_seed = seed;
        m_completed = completed;
        m_fallbacks = Collections.unmodifiableMap(new LinkedHashMap<>(fallbacks));
        m_trace = trace;
    }

    public int getChainIndex() {
        return m_chainIndex;
    }

    public int getSeed() {
        return m_seed;
    }

    public Dataset getCompleted() {
        return m_completed;
    }

    public Map<String, ColumnCondition> getFallbacks() {
        return m_fallbacks;
    }

    public ConvergenceTrace getConvergenceTrace() {
        return m_trace;
    }

}
