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
 *    SessionResult.java
 *
 */
package mice.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import mice.core.ColumnCondition;
import mice.core.ColumnRoles;
import mice.core.Dataset;
import mice.core.MissingnessTable;
import mice.engine.ChainResult;

/**
 * Everything one imputation run produced: the missingness table, the
 * sanitized original, the role assignment and one result per chain. The
 * chain list is empty when the sanitized original had no missing cell.
 */
public final class SessionResult {

    private final MissingnessTable m_missingnessTable;

    private final Dataset m_sanitizedOriginal;

    private final ColumnRoles m_roles;

    private final List<ChainResult> m_chains;

    public SessionResult(MissingnessTable missingnessTable, Dataset sanitizedOriginal,
            ColumnRoles roles, List<ChainResult> chains) {
        m_missingnessTable = missingnessTable;
        m_sanitizedOriginal = sanitizedOriginal;
        m_roles = roles;
        m_chains = Collections.unmodifiableList(new ArrayList<>(chains));
    }

    public MissingnessTable getMissingnessTable() {
        return m_missingnessTable;
    }

    public Dataset getSanitizedOriginal() {
        return m_sanitizedOriginal;
    }

    public ColumnRoles getRoles() {
        return m_roles;
    }

    public List<ChainResult> getChains() {
        return m_chains;
    }

    /**
     * @return completed datasets in chain order, empty if nothing was imputed
     */
    public List<Dataset> getCompletedDatasets() {
        List<Dataset> completed = new ArrayList<>(m_chains.size());
        for (ChainResult chain : m_chains) {
            completed.add(chain.getCompleted());
        }
        return completed;
    }

    /**
     * @return false when the original had no missing cell
     */
    public boolean hasImputations() {
        return !m_chains.isEmpty();
    }

    /**
     * @return columns that had missing cells, in column order
     */
    public List<String> getImputedColumns() {
        return m_sanitizedOriginal.columnsWithMissing();
    }

    /**
     * @return columns imputed by a fallback in any chain, with the reason
     */
    public Map<String, ColumnCondition> getFallbacks() {
        Map<String, ColumnCondition> fallbacks = new LinkedHashMap<>();
        for (ChainResult chain : m_chains) {
            fallbacks.putAll(chain.getFallbacks());
        }
        return fallbacks;
    }

    /**
     * @param column - name of a column that had missing cells
     * @param chainIndex - chain to compare against
     * @return before and after values of the column
     */
    public ColumnComparison comparison(String column, int chainIndex) {
        Dataset completed = m_chains.get(chainIndex).getCompleted();
        return new ColumnComparison(column, m_roles.roleOf(column), chainIndex,
                m_sanitizedOriginal.column(column), completed.column(column));
    }

    /**
     * @param chainIndex - chain to compare against
     * @return one comparison per imputed column, in column order
     */
    public List<ColumnComparison> comparisons(int chainIndex) {
        List<ColumnComparison> result = new ArrayList<>();
        for (String column : getImputedColumns()) {
            result.add(comparison(column, chainIndex));
        }
        return result;
    }

}
