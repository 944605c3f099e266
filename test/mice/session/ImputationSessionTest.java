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
 *    ImputationSessionTest.java
 *
 */
package mice.session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import mice.core.ColumnRole;
import mice.core.DataValidityException;
import mice.core.Dataset;
import mice.core.MissingnessTable;
import mice.core.TestDatasets;
import mice.engine.ImputationSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ImputationSessionTest {

    @Test
    void shouldReportAndImputeAgeAndGrade() {
        SessionResult result = new ImputationSession().run(TestDatasets.ageAndGrade(), Collections.singleton("age"));

        assertThat(result.getMissingnessTable().entries()).containsExactly(
                new MissingnessTable.Entry("age", 2, 20.0),
                new MissingnessTable.Entry("grade", 1, 10.0));
        assertThat(result.getCompletedDatasets()).hasSize(1);

        Dataset completed = result.getCompletedDatasets().get(0);
        assertThat(completed.hasMissingValue()).isFalse();
        assertThat(completed.value(2, 0)).isInstanceOf(Double.class);
        assertThat(completed.value(5, 0)).isInstanceOf(Double.class);
        assertThat(completed.value(7, 1)).isIn("A", "B");
        assertThat(result.getImputedColumns()).containsExactly("age", "grade");
    }

    @Test
    void shouldReturnOneDatasetPerChain() {
        SessionResult result = new ImputationSession().run(TestDatasets.people(), Arrays.asList("age", "income"), 3);

        assertThat(result.getCompletedDatasets()).hasSize(3);
        assertThat(result.getCompletedDatasets()).allSatisfy(d -> assertThat(d.hasMissingValue()).isFalse());
    }

    @Test
    void shouldSkipImputationWithoutMissingValues() {
        Dataset complete = Dataset.builder().column("a", 1, 2, 3).column("b", "x", "y", "z").build();

        SessionResult result = new ImputationSession().run(complete, Collections.singleton("a"));

        assertThat(result.hasImputations()).isFalse();
        assertThat(result.getCompletedDatasets()).isEmpty();
        assertThat(result.getMissingnessTable().totalMissing()).isZero();
        assertThat(result.comparisons(0)).isEmpty();
    }

    @Test
    void shouldTreatUnparseableContinuousCellsAsMissing() {
        Dataset raw = Dataset.builder()
                .column("v", 1, 2, "n/a", 4, 5, 6, 7, 8)
                .column("w", "a", "b", "a", "b", "a", "b", "a", "b")
                .build();

        SessionResult result = new ImputationSession().run(raw, Collections.singleton("v"));

        assertThat(result.getMissingnessTable().entry("v").getMissingCount()).isEqualTo(1);
        assertThat(result.getSanitizedOriginal().value(0, 0)).isEqualTo(1.0);
        assertThat(result.getCompletedDatasets().get(0).value(2, 0)).isInstanceOf(Double.class);
    }

    @Test
    void shouldRejectUnknownContinuousColumn() {
        assertThatThrownBy(() -> new ImputationSession().run(TestDatasets.ageAndGrade(), Arrays.asList("height")))
                .isInstanceOf(DataValidityException.class);
    }

    @Test
    void shouldRejectEmptyDataset() {
        assertThatThrownBy(() -> new ImputationSession().run(Dataset.builder().build(), Collections.<String>emptyList()))
                .isInstanceOf(DataValidityException.class);
    }

    @Test
    void shouldRejectZeroChains() {
        assertThatThrownBy(() -> new ImputationSession().run(TestDatasets.ageAndGrade(), Collections.singleton("age"), 0))
                .isInstanceOf(DataValidityException.class);
    }

    @Test
    void shouldRepeatForSameSeed() {
        ImputationSettings settings = new ImputationSettings().setSeed(11);

        SessionResult first = new ImputationSession(settings).run(TestDatasets.people(), Arrays.asList("age", "income"));
        SessionResult second = new ImputationSession(settings).run(TestDatasets.people(), Arrays.asList("age", "income"));

        assertThat(second.getCompletedDatasets()).isEqualTo(first.getCompletedDatasets());
    }

    @Test
    void shouldCompareColumnsRowByRow() {
        SessionResult result = new ImputationSession().run(TestDatasets.ageAndGrade(), Collections.singleton("age"));

        ColumnComparison age = result.comparison("age", 0);

        assertThat(age.getRole()).isEqualTo(ColumnRole.CONTINUOUS);
        assertThat(age.getMissingRows()).containsExactly(2, 5);
        assertThat(age.observedBefore()).hasSize(8);
        assertThat(age.imputedAfter()).hasSize(2).doesNotContain(Dataset.MISSING);
        assertThat(age.getAfter().get(0)).isEqualTo(age.getBefore().get(0));
        assertThat(result.comparisons(0)).extracting(ColumnComparison::getColumn).containsExactly("age", "grade");
    }

    @Test
    void shouldPublishToWriterAndRenderer() throws Exception {
        SessionResult result = new ImputationSession().run(TestDatasets.ageAndGrade(), Collections.singleton("age"));
        List<SessionResult> written = new ArrayList<>();
        List<String> rendered = new ArrayList<>();

        ImputationTool.publish(result, written::add, c -> rendered.add(c.getColumn()));

        assertThat(written).containsExactly(result);
        assertThat(rendered).containsExactly("age", "grade");
    }

    @Test
    void shouldPublishWithoutRenderer() throws Exception {
        SessionResult result = new ImputationSession().run(TestDatasets.ageAndGrade(), Collections.singleton("age"));

        assertThatCode(() -> ImputationTool.publish(result, null, null)).doesNotThrowAnyException();
    }

}
