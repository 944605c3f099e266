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
 *    TestDatasets.java
 *
 */
package mice.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Small datasets shared by the tests.
 */
public final class TestDatasets {

    private TestDatasets() {
    }

    /**
     * Ten rows, age continuous with rows 2 and 5 missing, grade categorical
     * with row 7 missing.
     */
    public static Dataset ageAndGrade() {
        return Dataset.builder()
                .column("age", 21, 34, Dataset.MISSING, 45, 29, Dataset.MISSING, 52, 38, 41, 27)
                .column("grade", "A", "B", "A", "B", "A", "B", "B", Dataset.MISSING, "A", "A")
                .build();
    }

    /**
     * Forty rows with a linear relation between age and income, a label
     * following age, and a complete id column. Missing cells are spread over
     * age, income and label.
     */
    public static Dataset people() {
        List<Object> id = new ArrayList<>();
        List<Object> age = new ArrayList<>();
        List<Object> income = new ArrayList<>();
        List<Object> label = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            int a = 20 + i;
            id.add("p" + i);
            age.add(i % 7 == 3 ? Dataset.MISSING : (double) a);
            income.add(i % 5 == 1 ? Dataset.MISSING : a * 1000.0 + (i % 3) * 150.0);
            label.add(i % 6 == 4 ? Dataset.MISSING : (a < 40 ? "young" : "old"));
        }
        return Dataset.builder()
                .column("id", id)
                .column("age", age)
                .column("income", income)
                .column("label", label)
                .build();
    }

    public static ColumnRoles peopleRoles(Dataset people) {
        List<String> continuous = new ArrayList<>();
        continuous.add("age");
        continuous.add("income");
        return SchemaClassifier.classify(people, continuous);
    }

    public static int countMissing(Dataset dataset) {
        int total = 0;
        for (int j = 0; j < dataset.numColumns(); j++) {
            total += dataset.missingCount(j);
        }
        return total;
    }

}
