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
 *    ImputationTool.java
 *
 */
package mice.session;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import mice.core.Dataset;
import mice.engine.ImputationSettings;
import mice.io.CsvResultWriter;
import mice.io.ExcelResultWriter;
import mice.io.WekaDatasetLoader;
import weka.core.Utils;

/**
 * Command line front end: loads a file, imputes it and writes the result
 * tables.
 * <p/>
 * Valid options are:
 * <pre> -i &lt;file&gt;
 *  Input file, any format Weka can load or an .xls/.xlsx workbook (required)</pre>
 * <pre> -o &lt;directory|file.xlsx&gt;
 *  Output directory for the CSV tables, or a workbook with one sheet
 *  per table (default: no output)</pre>
 * <pre> -C &lt;col1,col2,...&gt;
 *  Continuous columns, all others are categorical</pre>
 * <pre> -N &lt;num&gt;
 *  Number of chains (default 1)</pre>
 * <pre> -I &lt;num&gt;
 *  Number of iterations (default 3)</pre>
 * <pre> -S &lt;num&gt;
 *  Random number seed (default 42)</pre>
 * <pre> -K &lt;num&gt;
 *  Mean matching candidates (default 5)</pre>
 * <pre> -P
 *  Run chains in parallel</pre>
 *
 * @author mice
 */
public class ImputationTool {

    private static final Logger LOGGER = Logger.getLogger(ImputationTool.class.getName());

    /**
     * Hands a result to the output collaborators. Comparisons are rendered
     * for the first chain only.
     *
     * @param result - result of a run
     * @param writer - table writer, may be null
     * @param renderer - diagnostics renderer, may be null
     * @throws IOException if a collaborator fails
     */
    public static void publish(SessionResult result, ResultWriter writer, DiagnosticsRenderer renderer)
            throws IOException {
        if (writer != null) {
            writer.write(result);
        }
        if (renderer != null && result.hasImputations()) {
            for (ColumnComparison comparison : result.comparisons(0)) {
                renderer.render(comparison);
            }
        }
    }

    /**
     * Parses the settings part of the command line.
     *
     * @param options - command line options, consumed options are blanked
     * @return settings
     * @throws Exception if an option value is not a number
     */
    static ImputationSettings parseSettings(String[] options) throws Exception {
        ImputationSettings settings = new ImputationSettings();
        String optionString;

        optionString = Utils.getOption('N', options);
        if (optionString.length() != 0) {
            settings.setChains(Integer.parseInt(optionString));
        }

        optionString = Utils.getOption('I', options);
        if (optionString.length() != 0) {
            settings.setIterations(Integer.parseInt(optionString));
        }

        optionString = Utils.getOption('S', options);
        if (optionString.length() != 0) {
            settings.setSeed(Integer.parseInt(optionString));
        }

        optionString = Utils.getOption('K', options);
        if (optionString.length() != 0) {
            settings.setMeanMatchCandidates(Integer.parseInt(optionString));
        }

        settings.setParallelChains(Utils.getFlag('P', options));
        return settings;
    }

    /**
     * @param value - comma separated column names, may be empty
     * @return trimmed, non-empty names
     */
    static List<String> parseColumns(String value) {
        List<String> columns = new ArrayList<>();
        for (String name : value.split(",")) {
            if (!name.trim().isEmpty()) {
                columns.add(name.trim());
            }
        }
        return columns;
    }

    /**
     * Runs the tool.
     *
     * @param options - command line options
     * @return the session result
     * @throws Exception if the options are invalid or loading, imputing or writing fails
     */
    static SessionResult run(String[] options) throws Exception {

        String input = Utils.getOption('i', options);
        if (input.length() == 0) {
            throw new IllegalArgumentException("No input file given, use -i <file>");
        }
        String output = Utils.getOption('o', options);
        List<String> continuous = parseColumns(Utils.getOption('C', options));
        ImputationSettings settings = parseSettings(options);
        Utils.checkForRemainingOptions(options);

        Dataset raw = new WekaDatasetLoader(new File(input)).load();
        SessionResult result = new ImputationSession(settings).run(raw, continuous);

        LOGGER.log(Level.INFO, "Missingness:\n{0}", result.getMissingnessTable());
        if (!result.hasImputations()) {
            LOGGER.info("No missing values, nothing imputed");
        } else if (!result.getFallbacks().isEmpty()) {
            LOGGER.log(Level.INFO, "Columns imputed without a model: {0}", result.getFallbacks());
        }

        publish(result, output.length() == 0 ? null : writerFor(new File(output)), null);
        return result;
    }

    /**
     * @param output - value of the -o option
     * @return a workbook writer for .xlsx paths, a CSV directory writer otherwise
     */
    static ResultWriter writerFor(File output) {
        return ExcelResultWriter.isWorkbook(output) ? new ExcelResultWriter(output) : new CsvResultWriter(output);
    }

    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            Logger.getLogger(ImputationTool.class.getName()).log(Level.SEVERE, null, e);
            System.err.println("Imputation failed: " + e.getMessage());
            System.exit(1);
        }
    }

}
