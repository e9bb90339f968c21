package org.janelia.dwiproc.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes whitespace delimited numeric tables
 * (bval, bvec, transform, phase encoding and index files).
 */
public class TextMatrix {

    /** Fixed point format used for every numeric table this pipeline writes. */
    public static final String FIVE_DECIMAL_FORMAT = "%.5f";

    private TextMatrix() {
    }

    /**
     * Loads a table, ignoring blank lines and lines starting with '#'.
     *
     * @throws IOException
     *   if the file cannot be read, contains a non-numeric token or has ragged rows.
     */
    public static double[][] load(final Path path)
            throws IOException {

        final List<double[]> rows = new ArrayList<>();

        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString());
             final BufferedReader bufferedReader = new BufferedReader(reader)) {

            String line;
            int lineNumber = 0;
            while ((line = bufferedReader.readLine()) != null) {
                lineNumber++;
                final String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                final String[] tokens = trimmed.split("[\\s,]+");
                final double[] row = new double[tokens.length];
                for (int i = 0; i < tokens.length; i++) {
                    try {
                        row[i] = Double.parseDouble(tokens[i]);
                    } catch (final NumberFormatException e) {
                        throw new IOException("invalid value '" + tokens[i] + "' on line " + lineNumber +
                                              " of " + path, e);
                    }
                }
                if ((rows.size() > 0) && (rows.get(0).length != row.length)) {
                    throw new IOException("line " + lineNumber + " of " + path + " has " + row.length +
                                          " values but previous lines have " + rows.get(0).length);
                }
                rows.add(row);
            }
        }

        return rows.toArray(new double[0][]);
    }

    /**
     * @return all values of the table at path in row-major order
     *         (convenient for single row files like bval).
     */
    public static double[] loadFlat(final Path path)
            throws IOException {
        final double[][] rows = load(path);
        int count = 0;
        for (final double[] row : rows) {
            count += row.length;
        }
        final double[] values = new double[count];
        int offset = 0;
        for (final double[] row : rows) {
            System.arraycopy(row, 0, values, offset, row.length);
            offset += row.length;
        }
        return values;
    }

    public static void save(final Path path,
                            final double[][] rows)
            throws IOException {

        try (final Writer writer = FileUtil.DEFAULT_INSTANCE.getExtensionBasedWriter(path.toString());
             final PrintWriter printWriter = new PrintWriter(writer)) {
            for (final double[] row : rows) {
                printWriter.println(formatRow(row));
            }
            if (printWriter.checkError()) {
                throw new IOException("failed to write " + path);
            }
        }
    }

    public static String formatRow(final double[] row) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            // + 0.0 turns an exact -0.0 into 0.0, small negative values still print as -0.00000
            sb.append(String.format(Locale.US, FIVE_DECIMAL_FORMAT, row[i] + 0.0));
        }
        return sb.toString();
    }

}
