package eu.fbk.ontomodule.tool;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

/**
 * A table with a header row, read from a TSV or CSV file.
 * <p>
 * Import files list the terms of a module (columns {@code ID}, {@code Parent ID},
 * {@code Related} and optionally {@code Source}); configuration files list per-source extraction
 * options (columns {@code Source}, {@code Intermediates}, {@code Predicates}, {@code IRI}). Files
 * ending in {@code .csv} are comma-separated, with optional double quotes around cells; all the
 * other files are tab-separated.
 * </p>
 */
public final class ImportTable {

    private static final Splitter TAB_SPLITTER = Splitter.on('\t');

    private final List<String> columns;

    private final List<Map<String, String>> rows;

    private ImportTable(final List<String> columns, final List<Map<String, String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static ImportTable read(final File file) throws IOException {
        try (Reader reader = Files.newReader(file, Charsets.UTF_8)) {
            return read(reader, file.getName().toLowerCase().endsWith(".csv"));
        }
    }

    public static ImportTable read(final Reader reader, final boolean csv) throws IOException {
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        List<String> columns = null;
        final List<Map<String, String>> rows = Lists.newArrayList();
        int lineNum = 0;
        String line;
        while ((line = in.readLine()) != null) {
            ++lineNum;
            if (line.trim().isEmpty()) {
                continue;
            }
            final List<String> cells = csv ? splitCSV(line, lineNum) : TAB_SPLITTER
                    .splitToList(line);
            if (columns == null) {
                columns = Lists.newArrayList();
                for (final String cell : cells) {
                    final String column = cell.trim();
                    if (!column.isEmpty() && columns.contains(column)) {
                        throw new IOException("Duplicate column '" + column + "' in header row: "
                                + line);
                    }
                    columns.add(column);
                }
                continue;
            }
            final ImmutableMap.Builder<String, String> row = ImmutableMap.builder();
            for (int i = 0; i < Math.min(cells.size(), columns.size()); ++i) {
                if (!columns.get(i).isEmpty()) {
                    row.put(columns.get(i), cells.get(i).trim());
                }
            }
            rows.add(row.build());
        }
        if (columns == null) {
            throw new IOException("Missing header row");
        }
        return new ImportTable(ImmutableList.copyOf(columns), ImmutableList.copyOf(rows));
    }

    private static List<String> splitCSV(final String line, final int lineNum)
            throws IOException {
        final List<String> cells = Lists.newArrayList();
        final StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); ++i) {
            final char c = line.charAt(i);
            if (quoted) {
                if (c != '"') {
                    cell.append(c);
                } else if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    ++i;
                } else {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        if (quoted) {
            throw new IOException("Unterminated quoted cell at line " + lineNum + ": " + line);
        }
        cells.add(cell.toString());
        return cells;
    }

    /**
     * Reads a list of terms, one per line. Lines starting with {@code #} and blank lines are
     * skipped; anything following a whitespace-preceded {@code #} is a comment.
     *
     * @param file
     *            the file to read
     * @return the terms, in file order
     * @throws IOException
     *             if the file cannot be read
     */
    public static List<String> readTerms(final File file) throws IOException {
        final List<String> terms = Lists.newArrayList();
        for (final String line : Files.readLines(file, Charsets.UTF_8)) {
            if (line.startsWith("#") || line.trim().isEmpty()) {
                continue;
            }
            String term = line;
            for (int i = 1; i < line.length(); ++i) {
                if (line.charAt(i) == '#' && Character.isWhitespace(line.charAt(i - 1))) {
                    term = line.substring(0, i);
                    break;
                }
            }
            terms.add(term.trim());
        }
        return terms;
    }

    public List<String> getColumns() {
        return this.columns;
    }

    /**
     * Returns the data rows, each mapping column names to trimmed cell values. Cells missing at
     * the end of a row have no entry.
     *
     * @return an immutable list of rows
     */
    public List<Map<String, String>> getRows() {
        return this.rows;
    }

    /**
     * Returns the rows having the value specified in a column.
     *
     * @param column
     *            the column name
     * @param value
     *            the value to look for, null to return all the rows
     * @return the matching rows, in file order
     */
    public List<Map<String, String>> select(final String column, @Nullable final String value) {
        Preconditions.checkNotNull(column);
        if (value == null) {
            return this.rows;
        }
        final List<Map<String, String>> result = Lists.newArrayList();
        for (final Map<String, String> row : this.rows) {
            if (value.equals(row.get(column))) {
                result.add(row);
            }
        }
        return result;
    }

}
