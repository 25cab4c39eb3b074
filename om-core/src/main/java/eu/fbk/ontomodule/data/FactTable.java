package eu.fbk.ontomodule.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

/**
 * Reads and writes statement and prefix tables in TSV format.
 * <p>
 * A statement TSV file contains one {@link Fact} per line, as eight tab-separated columns in the
 * order assertion, retraction, graph, subject, predicate, object, datatype, annotation; empty
 * cells denote nulls (an empty assertion defaults to 1, an empty retraction to 0, an empty graph
 * to {@link Fact#DEFAULT_GRAPH}). The annotation cell holds the JSON serialization of the
 * {@link Annotation}. A prefix TSV file contains one {@code prefix<TAB>base} pair per line.
 * Blank lines are skipped in both formats.
 * </p>
 */
public final class FactTable {

    private static final Splitter TAB_SPLITTER = Splitter.on('\t');

    private static final Joiner TAB_JOINER = Joiner.on('\t');

    private FactTable() {
    }

    public static List<Fact> read(final File file) throws IOException {
        try (Reader reader = Files.newReader(file, Charsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<Fact> read(final Reader reader) throws IOException {
        final List<Fact> facts = Lists.newArrayList();
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        int lineNum = 0;
        String line;
        while ((line = in.readLine()) != null) {
            ++lineNum;
            if (line.trim().isEmpty()) {
                continue;
            }
            final List<String> cells = TAB_SPLITTER.splitToList(line);
            if (cells.size() < 7 || cells.size() > 8) {
                throw new IOException("Expected 8 columns at line " + lineNum + ", found "
                        + cells.size() + ": " + line);
            }
            try {
                final String assertion = Strings.emptyToNull(cells.get(0));
                final String retraction = Strings.emptyToNull(cells.get(1));
                facts.add(Fact.create( //
                        assertion == null ? 1 : Integer.parseInt(assertion), //
                        retraction == null ? 0 : Integer.parseInt(retraction), //
                        Strings.isNullOrEmpty(cells.get(2)) ? Fact.DEFAULT_GRAPH : cells.get(2),
                        cells.get(3), cells.get(4), cells.get(5), cells.get(6), //
                        cells.size() == 8 ? Annotation.parse(cells.get(7)) : null));
            } catch (final IllegalArgumentException ex) {
                throw new IOException("Invalid fact at line " + lineNum + ": " + line, ex);
            }
        }
        return facts;
    }

    public static void write(final Iterable<? extends Fact> facts, final Writer writer)
            throws IOException {
        for (final Fact fact : facts) {
            final Annotation annotation = fact.getAnnotation();
            writer.write(TAB_JOINER.join(fact.getAssertion(), fact.getRetraction(),
                    fact.getGraph(), fact.getSubject(), fact.getPredicate(), fact.getObject(),
                    fact.getDatatype(), annotation == null ? "" : annotation.toJSON()));
            writer.write('\n');
        }
        writer.flush();
    }

    public static List<Namespace> readNamespaces(final File file) throws IOException {
        try (Reader reader = Files.newReader(file, Charsets.UTF_8)) {
            return readNamespaces(reader);
        }
    }

    public static List<Namespace> readNamespaces(final Reader reader) throws IOException {
        final ImmutableList.Builder<Namespace> builder = ImmutableList.builder();
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        int lineNum = 0;
        String line;
        while ((line = in.readLine()) != null) {
            ++lineNum;
            if (line.trim().isEmpty()) {
                continue;
            }
            final List<String> cells = TAB_SPLITTER.splitToList(line);
            if (cells.size() != 2) {
                throw new IOException("Expected prefix and base at line " + lineNum + ": "
                        + line);
            }
            builder.add(new NamespaceImpl(cells.get(0).trim(), cells.get(1).trim()));
        }
        return builder.build();
    }

}
