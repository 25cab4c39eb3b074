package eu.fbk.ontomodule.tool;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.ConfigurationException;
import eu.fbk.ontomodule.ModuleException;
import eu.fbk.ontomodule.extract.ExtractionResult;
import eu.fbk.ontomodule.extract.Extractor;
import eu.fbk.ontomodule.extract.ModuleSpec;
import eu.fbk.ontomodule.extract.Related;
import eu.fbk.ontomodule.internal.CommandLine;
import eu.fbk.ontomodule.store.JdbcStatementStore;
import eu.fbk.ontomodule.store.LoggingStatementStore;
import eu.fbk.ontomodule.store.StatementStore;
import eu.fbk.ontomodule.vocabulary.IAO;

public final class ExtractTool {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractTool.class);

    private static final Splitter SPACE_SPLITTER = Splitter.on(' ').trimResults()
            .omitEmptyStrings();

    private ExtractTool() {
    }

    public static void main(final String... args) {
        try {
            final CommandLine cmd = parser().parse(args);

            final String database = cmd.getOptionValue("d", String.class);
            final String module = cmd.getOptionValue("e", String.class, "extract");
            final String statement = cmd.getOptionValue("S", String.class,
                    JdbcStatementStore.STATEMENT_TABLE_DEFAULT);

            final ModuleSpec spec = createSpec(cmd);

            final StatementStore store = new LoggingStatementStore(new JdbcStatementStore(
                    toJdbcURL(database), null, null, statement));
            try {
                store.init();
                final ExtractionResult result = new Extractor(store).extract(module, spec);
                LOGGER.info("{} terms and {} facts written to table {}", result.getTerms()
                        .size(), result.getFactCount(), result.getModule());
            } finally {
                store.close();
            }

        } catch (final Throwable ex) {
            CommandLine.fail(ex);
        }
    }

    static CommandLine.Parser parser() {
        return CommandLine
                .parser()
                .withName("om-extract")
                .withHeader("Extracts a module from an LDTab statement table, writing it "
                        + "to a new table of the same database")
                .withOption("d", "database", "the SQLite database file (.db) or JDBC URL",
                        "DB", CommandLine.Type.STRING, 1, true)
                .withOption("e", "extract-table", "the module table (default: extract)",
                        "TABLE", CommandLine.Type.STRING, 1, false)
                .withOption("S", "statement", "the ontology table (default: statement)",
                        "TABLE", CommandLine.Type.STRING, 1, false)
                .withOption("t", "term", "the CURIE or label of a term to extract", "TERM",
                        CommandLine.Type.STRING, 1, false)
                .withOption("T", "terms", "a file with the terms to extract, one per line",
                        "FILE", CommandLine.Type.FILE_EXISTING, 1, false)
                .withOption("p", "predicate", "the CURIE or label of a predicate to include",
                        "PRED", CommandLine.Type.STRING, 1, false)
                .withOption("P", "predicates", "a file with the predicates to include",
                        "FILE", CommandLine.Type.FILE_EXISTING, 1, false)
                .withOption("C", "copy", "copy the values of a predicate to another one",
                        "FROM TO", CommandLine.Type.STRING, 2, false)
                .withOption("i", "imports", "a TSV or CSV file with the terms to import",
                        "FILE", CommandLine.Type.FILE_EXISTING, 1, false)
                .withOption("c", "config", "a TSV or CSV file with per-source options",
                        "FILE", CommandLine.Type.FILE_EXISTING, 1, false)
                .withOption("s", "source", "the source filtering imports and config rows",
                        "SOURCE", CommandLine.Type.STRING, 1, false)
                .withOption("I", "intermediates",
                        "the intermediates to include, all or none (default: all)",
                        "MODE", CommandLine.Type.STRING, 1, false)
                .withOption("m", "imported-from", "the IRI of the source ontology",
                        "IRI", CommandLine.Type.STRING, 1, false)
                .withOption("M", "imported-from-property",
                        "the property of 'imported from' annotations "
                                + "(default: IAO:0000412)", "PROP",
                        CommandLine.Type.STRING, 1, false)
                .withOption("n", "no-hierarchy", "do not assert computed parents")
                .withFooter("Imports files have columns 'ID', 'Parent ID', 'Related' and "
                        + "optionally 'Source';\nconfig files have columns 'Source', "
                        + "'Intermediates', 'Predicates' and 'IRI'.\nFiles ending in .csv "
                        + "are comma-separated, other files tab-separated.")
                .withLogger(LoggerFactory.getLogger("eu.fbk.ontomodule"));
    }

    static ModuleSpec createSpec(final CommandLine cmd) throws ModuleException, IOException {

        final boolean noHierarchy = cmd.hasOption("n");
        final String source = cmd.getOptionValue("s", String.class);
        final ModuleSpec.Builder builder = ModuleSpec.builder();
        boolean hasSeeds = false;

        final File importsFile = cmd.getOptionValue("i", File.class);
        if (importsFile != null) {
            final ImportTable imports = ImportTable.read(importsFile);
            final boolean bySource = imports.getColumns().contains("Source");
            final List<Map<String, String>> rows = bySource ? imports.select("Source", source)
                    : imports.getRows();
            for (final Map<String, String> row : rows) {
                final String id = Strings.emptyToNull(row.get("ID"));
                if (id != null) {
                    builder.withSeed(id, row.get("Parent ID"), row.get("Related"));
                    hasSeeds = true;
                }
            }
        }

        for (final String term : collect(cmd.getOptionValues("t", String.class),
                cmd.getOptionValue("T", File.class))) {
            builder.withSeed(term, null, noHierarchy ? null : Related.ANCESTORS.toString());
            hasSeeds = true;
        }

        if (!hasSeeds) {
            throw new CommandLine.Exception(
                    "One or more terms must be specified with --term, --terms, or --imports");
        }

        final List<String> predicates = collect(cmd.getOptionValues("p", String.class),
                cmd.getOptionValue("P", File.class));
        String intermediates = cmd.getOptionValue("I", String.class, "all");
        String importedFrom = cmd.getOptionValue("m", String.class);

        final File configFile = cmd.getOptionValue("c", File.class);
        if (configFile != null) {
            if (source == null) {
                throw new CommandLine.Exception(
                        "A --source is required when using the --config option");
            }
            final List<Map<String, String>> rows = ImportTable.read(configFile).select("Source",
                    source);
            if (rows.isEmpty()) {
                throw new ConfigurationException("Source '" + source
                        + "' does not exist in config file " + configFile);
            }
            final Map<String, String> row = rows.get(0);
            intermediates = Strings.isNullOrEmpty(row.get("Intermediates")) ? "all" : row
                    .get("Intermediates");
            predicates.addAll(SPACE_SPLITTER.splitToList(Strings.nullToEmpty(row
                    .get("Predicates"))));
            importedFrom = row.get("IRI");
        }

        final List<String> copies = cmd.getOptionValues("C", String.class);
        for (int i = 0; i + 1 < copies.size(); i += 2) {
            builder.withCopy(copies.get(i), copies.get(i + 1));
        }

        return builder.withPredicates(predicates.isEmpty() ? null : predicates)
                .withIntermediates(intermediates).withSuppressHierarchy(noHierarchy)
                .withImportedFrom(importedFrom)
                .withImportedFromPredicate(cmd.getOptionValue("M", String.class,
                        IAO.IMPORTED_FROM)).build();
    }

    static List<String> collect(final List<String> values, @Nullable final File file)
            throws IOException {
        final List<String> result = Lists.newArrayList(values);
        if (file != null) {
            result.addAll(ImportTable.readTerms(file));
        }
        return result;
    }

    static String toJdbcURL(final String database) {
        if (database.startsWith("jdbc:")) {
            return database;
        } else if (database.endsWith(".db")) {
            return "jdbc:sqlite:" + new File(database).getAbsolutePath();
        }
        throw new CommandLine.Exception("Unsupported database '" + database
                + "': expected a .db file or a JDBC URL");
    }

}
