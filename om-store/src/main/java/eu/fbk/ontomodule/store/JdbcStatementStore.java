package eu.fbk.ontomodule.store;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.ontomodule.data.Annotation;
import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.runtime.DataCorruptedException;
import eu.fbk.ontomodule.vocabulary.RDFS;

/**
 * A {@code StatementStore} backed by an LDTab database accessed through JDBC.
 * <p>
 * The store reads an LDTab statement table (default name {@code statement}) and the optional
 * {@code prefix} table of the database, and stores each extracted module as a table with the
 * same eight columns. Connections are pooled with HikariCP and run with auto-commit disabled, so
 * that each {@link StatementTransaction} maps to a database transaction. Queries on sets of terms
 * are split in chunks of at most {@value #MAX_SQL_VARS} bound variables, the limit of SQLite.
 * </p>
 * <p>
 * Only portable SQL is used, so any database supporting {@code CREATE/DROP TABLE IF EXISTS} and
 * transactional DDL works; SQLite and PostgreSQL are the intended targets.
 * </p>
 */
public class JdbcStatementStore implements StatementStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcStatementStore.class);

    /** Maximum number of variables bound in a single SQL statement. */
    public static final int MAX_SQL_VARS = 999;

    /** The default name of the statement table. */
    public static final String STATEMENT_TABLE_DEFAULT = "statement";

    /** The name of the prefix table. */
    public static final String PREFIX_TABLE = "prefix";

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String FACT_COLUMNS = "assertion, retraction, graph, subject, "
            + "predicate, object, datatype, annotation";

    private static final String CREATE_TABLE = "CREATE TABLE \"%s\" (assertion INT NOT NULL, "
            + "retraction INT NOT NULL DEFAULT 0, graph TEXT NOT NULL, subject TEXT NOT NULL, "
            + "predicate TEXT NOT NULL, object TEXT NOT NULL, datatype TEXT NOT NULL, "
            + "annotation TEXT)";

    private static final String CREATE_PREFIX_TABLE = "CREATE TABLE IF NOT EXISTS \""
            + PREFIX_TABLE + "\" (prefix TEXT PRIMARY KEY, base TEXT NOT NULL)";

    private final HikariConfig config;

    private final String statementTable;

    @Nullable
    private HikariDataSource dataSource;

    private boolean closed;

    /**
     * Creates a new {@code JdbcStatementStore} for the database and statement table specified.
     *
     * @param url
     *            the JDBC URL of the database, e.g., {@code jdbc:sqlite:obi.db}
     * @param username
     *            the optional username
     * @param password
     *            the optional password
     * @param statementTable
     *            the name of the statement table, null to use {@code statement}
     */
    public JdbcStatementStore(final String url, @Nullable final String username,
            @Nullable final String password, @Nullable final String statementTable) {

        this.statementTable = checkTableName(MoreObjects.firstNonNull(statementTable,
                STATEMENT_TABLE_DEFAULT));

        this.config = new HikariConfig();
        this.config.setJdbcUrl(Preconditions.checkNotNull(url));
        if (username != null) {
            this.config.setUsername(username);
        }
        if (password != null) {
            this.config.setPassword(password);
        }
        this.config.setAutoCommit(false);
        this.config.setMinimumIdle(1); // default = max
        this.config.setMaximumPoolSize(4); // default = 10
        this.config.setConnectionTimeout(30000); // default 30000 ms (30 s)
        this.config.setPoolName(getClass().getSimpleName());

        LOGGER.info("{} configured, url={}, table={}", getClass().getSimpleName(), url,
                this.statementTable);
    }

    /**
     * Checks that a table name can be safely used as a quoted SQL identifier.
     *
     * @param name
     *            the table name
     * @return the name, unchanged
     * @throws IllegalArgumentException
     *             if the name contains characters other than letters, digits and underscores
     */
    public static String checkTableName(final String name) {
        Preconditions.checkArgument(TABLE_NAME_PATTERN.matcher(name).matches(),
                "Invalid table name '%s'", name);
        return name;
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(this.dataSource == null && !this.closed);
        try {
            this.dataSource = new HikariDataSource(this.config);
        } catch (final RuntimeException ex) {
            throw new IOException("Cannot connect to " + this.config.getJdbcUrl(), ex);
        }
    }

    @Override
    public synchronized StatementTransaction begin(final boolean readOnly) throws IOException,
            IllegalStateException {
        Preconditions.checkState(this.dataSource != null && !this.closed);
        try {
            return new JdbcStatementTransaction(this.dataSource.getConnection(), readOnly);
        } catch (final SQLException ex) {
            throw new IOException("Cannot begin transaction", ex);
        }
    }

    @Override
    public synchronized void reset() throws IOException, IllegalStateException {
        Preconditions.checkState(this.dataSource != null && !this.closed);
        try (Connection connection = this.dataSource.getConnection()) {
            try (Statement stmt = connection.createStatement()) {
                stmt.executeUpdate("DROP TABLE IF EXISTS \"" + this.statementTable + "\"");
                stmt.executeUpdate("DROP TABLE IF EXISTS \"" + PREFIX_TABLE + "\"");
                stmt.executeUpdate(String.format(CREATE_TABLE, this.statementTable));
                stmt.executeUpdate(CREATE_PREFIX_TABLE);
                connection.commit();
            } catch (final SQLException ex) {
                connection.rollback();
                throw ex;
            }
        } catch (final SQLException ex) {
            throw new IOException("Reset failed", ex);
        }
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.dataSource != null) {
            this.dataSource.close();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private class JdbcStatementTransaction implements StatementTransaction {

        private final Connection connection;

        private final boolean readOnly;

        private boolean ended;

        JdbcStatementTransaction(final Connection connection, final boolean readOnly)
                throws SQLException {
            this.connection = connection;
            this.readOnly = readOnly;
            this.ended = false;
            this.connection.setAutoCommit(false);
        }

        private void checkState(final boolean write) {
            Preconditions.checkState(!this.ended, "Transaction already ended");
            Preconditions.checkState(!write || !this.readOnly, "Read-only transaction");
        }

        private String placeholders(final int count) {
            return Joiner.on(", ").join(Collections.nCopies(count, "?"));
        }

        private void bind(final PreparedStatement stmt, final int offset,
                final List<String> values) throws SQLException {
            for (int i = 0; i < values.size(); ++i) {
                stmt.setString(offset + i + 1, values.get(i));
            }
        }

        private boolean tableExists(final String name) throws SQLException {
            final DatabaseMetaData metadata = this.connection.getMetaData();
            try (ResultSet rs = metadata.getTables(null, null, name, new String[] { "TABLE" })) {
                while (rs.next()) {
                    if (name.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
                return false;
            }
        }

        private Fact decode(final ResultSet rs) throws SQLException, DataCorruptedException {
            try {
                final String graph = rs.getString("graph");
                return Fact.create(rs.getInt("assertion"), rs.getInt("retraction"),
                        graph == null ? Fact.DEFAULT_GRAPH : graph, rs.getString("subject"),
                        rs.getString("predicate"), rs.getString("object"),
                        rs.getString("datatype"), Annotation.parse(rs.getString("annotation")));
            } catch (final IllegalArgumentException | NullPointerException ex) {
                throw new DataCorruptedException("Invalid row for subject "
                        + rs.getString("subject"), ex);
            }
        }

        private List<Fact> query(final String sql, final List<String> values)
                throws SQLException, DataCorruptedException {
            final List<Fact> facts = Lists.newArrayList();
            try (PreparedStatement stmt = this.connection.prepareStatement(sql)) {
                bind(stmt, 0, values);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        facts.add(decode(rs));
                    }
                }
            }
            return facts;
        }

        private SetMultimap<String, String> edges(final Set<String> terms, final boolean up)
                throws IOException {
            checkState(false);
            final String from = up ? "subject" : "object";
            final String to = up ? "object" : "subject";
            final SetMultimap<String, String> result = LinkedHashMultimap.create();
            try {
                for (final List<String> chunk : Iterables.partition(terms, MAX_SQL_VARS - 3)) {
                    final String sql = "SELECT DISTINCT " + from + ", " + to + " FROM \""
                            + JdbcStatementStore.this.statementTable + "\" WHERE datatype = ? "
                            + "AND predicate IN (?, ?) AND " + from + " IN ("
                            + placeholders(chunk.size()) + ") ORDER BY " + from + ", " + to;
                    try (PreparedStatement stmt = this.connection.prepareStatement(sql)) {
                        stmt.setString(1, Fact.IRI);
                        stmt.setString(2, RDFS.SUB_CLASS_OF);
                        stmt.setString(3, RDFS.SUB_PROPERTY_OF);
                        bind(stmt, 3, chunk);
                        try (ResultSet rs = stmt.executeQuery()) {
                            while (rs.next()) {
                                result.put(rs.getString(1), rs.getString(2));
                            }
                        }
                    }
                }
            } catch (final SQLException ex) {
                throw new IOException("Hierarchy query failed", ex);
            }
            return ImmutableSetMultimap.copyOf(result);
        }

        @Override
        public SetMultimap<String, String> parents(final Set<String> terms) throws IOException {
            return edges(terms, true);
        }

        @Override
        public SetMultimap<String, String> children(final Set<String> terms) throws IOException {
            return edges(terms, false);
        }

        @Override
        public List<Fact> match(@Nullable final Set<String> subjects,
                @Nullable final Set<String> predicates) throws IOException {
            checkState(false);
            if (subjects != null && subjects.isEmpty() || predicates != null
                    && predicates.isEmpty()) {
                return ImmutableList.of();
            }
            final String select = "SELECT " + FACT_COLUMNS + " FROM \""
                    + JdbcStatementStore.this.statementTable + "\"";
            final ImmutableList.Builder<Fact> builder = ImmutableList.builder();
            try {
                if (subjects == null && predicates == null) {
                    builder.addAll(query(select, ImmutableList.<String>of()));

                } else if (subjects == null) {
                    for (final List<String> chunk : Iterables.partition(predicates,
                            MAX_SQL_VARS)) {
                        builder.addAll(query(select + " WHERE predicate IN ("
                                + placeholders(chunk.size()) + ")", chunk));
                    }

                } else {
                    // Predicates are bound only when they leave room for a useful subject chunk
                    final int chunkSize = MAX_SQL_VARS / 2;
                    final boolean bindPredicates = predicates != null
                            && predicates.size() < MAX_SQL_VARS - chunkSize;
                    final List<String> predicateList = bindPredicates ? ImmutableList
                            .copyOf(predicates) : ImmutableList.<String>of();
                    for (final List<String> chunk : Iterables.partition(subjects, chunkSize)) {
                        String sql = select + " WHERE subject IN (" + placeholders(chunk.size())
                                + ")";
                        final List<String> values = Lists.newArrayList(chunk);
                        if (bindPredicates) {
                            sql += " AND predicate IN (" + placeholders(predicateList.size())
                                    + ")";
                            values.addAll(predicateList);
                        }
                        for (final Fact fact : query(sql, values)) {
                            if (predicates == null || predicates.contains(fact.getPredicate())) {
                                builder.add(fact);
                            }
                        }
                    }
                }
            } catch (final SQLException ex) {
                throw new IOException("Fact query failed", ex);
            }
            return builder.build();
        }

        @Override
        public Set<String> predicates() throws IOException {
            checkState(false);
            final Set<String> result = Sets.newTreeSet();
            try (Statement stmt = this.connection.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT DISTINCT predicate FROM \""
                            + JdbcStatementStore.this.statementTable + "\"")) {
                while (rs.next()) {
                    result.add(rs.getString(1));
                }
            } catch (final SQLException ex) {
                throw new IOException("Predicate query failed", ex);
            }
            return ImmutableSortedSet.copyOf(result);
        }

        private void collect(final String sql, final List<String> values, final Set<String> into)
                throws SQLException {
            try (PreparedStatement stmt = this.connection.prepareStatement(sql)) {
                bind(stmt, 0, values);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        into.add(rs.getString(1));
                    }
                }
            }
        }

        @Override
        public ListMultimap<String, String> resolve(final Iterable<String> idsOrLabels,
                final Position position) throws IOException {
            checkState(false);
            final Set<String> inputs = ImmutableSet.copyOf(idsOrLabels);
            final String table = "\"" + JdbcStatementStore.this.statementTable + "\"";
            final Set<String> found = Sets.newHashSet();
            final SetMultimap<String, String> byLabel = LinkedHashMultimap.create();
            try {
                for (final List<String> chunk : Iterables.partition(inputs, MAX_SQL_VARS - 1)) {
                    final String in = " IN (" + placeholders(chunk.size()) + ")";
                    collect("SELECT DISTINCT subject FROM " + table + " WHERE subject" + in,
                            chunk, found);
                    if (position == Position.PREDICATE) {
                        collect("SELECT DISTINCT predicate FROM " + table + " WHERE predicate"
                                + in, chunk, found);
                    }
                    final String sql = "SELECT DISTINCT object, subject FROM " + table
                            + " WHERE predicate = ? AND object" + in + " ORDER BY subject";
                    try (PreparedStatement stmt = this.connection.prepareStatement(sql)) {
                        stmt.setString(1, RDFS.LABEL);
                        bind(stmt, 1, chunk);
                        try (ResultSet rs = stmt.executeQuery()) {
                            while (rs.next()) {
                                byLabel.put(rs.getString(1), rs.getString(2));
                            }
                        }
                    }
                }
            } catch (final SQLException ex) {
                throw new IOException("Term resolution failed", ex);
            }
            final ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap
                    .builder();
            for (final String input : inputs) {
                final Set<String> ids = Sets.newLinkedHashSet();
                if (found.contains(input)) {
                    ids.add(input);
                }
                ids.addAll(byLabel.get(input));
                builder.putAll(input, ids);
            }
            return builder.build();
        }

        @Override
        public List<Namespace> namespaces() throws IOException {
            checkState(false);
            try {
                if (!tableExists(PREFIX_TABLE)) {
                    return ImmutableList.of();
                }
                final Map<String, Namespace> namespaces = Maps.newLinkedHashMap();
                try (Statement stmt = this.connection.createStatement();
                        ResultSet rs = stmt.executeQuery("SELECT prefix, base FROM \""
                                + PREFIX_TABLE + "\"")) {
                    while (rs.next()) {
                        final String prefix = rs.getString(1);
                        namespaces.put(prefix, new NamespaceImpl(prefix, rs.getString(2)));
                    }
                }
                return ImmutableList.copyOf(namespaces.values());
            } catch (final SQLException ex) {
                throw new IOException("Prefix query failed", ex);
            }
        }

        @Override
        public void addNamespaces(final Iterable<? extends Namespace> namespaces)
                throws IOException {
            checkState(true);
            try {
                try (Statement stmt = this.connection.createStatement()) {
                    stmt.executeUpdate(CREATE_PREFIX_TABLE);
                }
                try (PreparedStatement delete = this.connection.prepareStatement("DELETE FROM \""
                        + PREFIX_TABLE + "\" WHERE prefix = ?");
                        PreparedStatement insert = this.connection.prepareStatement(
                                "INSERT INTO \"" + PREFIX_TABLE + "\" (prefix, base) "
                                        + "VALUES (?, ?)")) {
                    for (final Namespace namespace : namespaces) {
                        delete.setString(1, namespace.getPrefix());
                        delete.executeUpdate();
                        insert.setString(1, namespace.getPrefix());
                        insert.setString(2, namespace.getName());
                        insert.executeUpdate();
                    }
                }
            } catch (final SQLException ex) {
                throw new IOException("Prefix update failed", ex);
            }
        }

        private void insert(final String table, final Iterable<? extends Fact> facts)
                throws SQLException {
            final String sql = "INSERT INTO \"" + table + "\" (" + FACT_COLUMNS
                    + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = this.connection.prepareStatement(sql)) {
                int pending = 0;
                for (final Fact fact : facts) {
                    stmt.setInt(1, fact.getAssertion());
                    stmt.setInt(2, fact.getRetraction());
                    stmt.setString(3, fact.getGraph());
                    stmt.setString(4, fact.getSubject());
                    stmt.setString(5, fact.getPredicate());
                    stmt.setString(6, fact.getObject());
                    stmt.setString(7, fact.getDatatype());
                    final Annotation annotation = fact.getAnnotation();
                    if (annotation == null) {
                        stmt.setNull(8, Types.VARCHAR);
                    } else {
                        stmt.setString(8, annotation.toJSON());
                    }
                    stmt.addBatch();
                    if (++pending == 1000) {
                        stmt.executeBatch();
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    stmt.executeBatch();
                }
            }
        }

        @Override
        public void add(final Iterable<? extends Fact> facts) throws IOException {
            checkState(true);
            final String table = JdbcStatementStore.this.statementTable;
            try {
                try (Statement stmt = this.connection.createStatement()) {
                    stmt.executeUpdate(String.format(CREATE_TABLE, table).replace(
                            "CREATE TABLE", "CREATE TABLE IF NOT EXISTS"));
                }
                insert(table, facts);
            } catch (final SQLException ex) {
                throw new IOException("Insertion into " + table + " failed", ex);
            }
        }

        private void checkModuleName(final String module) {
            checkTableName(module);
            Preconditions.checkArgument(
                    !module.equalsIgnoreCase(JdbcStatementStore.this.statementTable)
                            && !module.equalsIgnoreCase(PREFIX_TABLE),
                    "Module name '%s' clashes with a source table", module);
        }

        @Override
        public void write(final String module, final Iterable<? extends Fact> facts)
                throws IOException {
            checkState(true);
            checkModuleName(module);
            try {
                try (Statement stmt = this.connection.createStatement()) {
                    stmt.executeUpdate("DROP TABLE IF EXISTS \"" + module + "\"");
                    stmt.executeUpdate(String.format(CREATE_TABLE, module));
                }
                insert(module, facts);
            } catch (final SQLException ex) {
                throw new IOException("Cannot write module " + module, ex);
            }
        }

        @Override
        @Nullable
        public List<Fact> read(final String module) throws IOException {
            checkState(false);
            checkTableName(module);
            try {
                if (!tableExists(module)) {
                    return null;
                }
                return ImmutableList.copyOf(query("SELECT " + FACT_COLUMNS + " FROM \"" + module
                        + "\"", ImmutableList.<String>of()));
            } catch (final SQLException ex) {
                throw new IOException("Cannot read module " + module, ex);
            }
        }

        @Override
        public boolean drop(final String module) throws IOException {
            checkState(true);
            checkModuleName(module);
            try {
                if (!tableExists(module)) {
                    return false;
                }
                try (Statement stmt = this.connection.createStatement()) {
                    stmt.executeUpdate("DROP TABLE \"" + module + "\"");
                }
                return true;
            } catch (final SQLException ex) {
                throw new IOException("Cannot drop module " + module, ex);
            }
        }

        @Override
        public void end(final boolean commit) throws DataCorruptedException, IOException {
            if (this.ended) {
                return;
            }
            this.ended = true;
            try {
                if (commit && !this.readOnly) {
                    try {
                        this.connection.commit();
                    } catch (final SQLException ex) {
                        rollback();
                        throw new IOException("Commit failed, rollback performed", ex);
                    }
                } else {
                    rollback();
                }
            } finally {
                try {
                    this.connection.close();
                } catch (final SQLException ex) {
                    LOGGER.warn("Could not release connection", ex);
                }
            }
        }

        private void rollback() throws DataCorruptedException {
            try {
                this.connection.rollback();
            } catch (final SQLException ex) {
                throw new DataCorruptedException("Rollback failed", ex);
            }
        }

        @Override
        public String toString() {
            return JdbcStatementStore.this + "-tx" + System.identityHashCode(this);
        }

    }

}
