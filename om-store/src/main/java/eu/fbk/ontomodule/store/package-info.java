/**
 * Access to LDTab statement tables.
 * <p>
 * The {@link eu.fbk.ontomodule.store.StatementStore} abstraction gives transactional access to
 * a statement table, its prefix table and the modules extracted from it. Two implementations are
 * provided: {@link eu.fbk.ontomodule.store.MemoryStatementStore}, keeping everything in memory,
 * and {@link eu.fbk.ontomodule.store.JdbcStatementStore}, working on a relational database.
 * {@link eu.fbk.ontomodule.store.LoggingStatementStore} can wrap either of them to trace
 * operations and their timings.
 * </p>
 */
package eu.fbk.ontomodule.store;
