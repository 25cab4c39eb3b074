package eu.fbk.ontomodule.store;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.SetMultimap;

import org.openrdf.model.Namespace;

import eu.fbk.ontomodule.data.Fact;
import eu.fbk.ontomodule.runtime.DataCorruptedException;

/**
 * A statement store transaction.
 * <p>
 * A {@code StatementTransaction} is a unit of work over the contents of a {@link StatementStore}:
 * changes are either completely stored or discarded, and are not visible to other transactions
 * before commit. The operations offered fall in three groups:
 * </p>
 * <ul>
 * <li><b>Hierarchy navigation</b>, via {@link #parents(Set)} and {@link #children(Set)}, which
 * follow one level of {@code rdfs:subClassOf} / {@code rdfs:subPropertyOf} edges for a whole
 * batch of terms at once;</li>
 * <li><b>Fact and term lookup</b>, via {@link #match(Set, Set)}, {@link #predicates()},
 * {@link #resolve(Iterable, Position)} and {@link #namespaces()};</li>
 * <li><b>Modification</b>, via {@link #add(Iterable)}, {@link #addNamespaces(Iterable)},
 * {@link #write(String, Iterable)} and {@link #drop(String)}, not available to read-only
 * transactions ({@link IllegalStateException} is thrown in that case).</li>
 * </ul>
 * <p>
 * Transactions are terminated via {@link #end(boolean)}. If it throws an {@code IOException} a
 * rollback must be assumed, even if a commit was asked; if it throws a
 * {@code DataCorruptedException}, neither commit nor rollback were possible and the store is left
 * in an unpredictable state. {@code StatementTransaction} objects are not thread safe.
 * </p>
 */
public interface StatementTransaction {

    /**
     * Returns the direct parents of the terms specified, following hierarchy edges (facts with
     * predicate {@code rdfs:subClassOf} or {@code rdfs:subPropertyOf} and an IRI object) upward
     * by one level.
     *
     * @param terms
     *            the child terms
     * @return a multimap child to parents, with no entry for terms without parents
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    SetMultimap<String, String> parents(Set<String> terms) throws IOException,
            IllegalStateException;

    /**
     * Returns the direct children of the terms specified, following hierarchy edges downward by
     * one level.
     *
     * @param terms
     *            the parent terms
     * @return a multimap parent to children, with no entry for terms without children
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    SetMultimap<String, String> children(Set<String> terms) throws IOException,
            IllegalStateException;

    /**
     * Returns the facts of the statement table matching the optional subject and predicate
     * sets. A null set matches anything; an empty set matches nothing.
     *
     * @param subjects
     *            the subjects to match, null to match any subject
     * @param predicates
     *            the predicates to match, null to match any predicate
     * @return the matching facts
     * @throws IOException
     *             in case some IO error occurs
     * @throws DataCorruptedException
     *             if a stored annotation cannot be decoded
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    List<Fact> match(@Nullable Set<String> subjects, @Nullable Set<String> predicates)
            throws IOException, IllegalStateException;

    /**
     * Returns the distinct predicates used in the statement table.
     *
     * @return a sorted set of predicate identifiers
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    Set<String> predicates() throws IOException, IllegalStateException;

    /**
     * Resolves identifiers or labels to identifiers occurring in the statement table. An input
     * resolves to itself if it occurs in the column denoted by {@code position}, and to every
     * subject having it as {@code rdfs:label}.
     *
     * @param idsOrLabels
     *            the identifiers or labels to resolve
     * @param position
     *            the column inputs should occur in to resolve to themselves
     * @return a multimap input to the identifiers it resolves to, with no entry for inputs that
     *         cannot be resolved
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    ListMultimap<String, String> resolve(Iterable<String> idsOrLabels, Position position)
            throws IOException, IllegalStateException;

    /**
     * Returns the namespaces stored in the prefix table, or an empty list if there is no such
     * table.
     *
     * @return the stored namespaces
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    List<Namespace> namespaces() throws IOException, IllegalStateException;

    /**
     * Adds the namespaces specified to the prefix table.
     *
     * @param namespaces
     *            the namespaces to add
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void addNamespaces(Iterable<? extends Namespace> namespaces) throws IOException,
            IllegalStateException;

    /**
     * Appends the facts specified to the statement table.
     *
     * @param facts
     *            the facts to add
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void add(Iterable<? extends Fact> facts) throws IOException, IllegalStateException;

    /**
     * Stores the facts specified as the module with the name given, replacing any module
     * previously stored with that name.
     *
     * @param module
     *            the module name, a valid SQL identifier
     * @param facts
     *            the module facts, in the order they should be stored
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalArgumentException
     *             if the module name is not a valid identifier
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void write(String module, Iterable<? extends Fact> facts) throws IOException,
            IllegalArgumentException, IllegalStateException;

    /**
     * Returns the facts of the module with the name given, in stored order.
     *
     * @param module
     *            the module name
     * @return the module facts, or null if no such module exists
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    @Nullable
    List<Fact> read(String module) throws IOException, IllegalStateException;

    /**
     * Drops the module with the name given, if it exists.
     *
     * @param module
     *            the module name
     * @return true if a module was dropped
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    boolean drop(String module) throws IOException, IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes (if any). This method
     * always tries to end the transaction: if commit is requested but fails, a rollback is
     * performed and an {@code IOException} is thrown; if neither is possible a
     * {@code DataCorruptedException} is thrown. Calling it on an ended transaction has no
     * effect.
     *
     * @param commit
     *            true if changes should be committed
     * @throws DataCorruptedException
     *             if neither commit nor rollback could be performed
     * @throws IOException
     *             in case commit was requested but a rollback was performed instead
     */
    void end(boolean commit) throws DataCorruptedException, IOException;

    /**
     * The column an identifier must occur in to resolve to itself.
     */
    enum Position {

        /** The subject column. */
        SUBJECT,

        /** The predicate column (identifiers occurring as subject also resolve). */
        PREDICATE

    }

}
