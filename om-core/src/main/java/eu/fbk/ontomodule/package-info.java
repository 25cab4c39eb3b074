/**
 * OntoModule core API ({@code om-core}).
 * <p>
 * The core module defines the data model shared by the store adapters and the extraction engine:
 * the 8-field {@link eu.fbk.ontomodule.data.Fact} of an LDTab statement table, its nested
 * {@link eu.fbk.ontomodule.data.Annotation}s, the
 * {@link eu.fbk.ontomodule.data.PrefixRegistry} used to bring absolute IRIs back to their
 * compact form and the TSV {@link eu.fbk.ontomodule.data.FactTable} format used for dumps and
 * fixtures. Vocabulary constants are expressed as compact identifiers (CURIEs), as this is how
 * they occur in statement tables.
 * </p>
 * <p>
 * Errors raised before any write is attempted extend {@link eu.fbk.ontomodule.ModuleException};
 * store failures surface as {@code IOException}s.
 * </p>
 */
package eu.fbk.ontomodule;
