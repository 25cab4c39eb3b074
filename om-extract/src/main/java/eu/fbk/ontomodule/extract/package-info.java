/**
 * Module extraction.
 * <p>
 * {@link eu.fbk.ontomodule.extract.Extractor} is the entry point: given a
 * {@link eu.fbk.ontomodule.extract.ModuleSpec}, it resolves the seed terms, collects their
 * related terms through {@link eu.fbk.ontomodule.extract.RelatedEntityExpander}, and lets
 * {@link eu.fbk.ontomodule.extract.ModuleSynthesizer} build the module facts, which are finally
 * written to a table of the store. Hierarchy closures are obtained from the store by
 * {@link eu.fbk.ontomodule.extract.HierarchyResolver} and reduced by the pure functions of
 * {@link eu.fbk.ontomodule.extract.FrontierReducer}.
 * </p>
 */
package eu.fbk.ontomodule.extract;
