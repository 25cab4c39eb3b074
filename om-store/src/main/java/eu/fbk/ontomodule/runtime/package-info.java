/**
 * Lifecycle and failure types shared by store implementations.
 */
package eu.fbk.ontomodule.runtime;
