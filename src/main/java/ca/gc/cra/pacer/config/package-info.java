/**
 * Configuration parsing and wiring for PACER.
 * <p><strong>Role:</strong> Turns flat key/value maps (CLI arguments merged over YAML) into validated settings
 * records and assembles the governor and pipeline graph from them.</p>
 * <p><strong>Error handling:</strong> Invalid values raise {@link java.lang.IllegalArgumentException} naming the
 * key and its allowed range.</p>
 */
package ca.gc.cra.pacer.config;
