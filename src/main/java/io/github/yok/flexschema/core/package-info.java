/**
 * Schema inference workflow package.
 *
 * <p>
 * Reads input files into text and orchestrates parsing and schema inference. Format-specific
 * record extraction is delegated to sources in {@code parser}; type decisions are delegated to
 * {@code inference}.
 * </p>
 */
package io.github.yok.flexschema.core;
