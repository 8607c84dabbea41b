/**
 * Utility package for FlexSchema.
 *
 * <p>
 * Provides stateless helpers shared across the project: delimiter detection and CSV format
 * construction, and fatal error reporting for the command-line tool.
 * </p>
 */
package io.github.yok.flexschema.util;
