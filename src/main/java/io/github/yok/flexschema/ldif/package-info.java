/**
 * Directory-export (LDIF) parsing package.
 *
 * <p>
 * Splits a document into physical lines, folds continuation lines, groups attribute values into
 * entries and flags values that look binary. {@link io.github.yok.flexschema.ldif.EntryParser} is
 * the entry point.
 * </p>
 */
package io.github.yok.flexschema.ldif;
