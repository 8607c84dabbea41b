/**
 * Configuration model package for FlexSchema.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources): sampling limits of schema inference and input decoding settings.
 * </p>
 */
package io.github.yok.flexschema.config;
