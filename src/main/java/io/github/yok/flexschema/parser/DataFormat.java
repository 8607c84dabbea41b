package io.github.yok.flexschema.parser;

import io.github.yok.flexschema.inference.ClassificationContext;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported source formats.
 *
 * <p>
 * Each format lists the file extensions recognized as belonging to it and the
 * {@link ClassificationContext} used when the caller does not choose one. Formats flagged
 * {@code declaredSchema} are read by a {@link DeclaredSchemaSource}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Directory export (LDIF).
    LDIF(ClassificationContext.DIRECTORY, "ldif", "ldf"),

    // Delimited text (CSV, TSV, ...).
    DELIMITED(ClassificationContext.DELIMITED, "csv", "tsv", "txt", "dat"),

    // JSON document or JSON Lines.
    JSON(ClassificationContext.DIRECTORY, "json", "jsonl", "ndjson"),

    // Fixed-width positional text.
    POSITIONAL(ClassificationContext.DELIMITED, "fwf", "pos", "prn"),

    // Lines structured by a regular expression (logs).
    REGEX(ClassificationContext.DELIMITED, "log"),

    // Avro schema document; fields are declared, not inferred.
    AVRO_SCHEMA(ClassificationContext.DELIMITED, true, "avsc");

    private final ClassificationContext defaultContext;

    // true when the file declares its schema instead of holding sample records
    private final boolean declaredSchema;

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(ClassificationContext defaultContext, String... exts) {
        this(defaultContext, false, exts);
    }

    DataFormat(ClassificationContext defaultContext, boolean declaredSchema, String... exts) {
        this.defaultContext = defaultContext;
        this.declaredSchema = declaredSchema;
        this.extensions = Arrays.stream(exts).map(String::toLowerCase).collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return extensions.contains(ext.toLowerCase());
    }
}
