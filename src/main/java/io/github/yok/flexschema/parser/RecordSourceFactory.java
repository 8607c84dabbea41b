package io.github.yok.flexschema.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Factory resolving {@link DataFormat formats} from file names and creating the matching
 * {@link RecordSource}.
 *
 * <p>
 * Extensions are matched case-insensitively in the following priority order:
 * </p>
 * <ol>
 * <li>LDIF</li>
 * <li>Delimited</li>
 * <li>JSON</li>
 * <li>Positional</li>
 * <li>Regex</li>
 * <li>Avro schema</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class RecordSourceFactory {

    // Priority order of data formats when resolving an extension.
    private static final List<DataFormat> FORMAT_PRIORITY = Arrays.asList(DataFormat.LDIF,
            DataFormat.DELIMITED, DataFormat.JSON, DataFormat.POSITIONAL, DataFormat.REGEX,
            DataFormat.AVRO_SCHEMA);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private RecordSourceFactory() {}

    /**
     * Resolves the format of a file from its extension.
     *
     * @param fileName file name or path
     * @return resolved format, or empty if the extension is unknown
     */
    public static Optional<DataFormat> resolveFormat(String fileName) {
        String ext = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        for (DataFormat format : FORMAT_PRIORITY) {
            if (format.matches(ext)) {
                log.info("Resolved format {} for file: {}", format, FilenameUtils.getName(fileName));
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a format name as given on the command line.
     *
     * @param name format name (case-insensitive, {@code -} read as {@code _}), e.g. {@code ldif}
     *        or {@code avro-schema}
     * @return the format
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DataFormat formatOf(String name) {
        try {
            return DataFormat.valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported format: " + name, e);
        }
    }

    /**
     * Creates the appropriate {@link RecordSource} for the given {@link DataFormat}.
     *
     * @param format the {@link DataFormat} to create a source for
     * @return a {@link RecordSource} implementation corresponding to the format
     * @throws IllegalArgumentException if the format is not supported
     */
    public static RecordSource create(DataFormat format) {
        if (format == DataFormat.LDIF) {
            return new LdifRecordSource();
        }
        if (format == DataFormat.DELIMITED) {
            return new DelimitedRecordSource();
        }
        if (format == DataFormat.JSON) {
            return new JsonRecordSource();
        }
        if (format == DataFormat.POSITIONAL) {
            return new PositionalRecordSource();
        }
        if (format == DataFormat.REGEX) {
            return new RegexRecordSource();
        }
        if (format != null && format.isDeclaredSchema()) {
            throw new IllegalArgumentException(
                    "Format declares its schema and has no record source: " + format);
        }
        throw new IllegalArgumentException("Unsupported format: " + format);
    }

    /**
     * Creates the {@link DeclaredSchemaSource} for a format that declares its schema.
     *
     * @param format a format whose {@link DataFormat#isDeclaredSchema()} is {@code true}
     * @return the schema source
     * @throws IllegalArgumentException if the format does not declare a schema
     */
    public static DeclaredSchemaSource createSchemaSource(DataFormat format) {
        if (format == DataFormat.AVRO_SCHEMA) {
            return new AvroSchemaSource();
        }
        throw new IllegalArgumentException("Not a declared-schema format: " + format);
    }
}
