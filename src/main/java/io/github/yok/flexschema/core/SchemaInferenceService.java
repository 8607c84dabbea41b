package io.github.yok.flexschema.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexschema.config.InferenceConfig;
import io.github.yok.flexschema.inference.ClassificationContext;
import io.github.yok.flexschema.inference.FieldTypeResolver;
import io.github.yok.flexschema.inference.SampleFieldTypeResolver;
import io.github.yok.flexschema.inference.SampleRecord;
import io.github.yok.flexschema.inference.SchemaBuilder;
import io.github.yok.flexschema.inference.SchemaResult;
import io.github.yok.flexschema.inference.TypeClassifier;
import io.github.yok.flexschema.ldif.Attribute;
import io.github.yok.flexschema.ldif.DirectoryAttributeTypeResolver;
import io.github.yok.flexschema.ldif.DirectoryEntry;
import io.github.yok.flexschema.ldif.EntryParser;
import io.github.yok.flexschema.ldif.LdifParseResult;
import io.github.yok.flexschema.parser.DataFormat;
import io.github.yok.flexschema.parser.LdifRecordSource;
import io.github.yok.flexschema.parser.MalformedContentException;
import io.github.yok.flexschema.parser.ParseOptions;
import io.github.yok.flexschema.parser.RecordSourceFactory;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point of schema inference for already-loaded content.
 *
 * <p>
 * Every method is a pure function of its arguments: the content is parsed into records by the
 * {@link io.github.yok.flexschema.parser.RecordSource} of the format, then
 * {@link SchemaBuilder} proposes the schema. Directory exports (and any call in
 * {@link ClassificationContext#DIRECTORY} context on LDIF) use
 * {@link DirectoryAttributeTypeResolver} so that well-known attribute names are honored.
 * </p>
 *
 * <p>
 * The service keeps no state between calls; callers embedding it in an interactive UI own
 * debouncing and caching.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class SchemaInferenceService {

    private final InferenceConfig inferenceConfig;

    private final TypeClassifier classifier;

    private final EntryParser entryParser = new EntryParser();

    /**
     * Creates the service.
     *
     * @param inferenceConfig sampling limits and String length bounds
     */
    public SchemaInferenceService(InferenceConfig inferenceConfig) {
        this.inferenceConfig = inferenceConfig;
        this.classifier = new TypeClassifier(inferenceConfig.getMinStringLength(),
                inferenceConfig.getMaxStringLength());
    }

    /**
     * Parses a directory-export document, assigns an inferred type to every attribute and
     * proposes the attribute schema.
     *
     * @param content decoded document text
     * @return typed entries, base DN and schema
     */
    public LdifAnalysis analyzeLdif(String content) {
        LdifParseResult parsed = entryParser.parse(content);
        DirectoryAttributeTypeResolver resolver = new DirectoryAttributeTypeResolver(classifier);

        List<DirectoryEntry> typed = parsed.getEntries().stream()
                .map(entry -> entry.withAttributes(entry.getAttributes().stream()
                        .map(attribute -> typeOf(attribute, resolver))
                        .collect(Collectors.toList())))
                .collect(Collectors.toList());

        SchemaResult schema = newBuilder(resolver).build(LdifRecordSource.toRecords(typed));
        log.info("Analyzed directory export: {} entries, {} attributes, {} schema fields",
                typed.size(), parsed.getTotalAttributes(), schema.getTotalFields());
        return new LdifAnalysis(typed, parsed.getBaseDistinguishedName().orElse(null), schema);
    }

    /**
     * Proposes the schema of content in the given format.
     *
     * <p>
     * Formats that declare their schema (Avro {@code .avsc}) are read as declared and the options
     * are ignored.
     * </p>
     *
     * @param format source format
     * @param content decoded file content
     * @param options caller options; format defaults apply to unset values
     * @return proposed schema
     * @throws MalformedContentException if the content cannot be read as the format at all
     * @throws IllegalArgumentException if the options are invalid for the format
     */
    public SchemaResult infer(DataFormat format, String content, ParseOptions options)
            throws MalformedContentException {
        Preconditions.checkNotNull(format, "format must not be null");
        if (format.isDeclaredSchema()) {
            log.debug("Reading declared {} schema", format);
            return RecordSourceFactory.createSchemaSource(format).readSchema(content);
        }
        ParseOptions effective = options != null ? options : ParseOptions.defaults();

        List<SampleRecord> records = RecordSourceFactory.create(format).read(content, effective);
        ClassificationContext context = effective.getContext() != null ? effective.getContext()
                : format.getDefaultContext();
        FieldTypeResolver resolver = format == DataFormat.LDIF
                ? new DirectoryAttributeTypeResolver(classifier)
                : new SampleFieldTypeResolver(classifier, context);
        log.debug("Inferring {} schema from {} records (context {})", format, records.size(),
                context);
        return newBuilder(resolver).build(records);
    }

    private SchemaBuilder newBuilder(FieldTypeResolver resolver) {
        return new SchemaBuilder(resolver, inferenceConfig.getSampleLimit(),
                inferenceConfig.getPreviewSize());
    }

    private static Attribute typeOf(Attribute attribute, DirectoryAttributeTypeResolver resolver) {
        return attribute.withInferredType(resolver.resolveAttribute(attribute).getType());
    }
}
