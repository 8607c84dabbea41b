package io.github.yok.flexschema.inference;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates per-field samples of a record list into {@link SchemaField} definitions.
 *
 * <p>
 * For each distinct field name (in first-seen order, never alphabetical):
 * </p>
 * <ul>
 * <li>up to {@code sampleLimit} present values are kept as samples;</li>
 * <li>{@code nullable} is set when a null/empty value was seen or when the field appeared in fewer
 * records than the total;</li>
 * <li>{@code multiValued} is set when a single record contributed more than one value;</li>
 * <li>the type comes from the configured {@link FieldTypeResolver}.</li>
 * </ul>
 *
 * <p>
 * The builder holds no mutable state; each call works on its own accumulators.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class SchemaBuilder {

    private final FieldTypeResolver resolver;

    private final int sampleLimit;

    private final int previewSize;

    /**
     * Creates a builder.
     *
     * @param resolver resolver turning samples into a type
     * @param sampleLimit maximum number of samples kept per field
     * @param previewSize maximum number of sample values exposed per {@link SchemaField}
     * @throws IllegalArgumentException if a limit is not positive
     */
    public SchemaBuilder(FieldTypeResolver resolver, int sampleLimit, int previewSize) {
        Preconditions.checkNotNull(resolver, "resolver must not be null");
        Preconditions.checkArgument(sampleLimit > 0, "sampleLimit must be positive");
        Preconditions.checkArgument(previewSize > 0, "previewSize must be positive");
        this.resolver = resolver;
        this.sampleLimit = sampleLimit;
        this.previewSize = previewSize;
    }

    /**
     * Builds the schema of the given records.
     *
     * @param records extracted records
     * @return proposed schema
     */
    public SchemaResult build(List<SampleRecord> records) {
        return build(observe(records), records.size());
    }

    /**
     * Collects one {@link FieldObservation} per distinct field name.
     *
     * @param records extracted records
     * @return observations in first-seen field order
     */
    public List<FieldObservation> observe(List<SampleRecord> records) {
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        for (SampleRecord record : records) {
            for (Map.Entry<String, List<String>> field : record.getFields().entrySet()) {
                accumulators.computeIfAbsent(field.getKey(), k -> new Accumulator())
                        .accept(field.getValue());
            }
        }

        List<FieldObservation> observations = new ArrayList<>(accumulators.size());
        accumulators.forEach((name, acc) -> observations.add(new FieldObservation(name,
                acc.samples, acc.nullSeen, acc.recordCount, acc.multiValued)));
        return observations;
    }

    /**
     * Builds the schema from already collected observations.
     *
     * @param observations observations in the desired field order
     * @param totalRecords number of records the observations were taken from
     * @return proposed schema
     */
    public SchemaResult build(List<FieldObservation> observations, int totalRecords) {
        ImmutableList.Builder<SchemaField> fields = ImmutableList.builder();
        for (FieldObservation observation : observations) {
            List<String> present = observation.getPresentSamples();
            if (present.size() > sampleLimit) {
                present = present.subList(0, sampleLimit);
            }
            ClassificationResult result = resolver.resolve(observation.getFieldName(), present);
            boolean nullable = observation.isDeclaredNullableHint()
                    || observation.getRecordCount() < totalRecords;
            List<String> preview = ImmutableList
                    .copyOf(present.subList(0, Math.min(previewSize, present.size())));
            log.debug("Field [{}]: type={}, nullable={}, multiValued={}, samples={}",
                    observation.getFieldName(), result.getType(), nullable,
                    observation.isMultiValued(), present.size());
            fields.add(new SchemaField(observation.getFieldName(), result.getType(), nullable,
                    observation.isMultiValued(), result.getRecommendedLength(), preview));
        }
        SchemaResult schema = new SchemaResult(fields.build(), totalRecords);
        log.info("Schema built: {} fields from {} records", schema.getTotalFields(),
                totalRecords);
        return schema;
    }

    // Per-field running state while records are scanned.
    private final class Accumulator {

        private final List<String> samples = new ArrayList<>();
        private boolean nullSeen;
        private boolean multiValued;
        private int recordCount;

        void accept(List<String> values) {
            recordCount++;
            if (values.size() > 1) {
                multiValued = true;
            }
            if (values.isEmpty()) {
                nullSeen = true;
            }
            for (String value : values) {
                if (value == null || value.isEmpty()) {
                    nullSeen = true;
                } else if (samples.size() < sampleLimit) {
                    samples.add(value);
                }
            }
        }
    }
}
