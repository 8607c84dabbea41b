package io.github.yok.flexschema.inference;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;

/**
 * Samples collected for one field, the input of {@link SchemaBuilder}.
 *
 * <p>
 * {@link #getSamples()} keeps first-seen order and may contain {@code null}. {@code recordCount}
 * counts every record that contained the field, independently of the sample limit.
 * </p>
 */
@Getter
@ToString
public class FieldObservation {

    private final String fieldName;

    private final List<String> samples;

    // true if any occurrence was null or empty
    private final boolean declaredNullableHint;

    private final int recordCount;

    // true if some record contributed more than one value
    private final boolean multiValued;

    /**
     * Creates an observation.
     *
     * @param fieldName field name
     * @param samples sample values, may contain {@code null}
     * @param declaredNullableHint whether a null/absent occurrence was seen
     * @param recordCount number of records that contained the field
     * @param multiValued whether a record contributed more than one value
     */
    public FieldObservation(String fieldName, List<String> samples, boolean declaredNullableHint,
            int recordCount, boolean multiValued) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.declaredNullableHint = declaredNullableHint;
        this.recordCount = recordCount;
        this.multiValued = multiValued;
    }

    /**
     * Creates an observation where every sample comes from a distinct record.
     *
     * @param fieldName field name
     * @param samples sample values, may contain {@code null}
     * @return observation whose nullable hint reflects the presence of {@code null} samples
     */
    public static FieldObservation of(String fieldName, List<String> samples) {
        return new FieldObservation(fieldName, samples,
                samples.stream().anyMatch(Objects::isNull), samples.size(), false);
    }

    /**
     * Returns the non-null, non-empty samples.
     *
     * @return filtered samples in first-seen order
     */
    public List<String> getPresentSamples() {
        return samples.stream().filter(s -> s != null && !s.isEmpty())
                .collect(ImmutableList.toImmutableList());
    }
}
