package io.github.yok.flexschema.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One record extracted from a source file: field names mapped to the values the record
 * contributed, in first-seen order.
 *
 * <p>
 * A field may carry several values (a multi-valued directory attribute, a JSON array) and a value
 * may be {@code null} (an empty cell, a JSON {@code null}).
 * </p>
 */
@EqualsAndHashCode
@ToString
public class SampleRecord {

    private final Map<String, List<String>> fields = new LinkedHashMap<>();

    /**
     * Appends a value for the given field.
     *
     * @param fieldName field name
     * @param value value, may be {@code null}
     * @return this record
     */
    public SampleRecord add(String fieldName, String value) {
        fields.computeIfAbsent(fieldName, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Appends all values for the given field.
     *
     * @param fieldName field name
     * @param values values, elements may be {@code null}
     * @return this record
     */
    public SampleRecord addAll(String fieldName, List<String> values) {
        fields.computeIfAbsent(fieldName, k -> new ArrayList<>()).addAll(values);
        return this;
    }

    /**
     * Returns the fields of this record in first-seen order.
     *
     * @return unmodifiable view of field name to values
     */
    public Map<String, List<String>> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Returns the values for the given field.
     *
     * @param fieldName field name
     * @return values, or an empty list if the record does not contain the field
     */
    public List<String> getValues(String fieldName) {
        return Collections.unmodifiableList(fields.getOrDefault(fieldName, List.of()));
    }
}
