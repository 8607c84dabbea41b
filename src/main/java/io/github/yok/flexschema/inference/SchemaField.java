package io.github.yok.flexschema.inference;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Proposed definition of one field.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SchemaField {

    private final String name;

    private final SemanticType type;

    private final boolean nullable;

    private final boolean multiValued;

    // null when the type carries no length
    private final Integer recommendedLength;

    // at most previewSize entries, for display only
    private final List<String> sampleValues;
}
