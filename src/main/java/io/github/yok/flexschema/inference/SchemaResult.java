package io.github.yok.flexschema.inference;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Proposed schema plus the aggregate counts displayed next to it.
 */
@Getter
@AllArgsConstructor
@ToString
public class SchemaResult {

    // Fields in first-seen (source file) order
    private final List<SchemaField> fields;

    private final int totalRecords;

    /**
     * Returns the number of proposed fields.
     *
     * @return field count
     */
    public int getTotalFields() {
        return fields.size();
    }
}
