package io.github.yok.flexschema.inference;

import java.util.List;

/**
 * Strategy that turns the present samples of one field into a type proposal.
 */
@FunctionalInterface
public interface FieldTypeResolver {

    /**
     * Resolves the type of a field.
     *
     * @param fieldName field name, available for name-based hints
     * @param samples non-null, non-empty samples in first-seen order
     * @return inferred type and recommended length
     */
    ClassificationResult resolve(String fieldName, List<String> samples);
}
