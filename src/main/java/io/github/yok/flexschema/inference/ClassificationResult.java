package io.github.yok.flexschema.inference;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inferred type of one field together with the recommended storage length.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ClassificationResult {

    private final SemanticType type;

    /**
     * Recommended storage length, or {@code null} when the type carries no length.
     */
    private final Integer recommendedLength;

    /**
     * Creates a result for a type that has no recommended length.
     *
     * @param type inferred type
     * @return result without length
     */
    public static ClassificationResult of(SemanticType type) {
        return new ClassificationResult(type, null);
    }
}
