package io.github.yok.flexschema.inference;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@link FieldTypeResolver} that only looks at sample values, ignoring the field name.
 */
@Getter
@RequiredArgsConstructor
public class SampleFieldTypeResolver implements FieldTypeResolver {

    private final TypeClassifier classifier;

    private final ClassificationContext context;

    /**
     * {@inheritDoc}
     */
    @Override
    public ClassificationResult resolve(String fieldName, List<String> samples) {
        return classifier.classify(samples, context);
    }
}
