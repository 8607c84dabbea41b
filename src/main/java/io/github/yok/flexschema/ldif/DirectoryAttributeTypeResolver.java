package io.github.yok.flexschema.ldif;

import com.google.common.collect.ImmutableSet;
import io.github.yok.flexschema.inference.ClassificationContext;
import io.github.yok.flexschema.inference.ClassificationResult;
import io.github.yok.flexschema.inference.FieldTypeResolver;
import io.github.yok.flexschema.inference.SemanticType;
import io.github.yok.flexschema.inference.TypeClassifier;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * {@link FieldTypeResolver} for directory attributes.
 *
 * <p>
 * Well-known attribute names are mapped first, then the values are inspected:
 * </p>
 * <ol>
 * <li>binary values, {@code photo}/{@code jpegPhoto}: Binary</li>
 * <li>{@code mail}: Email; {@code telephone}/{@code phone}: Telephone; {@code password}:
 * Password; {@code timestamp}: Timestamp; {@code objectClass}: Object Class</li>
 * <li>{@code count}, {@code gidNumber}, {@code uidNumber}: Integer</li>
 * <li>all values e-mail addresses: Email; all values DNs: Distinguished Name</li>
 * <li>{@link TypeClassifier} in {@link ClassificationContext#DIRECTORY} context; a String result
 * whose values are all hex strings longer than 16 characters becomes Binary Hash</li>
 * </ol>
 */
@Getter
@RequiredArgsConstructor
public class DirectoryAttributeTypeResolver implements FieldTypeResolver {

    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Pattern DISTINGUISHED_NAME =
            Pattern.compile("^[A-Za-z][\\w.-]*=[^,=]+(,\\s*[A-Za-z][\\w.-]*=[^,=]+)+$");

    private static final Pattern HEX = Pattern.compile("^[a-fA-F0-9]+$");

    private static final int HASH_MIN_LENGTH = 17;

    private static final Set<String> INTEGER_NAMES = ImmutableSet.of("gidnumber", "uidnumber");

    private final TypeClassifier classifier;

    /**
     * {@inheritDoc}
     */
    @Override
    public ClassificationResult resolve(String fieldName, List<String> samples) {
        boolean binary = samples.stream().anyMatch(BinaryHeuristic::isBinary);
        return resolve(fieldName, samples, binary);
    }

    /**
     * Resolves the type of a parsed attribute, honoring its binary flag.
     *
     * @param attribute parsed attribute
     * @return inferred type and recommended length
     */
    public ClassificationResult resolveAttribute(Attribute attribute) {
        return resolve(attribute.getName(), attribute.getValues(), attribute.isBinary());
    }

    private ClassificationResult resolve(String fieldName, List<String> samples,
            boolean binary) {
        SemanticType hinted = typeFromName(fieldName.toLowerCase(Locale.ROOT), binary);
        if (hinted == SemanticType.INTEGER) {
            return new ClassificationResult(hinted, ClassificationContext.DIRECTORY
                    .getIntegerLength());
        }
        if (hinted != null) {
            return ClassificationResult.of(hinted);
        }
        if (!samples.isEmpty() && allMatch(samples, EMAIL)) {
            return ClassificationResult.of(SemanticType.EMAIL);
        }
        if (!samples.isEmpty() && allMatch(samples, DISTINGUISHED_NAME)) {
            return ClassificationResult.of(SemanticType.DISTINGUISHED_NAME);
        }

        ClassificationResult result = classifier.classify(samples, ClassificationContext.DIRECTORY);
        if (result.getType() == SemanticType.STRING && !samples.isEmpty()
                && samples.stream().allMatch(
                        s -> s.length() >= HASH_MIN_LENGTH && HEX.matcher(s).matches())) {
            return ClassificationResult.of(SemanticType.BINARY_HASH);
        }
        return result;
    }

    private static SemanticType typeFromName(String name, boolean binary) {
        if (binary || name.contains("photo")) {
            return SemanticType.BINARY;
        }
        if (name.contains("mail")) {
            return SemanticType.EMAIL;
        }
        if (name.contains("telephone") || name.contains("phone")) {
            return SemanticType.TELEPHONE;
        }
        if (name.contains("password")) {
            return SemanticType.PASSWORD;
        }
        if (name.contains("objectclass")) {
            return SemanticType.OBJECT_CLASS;
        }
        if (name.contains("timestamp")) {
            return SemanticType.TIMESTAMP;
        }
        if (name.contains("count") || INTEGER_NAMES.contains(name)) {
            return SemanticType.INTEGER;
        }
        return null;
    }

    private static boolean allMatch(List<String> samples, Pattern pattern) {
        return samples.stream().allMatch(s -> pattern.matcher(s).matches());
    }
}
