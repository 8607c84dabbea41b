package io.github.yok.flexschema.inference;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Classifies a bounded sample of string values into a {@link SemanticType}.
 *
 * <p>
 * Rules are evaluated in order and the first one whose matching fraction exceeds the threshold of
 * the {@link ClassificationContext} wins:
 * </p>
 * <ol>
 * <li>Date: literal layouts or any of {@link FlexibleDateParsers#GENERAL_FORMATTERS}.</li>
 * <li>Numeric: after removing {@code , $ %} the value is a finite number. Integer when more than
 * 90% of the numeric samples are exact integers, Decimal otherwise.</li>
 * <li>Boolean: one of {@code true false yes no 1 0 y n t f} (case-insensitive).</li>
 * <li>String otherwise.</li>
 * </ol>
 *
 * <p>
 * Classification never fails: an empty sample yields {@link SemanticType#STRING}. Instances are
 * immutable and thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class TypeClassifier {

    private static final Set<String> BOOLEAN_TOKENS =
            ImmutableSet.of("true", "false", "yes", "no", "1", "0", "y", "n", "t", "f");

    private static final Pattern NUMBER =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    // Share of numeric samples that must be integers for an Integer proposal
    private static final double INTEGER_SHARE = 0.9;

    // Lower bound of the recommended String length
    private final int minStringLength;

    // Upper bound of the recommended String length
    private final int maxStringLength;

    /**
     * Creates a classifier with the default String length bounds (10 to 4000).
     */
    public TypeClassifier() {
        this(10, 4000);
    }

    /**
     * Creates a classifier with custom String length bounds.
     *
     * @param minStringLength lower bound of the recommended String length
     * @param maxStringLength upper bound of the recommended String length
     * @throws IllegalArgumentException if the bounds are not positive or are inverted
     */
    public TypeClassifier(int minStringLength, int maxStringLength) {
        Preconditions.checkArgument(minStringLength > 0, "minStringLength must be positive");
        Preconditions.checkArgument(maxStringLength >= minStringLength,
                "maxStringLength must not be smaller than minStringLength");
        this.minStringLength = minStringLength;
        this.maxStringLength = maxStringLength;
    }

    /**
     * Classifies the samples and recommends a storage length.
     *
     * @param samples non-null, non-empty sample values (already filtered by the caller)
     * @param context source context selecting thresholds and numeric lengths
     * @return inferred type and recommended length
     */
    public ClassificationResult classify(List<String> samples, ClassificationContext context) {
        SemanticType type = classifyType(samples, context);
        return new ClassificationResult(type, recommendLength(type, samples, context));
    }

    /**
     * Infers only the semantic type of the samples.
     *
     * @param samples non-null, non-empty sample values
     * @param context source context selecting thresholds
     * @return inferred type
     */
    public SemanticType classifyType(List<String> samples, ClassificationContext context) {
        if (samples.isEmpty()) {
            return SemanticType.STRING;
        }
        double total = samples.size();

        long dateCount = samples.stream().filter(FlexibleDateParsers::isDateLike).count();
        if (dateCount / total > context.getDateThreshold()) {
            return SemanticType.DATE;
        }

        long numericCount = samples.stream().filter(TypeClassifier::isNumeric).count();
        if (numericCount / total > context.getNumericThreshold()) {
            long integerCount = samples.stream().filter(TypeClassifier::isInteger).count();
            return (double) integerCount / numericCount > INTEGER_SHARE ? SemanticType.INTEGER
                    : SemanticType.DECIMAL;
        }

        long booleanCount = samples.stream().filter(TypeClassifier::isBooleanLike).count();
        if (booleanCount / total > context.getBooleanThreshold()) {
            return SemanticType.BOOLEAN;
        }

        log.debug("No rule matched {} samples; falling back to String", samples.size());
        return SemanticType.STRING;
    }

    /**
     * Recommends a storage length for the given type.
     *
     * <ul>
     * <li>String: longest sample clamped to {@code [minStringLength, maxStringLength]}, or the
     * context default when there is no sample.</li>
     * <li>Integer / Decimal: fixed length of the context.</li>
     * <li>Other types: {@code null}.</li>
     * </ul>
     *
     * @param type inferred type
     * @param samples sample values
     * @param context source context
     * @return recommended length, or {@code null}
     */
    public Integer recommendLength(SemanticType type, List<String> samples,
            ClassificationContext context) {
        switch (type) {
            case STRING:
                if (samples.isEmpty()) {
                    return context.getEmptyStringLength();
                }
                int longest = samples.stream().mapToInt(String::length).max().orElse(0);
                return Math.min(Math.max(longest, minStringLength), maxStringLength);
            case INTEGER:
                return context.getIntegerLength();
            case DECIMAL:
                return context.getDecimalLength();
            default:
                return null;
        }
    }

    /**
     * Determines whether the value is a finite number once {@code , $ %} are removed.
     *
     * @param value sample value
     * @return {@code true} if numeric
     */
    public static boolean isNumeric(String value) {
        return parseNumber(value) != null;
    }

    /**
     * Determines whether the value is numeric and has no fractional part.
     *
     * @param value sample value
     * @return {@code true} if the value is an exact integer
     */
    public static boolean isInteger(String value) {
        Double number = parseNumber(value);
        return number != null && number == Math.rint(number);
    }

    /**
     * Determines whether the value is one of the recognized boolean tokens.
     *
     * @param value sample value
     * @return {@code true} if boolean-like
     */
    public static boolean isBooleanLike(String value) {
        return BOOLEAN_TOKENS.contains(StringUtils.trimToEmpty(value).toLowerCase(Locale.ROOT));
    }

    private static Double parseNumber(String value) {
        String stripped = StringUtils.trimToEmpty(StringUtils.replaceChars(value, ",$%", ""));
        if (!NUMBER.matcher(stripped).matches()) {
            return null;
        }
        double number = Double.parseDouble(stripped);
        return Double.isFinite(number) ? number : null;
    }
}
