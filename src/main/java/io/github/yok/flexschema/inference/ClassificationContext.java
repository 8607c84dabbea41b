package io.github.yok.flexschema.inference;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Source context a sample set was taken from.
 *
 * <p>
 * The context selects the match thresholds used by {@link TypeClassifier} and the fixed length
 * recommended for numeric types. Delimited text is the most lenient context; spreadsheet and
 * directory contexts require a larger share of matching samples.
 * </p>
 *
 * <ul>
 * <li>{@link #DELIMITED}: date &gt; 0.7, numeric &gt; 0.7, boolean &gt; 0.8</li>
 * <li>{@link #SPREADSHEET}: date &gt; 0.8, numeric &gt; 0.8, boolean &gt; 0.9</li>
 * <li>{@link #DIRECTORY}: date &gt; 0.8, numeric &gt; 0.8, boolean &gt; 0.9</li>
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum ClassificationContext {

    // Delimited text files (CSV, TSV, ...) and other line-oriented sources.
    DELIMITED(0.7, 0.7, 0.8, 15, 20, 255),

    // Tabular sources read cell by cell.
    SPREADSHEET(0.8, 0.8, 0.9, 10, 15, 50),

    // Directory exports and other record-oriented sources.
    DIRECTORY(0.8, 0.8, 0.9, 15, 20, 255);

    // Fraction of date-like samples that must be exceeded
    private final double dateThreshold;

    // Fraction of numeric samples that must be exceeded
    private final double numericThreshold;

    // Fraction of boolean-like samples that must be exceeded
    private final double booleanThreshold;

    // Recommended length for Integer fields
    private final int integerLength;

    // Recommended length for Decimal fields
    private final int decimalLength;

    // Recommended length for String fields without any sample
    private final int emptyStringLength;
}
