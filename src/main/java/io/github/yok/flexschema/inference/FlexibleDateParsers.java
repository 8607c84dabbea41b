package io.github.yok.flexschema.inference;

import com.google.common.collect.ImmutableList;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Shared date recognizers used by {@link TypeClassifier}.
 *
 * <p>
 * A value is date-like when it matches one of the literal layouts in {@link #LITERAL_PATTERNS} or
 * when one of the {@link #GENERAL_FORMATTERS} parses it completely. Bare integers are never
 * date-like, so that columns such as {@code 1, 2, 3} or {@code 20240101} stay numeric.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexibleDateParsers {

    /**
     * Literal layouts checked without calendar validation.
     * <ol>
     * <li>{@code YYYY-MM-DD}</li>
     * <li>{@code MM/DD/YYYY}</li>
     * <li>{@code MM-DD-YYYY}</li>
     * <li>{@code YYYY/MM/DD}</li>
     * </ol>
     */
    public static final List<Pattern> LITERAL_PATTERNS =
            ImmutableList.of(Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$"),
                    Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$"),
                    Pattern.compile("^\\d{2}-\\d{2}-\\d{4}$"),
                    Pattern.compile("^\\d{4}/\\d{2}/\\d{2}$"));

    /**
     * Local date-time with a space or {@code T} separator, optional seconds and optional fraction.
     */
    public static final DateTimeFormatter FLEXIBLE_LOCAL_DATE_TIME =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .optionalStart().appendLiteral(' ').optionalEnd().optionalStart()
                    .appendLiteral('T').optionalEnd().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    /**
     * Directory generalized time, e.g. {@code 20240101120000Z} or {@code 20240101120000.5+0900}.
     */
    public static final DateTimeFormatter GENERALIZED_TIME =
            new DateTimeFormatterBuilder().appendPattern("uuuuMMddHHmmss").optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .appendOffset("+HHMM", "Z").toFormatter();

    /**
     * General formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy-MM-dd[ |T]HH:mm[:ss][.fraction]}</li>
     * <li>ISO offset date-time and instant</li>
     * <li>{@code yyyy/MM/dd}, {@code yyyy.MM.dd}, {@code dd.MM.yyyy}, {@code MM/dd/yyyy}</li>
     * <li>RFC 1123</li>
     * <li>generalized time</li>
     * <li>{@code yyyy年M月d日} (Japanese)</li>
     * </ol>
     */
    public static final List<DateTimeFormatter> GENERAL_FORMATTERS =
            ImmutableList.of(DateTimeFormatter.ISO_LOCAL_DATE, FLEXIBLE_LOCAL_DATE_TIME,
                    DateTimeFormatter.ISO_OFFSET_DATE_TIME, DateTimeFormatter.ISO_INSTANT,
                    DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                    DateTimeFormatter.ofPattern("yyyy.MM.dd"),
                    DateTimeFormatter.ofPattern("dd.MM.yyyy"),
                    DateTimeFormatter.ofPattern("MM/dd/yyyy"),
                    DateTimeFormatter.RFC_1123_DATE_TIME, GENERALIZED_TIME,
                    DateTimeFormatter.ofPattern("yyyy年M月d日", Locale.JAPANESE));

    private static final Pattern BARE_INTEGER = Pattern.compile("^[+-]?\\d+$");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private FlexibleDateParsers() {}

    /**
     * Determines whether the given value looks like a date.
     *
     * @param value trimmed, non-empty sample value
     * @return {@code true} if a literal layout matches or a general formatter parses the value
     */
    public static boolean isDateLike(String value) {
        if (BARE_INTEGER.matcher(value).matches()) {
            return false;
        }
        for (Pattern pattern : LITERAL_PATTERNS) {
            if (pattern.matcher(value).matches()) {
                return true;
            }
        }
        for (DateTimeFormatter formatter : GENERAL_FORMATTERS) {
            try {
                formatter.parse(value);
                return true;
            } catch (DateTimeParseException e) {
                // try the next formatter
            }
        }
        return false;
    }
}
