package io.github.yok.flexschema.parser;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexschema.inference.ClassificationContext;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Caller-supplied options for reading one file.
 *
 * <p>
 * Every option is optional; a field that does not apply to the selected format is ignored.
 * </p>
 * <ul>
 * <li>{@code delimiter}: field separator of delimited files; auto-detected when {@code null}</li>
 * <li>{@code hasHeader}: whether the first delimited row holds the column names</li>
 * <li>{@code columnWidths}: widths of positional columns; auto-detected when empty</li>
 * <li>{@code pattern}: regular expression applied to each line of regex-structured files</li>
 * <li>{@code context}: classification context; the format default when {@code null}</li>
 * </ul>
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
public class ParseOptions {

    private Character delimiter;

    private boolean hasHeader = true;

    private List<Integer> columnWidths = ImmutableList.of();

    private String pattern;

    private ClassificationContext context;

    /**
     * Returns options with all defaults.
     *
     * @return default options
     */
    public static ParseOptions defaults() {
        return new ParseOptions();
    }
}
