package io.github.yok.flexschema.config;

import java.nio.charset.Charset;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class for decoding input files.
 *
 * <ul>
 * <li>{@code reader.encoding}: charset of input files (default {@code UTF-8})</li>
 * <li>{@code reader.strip-carriage-return}: convert CRLF line ends to LF before parsing (default
 * {@code true})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "reader")
@Data
public class ReaderConfig {

    private String encoding = "UTF-8";

    private boolean stripCarriageReturn = true;

    /**
     * Returns the configured charset.
     *
     * @return charset
     * @throws IllegalStateException if {@code encoding} is blank
     * @throws java.nio.charset.UnsupportedCharsetException if the charset is not available
     */
    public Charset getCharset() {
        if (StringUtils.isBlank(encoding)) {
            throw new IllegalStateException(
                    "reader.encoding is not configured. Please set 'reader.encoding' in application.yml.");
        }
        return Charset.forName(encoding.trim());
    }
}
