package io.github.yok.flexschema.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Property class that holds the sampling limits of schema inference.
 *
 * <p>
 * Specify the following properties in {@code application.yml} or {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code inference.sample-limit}: maximum samples kept per field (default 100)</li>
 * <li>{@code inference.preview-size}: sample values exposed per field (default 5)</li>
 * <li>{@code inference.min-string-length}: lower bound of recommended String length (default
 * 10)</li>
 * <li>{@code inference.max-string-length}: upper bound of recommended String length (default
 * 4000)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "inference")
@Getter
@Setter
@NoArgsConstructor
public class InferenceConfig {

    private int sampleLimit = 100;

    private int previewSize = 5;

    private int minStringLength = 10;

    private int maxStringLength = 4000;
}
