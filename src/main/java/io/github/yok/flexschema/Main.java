package io.github.yok.flexschema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import io.github.yok.flexschema.config.InferenceConfig;
import io.github.yok.flexschema.config.ReaderConfig;
import io.github.yok.flexschema.core.ContentReader;
import io.github.yok.flexschema.core.LdifAnalysis;
import io.github.yok.flexschema.core.SchemaInferenceService;
import io.github.yok.flexschema.inference.ClassificationContext;
import io.github.yok.flexschema.inference.SchemaField;
import io.github.yok.flexschema.inference.SchemaResult;
import io.github.yok.flexschema.parser.DataFormat;
import io.github.yok.flexschema.parser.ParseOptions;
import io.github.yok.flexschema.parser.RecordSourceFactory;
import io.github.yok.flexschema.util.ErrorHandler;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads one input file, proposes its schema and prints the result as JSON to standard output.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --file <path>} or {@code -f <path>}: input file (required).</li>
 * <li>{@code --format <name>} or {@code -t <name>}: one of {@code ldif}, {@code delimited},
 * {@code json}, {@code positional}, {@code regex}, {@code avro-schema}. Resolved from the file
 * extension when omitted.</li>
 * <li>{@code --delimiter <char>} or {@code -d <char>}: field separator of delimited files;
 * {@code \t} or {@code tab} for TAB. Auto-detected when omitted.</li>
 * <li>{@code --no-header}: the first delimited row is data.</li>
 * <li>{@code --widths <w1,w2,...>} or {@code -w <w1,w2,...>}: positional column widths.</li>
 * <li>{@code --pattern <regex>} or {@code -p <regex>}: pattern applied to each line.</li>
 * <li>{@code --context <name>} or {@code -c <name>}: {@code delimited}, {@code spreadsheet} or
 * {@code directory}.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link InferenceConfig} and {@link ReaderConfig} from {@code application.yml}.
 * </p>
 *
 * @see SchemaInferenceService
 * @see ContentReader
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({InferenceConfig.class, ReaderConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ContentReader contentReader;
    private final SchemaInferenceService inferenceService;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String filePath = null;
        String formatName = null;
        ParseOptions options = ParseOptions.defaults();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--file":
                    case "-f":
                        filePath = (i + 1 < args.length ? args[++i] : null);
                        break;
                    case "--format":
                    case "-t":
                        formatName = (i + 1 < args.length ? args[++i] : null);
                        break;
                    case "--delimiter":
                    case "-d":
                        if (i + 1 < args.length) {
                            options.setDelimiter(parseDelimiter(args[++i]));
                        }
                        break;
                    case "--no-header":
                        options.setHasHeader(false);
                        break;
                    case "--widths":
                    case "-w":
                        if (i + 1 < args.length) {
                            options.setColumnWidths(parseWidths(args[++i]));
                        }
                        break;
                    case "--pattern":
                    case "-p":
                        options.setPattern(i + 1 < args.length ? args[++i] : null);
                        break;
                    case "--context":
                    case "-c":
                        if (i + 1 < args.length) {
                            options.setContext(ClassificationContext
                                    .valueOf(args[++i].trim().toUpperCase(Locale.ROOT)));
                        }
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid argument: " + e.getMessage(), e);
            return;
        }

        if (StringUtils.isBlank(filePath)) {
            ErrorHandler.errorAndExit("Input file is required (--file <path>).");
            return;
        }

        File file = new File(filePath);
        try {
            DataFormat format = StringUtils.isNotBlank(formatName)
                    ? RecordSourceFactory.formatOf(formatName)
                    : RecordSourceFactory.resolveFormat(file.getName())
                            .orElseThrow(() -> new IllegalArgumentException(
                                    "Cannot resolve format from file name: " + file.getName()));
            log.info("Inferring schema. File [{}], Format [{}], Options {}", file, format, options);

            String content = contentReader.read(file);
            ObjectNode report;
            if (format == DataFormat.LDIF) {
                report = toJson(inferenceService.analyzeLdif(content));
            } else {
                report = toJson(inferenceService.infer(format, content, options));
            }
            report.put("format", format.name());
            System.out.println(MAPPER.writeValueAsString(report));
            log.info("Schema inference completed. File [{}]", file);
        } catch (Exception e) {
            log.error("Fatal error occurred (file={}): {}", file, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the delimiter argument.
     *
     * @param value argument value
     * @return delimiter character
     * @throws IllegalArgumentException if the value is not a single character
     */
    static Character parseDelimiter(String value) {
        if ("\\t".equals(value) || "tab".equalsIgnoreCase(value)) {
            return '\t';
        }
        if (value == null || value.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: " + value);
        }
        return value.charAt(0);
    }

    /**
     * Parses a comma-separated list of column widths.
     *
     * @param value argument value, e.g. {@code 10,5,8}
     * @return widths
     * @throws NumberFormatException if an element is not an integer
     */
    static List<Integer> parseWidths(String value) {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value).stream()
                .map(Integer::valueOf).collect(Collectors.toList());
    }

    static ObjectNode toJson(SchemaResult schema) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("totalRecords", schema.getTotalRecords());
        root.put("totalFields", schema.getTotalFields());
        ArrayNode fields = root.putArray("fields");
        for (SchemaField field : schema.getFields()) {
            ObjectNode node = fields.addObject();
            node.put("name", field.getName());
            node.put("type", field.getType().getDisplayName());
            node.put("nullable", field.isNullable());
            node.put("multiValued", field.isMultiValued());
            if (field.getRecommendedLength() != null) {
                node.put("recommendedLength", field.getRecommendedLength());
            }
            ArrayNode samples = node.putArray("sampleValues");
            field.getSampleValues().forEach(samples::add);
        }
        return root;
    }

    static ObjectNode toJson(LdifAnalysis analysis) {
        ObjectNode root = toJson(analysis.getSchema());
        root.put("totalEntries", analysis.getTotalEntries());
        root.put("totalAttributes", analysis.getTotalAttributes());
        analysis.getBaseDistinguishedName().ifPresent(dn -> root.put("baseDN", dn));
        return root;
    }
}
