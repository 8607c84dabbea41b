package io.github.yok.flexschema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.yok.flexschema.core.ContentReader;
import io.github.yok.flexschema.core.LdifAnalysis;
import io.github.yok.flexschema.core.SchemaInferenceService;
import io.github.yok.flexschema.inference.ClassificationContext;
import io.github.yok.flexschema.inference.SchemaField;
import io.github.yok.flexschema.inference.SchemaResult;
import io.github.yok.flexschema.inference.SemanticType;
import io.github.yok.flexschema.parser.DataFormat;
import io.github.yok.flexschema.parser.MalformedContentException;
import io.github.yok.flexschema.parser.ParseOptions;
import io.github.yok.flexschema.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private static final SchemaResult CSV_SCHEMA = new SchemaResult(
            List.of(new SchemaField("id", SemanticType.INTEGER, false, false, 15, List.of("1")),
                    new SchemaField("joined", SemanticType.DATE, true, false, null,
                            List.of("2024-01-01"))),
            2);

    private ContentReader contentReader;
    private SchemaInferenceService inferenceService;

    private Main main;

    @BeforeEach
    void setup() {
        contentReader = mock(ContentReader.class);
        inferenceService = mock(SchemaInferenceService.class);
        main = new Main(contentReader, inferenceService);
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);

                    Class<?>[] sources = (Class<?>[]) ctx.arguments().get(0);
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--file", "people.ldif"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--file"), eq("people.ldif"));
        }
    }

    @Test
    void run_正常ケース_CSVファイル_拡張子から形式が解決されJSONが出力されること() throws Exception {
        when(contentReader.read(any(File.class))).thenReturn("id,joined\n1,2024-01-01\n");
        when(inferenceService.infer(eq(DataFormat.DELIMITED), anyString(), any(ParseOptions.class)))
                .thenReturn(CSV_SCHEMA);

        String out = captureStdout(() -> main.run("--file", "data/EMP.csv"));

        JsonNode json = new ObjectMapper().readTree(out);
        assertEquals("DELIMITED", json.get("format").asText());
        assertEquals(2, json.get("totalRecords").asInt());
        assertEquals(2, json.get("totalFields").asInt());
        assertEquals("Integer", json.get("fields").get(0).get("type").asText());
        assertEquals(15, json.get("fields").get(0).get("recommendedLength").asInt());
        assertFalse(json.get("fields").get(1).has("recommendedLength"));
        assertTrue(json.get("fields").get(1).get("nullable").asBoolean());
    }

    @Test
    void run_正常ケース_全オプション指定_ParseOptionsに反映されること() throws Exception {
        when(contentReader.read(any(File.class))).thenReturn("x");
        when(inferenceService.infer(any(), anyString(), any())).thenReturn(CSV_SCHEMA);

        captureStdout(() -> main.run("-f", "data.txt", "-t", "positional", "-d", "tab",
                "--no-header", "-w", "4, 10,3", "-p", "(\\d+)", "-c", "spreadsheet"));

        ArgumentCaptor<ParseOptions> captor = ArgumentCaptor.forClass(ParseOptions.class);
        verify(inferenceService).infer(eq(DataFormat.POSITIONAL), eq("x"), captor.capture());
        ParseOptions options = captor.getValue();
        assertEquals('\t', options.getDelimiter());
        assertFalse(options.isHasHeader());
        assertEquals(List.of(4, 10, 3), options.getColumnWidths());
        assertEquals("(\\d+)", options.getPattern());
        assertEquals(ClassificationContext.SPREADSHEET, options.getContext());
    }

    @Test
    void run_正常ケース_LDIFファイル_エントリ数とベースDNが出力されること() throws Exception {
        when(contentReader.read(any(File.class))).thenReturn("dn: cn=A,dc=example,dc=com");
        LdifAnalysis analysis = new LdifAnalysis(List.of(), "dc=example,dc=com",
                new SchemaResult(List.of(), 0));
        when(inferenceService.analyzeLdif("dn: cn=A,dc=example,dc=com")).thenReturn(analysis);

        String out = captureStdout(() -> main.run("--file", "people.LDIF"));

        JsonNode json = new ObjectMapper().readTree(out);
        assertEquals("LDIF", json.get("format").asText());
        assertEquals("dc=example,dc=com", json.get("baseDN").asText());
        assertEquals(0, json.get("totalEntries").asInt());
        verify(inferenceService, never()).infer(any(), anyString(), any());
    }

    @Test
    void run_異常ケース_ファイル未指定_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            mocked.when(() -> ErrorHandler.errorAndExit(anyString())).thenAnswer(inv -> {
                throw new IllegalStateException("exit");
            });

            assertThrows(IllegalStateException.class, () -> main.run("--no-header"));

            mocked.verify(
                    () -> ErrorHandler.errorAndExit(eq("Input file is required (--file <path>).")));
        }
    }

    @Test
    void run_異常ケース_拡張子から形式を解決できない_ErrorHandlerが呼ばれること() throws Exception {
        ErrorHandler.disableExitForCurrentThread();
        try {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> main.run("--file", "book.xlsx"));
            assertEquals("Fatal error: Cannot resolve format from file name: book.xlsx",
                    ex.getMessage());
            verify(contentReader, never()).read(any());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void run_異常ケース_読み込み失敗_原因付きでErrorHandlerが呼ばれること() throws Exception {
        MalformedContentException cause = new MalformedContentException("bad bytes", null);
        when(contentReader.read(any(File.class))).thenThrow(cause);

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("--file", "people.ldif");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Fatal error: bad bytes"), eq(cause)));
        }
    }

    @Test
    void run_異常ケース_不正な区切り文字_ErrorHandlerが呼ばれること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> main.run("--file", "a.csv", "--delimiter", ";;"));
            assertTrue(ex.getMessage().startsWith("Invalid argument: Delimiter must be"));
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void run_正常ケース_未知の引数はwarnされても処理継続すること() throws Exception {
        when(contentReader.read(any(File.class))).thenReturn("a\n1\n");
        when(inferenceService.infer(any(), anyString(), any())).thenReturn(CSV_SCHEMA);

        captureStdout(() -> main.run("--unknown", "--file", "a.csv"));

        verify(inferenceService).infer(eq(DataFormat.DELIMITED), eq("a\n1\n"), any());
    }

    @Test
    void parseDelimiter_正常ケース_タブ表記と1文字_文字に変換されること() {
        assertEquals('\t', Main.parseDelimiter("\\t"));
        assertEquals('\t', Main.parseDelimiter("TAB"));
        assertEquals('|', Main.parseDelimiter("|"));
        assertThrows(IllegalArgumentException.class, () -> Main.parseDelimiter(""));
    }

    @Test
    void parseWidths_異常ケース_数値でない要素_NumberFormatExceptionが送出されること() {
        assertThrows(NumberFormatException.class, () -> Main.parseWidths("4,x"));
    }

    @Test
    void toJson_正常ケース_ベースDNなし_baseDNが出力されないこと() {
        ObjectNode node = Main.toJson(new LdifAnalysis(List.of(), null, new SchemaResult(List.of(), 0)));
        assertNull(node.get("baseDN"));
        assertEquals(0, node.get("totalAttributes").asInt());
    }

    private static String captureStdout(Runnable action) {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
