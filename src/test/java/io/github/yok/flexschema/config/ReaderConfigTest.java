package io.github.yok.flexschema.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import org.junit.jupiter.api.Test;

class ReaderConfigTest {

    @Test
    void getCharset_正常ケース_既定値_UTF8が返ること() {
        ReaderConfig config = new ReaderConfig();
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
        assertTrue(config.isStripCarriageReturn());
    }

    @Test
    void getCharset_正常ケース_前後空白付きの指定_トリムして解決されること() {
        ReaderConfig config = new ReaderConfig();
        config.setEncoding(" ISO-8859-1 ");
        assertEquals(StandardCharsets.ISO_8859_1, config.getCharset());
    }

    @Test
    void getCharset_異常ケース_空白の指定_IllegalStateExceptionが送出されること() {
        ReaderConfig config = new ReaderConfig();
        config.setEncoding(" ");
        IllegalStateException ex = assertThrows(IllegalStateException.class, config::getCharset);
        assertTrue(ex.getMessage().contains("reader.encoding"));
    }

    @Test
    void getCharset_異常ケース_未知の文字コード_UnsupportedCharsetExceptionが送出されること() {
        ReaderConfig config = new ReaderConfig();
        config.setEncoding("NO-SUCH-CHARSET");
        assertThrows(UnsupportedCharsetException.class, config::getCharset);
    }
}
