package io.github.yok.flexschema.core;

import io.github.yok.flexschema.config.ReaderConfig;
import io.github.yok.flexschema.parser.MalformedContentException;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.Strings;
import org.springframework.stereotype.Component;

/**
 * Reads input files into text for schema inference.
 *
 * <p>
 * Decoding is strict: malformed or unmappable byte sequences raise
 * {@link MalformedContentException} instead of being replaced. A leading byte order mark is
 * removed and, when {@link ReaderConfig#isStripCarriageReturn()} is set, CRLF line ends are
 * converted to LF.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentReader {

    private static final String BOM = "\uFEFF";

    private final ReaderConfig readerConfig;

    /**
     * Reads and decodes a file.
     *
     * @param file input file
     * @return decoded text
     * @throws IOException if the file cannot be read
     * @throws MalformedContentException if the bytes are not valid in the configured charset
     */
    public String read(File file) throws IOException, MalformedContentException {
        byte[] bytes = FileUtils.readFileToByteArray(file);
        log.info("Read {} bytes from {}", bytes.length, file.getName());
        return decode(bytes);
    }

    /**
     * Decodes raw bytes with the configured charset.
     *
     * @param bytes raw content
     * @return decoded text
     * @throws MalformedContentException if the bytes are not valid in the configured charset
     */
    public String decode(byte[] bytes) throws MalformedContentException {
        Charset charset = readerConfig.getCharset();
        String text;
        try {
            text = charset.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedContentException(
                    "Content is not decodable as " + charset.name() + ": " + e.getMessage(), e);
        }
        text = Strings.CS.removeStart(text, BOM);
        if (readerConfig.isStripCarriageReturn()) {
            text = Strings.CS.replace(text, "\r\n", "\n");
        }
        return text;
    }
}
