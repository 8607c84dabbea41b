package io.github.yok.flexschema.parser;

import io.github.yok.flexschema.inference.SampleRecord;
import java.util.List;

/**
 * Extracts {@link SampleRecord records} from the content of one file format.
 *
 * <p>
 * Implementations are stateless: the result depends only on the content and the options.
 * </p>
 */
public interface RecordSource {

    /**
     * Reads the records of the given content.
     *
     * @param content decoded file content
     * @param options caller options
     * @return records in file order
     * @throws MalformedContentException if the content cannot be read as this format at all
     */
    List<SampleRecord> read(String content, ParseOptions options)
            throws MalformedContentException;
}
