package io.github.yok.flexschema.parser;

import io.github.yok.flexschema.inference.SchemaResult;

/**
 * Reads a schema that a file declares explicitly instead of inferring it from sample records.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DeclaredSchemaSource {

    /**
     * Reads the declared fields of the given schema document.
     *
     * @param content decoded schema document
     * @return schema whose fields follow declaration order; {@code totalRecords} is {@code 0}
     * @throws MalformedContentException if the content is not a schema of this format
     */
    SchemaResult readSchema(String content) throws MalformedContentException;
}
