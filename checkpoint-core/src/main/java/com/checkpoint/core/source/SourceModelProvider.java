package com.checkpoint.core.source;

import com.checkpoint.core.util.PathUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Builds {@link SourceModel}s from source files.
 *
 * @see JavaParserSourceModelProvider
 */
public interface SourceModelProvider {

    /**
     * Builds a model from source text.
     *
     * @param location name used in diagnostics
     * @param content source text
     * @return model, empty if the text cannot be parsed
     */
    Optional<SourceModel> parse(String location, String content);

    /**
     * Builds a model from a file. The file is decoded as UTF-8; bytes that
     * are not valid UTF-8 are replaced, so a stray Latin-1 comment does not
     * make the file unreadable.
     *
     * @param file source file
     * @return model, empty if the file cannot be parsed
     * @throws IOException if the file cannot be read
     */
    default Optional<SourceModel> load(Path file) throws IOException {
        return parse(file.toString(), PathUtils.readString(file));
    }
}
