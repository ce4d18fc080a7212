package com.checkpoint.core.flags;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FieldNameMapper}.
 */
class FieldNameMapperTest {

    @ParameterizedTest
    @CsvSource({
        "dry-run, DryRun",
        "output, Output",
        "max-retry-count, MaxRetryCount",
        "log_level, LogLevel",
        "already-Upper, AlreadyUpper",
        "--double--dash, DoubleDash"
    })
    void transform_stripsSeparatorsAndTitleCases(String longForm, String expected) {
        assertThat(FieldNameMapper.transform(longForm)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
        "json, JSON",
        "jsonl, JSONL",
        "csv, CSV",
        "help, ShowHelp",
        "version, ShowVersion",
        "config, ConfigFile",
        "log-json, LogJSON",
        "format, OutputFormat"
    })
    void fieldNameFor_usesOverridesFirst(String longForm, String expected) {
        assertThat(new FieldNameMapper().fieldNameFor(longForm)).isEqualTo(expected);
    }

    @Test
    void fieldNameFor_extraOverridesWinOverDefaults() {
        FieldNameMapper mapper = new FieldNameMapper(Map.of("format", "Fmt", "dry-run", "Preview"));

        assertThat(mapper.fieldNameFor("format")).isEqualTo("Fmt");
        assertThat(mapper.fieldNameFor("dry-run")).isEqualTo("Preview");
        assertThat(mapper.fieldNameFor("json")).isEqualTo("JSON");
        assertThat(mapper.fieldNameFor("quiet")).isEqualTo("Quiet");
    }
}
