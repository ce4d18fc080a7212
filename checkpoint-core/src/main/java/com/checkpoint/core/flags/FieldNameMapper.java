package com.checkpoint.core.flags;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a flag's long form to the configuration field that stores its value.
 *
 * <p>An exact-match override table is consulted first; anything else goes through
 * {@link #transform(String)}, which strips separators and title-cases each word
 * ({@code dry-run -> DryRun}).</p>
 */
public final class FieldNameMapper {

    /**
     * Irregular names that the generic transform gets wrong.
     */
    public static final Map<String, String> DEFAULT_OVERRIDES = Map.of(
        "json", "JSON",
        "jsonl", "JSONL",
        "csv", "CSV",
        "help", "ShowHelp",
        "version", "ShowVersion",
        "config", "ConfigFile",
        "log-json", "LogJSON",
        "format", "OutputFormat"
    );

    private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+");

    private final Map<String, String> overrides;

    public FieldNameMapper() {
        this(Map.of());
    }

    /**
     * Creates a mapper with extra overrides layered on top of {@link #DEFAULT_OVERRIDES}.
     *
     * @param extraOverrides long form to field name entries, winning over the defaults
     */
    public FieldNameMapper(Map<String, String> extraOverrides) {
        Map<String, String> table = new HashMap<>(DEFAULT_OVERRIDES);
        table.putAll(extraOverrides);
        this.overrides = Map.copyOf(table);
    }

    /**
     * Returns the configuration field name for a flag.
     *
     * @param longForm flag name without the leading marker
     * @return field name
     */
    public String fieldNameFor(String longForm) {
        String override = overrides.get(longForm);
        return override != null ? override : transform(longForm);
    }

    /**
     * Generic transform: split on separators, upper-case the first letter of each word.
     *
     * @param longForm flag name without the leading marker
     * @return title-cased name without separators
     */
    public static String transform(String longForm) {
        StringBuilder sb = new StringBuilder();
        for (String word : SEPARATORS.split(longForm)) {
            if (word.isEmpty()) {
                continue;
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }
}
