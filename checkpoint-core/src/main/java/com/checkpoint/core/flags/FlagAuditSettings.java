package com.checkpoint.core.flags;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Where the flag reconciliation looks for each of its sources, and how it
 * recognizes flag registrations.
 *
 * <p>Missing values fall back to {@link #defaults()}.</p>
 *
 * @param configPackage last segment of the package holding flag registrations
 * @param mainSource main entry source, relative to the project root
 * @param receivers identifiers through which configuration fields are accessed
 * @param registrationSuffixes member-name suffixes of flag registration calls
 * @param shortFormMarker suffix marking registrations that also carry a short form
 * @param userDocs user-facing documentation files, relative to the project root
 * @param planningDocs internal planning documents, relative to the project root
 * @param fieldOverrides extra long-form to field-name mappings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlagAuditSettings(
    @JsonProperty("configPackage") String configPackage,
    @JsonProperty("mainSource") String mainSource,
    @JsonProperty("receivers") List<String> receivers,
    @JsonProperty("registrationSuffixes") List<String> registrationSuffixes,
    @JsonProperty("shortFormMarker") String shortFormMarker,
    @JsonProperty("userDocs") List<String> userDocs,
    @JsonProperty("planningDocs") List<String> planningDocs,
    @JsonProperty("fieldOverrides") Map<String, String> fieldOverrides
) {
    static final List<String> DEFAULT_USER_DOCS = List.of(
        "README.md",
        "docs/user/dry-run.md",
        "docs/user/examples.md",
        "docs/user/filtering.md",
        "docs/user/incremental.md",
        "docs/user/command-reference.md"
    );

    static final List<String> DEFAULT_PLANNING_DOCS = List.of(
        "docs/checkpoint/checkpoint_design.md",
        "docs/checkpoint/checkpoint_requirements.md",
        "docs/remediation/audit_remediation_plan.md",
        "docs/remediation/remediation_tasks.md",
        "docs/dev/flag_conflicts.md",
        "docs/design/new_conflict_resolution.md"
    );

    /**
     * Compact constructor filling in defaults.
     */
    public FlagAuditSettings {
        if (configPackage == null || configPackage.isBlank()) {
            configPackage = "config";
        }
        if (mainSource == null || mainSource.isBlank()) {
            mainSource = "src/main/java/Main.java";
        }
        receivers = receivers == null || receivers.isEmpty() ? List.of("cfg", "c", "config") : List.copyOf(receivers);
        registrationSuffixes = registrationSuffixes == null || registrationSuffixes.isEmpty()
            ? List.of("Var", "VarP") : List.copyOf(registrationSuffixes);
        if (shortFormMarker == null || shortFormMarker.isEmpty()) {
            shortFormMarker = "P";
        }
        userDocs = userDocs == null ? DEFAULT_USER_DOCS : List.copyOf(userDocs);
        planningDocs = planningDocs == null ? DEFAULT_PLANNING_DOCS : List.copyOf(planningDocs);
        fieldOverrides = fieldOverrides == null ? Map.of() : Map.copyOf(fieldOverrides);
    }

    /**
     * Returns the settings used when nothing is configured.
     *
     * @return default settings
     */
    public static FlagAuditSettings defaults() {
        return new FlagAuditSettings(null, null, null, null, null, null, null, null);
    }
}
