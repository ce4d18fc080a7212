package com.checkpoint.core.flags;

import com.checkpoint.core.model.ConflictType;
import com.checkpoint.core.model.FlagConflict;
import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.model.ImplementationStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Markdown table summarizing reconciled flags. Status and conflict cells use
 * the labels of {@link ImplementationStatus} and {@link ConflictType}.
 */
public final class FlagStatusReport {

    static final String UNCLASSIFIED = "Unclassified";

    private FlagStatusReport() {
        // Utility class
    }

    public static String render(List<FlagStatus> flags) {
        StringBuilder sb = new StringBuilder();
        sb.append("# CLI Flag Status and Conflict Report\n\n");
        sb.append("| Flag | Status | Help | Docs | Plan | Conflicts |\n");
        sb.append("|------|--------|------|------|------|-----------|\n");
        for (FlagStatus flag : flags) {
            String conflicts = flag.getConflicts().isEmpty()
                ? "None"
                : flag.getConflicts().stream()
                    .map(FlagConflict::type)
                    .map(ConflictType::label)
                    .collect(Collectors.joining(", "));
            sb.append(String.format("| --%s | %s | %s | %s | %s | %s |\n",
                flag.getLongForm(),
                flag.getStatus() != null ? flag.getStatus().label() : UNCLASSIFIED,
                mark(flag.isDefinedInHelp()),
                mark(flag.isDefinedInDocs()),
                mark(flag.isDefinedInPlanning()),
                conflicts));
        }
        return sb.toString();
    }

    private static String mark(boolean present) {
        return present ? "yes" : "no";
    }
}
