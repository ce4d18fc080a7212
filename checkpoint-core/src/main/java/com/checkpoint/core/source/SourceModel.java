package com.checkpoint.core.source;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Structural model of one source file.
 *
 * <p>This is the only view of source code the analysis logic depends on, so it
 * stays agnostic of the parser producing it.</p>
 *
 * @param location file the model was built from
 * @param text raw file content
 * @param imports imported identifiers
 * @param symbols declared symbols
 * @param calls call expressions in source order
 * @param memberReferences member accesses through named receivers
 */
public record SourceModel(
    String location,
    String text,
    List<String> imports,
    List<SymbolInfo> symbols,
    List<CallShape> calls,
    List<MemberReference> memberReferences
) {
    public SourceModel {
        Objects.requireNonNull(location, "location must not be null");
        if (text == null) {
            text = "";
        }
        imports = imports == null ? List.of() : List.copyOf(imports);
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        calls = calls == null ? List.of() : List.copyOf(calls);
        memberReferences = memberReferences == null ? List.of() : List.copyOf(memberReferences);
    }

    /**
     * Checks whether {@code member} is accessed through any of the given receivers.
     *
     * @param receivers accepted receiver names
     * @param member member name
     * @return true if such a reference exists
     */
    public boolean referencesMember(Collection<String> receivers, String member) {
        return memberReferences.stream()
            .anyMatch(ref -> receivers.contains(ref.receiver()) && ref.member().equals(member));
    }
}
