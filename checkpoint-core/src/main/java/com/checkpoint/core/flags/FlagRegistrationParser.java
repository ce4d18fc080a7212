package com.checkpoint.core.flags;

import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.source.CallShape;

import java.util.List;
import java.util.Optional;

/**
 * Recognizes flag registration calls and extracts the flag they declare.
 *
 * <p>A registration is a call whose member name ends in one of the registration
 * suffixes and that carries at least three arguments. Two shapes exist:
 * <ul>
 *   <li>long-only, e.g. {@code flags.stringVar(&amp;target, "output", "", "Output file")}:
 *       long name at position 1, description at position 3</li>
 *   <li>long+short (member name ends with the short-form marker), e.g.
 *       {@code flags.boolVarP(ref, "verbose", "v", false, "Verbose output")}:
 *       long name at 1, short name at 2, description at 4</li>
 * </ul>
 * Only string literal arguments are read; a call without a literal long name is ignored.</p>
 */
public final class FlagRegistrationParser {

    private final List<String> suffixes;
    private final String shortFormMarker;

    public FlagRegistrationParser(List<String> suffixes, String shortFormMarker) {
        this.suffixes = List.copyOf(suffixes);
        this.shortFormMarker = shortFormMarker;
    }

    /**
     * Parses a call expression.
     *
     * @param call call shape
     * @return declared flag, marked as defined in code, or empty if the call is not a registration
     */
    public Optional<FlagStatus> parse(CallShape call) {
        String member = call.name();
        if (suffixes.stream().noneMatch(member::endsWith)) {
            return Optional.empty();
        }
        int argumentCount = call.arguments().size();
        if (argumentCount < 3) {
            return Optional.empty();
        }

        Optional<String> longForm = call.literalArgument(1).filter(name -> !name.isEmpty());
        if (longForm.isEmpty()) {
            return Optional.empty();
        }

        FlagStatus status = new FlagStatus(longForm.get());
        status.setDefinedInCode(true);

        boolean withShortForm = member.endsWith(shortFormMarker);
        if (withShortForm && argumentCount >= 4) {
            call.literalArgument(2).ifPresent(status::setShortForm);
            call.literalArgument(4).ifPresent(status::setDescription);
        } else if (argumentCount >= 4) {
            call.literalArgument(3).ifPresent(status::setDescription);
        }
        return Optional.of(status);
    }
}
