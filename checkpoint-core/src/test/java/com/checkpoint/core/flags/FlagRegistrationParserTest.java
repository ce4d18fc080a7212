package com.checkpoint.core.flags;

import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.source.CallArgument;
import com.checkpoint.core.source.CallShape;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FlagRegistrationParser}.
 */
class FlagRegistrationParserTest {

    private final FlagRegistrationParser parser = new FlagRegistrationParser(List.of("Var", "VarP"), "P");

    @Test
    void parse_longAndShortShape_readsShortFormAndDescription() {
        CallShape call = new CallShape("fs", "boolVarP", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("verbose"),
            CallArgument.literal("v"),
            CallArgument.expression("false"),
            CallArgument.literal("Verbose output")));

        FlagStatus flag = parser.parse(call).orElseThrow();

        assertThat(flag.getLongForm()).isEqualTo("verbose");
        assertThat(flag.getName()).isEqualTo("verbose");
        assertThat(flag.getShortForm()).isEqualTo("v");
        assertThat(flag.getDescription()).isEqualTo("Verbose output");
        assertThat(flag.isDefinedInCode()).isTrue();
        assertThat(flag.getStatus()).isNull();
    }

    @Test
    void parse_longOnlyShape_readsDescriptionAtFourthPosition() {
        CallShape call = new CallShape("fs", "stringVar", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("output"),
            CallArgument.literal(""),
            CallArgument.literal("Output file")));

        FlagStatus flag = parser.parse(call).orElseThrow();

        assertThat(flag.getLongForm()).isEqualTo("output");
        assertThat(flag.getShortForm()).isEmpty();
        assertThat(flag.getDescription()).isEqualTo("Output file");
    }

    @Test
    void parse_shortShapeWithoutDescription_keepsShortForm() {
        CallShape call = new CallShape("fs", "intVarP", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("jobs"),
            CallArgument.literal("j"),
            CallArgument.expression("4")));

        FlagStatus flag = parser.parse(call).orElseThrow();

        assertThat(flag.getShortForm()).isEqualTo("j");
        assertThat(flag.getDescription()).isEmpty();
    }

    @Test
    void parse_threeArguments_isAcceptedWithoutDescription() {
        CallShape call = new CallShape("fs", "boolVar", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("force"),
            CallArgument.expression("false")));

        assertThat(parser.parse(call)).map(FlagStatus::getDescription).contains("");
    }

    @Test
    void parse_tooFewArguments_isIgnored() {
        CallShape call = new CallShape("fs", "boolVar", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("force")));

        assertThat(parser.parse(call)).isEmpty();
    }

    @Test
    void parse_unrecognizedSuffix_isIgnored() {
        CallShape call = new CallShape("fs", "parse", List.of(
            CallArgument.expression("cfg"),
            CallArgument.literal("force"),
            CallArgument.expression("false")));

        assertThat(parser.parse(call)).isEmpty();
    }

    @Test
    void parse_nonLiteralName_isIgnored() {
        CallShape call = new CallShape("fs", "boolVar", List.of(
            CallArgument.expression("cfg"),
            CallArgument.expression("NAME_CONSTANT"),
            CallArgument.expression("false")));

        Optional<FlagStatus> flag = parser.parse(call);

        assertThat(flag).isEmpty();
    }
}
