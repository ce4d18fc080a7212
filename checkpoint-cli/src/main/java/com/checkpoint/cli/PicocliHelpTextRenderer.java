package com.checkpoint.cli;

import com.checkpoint.core.flags.HelpTextRenderer;
import picocli.CommandLine;

import java.util.function.Supplier;

/**
 * Renders the usage text of a picocli command tree, subcommands included.
 */
public class PicocliHelpTextRenderer implements HelpTextRenderer {

    private final Supplier<CommandLine> commandLine;

    /**
     * @param commandLine supplies a fresh command line for every rendering
     */
    public PicocliHelpTextRenderer(Supplier<CommandLine> commandLine) {
        this.commandLine = commandLine;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        append(commandLine.get(), sb);
        return sb.toString();
    }

    private static void append(CommandLine command, StringBuilder sb) {
        sb.append(command.getUsageMessage(CommandLine.Help.Ansi.OFF)).append('\n');
        for (CommandLine subcommand : command.getSubcommands().values()) {
            append(subcommand, sb);
        }
    }
}
