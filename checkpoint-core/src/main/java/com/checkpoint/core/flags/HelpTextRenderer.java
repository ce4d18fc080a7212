package com.checkpoint.core.flags;

/**
 * Renders the audited program's current help text.
 */
@FunctionalInterface
public interface HelpTextRenderer {

    /**
     * Renders the help text.
     *
     * @return help text as printed by {@code --help}
     * @throws Exception if the help text cannot be produced
     */
    String render() throws Exception;
}
