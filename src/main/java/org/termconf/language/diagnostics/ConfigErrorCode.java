package org.termconf.language.diagnostics;

/**
 * Defines unique, testable codes for all errors the parser can report.
 * This decouples test logic from the exact wording of messages.
 */
public enum ConfigErrorCode {
    // region Token level
    /** A token carried a lexical error or was otherwise malformed. */
    SYNTAX_ERROR,
    /** An option appeared where a command name was expected. */
    UNEXPECTED_OPTION,
    /** A token of an unexpected type appeared where a command name was expected. */
    UNEXPECTED_TOKEN,
    // endregion

    // region Grammar
    /** The leading word does not name a registered command. */
    INVALID_COMMAND,
    /** An argument token did not have the type the command's grammar expects. */
    UNEXPECTED_TOKEN_TYPE,
    /** The input ended in the middle of a command. */
    UNEXPECTED_EOF,
    // endregion

    // region Command construction
    /** The theme command was given a switch it does not know. */
    INVALID_THEME_OPTION,
    /** A variable arity command was given no view name. */
    INVALID_USAGE,
    /** A handler was invoked for a command name it does not support. */
    UNRECOGNISED_COMMAND,
    // endregion

    /** The scanner could not read the underlying input. */
    SCANNER_FAILURE
}
